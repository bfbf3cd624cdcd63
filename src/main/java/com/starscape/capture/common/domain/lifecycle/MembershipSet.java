package com.starscape.capture.common.domain.lifecycle;

import com.starscape.capture.common.domain.Identifier;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.common.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of member ids held by a composite aggregate (board, collection, thread, playlist).
 * <p>
 * Every operation validates before touching the list, so a rejected call leaves the
 * membership exactly as it was.
 */
public final class MembershipSet<ID extends Identifier> {

    private final String memberLabel;
    private final List<ID> members;

    private MembershipSet(String memberLabel, List<ID> members) {
        this.memberLabel = memberLabel;
        this.members = members;
    }

    public static <ID extends Identifier> MembershipSet<ID> empty(String memberLabel) {
        return new MembershipSet<>(memberLabel, new ArrayList<>());
    }

    public static <ID extends Identifier> MembershipSet<ID> of(String memberLabel, Collection<ID> ids) {
        MembershipSet<ID> set = empty(memberLabel);
        set.replaceAll(ids);
        return set;
    }

    /**
     * @return false when the id was already a member (no-op)
     */
    public boolean add(ID id) {
        requireMember(id);
        if (members.contains(id)) {
            return false;
        }
        members.add(id);
        return true;
    }

    public void remove(ID id) {
        requireMember(id);
        if (!members.remove(id)) {
            throw new InvalidStateException("MEMBER_NOT_FOUND",
                    capitalize(memberLabel) + " " + id.value() + " is not a member");
        }
    }

    /**
     * Full replace of the snapshot. Duplicates in the incoming list collapse to their first position.
     */
    public void replaceAll(Collection<ID> ids) {
        if (ids == null) {
            throw new ValidationException(memberLabel + "Ids", memberLabel + "Ids is required");
        }
        ids.forEach(this::requireMember);
        List<ID> deduplicated = new ArrayList<>(new LinkedHashSet<>(ids));
        members.clear();
        members.addAll(deduplicated);
    }

    /**
     * Accepts only a permutation of the current members: nothing added, dropped or repeated.
     */
    public void reorder(List<ID> newOrder) {
        if (newOrder == null) {
            throw new ValidationException("newOrder", "newOrder is required");
        }
        Set<ID> distinct = new HashSet<>(newOrder);
        if (newOrder.size() != members.size()
                || distinct.size() != newOrder.size()
                || !distinct.equals(new HashSet<>(members))) {
            throw new InvalidStateException("INVALID_REORDER",
                    "New order must contain exactly the current " + memberLabel + "s");
        }
        members.clear();
        members.addAll(newOrder);
    }

    public boolean contains(ID id) {
        return members.contains(id);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    public List<ID> asList() {
        return List.copyOf(members);
    }

    private void requireMember(ID id) {
        if (id == null) {
            throw new ValidationException(memberLabel + "Id", memberLabel + "Id is required");
        }
    }

    private static String capitalize(String label) {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
