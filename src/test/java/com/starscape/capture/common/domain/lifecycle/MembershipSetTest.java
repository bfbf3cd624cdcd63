package com.starscape.capture.common.domain.lifecycle;

import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.pinterest.domain.PinId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MembershipSetTest {

    private static final PinId A = PinId.of("1");
    private static final PinId B = PinId.of("2");
    private static final PinId C = PinId.of("3");

    @Test
    void addIsIdempotent() {
        MembershipSet<PinId> set = MembershipSet.empty("pin");
        assertTrue(set.add(A));
        assertFalse(set.add(A));
        assertEquals(1, set.size());
    }

    @Test
    void removingNonMemberFails() {
        MembershipSet<PinId> set = MembershipSet.of("pin", List.of(A));
        InvalidStateException ex = assertThrows(InvalidStateException.class, () -> set.remove(B));
        assertEquals("MEMBER_NOT_FOUND", ex.getCode());
        assertEquals(List.of(A), set.asList());
    }

    @Test
    void replaceAllCollapsesDuplicatesAndAcceptsEmpty() {
        MembershipSet<PinId> set = MembershipSet.of("pin", List.of(A, B));
        set.replaceAll(List.of(C, A, C));
        assertEquals(List.of(C, A), set.asList());

        set.replaceAll(List.of());
        assertTrue(set.isEmpty());
    }

    @Test
    void replaceAllRejectsMissingList() {
        MembershipSet<PinId> set = MembershipSet.of("pin", List.of(A));
        ValidationException ex = assertThrows(ValidationException.class, () -> set.replaceAll(null));
        assertEquals("pinIds", ex.getField());
        assertEquals(List.of(A), set.asList());
    }

    @Test
    void reorderAcceptsPermutation() {
        MembershipSet<PinId> set = MembershipSet.of("pin", List.of(A, B, C));
        set.reorder(List.of(C, A, B));
        assertEquals(List.of(C, A, B), set.asList());
    }

    @Test
    void reorderRejectsForeignMissingOrRepeatedIds() {
        MembershipSet<PinId> set = MembershipSet.of("pin", List.of(A, B));

        assertThrows(InvalidStateException.class, () -> set.reorder(List.of(A, C)));
        assertThrows(InvalidStateException.class, () -> set.reorder(List.of(A)));
        assertThrows(InvalidStateException.class, () -> set.reorder(List.of(A, A)));
        assertEquals(List.of(A, B), set.asList());
    }
}
