package com.starscape.capture.common.domain;

import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.instagram.domain.PostId;
import com.starscape.capture.features.twitter.domain.ThreadId;
import com.starscape.capture.features.unsplash.domain.ArtistId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "\t"})
    void blankIdsAreRejected(String value) {
        assertThrows(ValidationException.class, () -> PostId.of(value));
        assertThrows(ValidationException.class, () -> ThreadId.of(value));
        assertThrows(ValidationException.class, () -> ArtistId.of(value));
    }

    @Test
    void equalityIsStructural() {
        assertEquals(PostId.of("abc"), PostId.of("abc"));
        assertEquals(PostId.of("abc").hashCode(), PostId.of("abc").hashCode());
        assertNotEquals(PostId.of("abc"), PostId.of("abd"));
        assertEquals("abc", PostId.of("abc").toString());
    }
}
