package com.starscape.capture.common.domain;

import java.io.Serializable;

/**
 * Marker for immutable, self-validating values compared by their attributes.
 * Implementations validate in their constructor, so an invalid instance can never exist.
 */
public interface ValueObject extends Serializable {
}
