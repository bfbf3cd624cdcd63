package com.starscape.capture.common.domain;

/**
 * Platform-scoped identifier of an aggregate or of the account that owns it.
 */
public interface Identifier extends ValueObject {

    String value();
}
