package com.starscape.capture.common.observability;

/**
 * MDC keys used in log patterns and copied onto outbox events.
 */
public final class MdcKeys {
    public static final String CORRELATION_ID = "correlationId";
    public static final String AGGREGATE_ID = "aggregateId";
    public static final String AGGREGATE_TYPE = "aggregateType";

    private MdcKeys() {
        throw new UnsupportedOperationException("Utility class");
    }
}
