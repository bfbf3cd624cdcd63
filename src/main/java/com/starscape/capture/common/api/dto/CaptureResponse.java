package com.starscape.capture.common.api.dto;

import com.starscape.capture.common.domain.AggregateRoot;

/**
 * Response DTO naming a captured or mutated aggregate.
 */
public record CaptureResponse(
    String contentType,
    String id
) {

    public static CaptureResponse of(AggregateRoot<?> aggregate) {
        return new CaptureResponse(aggregate.getAggregateType(), aggregate.getId().value());
    }
}
