package com.starscape.capture.features.twitter.api.dto;

public record ThreadMetadataRequest(
    String title,
    String description
) {}
