package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record CollectionMetadataRequest(
    @NotBlank(message = "Collection title is required")
    String title,
    String description,
    List<String> tags
) {}
