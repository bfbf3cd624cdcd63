package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

import java.time.Instant;
import java.util.List;

public record PhotoAttributes(
    String title,
    String description,
    String url,
    String downloadUrl,
    String thumbnailUrl,
    int width,
    int height,
    String color,
    long likes,
    long downloads,
    List<String> tags,
    Instant createdAt
) implements ValueObject {

    public PhotoAttributes {
        title = title == null ? "" : title;
        Guard.requireNonBlank("url", url);
        Guard.requireNonBlank("downloadUrl", downloadUrl);
        Guard.requireNonBlank("thumbnailUrl", thumbnailUrl);
        Guard.requirePositive("width", width);
        Guard.requirePositive("height", height);
        Guard.requireNonNegative("likes", likes);
        Guard.requireNonNegative("downloads", downloads);
        tags = Guard.copyOf("tags", tags);
        Guard.requireNonNull("createdAt", createdAt);
    }

    public PhotoAttributes withEngagement(long likes, long downloads) {
        return new PhotoAttributes(title, description, url, downloadUrl, thumbnailUrl, width, height, color,
                likes, downloads, tags, createdAt);
    }

    public PhotoAttributes withTags(List<String> tags) {
        return new PhotoAttributes(title, description, url, downloadUrl, thumbnailUrl, width, height, color,
                likes, downloads, tags, createdAt);
    }
}
