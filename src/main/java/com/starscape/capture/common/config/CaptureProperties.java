package com.starscape.capture.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for capture handling.
 * Binds to app.capture.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.capture")
public class CaptureProperties {

    /**
     * Lifetime applied to a story whose payload carries no expiresAt.
     */
    private Duration storyLifetime = Duration.ofHours(24);

    /**
     * Default number of pending outbox events handed to the transport per poll.
     */
    private int outboxBatchSize = 50;

    /**
     * How long a command waits for another in-flight command on the same aggregate.
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    public Duration getStoryLifetime() {
        return storyLifetime;
    }

    public void setStoryLifetime(Duration storyLifetime) {
        this.storyLifetime = storyLifetime;
    }

    public int getOutboxBatchSize() {
        return outboxBatchSize;
    }

    public void setOutboxBatchSize(int outboxBatchSize) {
        this.outboxBatchSize = outboxBatchSize;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
        this.lockTimeout = lockTimeout;
    }
}
