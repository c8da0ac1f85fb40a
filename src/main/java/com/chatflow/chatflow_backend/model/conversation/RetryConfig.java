package com.chatflow.chatflow_backend.model.conversation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Retry policy of an EXTERNAL_CALL node, read from the "retry" entry of its config:
 * {@code {"maxRetries": 2, "backoffMs": 500, "backoffMultiplier": 2.0, "maxBackoffMs": 5000}}.
 * Only retryable call failures (timeouts, 5xx, 429) are retried.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryConfig {

    public static final int MAX_RETRIES_CAP = 10;

    private int maxRetries = 0;

    private long backoffMs = 1000L;

    private double backoffMultiplier = 2.0d;

    // An inbound event holds the conversation lock while it sleeps, so delays are bounded
    private long maxBackoffMs = 30_000L;

    public static RetryConfig none() {
        return new RetryConfig();
    }

    /** Clamps values an author could have set out of range. */
    public RetryConfig normalized() {
        RetryConfig copy = new RetryConfig();
        copy.setMaxRetries(Math.max(0, Math.min(MAX_RETRIES_CAP, maxRetries)));
        copy.setBackoffMs(Math.max(0L, backoffMs));
        copy.setBackoffMultiplier(backoffMultiplier > 0d ? backoffMultiplier : 1.0d);
        copy.setMaxBackoffMs(Math.max(copy.getBackoffMs(), maxBackoffMs));
        return copy;
    }

    /** Total attempts including the first call. */
    public int totalAttempts() {
        return maxRetries + 1;
    }

    /** Delay before retry number {@code retry} (1-based). */
    public long delayBeforeRetry(int retry) {
        double delay = backoffMs * Math.pow(backoffMultiplier, Math.max(0, retry - 1));
        return (long) Math.min(maxBackoffMs, delay);
    }
}
