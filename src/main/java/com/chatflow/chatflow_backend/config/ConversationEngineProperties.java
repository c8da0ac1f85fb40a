package com.chatflow.chatflow_backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.conversation")
public class ConversationEngineProperties {

    /** Free-form replies are allowed for this long after the contact's last message. */
    @NotNull
    private Duration windowLength = Duration.ofHours(24);

    /** Idle TTL of a session; distinct from the messaging window. */
    @NotNull
    private Duration sessionTtl = Duration.ofHours(24);

    /** Hard cap on node steps per inbound event (runaway/cyclic graph guard). */
    @Min(1)
    @Max(10_000)
    private int maxIterations = 100;

    @Min(1)
    private int executionPathLimit = 50;

    @NotNull
    private Duration externalCallTimeout = Duration.ofSeconds(10);

    /**
     * Total time one event may spend retrying external calls, backoff included. Retries stop once
     * the next backoff would cross it. Keep it below the Redis lock lease.
     */
    @NotNull
    private Duration retryBudget = Duration.ofSeconds(30);

    /** Whole-event retries on VersionConflict / busy key. */
    @Min(0)
    private int conflictRetries = 3;

    /** "jpa" or "memory". */
    private String store = "jpa";

    private Lock lock = new Lock();
    private Sweeper sweeper = new Sweeper();
    private Janitor janitor = new Janitor();

    @Data
    public static class Lock {
        /** "local" (single instance) or "redis" (shared across instances). */
        private String mode = "local";
        private Duration waitTimeout = Duration.ofSeconds(5);
        /** Redis lease; must exceed retryBudget plus one externalCallTimeout. */
        private Duration leaseTime = Duration.ofSeconds(60);
        private int stripes = 256;
    }

    @Data
    public static class Sweeper {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(15);
        @Min(1)
        private int batchSize = 500;
    }

    @Data
    public static class Janitor {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        /** Terminal conversations are deleted this long after their idle TTL lapsed. */
        private Duration retention = Duration.ofDays(7);
        @Min(1)
        private int batchSize = 500;
    }
}
