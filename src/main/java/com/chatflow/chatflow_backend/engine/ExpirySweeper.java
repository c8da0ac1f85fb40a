package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.engine.lock.ConversationLockManager;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.store.ConversationStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodically flips the cached window flag of expired windows to closed, one tenant at a time.
 *
 * <p>Send decisions never read the flag, so a late or failed sweep only delays bookkeeping and
 * events. Conversations locked by a running event are skipped and picked up next period.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.conversation.sweeper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweeper {

    private final ConversationStateStore store;
    private final ConversationLockManager lockManager;
    private final ConversationEventPublisher eventPublisher;
    private final ConversationEngineProperties properties;
    private final Clock clock;

    public ExpirySweeper(ConversationStateStore store,
                         ConversationLockManager lockManager,
                         ConversationEventPublisher eventPublisher,
                         ConversationEngineProperties properties,
                         Clock clock) {
        this.store = store;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.conversation.sweeper.interval:PT15M}")
    public void sweepExpiredWindows() {
        SweepResult result = sweepOnce();
        if (result.closed() > 0 || result.failedPartitions() > 0) {
            log.info("Window sweep: {} closed, {} skipped (busy), {} of {} tenant partitions failed",
                    result.closed(), result.skipped(), result.failedPartitions(), result.partitions());
        }
    }

    public SweepResult sweepOnce() {
        Instant now = clock.instant();
        List<String> tenants;
        try {
            tenants = store.findTenantsWithExpiredOpenWindows(now);
        } catch (RuntimeException e) {
            log.error("Window sweep could not list tenants; retrying next period", e);
            return new SweepResult(0, 0, 0, 1);
        }

        int closed = 0;
        int skipped = 0;
        int failed = 0;
        for (String tenant : tenants) {
            try {
                PartitionResult partition = sweepTenant(tenant, now);
                closed += partition.closed();
                skipped += partition.skipped();
            } catch (RuntimeException e) {
                failed++;
                log.warn("Window sweep for tenant {} failed; retrying next period", tenant, e);
            }
        }
        return new SweepResult(tenants.size(), closed, skipped, failed);
    }

    private PartitionResult sweepTenant(String tenant, Instant now) {
        int closed = 0;
        int skipped = 0;
        for (ConversationKey key : store.findExpiredOpenWindows(tenant, now, properties.getSweeper().getBatchSize())) {
            Optional<Boolean> result = lockManager.tryWithLock(key, () -> store.closeWindow(key, now));
            if (result.isEmpty()) {
                skipped++;
                log.debug("Window sweep skipped {}: conversation busy", key);
            } else if (result.get()) {
                closed++;
                log.debug("Window of {} closed", key);
                eventPublisher.windowClosed(key, now);
            }
        }
        return new PartitionResult(closed, skipped);
    }

    public record SweepResult(int partitions, int closed, int skipped, int failedPartitions) {}

    private record PartitionResult(int closed, int skipped) {}
}
