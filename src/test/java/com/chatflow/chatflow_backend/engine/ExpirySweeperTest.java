package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.engine.lock.ConversationLockManager;
import com.chatflow.chatflow_backend.engine.lock.LocalConversationLockManager;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.store.ConversationStateStore;
import com.chatflow.chatflow_backend.store.InMemoryConversationStateStore;
import com.chatflow.chatflow_backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpirySweeperTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID FLOW_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    private ConversationEventPublisher events;

    private MutableClock clock;
    private InMemoryConversationStateStore store;
    private ExpirySweeper sweeper;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(T0);
        store = new InMemoryConversationStateStore();
        sweeper = new ExpirySweeper(store, new LocalConversationLockManager(16, Duration.ofSeconds(1)),
                events, new ConversationEngineProperties(), clock);
    }

    private ConversationKey seed(String contact, String tenant, Instant windowExpiresAt) {
        ConversationState state = ConversationState.builder()
                .contactAddress(contact)
                .flowId(FLOW_ID)
                .activeFlowId(FLOW_ID)
                .tenantId(tenant)
                .currentNodeId("ask")
                .runState(RunState.AWAITING_INPUT)
                .sessionExpiresAt(T0.plus(Duration.ofDays(2)))
                .window(MessageWindow.builder().windowExpiresAt(windowExpiresAt).windowOpen(true).build())
                .build();
        store.save(state, 0);
        return state.key();
    }

    @Test
    void closesOnlyExpiredWindowsAcrossTenants() {
        ConversationKey expiredA = seed("+1", "tenant-a", T0.minusSeconds(1));
        ConversationKey expiredB = seed("+2", "tenant-b", T0);
        ConversationKey open = seed("+3", "tenant-a", T0.plusSeconds(60));

        ExpirySweeper.SweepResult result = sweeper.sweepOnce();

        assertThat(result.partitions()).isEqualTo(2);
        assertThat(result.closed()).isEqualTo(2);
        assertThat(result.failedPartitions()).isZero();
        assertThat(store.load(expiredA).orElseThrow().getWindow().isWindowOpen()).isFalse();
        assertThat(store.load(expiredA).orElseThrow().getWindow().getWindowClosedAt()).isEqualTo(T0);
        assertThat(store.load(expiredB).orElseThrow().getWindow().isWindowOpen()).isFalse();
        assertThat(store.load(open).orElseThrow().getWindow().isWindowOpen()).isTrue();
        verify(events).windowClosed(expiredA, T0);
        verify(events).windowClosed(expiredB, T0);
        verify(events, never()).windowClosed(eq(open), any());
    }

    @Test
    void sweepIsIdempotentAndLeavesRunStateAlone() {
        ConversationKey key = seed("+1", "tenant-a", T0.minusSeconds(1));

        sweeper.sweepOnce();
        ExpirySweeper.SweepResult second = sweeper.sweepOnce();

        assertThat(second.closed()).isZero();
        ConversationState state = store.load(key).orElseThrow();
        assertThat(state.getRunState()).isEqualTo(RunState.AWAITING_INPUT);
        assertThat(state.getCurrentNodeId()).isEqualTo("ask");
        assertThat(state.getVersion()).isEqualTo(1);
    }

    @Test
    void busyConversationIsSkippedForNextPeriod() {
        ConversationLockManager busy = mock(ConversationLockManager.class);
        when(busy.tryWithLock(any(), any())).thenReturn(Optional.empty());
        ExpirySweeper withBusyLocks = new ExpirySweeper(store, busy, events, new ConversationEngineProperties(), clock);
        ConversationKey key = seed("+1", "tenant-a", T0.minusSeconds(1));

        ExpirySweeper.SweepResult result = withBusyLocks.sweepOnce();

        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.closed()).isZero();
        assertThat(store.load(key).orElseThrow().getWindow().isWindowOpen()).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void failingTenantDoesNotStopOthers() {
        ConversationStateStore flaky = mock(ConversationStateStore.class);
        ConversationKey key = new ConversationKey("+2", FLOW_ID);
        when(flaky.findTenantsWithExpiredOpenWindows(T0)).thenReturn(List.of("broken", "healthy"));
        when(flaky.findExpiredOpenWindows(eq("broken"), eq(T0), anyInt())).thenThrow(new IllegalStateException("db down"));
        when(flaky.findExpiredOpenWindows(eq("healthy"), eq(T0), anyInt())).thenReturn(List.of(key));
        when(flaky.closeWindow(key, T0)).thenReturn(true);
        ConversationLockManager passThrough = mock(ConversationLockManager.class);
        when(passThrough.tryWithLock(any(), any())).thenAnswer(inv -> Optional.of(((Supplier<Object>) inv.getArgument(1)).get()));

        ExpirySweeper.SweepResult result = new ExpirySweeper(flaky, passThrough, events,
                new ConversationEngineProperties(), clock).sweepOnce();

        assertThat(result.failedPartitions()).isEqualTo(1);
        assertThat(result.closed()).isEqualTo(1);
        verify(events).windowClosed(key, T0);
    }
}
