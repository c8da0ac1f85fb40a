package com.chatflow.chatflow_backend.engine;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.engine.lock.LocalConversationLockManager;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.store.InMemoryConversationStateStore;
import com.chatflow.chatflow_backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ConversationJanitorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID FLOW_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    private ConversationEventPublisher events;

    private MutableClock clock;
    private InMemoryConversationStateStore store;
    private ConversationJanitor janitor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(T0);
        store = new InMemoryConversationStateStore();
        janitor = new ConversationJanitor(store, new LocalConversationLockManager(16, Duration.ofSeconds(1)),
                events, new ConversationEngineProperties(), clock);
    }

    private ConversationKey seed(String contact, RunState runState, Instant sessionExpiresAt) {
        ConversationState state = ConversationState.builder()
                .contactAddress(contact)
                .flowId(FLOW_ID)
                .activeFlowId(FLOW_ID)
                .currentNodeId(runState.isActive() ? "ask" : null)
                .runState(runState)
                .sessionExpiresAt(sessionExpiresAt)
                .build();
        store.save(state, 0);
        return state.key();
    }

    @Test
    void expiresIdleActiveConversations() {
        ConversationKey idle = seed("+1", RunState.AWAITING_INPUT, T0.minusSeconds(1));
        ConversationKey fresh = seed("+2", RunState.AWAITING_INPUT, T0.plus(Duration.ofHours(3)));

        ConversationJanitor.JanitorResult result = janitor.runOnce();

        assertThat(result.expired()).isEqualTo(1);
        ConversationState expired = store.load(idle).orElseThrow();
        assertThat(expired.getRunState()).isEqualTo(RunState.EXPIRED);
        assertThat(expired.getCurrentNodeId()).isNull();
        assertThat(expired.getErrorMessage()).isEqualTo(ConversationJanitor.IDLE_TIMEOUT_MESSAGE);
        assertThat(expired.getVersion()).isEqualTo(2);
        assertThat(store.load(fresh).orElseThrow().getRunState()).isEqualTo(RunState.AWAITING_INPUT);
        verify(events).conversationExpired(idle);
        verify(events, never()).conversationExpired(fresh);
    }

    @Test
    void deletesFinishedConversationsAfterRetention() {
        ConversationKey old = seed("+1", RunState.COMPLETED, T0.minus(Duration.ofDays(8)));
        ConversationKey recent = seed("+2", RunState.FAILED, T0.minus(Duration.ofDays(1)));
        ConversationKey idle = seed("+3", RunState.RUNNING, T0.minus(Duration.ofDays(2)));

        ConversationJanitor.JanitorResult result = janitor.runOnce();

        assertThat(result.deleted()).isEqualTo(1);
        assertThat(store.load(old)).isEmpty();
        assertThat(store.load(recent)).isPresent();
        // Expired in this pass; deleted once its retention has passed as well
        assertThat(store.load(idle).orElseThrow().getRunState()).isEqualTo(RunState.EXPIRED);
    }

    @Test
    void nothingToDoIsQuiet() {
        ConversationJanitor.JanitorResult result = janitor.runOnce();

        assertThat(result.expired()).isZero();
        assertThat(result.deleted()).isZero();
        verify(events, never()).conversationExpired(any());
    }
}
