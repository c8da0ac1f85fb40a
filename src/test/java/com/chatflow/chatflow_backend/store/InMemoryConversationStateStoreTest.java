package com.chatflow.chatflow_backend.store;

import com.chatflow.chatflow_backend.exception.VersionConflictException;
import com.chatflow.chatflow_backend.model.conversation.ConversationKey;
import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryConversationStateStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private final InMemoryConversationStateStore store = new InMemoryConversationStateStore();
    private final ConversationKey key = new ConversationKey("+1555", UUID.randomUUID());

    private ConversationState state() {
        return ConversationState.builder()
                .contactAddress(key.contactAddress())
                .flowId(key.flowId())
                .tenantId("acme")
                .currentNodeId("ask")
                .runState(RunState.AWAITING_INPUT)
                .build();
    }

    @Test
    void saveBumpsVersionAndLoadReturnsCopies() {
        ConversationState saved = store.save(state(), 0);
        assertThat(saved.getVersion()).isEqualTo(1);

        ConversationState loaded = store.load(key).orElseThrow();
        loaded.getVariables().put("leak", "yes");

        assertThat(store.load(key).orElseThrow().getVariables()).doesNotContainKey("leak");
    }

    @Test
    void staleVersionIsRejected() {
        store.save(state(), 0);
        store.save(store.load(key).orElseThrow(), 1);

        assertThatThrownBy(() -> store.save(state(), 1)).isInstanceOf(VersionConflictException.class);
        assertThatThrownBy(() -> store.save(state(), 0)).isInstanceOf(VersionConflictException.class);
        assertThat(store.load(key).orElseThrow().getVersion()).isEqualTo(2);
    }

    @Test
    void closeWindowTouchesOnlyExpiredOpenWindows() {
        ConversationState s = state();
        s.setWindow(MessageWindow.builder().windowExpiresAt(T0).windowOpen(true).build());
        store.save(s, 0);

        assertThat(store.closeWindow(key, T0.minusSeconds(1))).isFalse();
        assertThat(store.closeWindow(key, T0)).isTrue();
        assertThat(store.closeWindow(key, T0.plusSeconds(5))).isFalse();

        ConversationState after = store.load(key).orElseThrow();
        assertThat(after.getWindow().isWindowOpen()).isFalse();
        assertThat(after.getWindow().getWindowClosedAt()).isEqualTo(T0);
        assertThat(after.getVersion()).isEqualTo(1);
        assertThat(after.getCurrentNodeId()).isEqualTo("ask");
    }

    @Test
    void findsIdleActiveAndDeletesOldTerminal() {
        ConversationState idle = state();
        idle.setSessionExpiresAt(T0.minusSeconds(10));
        store.save(idle, 0);

        ConversationKey doneKey = new ConversationKey("+1666", key.flowId());
        ConversationState done = state().toBuilder().contactAddress(doneKey.contactAddress())
                .runState(RunState.COMPLETED).currentNodeId(null).sessionExpiresAt(T0.minusSeconds(10)).build();
        store.save(done, 0);

        assertThat(store.findIdleActive(T0, 10)).containsExactly(key);
        assertThat(store.deleteTerminalBefore(T0)).isEqualTo(1);
        assertThat(store.load(doneKey)).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }
}
