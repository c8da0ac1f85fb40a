package com.chatflow.chatflow_backend.controller;

import com.chatflow.chatflow_backend.model.conversation.ConversationState;
import com.chatflow.chatflow_backend.model.conversation.ExecutionOutcome;
import com.chatflow.chatflow_backend.model.conversation.MessageWindow;
import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.model.conversation.WindowOpener;
import com.chatflow.chatflow_backend.service.ConversationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;

    // GET /api/conversations/{flowId}/{contactAddress}
    @GetMapping("/{flowId}/{contactAddress}")
    public ResponseEntity<ConversationView> get(@PathVariable UUID flowId, @PathVariable String contactAddress) {
        return conversationService.find(contactAddress, flowId)
                .map(state -> ResponseEntity.ok(toView(state)))
                .orElse(ResponseEntity.notFound().build());
    }

    // POST /api/conversations/{flowId}/{contactAddress}/trigger: business-initiated start
    @PostMapping("/{flowId}/{contactAddress}/trigger")
    public ResponseEntity<ExecutionOutcome> trigger(@PathVariable UUID flowId,
                                                    @PathVariable String contactAddress,
                                                    @RequestBody(required = false) TriggerRequest request) {
        Map<String, String> variables = request != null && request.variables() != null ? request.variables() : Map.of();
        return ResponseEntity.ok(conversationService.trigger(contactAddress, flowId, variables));
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    private ConversationView toView(ConversationState s) {
        MessageWindow w = s.getWindow();
        return new ConversationView(
                s.getContactAddress(),
                s.getFlowId(),
                s.getActiveFlowId(),
                s.getFlowVersion(),
                s.getSessionId(),
                s.getCurrentNodeId(),
                s.getRunState(),
                s.getVariables(),
                s.getExecutionPath(),
                s.getErrorMessage(),
                s.getStartedAt(),
                s.getLastMessageAt(),
                s.getSessionExpiresAt(),
                new WindowView(w.getWindowExpiresAt(), w.getLastUserMessageAt(), w.getLastOutboundTemplateAt(),
                        w.getOpenedBy(), w.isWindowOpen(), conversationService.canSendFreeform(s)),
                s.getVersion()
        );
    }

    public record TriggerRequest(Map<String, String> variables) {}

    public record WindowView(Instant windowExpiresAt,
                             Instant lastUserMessageAt,
                             Instant lastOutboundTemplateAt,
                             WindowOpener openedBy,
                             boolean windowOpenFlag,
                             boolean canSendFreeform) {}

    public record ConversationView(String contactAddress,
                                   UUID flowId,
                                   UUID activeFlowId,
                                   int flowVersion,
                                   UUID sessionId,
                                   String currentNodeId,
                                   RunState runState,
                                   Map<String, String> variables,
                                   List<String> executionPath,
                                   String errorMessage,
                                   Instant startedAt,
                                   Instant lastMessageAt,
                                   Instant sessionExpiresAt,
                                   WindowView window,
                                   long version) {}
}
