package com.chatflow.chatflow_backend.controller;

import com.chatflow.chatflow_backend.model.conversation.ExecutionOutcome;
import com.chatflow.chatflow_backend.service.ConversationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Webhook side: the channel adapter has already parsed the provider payload and posts the
 * sender's address and text here.
 */
@RestController
@RequestMapping("/api/inbound")
@RequiredArgsConstructor
public class InboundMessageController {

    private final ConversationService conversationService;

    // POST /api/inbound/{flowId}
    @PostMapping("/{flowId}")
    public ResponseEntity<ExecutionOutcome> receive(@PathVariable UUID flowId,
                                                    @Valid @RequestBody InboundMessageRequest request) {
        return ResponseEntity.ok(conversationService.handleInbound(request.contactAddress(), flowId, request.text()));
    }

    public record InboundMessageRequest(@NotBlank String contactAddress, @NotNull String text) {}
}
