package com.chatflow.chatflow_backend.model.domain;

import com.chatflow.chatflow_backend.model.conversation.RunState;
import com.chatflow.chatflow_backend.model.conversation.WindowOpener;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "conversation_states",
        uniqueConstraints = @UniqueConstraint(name = "uk_conversation_contact_flow",
                columnNames = {"contact_address", "flow_id"}),
        indexes = {
                @Index(name = "idx_conversation_window", columnList = "tenant_id, window_open, window_expires_at"),
                @Index(name = "idx_conversation_session", columnList = "run_state, session_expires_at")
        })
@Data
public class ConversationStateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "contact_address", nullable = false)
    private String contactAddress;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "active_flow_id")
    private UUID activeFlowId;

    @Column(name = "flow_version")
    private int flowVersion;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId = "default";

    @Column(name = "session_id")
    private UUID sessionId;

    @Column(name = "current_node_id")
    private String currentNodeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_state", nullable = false)
    private RunState runState = RunState.RUNNING;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> variables = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_path")
    private List<String> executionPath = new ArrayList<>();

    @Column(name = "input_attempts")
    private int inputAttempts;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "session_expires_at")
    private Instant sessionExpiresAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Messaging window, flattened

    @Column(name = "window_expires_at")
    private Instant windowExpiresAt;

    @Column(name = "last_user_message_at")
    private Instant lastUserMessageAt;

    @Column(name = "last_outbound_template_at")
    private Instant lastOutboundTemplateAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "window_opened_by")
    private WindowOpener windowOpenedBy;

    @Column(name = "window_open", nullable = false)
    private boolean windowOpen;

    @Column(name = "window_closed_at")
    private Instant windowClosedAt;

    // Compared and bumped by the store itself, not by Hibernate
    @Column(name = "state_version", nullable = false)
    private long stateVersion;
}
