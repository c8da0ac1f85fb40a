package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.executor.call.ExternalCallClient;
import com.chatflow.chatflow_backend.executor.call.ExternalCallClientRegistry;
import com.chatflow.chatflow_backend.executor.call.ExternalCallResult;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.chatflow.chatflow_backend.support.TestFlows.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExternalCallHandlerTest {

    @Mock
    private ExternalCallClient client;

    private ExternalCallHandler handler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(client.capability()).thenReturn("http");
        handler = new ExternalCallHandler(new VariableResolver(), new ExternalCallClientRegistry(List.of(client)),
                new ConversationEngineProperties(), new ObjectMapper());
    }

    private static NodeExecutionContext vars(Map<String, String> variables) {
        return new NodeExecutionContext("+1555", null, variables, null, false, 0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void resolvesConfigAndMapsResponse() {
        when(client.invoke(anyMap(), anyMap(), any())).thenReturn(new ExternalCallResult(200, Map.of(
                "data", Map.of("plan", "gold", "score", 7.0, "items", List.of(Map.of("sku", "A1"))))));
        NodeDefinition node = node("crm", NodeType.EXTERNAL_CALL, Map.of(
                "url", "https://crm.example.com/contacts/{{id}}",
                "params", Map.of("fields", "{{fields}}"),
                "timeoutMs", 2500,
                "saveStatusAs", "crm_status",
                "responseMapping", Map.of(
                        "plan", "data.plan",
                        "score", "data.score",
                        "first_sku", "data.items.0.sku",
                        "missing", "data.nope")), "next");

        NodeExecutionResult result = handler.execute(node, vars(Map.of("id", "42", "fields", "plan")));

        ArgumentCaptor<Map<String, Object>> config = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(client).invoke(config.capture(), params.capture(), eq(Duration.ofMillis(2500)));
        assertThat(config.getValue()).containsEntry("url", "https://crm.example.com/contacts/42");
        assertThat(params.getValue()).containsEntry("fields", "plan");

        assertThat(result.getNextNodeId()).isEqualTo("next");
        assertThat(result.getVariableUpdates())
                .containsEntry("crm_status", "200")
                .containsEntry("plan", "gold")
                .containsEntry("score", "7")
                .containsEntry("first_sku", "A1")
                .doesNotContainKey("missing");
    }

    @Test
    void rawResponseIsStoredAsJson() {
        when(client.invoke(anyMap(), anyMap(), any())).thenReturn(new ExternalCallResult(200, Map.of("ok", true)));
        NodeDefinition node = node("crm", NodeType.EXTERNAL_CALL,
                Map.of("url", "https://crm.example.com", "saveResponseAs", "raw"), "next");

        NodeExecutionResult result = handler.execute(node, vars(Map.of()));

        assertThat(result.getVariableUpdates()).containsEntry("raw", "{\"ok\":true}");
    }

    @Test
    void defaultTimeoutComesFromProperties() {
        when(client.invoke(anyMap(), anyMap(), any())).thenReturn(new ExternalCallResult(204, null));

        handler.execute(node("crm", NodeType.EXTERNAL_CALL, Map.of("url", "https://crm.example.com"), "next"), vars(Map.of()));

        verify(client).invoke(anyMap(), anyMap(), eq(Duration.ofSeconds(10)));
    }

    @Test
    void invalidTimeoutOrCapabilityIsGraphError() {
        assertThatThrownBy(() -> handler.execute(node("crm", NodeType.EXTERNAL_CALL,
                Map.of("url", "https://x", "timeoutMs", "soon"), "next"), vars(Map.of())))
                .isInstanceOf(GraphException.class);
        assertThatThrownBy(() -> handler.execute(node("crm", NodeType.EXTERNAL_CALL,
                Map.of("url", "https://x", "capability", "grpc"), "next"), vars(Map.of())))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("grpc");
    }
}
