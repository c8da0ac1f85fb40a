package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.config.ConversationEngineProperties;
import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.executor.call.ExternalCallClient;
import com.chatflow.chatflow_backend.executor.call.ExternalCallClientRegistry;
import com.chatflow.chatflow_backend.executor.call.ExternalCallResult;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes EXTERNAL_CALL nodes.
 *
 * Config shape:
 * {
 *   "capability":      "http",
 *   "url":             "https://crm.example.com/contacts/{{contact_address}}",
 *   "method":          "GET",
 *   "params":          { "fields": "name,plan" },
 *   "timeoutMs":       5000,
 *   "responseMapping": { "name": "data.name", "plan": "data.plan" },
 *   "saveStatusAs":    "crm_status",
 *   "saveResponseAs":  "crm_raw",
 *   "retry":           { "maxRetries": 2, "backoffMs": 500, "backoffMultiplier": 2.0 }
 * }
 *
 * Failures surface as ExternalCallException; retries are applied by the executor from "retry".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExternalCallHandler implements NodeHandler {

    private final VariableResolver resolver;
    private final ExternalCallClientRegistry clients;
    private final ConversationEngineProperties properties;
    private final ObjectMapper mapper;

    @Override
    public NodeType supportedType() {
        return NodeType.EXTERNAL_CALL;
    }

    @Override
    @SuppressWarnings("unchecked")
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        ExternalCallClient client = clients.get(node.configString("capability", "http"));

        Map<String, Object> config = (Map<String, Object>) resolver.resolveTree(node.config(), context.variables());
        Object rawParams = config.get("params");
        Map<String, Object> params = rawParams instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of();

        ExternalCallResult result = client.invoke(config, params, timeout(node));

        NodeExecutionResult.NodeExecutionResultBuilder out = NodeExecutionResult.builder()
                .nextNodeId(node.defaultNext());
        String statusVar = node.configString("saveStatusAs");
        if (statusVar != null && !statusVar.isBlank()) {
            out.variableUpdate(statusVar, String.valueOf(result.statusCode()));
        }
        String rawVar = node.configString("saveResponseAs");
        if (rawVar != null && !rawVar.isBlank()) {
            out.variableUpdate(rawVar, stringify(result.body()));
        }
        Object mapping = node.config().get("responseMapping");
        if (mapping instanceof Map<?, ?> m) {
            m.forEach((variable, path) -> {
                Object value = result.path(path != null ? path.toString() : null);
                if (value != null) {
                    out.variableUpdate(variable.toString(), stringify(value));
                } else {
                    log.debug("Node {}: response path '{}' not present, '{}' left unchanged", node.id(), path, variable);
                }
            });
        }
        return out.build();
    }

    private Duration timeout(NodeDefinition node) {
        String raw = node.configString("timeoutMs");
        if (raw == null || raw.isBlank()) return properties.getExternalCallTimeout();
        try {
            long ms = Long.parseLong(raw.trim());
            if (ms <= 0) throw new GraphException("EXTERNAL_CALL node '" + node.id() + "' timeoutMs must be positive");
            return Duration.ofMillis(ms);
        } catch (NumberFormatException e) {
            throw new GraphException("EXTERNAL_CALL node '" + node.id() + "' has invalid timeoutMs: " + raw);
        }
    }

    private String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Map || value instanceof List) {
            try {
                return mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        if (value instanceof Double d) return VariableResolver.formatNumber(d);
        return value.toString();
    }
}
