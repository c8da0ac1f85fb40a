package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.conversation.OutboundMessage;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the outbound message a node declares, either
 * { "text": "Thanks {{name}}!" } or
 * { "template": { "name": "order_update", "language": "en", "params": { "1": "{{name}}" } } }.
 */
@Component
@RequiredArgsConstructor
public class MessageComposer {

    private final VariableResolver resolver;

    public Optional<OutboundMessage> compose(NodeDefinition node, String textKey, Map<String, String> variables) {
        Object template = node.config().get("template");
        if (template instanceof Map<?, ?> templateConfig) {
            return Optional.of(composeTemplate(node, templateConfig, variables));
        }
        String text = node.configString(textKey);
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(OutboundMessage.freeform(node.id(), resolver.resolve(text, variables)));
    }

    public OutboundMessage freeform(NodeDefinition node, String text, Map<String, String> variables) {
        return OutboundMessage.freeform(node.id(), resolver.resolve(text, variables));
    }

    @SuppressWarnings("unchecked")
    private OutboundMessage composeTemplate(NodeDefinition node, Map<?, ?> templateConfig, Map<String, String> variables) {
        Object name = templateConfig.get("name");
        if (name == null || name.toString().isBlank()) {
            throw new GraphException("Node '" + node.id() + "' declares a template without a name");
        }
        Object language = templateConfig.get("language");
        Object params = templateConfig.get("params");
        Map<String, String> resolvedParams = new LinkedHashMap<>();
        if (params instanceof Map<?, ?> p) {
            resolver.resolveMap((Map<String, ?>) p, variables)
                    .forEach((key, value) -> resolvedParams.put(key, value != null ? value : ""));
        }
        return OutboundMessage.template(node.id(), name.toString(),
                language != null ? language.toString() : null, resolvedParams);
    }
}
