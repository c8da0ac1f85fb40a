package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.conversation.OutboundMessage;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static com.chatflow.chatflow_backend.support.TestFlows.assign;
import static com.chatflow.chatflow_backend.support.TestFlows.message;
import static com.chatflow.chatflow_backend.support.TestFlows.node;
import static com.chatflow.chatflow_backend.support.TestFlows.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageHandlerTest {

    private final VariableResolver resolver = new VariableResolver();
    private final MessageComposer composer = new MessageComposer(resolver);
    private final MessageHandler messages = new MessageHandler(composer);
    private final EndHandler ends = new EndHandler(composer);

    private static NodeExecutionContext vars(Map<String, String> variables) {
        return new NodeExecutionContext("+1555", null, variables, null, false, 0);
    }

    @Test
    void textMessageIsResolvedAndContinues() {
        NodeExecutionResult result = messages.execute(message("hi", "Hello {{name}}", "next"), vars(Map.of("name", "Ana")));

        assertThat(result.getMessagesToSend()).singleElement().satisfies(m -> {
            assertThat(m.isFreeform()).isTrue();
            assertThat(m.text()).isEqualTo("Hello Ana");
            assertThat(m.nodeId()).isEqualTo("hi");
        });
        assertThat(result.getNextNodeId()).isEqualTo("next");
    }

    @Test
    void templateMessageResolvesParams() {
        NodeExecutionResult result = messages.execute(template("tpl", "order_update", "next"), vars(Map.of("name", "Ana")));

        OutboundMessage sent = result.getMessagesToSend().get(0);
        assertThat(sent.kind()).isEqualTo(OutboundMessage.Kind.TEMPLATE);
        assertThat(sent.templateRef()).isEqualTo("order_update");
        assertThat(sent.language()).isEqualTo("en");
        assertThat(sent.params()).containsExactly(Map.entry("1", "Ana"));
    }

    @Test
    void emptyMessageNodeIsGraphError() {
        NodeDefinition empty = node("hi", NodeType.MESSAGE, Map.of(), "next");

        assertThatThrownBy(() -> messages.execute(empty, vars(Map.of())))
                .isInstanceOf(GraphException.class);
    }

    @Test
    void endIsTerminalWithOptionalGoodbye() {
        NodeExecutionResult silent = ends.execute(node("end", NodeType.END, Map.of(), null), vars(Map.of()));
        NodeExecutionResult goodbye = ends.execute(node("end", NodeType.END, Map.of("text", "Bye {{name}}"), null),
                vars(Map.of("name", "Ana")));

        assertThat(silent.isTerminal()).isTrue();
        assertThat(silent.getMessagesToSend()).isEmpty();
        assertThat(goodbye.getMessagesToSend()).extracting(OutboundMessage::text).containsExactly("Bye Ana");
    }

    @Test
    void assignmentsSeeVariablesFromBeforeTheNode() {
        AssignmentHandler handler = new AssignmentHandler(resolver);

        NodeExecutionResult result = handler.execute(
                assign("set", Map.of("total", "{{price * qty}}", "greeting", "Hi {{name}}"), "next"),
                vars(Map.of("price", "3", "qty", "2", "name", "Ana")));

        assertThat(result.getVariableUpdates()).containsEntry("total", "6").containsEntry("greeting", "Hi Ana");
        assertThat(result.getNextNodeId()).isEqualTo("next");
    }

    @Test
    void jumpNeedsValidTargetFlow() {
        JumpHandler handler = new JumpHandler();
        UUID target = UUID.randomUUID();

        assertThat(handler.execute(node("j", NodeType.JUMP, Map.of("targetFlowId", target.toString()), null), vars(Map.of()))
                .getJumpToFlowId()).isEqualTo(target);
        assertThatThrownBy(() -> handler.execute(node("j", NodeType.JUMP, Map.of("targetFlowId", "nope"), null), vars(Map.of())))
                .isInstanceOf(GraphException.class);
        assertThatThrownBy(() -> handler.execute(node("j", NodeType.JUMP, Map.of(), null), vars(Map.of())))
                .isInstanceOf(GraphException.class);
    }
}
