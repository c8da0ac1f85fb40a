package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.executor.condition.ConditionExpressionEvaluator;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.chatflow.chatflow_backend.support.TestFlows.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionHandlerTest {

    private final ConditionHandler handler = new ConditionHandler(new ConditionExpressionEvaluator());

    private static NodeExecutionContext vars(Map<String, String> variables) {
        return new NodeExecutionContext("+1555", null, variables, null, false, 0);
    }

    @Test
    void firstMatchingRuleWins() {
        NodeDefinition node = node("route", NodeType.CONDITION, Map.of("rules", List.of(
                        Map.of("expression", "plan == 'gold'", "branch", "gold"),
                        Map.of("expression", "age >= 18", "branch", "adult"))),
                "other", Map.of("gold", "gold-node", "adult", "adult-node"));

        assertThat(handler.execute(node, vars(Map.of("plan", "gold", "age", "30"))).getNextNodeId()).isEqualTo("gold-node");
        assertThat(handler.execute(node, vars(Map.of("plan", "free", "age", "30"))).getNextNodeId()).isEqualTo("adult-node");
        assertThat(handler.execute(node, vars(Map.of("age", "12"))).getNextNodeId()).isEqualTo("other");
    }

    @Test
    void singleExpressionUsesTrueFalseBranches() {
        NodeDefinition node = node("check", NodeType.CONDITION, Map.of("expression", "opted_in == 'yes'"),
                null, Map.of("true", "subscribed", "false", "ask"));

        assertThat(handler.execute(node, vars(Map.of("opted_in", "yes"))).getNextNodeId()).isEqualTo("subscribed");
        assertThat(handler.execute(node, vars(Map.of())).getNextNodeId()).isEqualTo("ask");
    }

    @Test
    void branchWithoutEdgeFallsBackToDefault() {
        NodeDefinition node = node("check", NodeType.CONDITION, Map.of("expression", "x == '1'"),
                "fallback", Map.of("true", "one"));

        assertThat(handler.execute(node, vars(Map.of("x", "2"))).getNextNodeId()).isEqualTo("fallback");
    }

    @Test
    void noBranchAndNoDefaultIsGraphError() {
        NodeDefinition node = node("check", NodeType.CONDITION, Map.of("expression", "x == '1'"),
                null, Map.of("true", "one"));

        assertThatThrownBy(() -> handler.execute(node, vars(Map.of())))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("no default edge");
    }

    @Test
    void nodeWithoutExpressionIsGraphError() {
        NodeDefinition node = node("check", NodeType.CONDITION, Map.of(), "next");

        assertThatThrownBy(() -> handler.execute(node, vars(Map.of())))
                .isInstanceOf(GraphException.class);
    }
}
