package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.executor.condition.ConditionExpressionEvaluator;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionHandler implements NodeHandler {

    private final ConditionExpressionEvaluator evaluator;

    @Override
    public NodeType supportedType() {
        return NodeType.CONDITION;
    }

    /*
     * Config shape, either a single expression selecting the "true"/"false" branch:
     *   { "expression": "age >= 18" }
     * or ordered rules, first match wins:
     *   { "rules": [ { "expression": "plan == 'gold'", "branch": "gold" }, ... ] }
     * No match (or a branch without an edge) falls through to the default edge.
     */
    @Override
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        String branchKey = selectBranch(node, context.variables());

        String target = node.transitions().branch(branchKey);
        if (target == null) {
            target = node.defaultNext();
        }
        if (target == null) {
            throw new GraphException("CONDITION node '" + node.id() + "' selected branch '" + branchKey
                    + "' which has no edge, and no default edge exists");
        }

        log.debug("Condition {} -> branch {} -> {}", node.id(), branchKey, target);
        return NodeExecutionResult.continueTo(target);
    }

    private String selectBranch(NodeDefinition node, Map<String, String> variables) {
        Object rules = node.config().get("rules");
        if (rules instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> rule)) {
                    throw new GraphException("CONDITION node '" + node.id() + "' has a malformed rule: " + item);
                }
                Object expression = rule.get("expression");
                Object branch = rule.get("branch");
                if (expression == null || branch == null) {
                    throw new GraphException("CONDITION node '" + node.id() + "' rule needs expression and branch");
                }
                if (evaluator.evaluate(expression.toString(), variables)) {
                    return branch.toString();
                }
            }
            return null;
        }

        String expression = node.configString("expression");
        if (expression == null || expression.isBlank()) {
            throw new GraphException("CONDITION node '" + node.id() + "' has neither expression nor rules");
        }
        return evaluator.evaluate(expression, variables) ? "true" : "false";
    }
}
