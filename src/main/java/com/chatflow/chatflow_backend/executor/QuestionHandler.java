package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.model.conversation.NodeExecutionResult;
import com.chatflow.chatflow_backend.model.domain.NodeType;
import com.chatflow.chatflow_backend.model.flow.NodeDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Executes QUESTION nodes.
 *
 * Config shape:
 * {
 *   "prompt":             "What's your email, {{name}}?",
 *   "variable":           "email",
 *   "validation":         "email",
 *   "invalidMessage":     "That doesn't look like an email, try again",
 *   "maxAttempts":        3,
 *   "acceptsPendingInput": false
 * }
 *
 * First visit sends the prompt and parks the conversation. The next inbound text resumes the
 * node: a valid answer is stored verbatim under {@code variable}, an invalid one re-prompts until
 * {@code maxAttempts} is reached, after which the "invalid" branch is taken when present.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionHandler implements NodeHandler {

    public static final String INVALID_BRANCH = "invalid";

    private final MessageComposer composer;

    @Override
    public NodeType supportedType() {
        return NodeType.QUESTION;
    }

    @Override
    public NodeExecutionResult execute(NodeDefinition node, NodeExecutionContext context) {
        String variable = node.configString("variable");
        if (variable == null || variable.isBlank()) {
            throw new GraphException("QUESTION node '" + node.id() + "' has no target variable");
        }

        if (context.resuming()) {
            return resume(node, context, variable);
        }

        boolean acceptsPending = Boolean.parseBoolean(node.configString("acceptsPendingInput", "false"));
        if (acceptsPending && context.hasPendingInput()
                && InputValidation.isValid(context.pendingInput(), node.configString("validation"))) {
            return accept(node, variable, context.pendingInput());
        }
        return prompt(node, context, null);
    }

    private NodeExecutionResult resume(NodeDefinition node, NodeExecutionContext context, String variable) {
        if (!context.hasPendingInput()) {
            // Re-entered without an answer (e.g. a trigger); keep waiting silently
            return NodeExecutionResult.builder()
                    .awaitingInput(true)
                    .inputAttempts(context.inputAttempts())
                    .build();
        }

        String answer = context.pendingInput();
        if (InputValidation.isValid(answer, node.configString("validation"))) {
            return accept(node, variable, answer);
        }

        int attempts = context.inputAttempts() + 1;
        int maxAttempts = parseMaxAttempts(node);
        String invalidTarget = node.transitions().branch(INVALID_BRANCH);
        log.debug("Invalid answer for node {} (attempt {}/{})", node.id(), attempts, maxAttempts);

        if (maxAttempts > 0 && attempts >= maxAttempts && invalidTarget != null) {
            return NodeExecutionResult.builder()
                    .nextNodeId(invalidTarget)
                    .inputConsumed(true)
                    .build();
        }

        NodeExecutionResult.NodeExecutionResultBuilder result = NodeExecutionResult.builder()
                .awaitingInput(true)
                .inputConsumed(true)
                .inputAttempts(attempts);
        String invalidMessage = node.configString("invalidMessage");
        if (invalidMessage != null && !invalidMessage.isBlank()) {
            result.message(composer.freeform(node, invalidMessage, context.variables()));
        } else {
            composer.compose(node, "prompt", context.variables()).ifPresent(result::message);
        }
        return result.build();
    }

    // The inbound text is stored as received; only the validation rules see it trimmed
    private NodeExecutionResult accept(NodeDefinition node, String variable, String answer) {
        return NodeExecutionResult.builder()
                .variableUpdate(variable, answer)
                .nextNodeId(node.defaultNext())
                .inputConsumed(true)
                .build();
    }

    private NodeExecutionResult prompt(NodeDefinition node, NodeExecutionContext context, Integer attempts) {
        NodeExecutionResult.NodeExecutionResultBuilder result = NodeExecutionResult.builder()
                .awaitingInput(true)
                .inputAttempts(attempts);
        composer.compose(node, "prompt", context.variables()).ifPresent(result::message);
        return result.build();
    }

    private int parseMaxAttempts(NodeDefinition node) {
        String raw = node.configString("maxAttempts", "0");
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new GraphException("QUESTION node '" + node.id() + "' has invalid maxAttempts: " + raw);
        }
    }
}
