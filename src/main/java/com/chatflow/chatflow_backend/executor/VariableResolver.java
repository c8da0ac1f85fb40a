package com.chatflow.chatflow_backend.executor;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {{name}} placeholders with conversation variables. Pure, no I/O.
 *
 * <p>Supported forms: {{name}}, {{variables.name}} and a single arithmetic/concatenation step such
 * as {{price * qty}} or {{count + 1}}. A placeholder that cannot be resolved is left in the text
 * untouched so a missing variable is visible instead of silently blanked.
 */
@Component
public class VariableResolver {

    private static final Pattern REF_PATTERN = Pattern.compile("\\{\\{([^}]+)}}");
    private static final String[] OPERATORS = { " + ", " - ", " * ", " / " };

    public String resolve(String template, Map<String, String> variables) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = REF_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String expression = matcher.group(1).trim();
            String value = resolveExpression(expression, variables);
            String replacement = value != null ? value : matcher.group(0);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /** Resolves every value of a flat config map to a string. */
    public Map<String, String> resolveMap(Map<String, ?> config, Map<String, String> variables) {
        Map<String, String> resolved = new LinkedHashMap<>();
        if (config == null) return resolved;
        config.forEach((key, value) -> resolved.put(key, value != null ? resolve(value.toString(), variables) : null));
        return resolved;
    }

    /** Walks nested maps/lists (e.g. a request body) and resolves every string leaf. */
    @SuppressWarnings("unchecked")
    public Object resolveTree(Object node, Map<String, String> variables) {
        if (node instanceof String s) {
            return resolve(s, variables);
        }
        if (node instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((k, v) -> out.put(k, resolveTree(v, variables)));
            return out;
        }
        if (node instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(resolveTree(item, variables)));
            return out;
        }
        return node;
    }

    /** Value of a bare variable reference, or null when unknown. */
    public String lookup(String name, Map<String, String> variables) {
        if (name == null || variables == null) return null;
        String key = name.startsWith("variables.") ? name.substring("variables.".length()) : name;
        return variables.get(key);
    }

    private String resolveExpression(String expression, Map<String, String> variables) {
        for (String candidate : OPERATORS) {
            int i = expression.indexOf(candidate);
            if (i > 0) {
                String left = operandValue(expression.substring(0, i).trim(), variables);
                String right = operandValue(expression.substring(i + candidate.length()).trim(), variables);
                if (left == null || right == null) return null;
                return evaluateOp(candidate.trim(), left, right);
            }
        }
        return lookup(expression, variables);
    }

    // An operand is a variable name or a numeric literal
    private String operandValue(String token, Map<String, String> variables) {
        String value = lookup(token, variables);
        if (value != null) return value;
        return Double.isNaN(toDouble(token)) ? null : token;
    }

    private String evaluateOp(String op, String left, String right) {
        double l = toDouble(left);
        double r = toDouble(right);
        if ("+".equals(op) && (Double.isNaN(l) || Double.isNaN(r))) {
            return left + right;
        }
        if (Double.isNaN(l) || Double.isNaN(r)) return null;
        double result = switch (op) {
            case "+" -> l + r;
            case "-" -> l - r;
            case "*" -> l * r;
            case "/" -> r == 0 ? Double.NaN : l / r;
            default -> Double.NaN;
        };
        return Double.isNaN(result) ? null : formatNumber(result);
    }

    static String formatNumber(double d) {
        if (d == Math.floor(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private static double toDouble(String s) {
        Double d = Numbers.parse(s);
        return d != null ? d : Double.NaN;
    }
}
