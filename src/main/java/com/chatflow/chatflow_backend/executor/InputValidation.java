package com.chatflow.chatflow_backend.executor;

import com.chatflow.chatflow_backend.exception.GraphException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Answer rules of a QUESTION node, written as a comma separated list:
 * "min:2,max:50", "email", "number", "regex:^[0-9]{5}$".
 * A regex rule swallows the rest of the string so its pattern may contain commas.
 */
public final class InputValidation {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private InputValidation() {
    }

    /** @return true when the answer satisfies every rule; blank rules accept anything. */
    public static boolean isValid(String answer, String rules) {
        if (answer == null) return false;
        if (rules == null || rules.isBlank()) return true;

        String value = answer.trim();
        for (String rule : parse(rules)) {
            if (!check(value, rule)) return false;
        }
        return true;
    }

    static List<String> parse(String rules) {
        List<String> parsed = new ArrayList<>();
        String remaining = rules.trim();
        while (!remaining.isEmpty()) {
            if (remaining.startsWith("regex:")) {
                parsed.add(remaining);
                break;
            }
            int comma = remaining.indexOf(',');
            String rule = comma < 0 ? remaining : remaining.substring(0, comma);
            if (!rule.isBlank()) parsed.add(rule.trim());
            remaining = comma < 0 ? "" : remaining.substring(comma + 1).trim();
        }
        return parsed;
    }

    private static boolean check(String value, String rule) {
        if (rule.equals("email")) {
            return EMAIL.matcher(value).matches();
        }
        if (rule.equals("number")) {
            return Numbers.isNumeric(value);
        }
        if (rule.equals("required")) {
            return !value.isEmpty();
        }
        if (rule.startsWith("min:")) {
            return value.length() >= intArgument(rule);
        }
        if (rule.startsWith("max:")) {
            return value.length() <= intArgument(rule);
        }
        if (rule.startsWith("regex:")) {
            try {
                return Pattern.compile(rule.substring("regex:".length())).matcher(value).matches();
            } catch (PatternSyntaxException e) {
                throw new GraphException("Invalid validation regex '" + rule + "': " + e.getDescription());
            }
        }
        throw new GraphException("Unknown validation rule: " + rule);
    }

    private static int intArgument(String rule) {
        String arg = rule.substring(rule.indexOf(':') + 1).trim();
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw new GraphException("Validation rule '" + rule + "' needs an integer argument");
        }
    }
}
