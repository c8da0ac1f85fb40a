package com.chatflow.chatflow_backend.executor.condition;

import com.chatflow.chatflow_backend.exception.GraphException;
import com.chatflow.chatflow_backend.executor.Numbers;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates boolean expressions over conversation variables, e.g.
 * <pre>
 *   plan == 'premium' and age >= 18
 *   country in ['BR', 'PT'] or email ends_with '@acme.com'
 *   nickname is_empty
 * </pre>
 * Identifiers are variable names and resolve to "" when missing. Ordering operators compare
 * numerically and are false when either side is not a number. Parsed expressions are cached.
 */
@Component
public class ConditionExpressionEvaluator {

    private static final Set<String> BINARY_WORD_OPS = Set.of(
            "contains", "not_contains", "starts_with", "ends_with", "in", "not_in", "matches");
    private static final Set<String> UNARY_WORD_OPS = Set.of("is_empty", "is_not_empty");

    private final Map<String, Expr> cache = new ConcurrentHashMap<>();

    public boolean evaluate(String expression, Map<String, String> variables) {
        if (expression == null || expression.isBlank()) {
            throw new GraphException("Empty condition expression");
        }
        Expr parsed = cache.computeIfAbsent(expression, e -> new Parser(Tokenizer.tokenize(e), e).parse());
        return parsed.test(variables != null ? variables : Map.of());
    }

    // ── AST ───────────────────────────────────────────────────────────────────

    private interface Expr {
        boolean test(Map<String, String> vars);
    }

    private interface Operand {
        Object value(Map<String, String> vars);
    }

    private record Literal(Object literal) implements Operand {
        public Object value(Map<String, String> vars) { return literal; }
    }

    private record VariableRef(String name) implements Operand {
        public Object value(Map<String, String> vars) {
            String key = name.startsWith("variables.") ? name.substring("variables.".length()) : name;
            String v = vars.get(key);
            return v != null ? v : "";
        }
    }

    private record Comparison(Operand left, String op, Operand right) implements Expr {
        public boolean test(Map<String, String> vars) {
            Object l = left.value(vars);
            Object r = right != null ? right.value(vars) : null;
            return compare(op, l, r);
        }
    }

    private record Truthy(Operand operand) implements Expr {
        public boolean test(Map<String, String> vars) {
            Object v = operand.value(vars);
            String s = String.valueOf(v).trim();
            return !s.isEmpty() && !"false".equalsIgnoreCase(s) && !"0".equals(s);
        }
    }

    private record Not(Expr inner) implements Expr {
        public boolean test(Map<String, String> vars) { return !inner.test(vars); }
    }

    private record And(Expr left, Expr right) implements Expr {
        public boolean test(Map<String, String> vars) { return left.test(vars) && right.test(vars); }
    }

    private record Or(Expr left, Expr right) implements Expr {
        public boolean test(Map<String, String> vars) { return left.test(vars) || right.test(vars); }
    }

    private static boolean compare(String op, Object left, Object right) {
        String l = String.valueOf(left);
        switch (op) {
            case "is_empty":
                return l.trim().isEmpty();
            case "is_not_empty":
                return !l.trim().isEmpty();
            case "in":
                return asList(right).contains(l);
            case "not_in":
                return !asList(right).contains(l);
            default:
                break;
        }
        String r = String.valueOf(right);
        switch (op) {
            case "==": return equalsLoosely(l, r);
            case "!=": return !equalsLoosely(l, r);
            case "contains": return l.contains(r);
            case "not_contains": return !l.contains(r);
            case "starts_with": return l.startsWith(r);
            case "ends_with": return l.endsWith(r);
            case "matches":
                try {
                    return Pattern.compile(r).matcher(l).find();
                } catch (PatternSyntaxException e) {
                    throw new GraphException("Invalid regex in condition: " + r);
                }
            default:
                break;
        }
        Double ln = number(l);
        Double rn = number(r);
        if (ln == null || rn == null) return false;
        return switch (op) {
            case ">" -> ln > rn;
            case ">=" -> ln >= rn;
            case "<" -> ln < rn;
            case "<=" -> ln <= rn;
            default -> throw new GraphException("Unknown operator: " + op);
        };
    }

    // "10" == "10.0" is true; otherwise plain string equality
    private static boolean equalsLoosely(String l, String r) {
        if (l.equals(r)) return true;
        Double ln = number(l);
        Double rn = number(r);
        return ln != null && rn != null && ln.doubleValue() == rn.doubleValue();
    }

    private static List<String> asList(Object value) {
        if (value instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            list.forEach(item -> out.add(String.valueOf(item)));
            return out;
        }
        // A variable holding "a,b,c" works as a list too
        List<String> out = new ArrayList<>();
        for (String part : String.valueOf(value).split(",")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    private static Double number(String s) {
        return Numbers.parse(s);
    }

    // ── Parser ────────────────────────────────────────────────────────────────

    private static final class Parser {

        private final List<Token> tokens;
        private final String source;
        private int pos;

        Parser(List<Token> tokens, String source) {
            this.tokens = tokens;
            this.source = source;
        }

        Expr parse() {
            Expr expr = parseOr();
            if (!atEnd()) {
                throw error("unexpected '" + peek().text() + "'");
            }
            return expr;
        }

        private Expr parseOr() {
            Expr left = parseAnd();
            while (matchWord("or") || matchSymbol("||")) {
                left = new Or(left, parseAnd());
            }
            return left;
        }

        private Expr parseAnd() {
            Expr left = parseUnary();
            while (matchWord("and") || matchSymbol("&&")) {
                left = new And(left, parseUnary());
            }
            return left;
        }

        private Expr parseUnary() {
            if (matchWord("not") || matchSymbol("!")) {
                return new Not(parseUnary());
            }
            if (matchSymbol("(")) {
                Expr inner = parseOr();
                expectSymbol(")");
                return inner;
            }
            return parseComparison();
        }

        private Expr parseComparison() {
            Operand left = parseOperand();
            if (atEnd()) return new Truthy(left);

            Token next = peek();
            if (next.type() == TokenType.SYMBOL && isComparisonSymbol(next.text())) {
                pos++;
                return new Comparison(left, next.text(), parseOperand());
            }
            if (next.type() == TokenType.IDENT) {
                String word = next.text().toLowerCase();
                if (UNARY_WORD_OPS.contains(word)) {
                    pos++;
                    return new Comparison(left, word, null);
                }
                if (BINARY_WORD_OPS.contains(word)) {
                    pos++;
                    return new Comparison(left, word, parseOperand());
                }
            }
            return new Truthy(left);
        }

        private Operand parseOperand() {
            if (atEnd()) throw error("missing operand");
            Token t = tokens.get(pos++);
            switch (t.type()) {
                case STRING:
                    return new Literal(t.text());
                case NUMBER:
                    return new Literal(t.text());
                case IDENT:
                    if ("true".equalsIgnoreCase(t.text()) || "false".equalsIgnoreCase(t.text())) {
                        return new Literal(t.text().toLowerCase());
                    }
                    return new VariableRef(t.text());
                case SYMBOL:
                    if ("[".equals(t.text())) return parseList();
                    throw error("unexpected '" + t.text() + "'");
                default:
                    throw error("unexpected token");
            }
        }

        private Operand parseList() {
            List<Operand> items = new ArrayList<>();
            if (!matchSymbol("]")) {
                do {
                    items.add(parseOperand());
                } while (matchSymbol(","));
                expectSymbol("]");
            }
            return vars -> {
                List<Object> values = new ArrayList<>(items.size());
                items.forEach(item -> values.add(item.value(vars)));
                return values;
            };
        }

        private boolean isComparisonSymbol(String s) {
            return s.equals("==") || s.equals("!=") || s.equals(">") || s.equals(">=")
                    || s.equals("<") || s.equals("<=");
        }

        private boolean matchWord(String word) {
            if (!atEnd() && peek().type() == TokenType.IDENT && peek().text().equalsIgnoreCase(word)) {
                pos++;
                return true;
            }
            return false;
        }

        private boolean matchSymbol(String symbol) {
            if (!atEnd() && peek().type() == TokenType.SYMBOL && peek().text().equals(symbol)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expectSymbol(String symbol) {
            if (!matchSymbol(symbol)) throw error("expected '" + symbol + "'");
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private GraphException error(String detail) {
            return new GraphException("Malformed condition '" + source + "': " + detail);
        }
    }

    // ── Tokenizer ─────────────────────────────────────────────────────────────

    private enum TokenType { IDENT, STRING, NUMBER, SYMBOL }

    private record Token(TokenType type, String text) {
    }

    private static final class Tokenizer {

        static List<Token> tokenize(String source) {
            List<Token> tokens = new ArrayList<>();
            int i = 0;
            int n = source.length();
            while (i < n) {
                char c = source.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                } else if (c == '\'' || c == '"') {
                    int end = i + 1;
                    StringBuilder sb = new StringBuilder();
                    while (end < n && source.charAt(end) != c) {
                        if (source.charAt(end) == '\\' && end + 1 < n) end++;
                        sb.append(source.charAt(end++));
                    }
                    if (end >= n) {
                        throw new GraphException("Malformed condition '" + source + "': unterminated string");
                    }
                    tokens.add(new Token(TokenType.STRING, sb.toString()));
                    i = end + 1;
                } else if (Character.isDigit(c) || (c == '-' && i + 1 < n && Character.isDigit(source.charAt(i + 1)))) {
                    int end = i + 1;
                    while (end < n && (Character.isDigit(source.charAt(end)) || source.charAt(end) == '.')) end++;
                    tokens.add(new Token(TokenType.NUMBER, source.substring(i, end)));
                    i = end;
                } else if (Character.isLetter(c) || c == '_') {
                    int end = i + 1;
                    while (end < n && (Character.isLetterOrDigit(source.charAt(end))
                            || source.charAt(end) == '_' || source.charAt(end) == '.')) end++;
                    tokens.add(new Token(TokenType.IDENT, source.substring(i, end)));
                    i = end;
                } else {
                    String two = i + 1 < n ? source.substring(i, i + 2) : "";
                    if (two.equals("==") || two.equals("!=") || two.equals(">=") || two.equals("<=")
                            || two.equals("&&") || two.equals("||")) {
                        tokens.add(new Token(TokenType.SYMBOL, two));
                        i += 2;
                    } else if ("<>![](),".indexOf(c) >= 0) {
                        tokens.add(new Token(TokenType.SYMBOL, String.valueOf(c)));
                        i++;
                    } else {
                        throw new GraphException("Malformed condition '" + source + "': unexpected character '" + c + "'");
                    }
                }
            }
            if (tokens.isEmpty()) {
                throw new GraphException("Empty condition expression");
            }
            return tokens;
        }
    }
}
