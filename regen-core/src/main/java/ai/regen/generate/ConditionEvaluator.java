package ai.regen.generate;

import ai.regen.api.GenerationException;
import ai.regen.api.GenerationException.Reason;
import ai.regen.api.TemplateRenderer.VariableLookup;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates the small expression language used by conditional markers.
 *
 * <pre>
 * expr    := or
 * or      := and ('||' and)*
 * and     := unary ('&amp;&amp;' unary)*
 * unary   := '!' unary | compare
 * compare := primary (('==' | '!=') primary)?
 * primary := identifier | string | number | true | false | null | '(' expr ')'
 * </pre>
 *
 * Identifiers are dotted model keys. Referencing a key the model does not hold is an error rather than false, so a
 * typo in a condition cannot silently drop a block.
 */
public final class ConditionEvaluator {
    private ConditionEvaluator() {
        // utility class
    }

    /** Evaluates {@code expression} for truthiness. */
    public static boolean test(String expression, VariableLookup variables) throws GenerationException {
        return ValueText.truthy(evaluate(expression, variables));
    }

    /** Evaluates {@code expression} and returns its value as text, used to pick a switch alternative. */
    public static String select(String expression, VariableLookup variables) throws GenerationException {
        return ValueText.of(evaluate(expression, variables));
    }

    public static JsonNode evaluate(String expression, VariableLookup variables) throws GenerationException {
        var parser = new Parser(tokenize(expression), expression, variables);
        var value = parser.or();
        parser.expectEnd();
        return value;
    }

    /**
     * Model keys the expression reads. Malformed expressions yield whatever identifiers could be tokenized; they
     * fail later at evaluation.
     */
    public static Set<String> referencedKeys(String expression) {
        var keys = new LinkedHashSet<String>();
        try {
            for (var token : tokenize(expression)) {
                if (token.type == TokenType.IDENT) {
                    keys.add(token.text);
                }
            }
        } catch (GenerationException e) {
            // an untokenizable expression has no reliable keys; evaluation reports the error
            return keys;
        }
        return keys;
    }

    private enum TokenType {
        IDENT,
        STRING,
        NUMBER,
        TRUE,
        FALSE,
        NULL,
        EQ,
        NE,
        NOT,
        AND,
        OR,
        LPAREN,
        RPAREN
    }

    private record Token(TokenType type, String text) {}

    private static List<Token> tokenize(String s) throws GenerationException {
        var tokens = new ArrayList<Token>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")"));
                i++;
            } else if (s.startsWith("==", i)) {
                tokens.add(new Token(TokenType.EQ, "=="));
                i += 2;
            } else if (s.startsWith("!=", i)) {
                tokens.add(new Token(TokenType.NE, "!="));
                i += 2;
            } else if (c == '!') {
                tokens.add(new Token(TokenType.NOT, "!"));
                i++;
            } else if (s.startsWith("&&", i)) {
                tokens.add(new Token(TokenType.AND, "&&"));
                i += 2;
            } else if (s.startsWith("||", i)) {
                tokens.add(new Token(TokenType.OR, "||"));
                i += 2;
            } else if (c == '"' || c == '\'') {
                int end = s.indexOf(c, i + 1);
                if (end < 0) {
                    throw unevaluable(s, "unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, s.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c) || (c == '-' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
                int start = i++;
                while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(new Token(TokenType.NUMBER, s.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < s.length() && isIdentPart(s.charAt(i))) {
                    i++;
                }
                var word = s.substring(start, i);
                tokens.add(
                        switch (word) {
                            case "true" -> new Token(TokenType.TRUE, word);
                            case "false" -> new Token(TokenType.FALSE, word);
                            case "null" -> new Token(TokenType.NULL, word);
                            default -> new Token(TokenType.IDENT, word);
                        });
            } else {
                throw unevaluable(s, "unexpected character '" + c + "' at " + i);
            }
        }
        return tokens;
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    private static GenerationException unevaluable(String expression, String detail) {
        return new GenerationException(Reason.UNEVALUABLE_CONDITION, "cannot evaluate '" + expression + "': " + detail);
    }

    private static final class Parser {
        private final List<Token> tokens;
        private final String source;
        private final VariableLookup variables;
        private int pos;

        Parser(List<Token> tokens, String source, VariableLookup variables) {
            this.tokens = tokens;
            this.source = source;
            this.variables = variables;
        }

        // no short-circuiting: a missing key is reported wherever it appears
        JsonNode or() throws GenerationException {
            var left = and();
            while (accept(TokenType.OR)) {
                var right = and();
                left = BooleanNode.valueOf(ValueText.truthy(left) || ValueText.truthy(right));
            }
            return left;
        }

        JsonNode and() throws GenerationException {
            var left = unary();
            while (accept(TokenType.AND)) {
                var right = unary();
                left = BooleanNode.valueOf(ValueText.truthy(left) && ValueText.truthy(right));
            }
            return left;
        }

        JsonNode unary() throws GenerationException {
            if (accept(TokenType.NOT)) {
                return BooleanNode.valueOf(!ValueText.truthy(unary()));
            }
            return compare();
        }

        JsonNode compare() throws GenerationException {
            var left = primary();
            if (accept(TokenType.EQ)) {
                return BooleanNode.valueOf(equal(left, primary()));
            }
            if (accept(TokenType.NE)) {
                return BooleanNode.valueOf(!equal(left, primary()));
            }
            return left;
        }

        JsonNode primary() throws GenerationException {
            if (pos >= tokens.size()) {
                throw unevaluable(source, "unexpected end of expression");
            }
            var token = tokens.get(pos++);
            return switch (token.type) {
                case IDENT -> variables
                        .lookup(token.text)
                        .orElseThrow(() -> unevaluable(source, "unknown key '" + token.text + "'"));
                case STRING -> TextNode.valueOf(token.text);
                case NUMBER -> number(token.text);
                case TRUE -> BooleanNode.TRUE;
                case FALSE -> BooleanNode.FALSE;
                case NULL -> NullNode.getInstance();
                case LPAREN -> {
                    var inner = or();
                    if (!accept(TokenType.RPAREN)) {
                        throw unevaluable(source, "missing ')'");
                    }
                    yield inner;
                }
                default -> throw unevaluable(source, "unexpected '" + token.text + "'");
            };
        }

        void expectEnd() throws GenerationException {
            if (pos < tokens.size()) {
                throw unevaluable(source, "unexpected '" + tokens.get(pos).text + "'");
            }
        }

        private boolean accept(TokenType type) {
            if (pos < tokens.size() && tokens.get(pos).type == type) {
                pos++;
                return true;
            }
            return false;
        }

        private JsonNode number(String text) throws GenerationException {
            try {
                return text.contains(".")
                        ? DoubleNode.valueOf(Double.parseDouble(text))
                        : LongNode.valueOf(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new GenerationException(Reason.UNEVALUABLE_CONDITION, "bad number '" + text + "'", e);
            }
        }
    }

    static boolean equal(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.isNull() || b.isNull()) {
            return a.isNull() && b.isNull();
        }
        if (a.isContainerNode() || b.isContainerNode()) {
            return a.equals(b);
        }
        return ValueText.of(a).equals(ValueText.of(b));
    }
}
