package com.pkgmeta.core.requirement;

import com.pkgmeta.core.requirement.MarkerExpression.And;
import com.pkgmeta.core.requirement.MarkerExpression.Comparison;
import com.pkgmeta.core.requirement.MarkerExpression.Operand;
import com.pkgmeta.core.requirement.MarkerExpression.Or;
import com.pkgmeta.core.requirement.MarkerExpression.Value;
import com.pkgmeta.core.requirement.MarkerExpression.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for environment markers.
 *
 * <pre>
 * marker     := and ( 'or' and )*
 * and        := atom ( 'and' atom )*
 * atom       := '(' marker ')' | operand op operand
 * operand    := VARIABLE | QUOTED_STRING
 * </pre>
 *
 * <p>Only the standard environment variables are accepted; anything else is a
 * syntax error rather than an opaque string.
 */
public final class MarkerParser {

    static final Set<String> VARIABLES = Set.of(
        "python_version", "python_full_version", "os_name", "sys_platform",
        "platform_release", "platform_system", "platform_version", "platform_machine",
        "platform_python_implementation", "implementation_name", "implementation_version",
        "extra", "os.name", "sys.platform", "platform.version", "platform.machine",
        "platform.python_implementation", "python_implementation"
    );

    private static final List<String> SYMBOL_OPERATORS = List.of("===", "==", "!=", "<=", ">=", "~=", "<", ">");

    private enum Kind { LPAREN, RPAREN, STRING, WORD, OPERATOR, END }

    private record Token(Kind kind, String text, int position) {
    }

    private final String input;
    private final List<Token> tokens;
    private int index;

    private MarkerParser(String input) {
        this.input = input;
        this.tokens = tokenize(input);
    }

    /**
     * Parses a marker expression.
     *
     * @param marker marker text, without the leading semicolon
     * @return expression tree
     * @throws RequirementSyntaxException if the marker is malformed
     */
    public static MarkerExpression parse(String marker) {
        if (marker == null || marker.isBlank()) {
            throw new RequirementSyntaxException("Empty marker", String.valueOf(marker), 0);
        }
        MarkerParser parser = new MarkerParser(marker);
        MarkerExpression expression = parser.parseOr();
        Token trailing = parser.peek();
        if (trailing.kind() != Kind.END) {
            throw parser.error("Unexpected '" + trailing.text() + "'", trailing);
        }
        return expression;
    }

    private MarkerExpression parseOr() {
        MarkerExpression left = parseAnd();
        while (isWord(peek(), "or")) {
            index++;
            left = new Or(left, parseAnd());
        }
        return left;
    }

    private MarkerExpression parseAnd() {
        MarkerExpression left = parseAtom();
        while (isWord(peek(), "and")) {
            index++;
            left = new And(left, parseAtom());
        }
        return left;
    }

    private MarkerExpression parseAtom() {
        Token token = peek();
        if (token.kind() == Kind.LPAREN) {
            index++;
            MarkerExpression inner = parseOr();
            Token closing = next();
            if (closing.kind() != Kind.RPAREN) {
                throw error("Expected ')'", closing);
            }
            return inner;
        }
        Operand left = parseOperand();
        String operator = parseOperator();
        Operand right = parseOperand();
        return new Comparison(left, operator, right);
    }

    private Operand parseOperand() {
        Token token = next();
        return switch (token.kind()) {
            case STRING -> new Value(token.text());
            case WORD -> {
                if (!VARIABLES.contains(token.text())) {
                    throw error("Unknown marker variable '" + token.text() + "'", token);
                }
                yield new Variable(token.text());
            }
            default -> throw error("Expected variable or quoted string", token);
        };
    }

    private String parseOperator() {
        Token token = next();
        if (token.kind() == Kind.OPERATOR) {
            return token.text();
        }
        if (isWord(token, "in")) {
            return "in";
        }
        if (isWord(token, "not") && isWord(peek(), "in")) {
            index++;
            return "not in";
        }
        throw error("Expected comparison operator", token);
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.kind() != Kind.END) {
            index++;
        }
        return token;
    }

    private static boolean isWord(Token token, String word) {
        return token.kind() == Kind.WORD && token.text().equals(word);
    }

    private RequirementSyntaxException error(String message, Token token) {
        return new RequirementSyntaxException(message, input, token.position());
    }

    private static List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = input.length();
        while (pos < length) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", pos++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", pos++));
            } else if (c == '\'' || c == '"') {
                int end = input.indexOf(c, pos + 1);
                if (end < 0) {
                    throw new RequirementSyntaxException("Unterminated string", input, pos);
                }
                tokens.add(new Token(Kind.STRING, input.substring(pos + 1, end), pos));
                pos = end + 1;
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < length && isWordChar(input.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(Kind.WORD, input.substring(start, pos), start));
            } else {
                String operator = matchOperator(input, pos);
                if (operator == null) {
                    throw new RequirementSyntaxException("Unexpected character '" + c + "'", input, pos);
                }
                tokens.add(new Token(Kind.OPERATOR, operator, pos));
                pos += operator.length();
            }
        }
        tokens.add(new Token(Kind.END, "<end>", length));
        return tokens;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private static String matchOperator(String input, int pos) {
        for (String operator : SYMBOL_OPERATORS) {
            if (input.startsWith(operator, pos)) {
                return operator;
            }
        }
        return null;
    }
}
