package com.eligibility.config.expression;

import com.eligibility.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.eligibility.config.expression.ExpressionConfig.*;

/**
 * Splits a text condition into tokens.
 * <p>
 * Identifiers may contain dots (e.g. {@code applicant.age}). Numbers without a
 * fraction or exponent become {@code Long}, others {@code Double}. Strings take
 * single or double quotes with backslash escapes.
 */
public final class ExpressionTokenizer {

    private final String input;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * @return Tokens, always ending with {@link TokenType#EOF}
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (skipWhitespace()) {
            char c = input.charAt(pos);
            if (c == QUOTE_DOUBLE || c == QUOTE_SINGLE) {
                tokens.add(string(c));
            } else if (Character.isLetter(c) || c == '_' || c == '$') {
                tokens.add(word());
            } else if (startsNumber(c)) {
                tokens.add(number());
            } else {
                tokens.add(symbol());
            }
        }
        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private boolean skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
        return pos < input.length();
    }

    private boolean startsNumber(char c) {
        return Character.isDigit(c)
                || c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1));
    }

    private Token symbol() {
        for (Map.Entry<String, TokenType> entry : SYMBOLS.entrySet()) {
            if (input.startsWith(entry.getKey(), pos)) {
                Token token = new Token(entry.getValue(), entry.getKey(), null, pos);
                pos += entry.getKey().length();
                return token;
            }
        }
        throw error("Unexpected character '" + input.charAt(pos) + "'", pos);
    }

    private Token word() {
        int start = pos;
        while (pos < input.length() && isWordPart(input.charAt(pos))) {
            pos++;
        }
        String text = input.substring(start, pos);
        String keyword = text.toUpperCase(Locale.ROOT);

        TokenType type = KEYWORDS.get(keyword);
        if (type == null) {
            return new Token(TokenType.IDENT, text, text, start);
        }
        Object literal = type == TokenType.BOOLEAN ? Boolean.valueOf("TRUE".equals(keyword)) : null;
        return new Token(type, text, literal, start);
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    private Token number() {
        int start = pos;
        boolean integral = true;
        digits();
        if (pos < input.length() && input.charAt(pos) == '.') {
            integral = false;
            pos++;
            digits();
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            integral = false;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                pos++;
            }
            int exponentStart = pos;
            digits();
            if (pos == exponentStart) {
                throw error("Missing exponent digits", start);
            }
        }

        String text = input.substring(start, pos);
        try {
            Object value = integral ? (Object) Long.parseLong(text) : (Object) Double.parseDouble(text);
            return new Token(TokenType.NUMBER, text, value, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private void digits() {
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, input.substring(start, pos), value.toString(), start);
            }
            if (c == ESCAPE && pos < input.length()) {
                char escaped = input.charAt(pos++);
                value.append(switch (escaped) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    case 'r' -> '\r';
                    default -> escaped;
                });
            } else {
                value.append(c);
            }
        }
        throw error("Unterminated string", start);
    }

    private InvalidExpressionException error(String message, int position) {
        return new InvalidExpressionException("Invalid condition-expr at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
