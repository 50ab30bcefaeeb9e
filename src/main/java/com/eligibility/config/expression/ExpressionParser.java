package com.eligibility.config.expression;

import com.eligibility.exception.InvalidExpressionException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.eligibility.config.expression.ExpressionConfig.*;

/**
 * Parser for text conditions.
 * Converts tokens into a JSON-logic tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR; {@code * / %} over {@code + -}):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | comparison
 * comparison := additive ( compareOp additive | 'IN' list | 'NOT' 'IN' list )?
 * additive   := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := '-' unary | primary
 * primary    := '(' expression ')' | literal | field | list
 * list       := '[' (additive (',' additive)*)? ']'
 * </pre>
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a JSON-logic tree.
     *
     * @return Root expression (map, list or literal)
     */
    public Object parse() {
        Object result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private Object parseExpression() {
        return parseOr();
    }

    private Object parseOr() {
        Object left = parseAnd();
        List<Object> operands = new ArrayList<>();
        operands.add(left);

        while (match(TokenType.OR)) {
            operands.add(parseAnd());
        }

        return operands.size() == 1 ? left : operation("or", operands);
    }

    private Object parseAnd() {
        Object left = parseNot();
        List<Object> operands = new ArrayList<>();
        operands.add(left);

        while (match(TokenType.AND)) {
            operands.add(parseNot());
        }

        return operands.size() == 1 ? left : operation("and", operands);
    }

    private Object parseNot() {
        if (match(TokenType.NOT)) {
            return operation("!", parseNot());
        }
        return parseComparison();
    }

    private Object parseComparison() {
        Object left = parseAdditive();

        // NOT IN
        if (match(TokenType.NOT)) {
            if (match(TokenType.IN)) {
                return operation("!", operation("in", left, parseList()));
            }
            throw error("Expected IN after NOT");
        }

        // IN
        if (match(TokenType.IN)) {
            return operation("in", left, parseList());
        }

        for (Map.Entry<TokenType, String> entry : COMPARISON_OPERATORS.entrySet()) {
            if (match(entry.getKey())) {
                return operation(entry.getValue(), left, parseAdditive());
            }
        }
        return left;
    }

    private Object parseAdditive() {
        Object left = parseTerm();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            TokenType op = advance().type();
            left = combine(ARITHMETIC_OPERATORS.get(op), left, parseTerm());
        }
        return left;
    }

    private Object parseTerm() {
        Object left = parseUnary();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            TokenType op = advance().type();
            left = combine(ARITHMETIC_OPERATORS.get(op), left, parseUnary());
        }
        return left;
    }

    private Object parseUnary() {
        if (match(TokenType.MINUS)) {
            Object operand = parseUnary();
            if (operand instanceof Long l) {
                return -l;
            }
            if (operand instanceof Double d) {
                return -d;
            }
            return operation("-", operand);
        }
        return parsePrimary();
    }

    private Object parsePrimary() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            Object expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }

        if (match(TokenType.NUMBER, TokenType.STRING, TokenType.BOOLEAN)) {
            return previous().literal();
        }
        if (match(TokenType.NULL)) {
            return null;
        }
        if (match(TokenType.IDENT)) {
            Map<String, Object> var = new LinkedHashMap<>();
            var.put("var", previous().text());
            return var;
        }
        if (check(TokenType.LBRACKET)) {
            return parseList();
        }

        throw error("Expected field, literal or '('");
    }

    private List<Object> parseList() {
        expect(TokenType.LBRACKET);

        List<Object> values = new ArrayList<>();
        if (!check(TokenType.RBRACKET)) {
            values.add(parseAdditive());
            while (match(TokenType.COMMA)) {
                values.add(parseAdditive());
            }
        }

        expect(TokenType.RBRACKET);
        return values;
    }

    /**
     * Chained {@code +} and {@code *} are flattened into one variadic node.
     */
    @SuppressWarnings("unchecked")
    private Object combine(String symbol, Object left, Object right) {
        boolean variadic = "+".equals(symbol) || "*".equals(symbol);
        if (variadic && left instanceof Map<?, ?> map && map.size() == 1 && map.containsKey(symbol)) {
            List<Object> operands = (List<Object>) map.get(symbol);
            operands.add(right);
            return left;
        }
        return operation(symbol, left, right);
    }

    private Map<String, Object> operation(String symbol, Object... operands) {
        List<Object> args = new ArrayList<>(operands.length);
        for (Object operand : operands) {
            args.add(operand);
        }
        return operation(symbol, args);
    }

    private Map<String, Object> operation(String symbol, List<Object> operands) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put(symbol, operands);
        return node;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private InvalidExpressionException error(String message) {
        int position = peek().position();
        return new InvalidExpressionException("Invalid condition-expr at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
