package com.eligibility.config.expression;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keywords, symbols and their JSON-logic equivalents for text conditions.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords (matched case-insensitively) mapped to token types.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "IN", TokenType.IN,
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN,
            "NULL", TokenType.NULL
    );

    /**
     * Punctuation and operator symbols. Two-character symbols come first so
     * the tokenizer can take the longest match.
     */
    public static final Map<String, TokenType> SYMBOLS = symbols();

    /**
     * Comparison tokens mapped to JSON-logic operators.
     */
    public static final Map<TokenType, String> COMPARISON_OPERATORS = Map.of(
            TokenType.EQ, "==",
            TokenType.NE, "!=",
            TokenType.GT, ">",
            TokenType.GTE, ">=",
            TokenType.LT, "<",
            TokenType.LTE, "<="
    );

    /**
     * Arithmetic tokens mapped to JSON-logic operators.
     */
    public static final Map<TokenType, String> ARITHMETIC_OPERATORS = Map.of(
            TokenType.PLUS, "+",
            TokenType.MINUS, "-",
            TokenType.STAR, "*",
            TokenType.SLASH, "/",
            TokenType.PERCENT, "%"
    );

    public static final char QUOTE_DOUBLE = '"';
    public static final char QUOTE_SINGLE = '\'';
    public static final char ESCAPE = '\\';

    private static Map<String, TokenType> symbols() {
        Map<String, TokenType> symbols = new LinkedHashMap<>();
        symbols.put("==", TokenType.EQ);
        symbols.put("!=", TokenType.NE);
        symbols.put("<>", TokenType.NE);
        symbols.put(">=", TokenType.GTE);
        symbols.put("<=", TokenType.LTE);
        symbols.put("&&", TokenType.AND);
        symbols.put("||", TokenType.OR);
        symbols.put("=", TokenType.EQ);
        symbols.put(">", TokenType.GT);
        symbols.put("<", TokenType.LT);
        symbols.put("!", TokenType.NOT);
        symbols.put("(", TokenType.LPAREN);
        symbols.put(")", TokenType.RPAREN);
        symbols.put("[", TokenType.LBRACKET);
        symbols.put("]", TokenType.RBRACKET);
        symbols.put(",", TokenType.COMMA);
        symbols.put("+", TokenType.PLUS);
        symbols.put("-", TokenType.MINUS);
        symbols.put("*", TokenType.STAR);
        symbols.put("/", TokenType.SLASH);
        symbols.put("%", TokenType.PERCENT);
        return symbols;
    }
}
