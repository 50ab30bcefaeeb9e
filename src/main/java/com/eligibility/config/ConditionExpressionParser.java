package com.eligibility.config;

import com.eligibility.config.expression.ExpressionParser;
import com.eligibility.config.expression.ExpressionTokenizer;
import com.eligibility.config.expression.Token;
import com.eligibility.exception.InvalidExpressionException;

import java.util.List;

/**
 * Facade for compiling infix requirement conditions into JSON-logic trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: AND / &amp;&amp;, OR / ||, NOT / !</li>
 *   <li>Comparisons: ==, =, !=, &lt;&gt;, &gt;, &gt;=, &lt;, &lt;=</li>
 *   <li>Collection: IN, NOT IN</li>
 *   <li>Arithmetic: +, -, *, /, % and unary minus</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: NOT > AND > OR (parentheses override)
 * <p>
 * Example: {@code min_salary >= 25000 AND has_valid_passport == true} becomes
 * {@code {"and": [{">=": [{"var": "min_salary"}, 25000]}, {"==": [{"var": "has_valid_passport"}, true]}]}}.
 */
public final class ConditionExpressionParser {

    private ConditionExpressionParser() {
    }

    /**
     * Parse a condition into a JSON-logic tree.
     *
     * @param expression Condition text
     * @return Raw expression (maps, lists and scalars)
     * @throws InvalidExpressionException if the text is blank or malformed
     */
    public static Object parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidExpressionException("Invalid condition-expr: expression is empty", 0);
        }

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(expression, tokens);
        return parser.parse();
    }
}
