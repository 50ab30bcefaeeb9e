package com.eligibility.expression;

import com.eligibility.expression.ast.NodeType;
import com.eligibility.fact.ValueType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionValidator.
 */
class ExpressionValidatorTest {

    private final ExpressionValidator validator = new ExpressionValidator();

    private static Object nestedNot(int levels) {
        Object expression = true;
        for (int i = 0; i < levels; i++) {
            expression = Map.of("!", List.of(expression));
        }
        return expression;
    }

    @Test
    @DisplayName("Should reject null and empty expressions")
    void shouldRejectNullAndEmpty() {
        assertEquals(List.of("Expression is null"), validator.validate(null).errors());
        assertEquals(List.of("Expression cannot be empty"), validator.validate(Map.of()).errors());
        assertEquals(List.of("Expression cannot be empty"), validator.validate(List.of()).errors());
    }

    @Test
    @DisplayName("Should accept a bare constant")
    void shouldAcceptConstant() {
        ValidationResult result = validator.validate(true);

        assertTrue(result.ok());
        assertTrue(result.isConstant());
        assertNotNull(result.expression());
    }

    @Test
    @DisplayName("Should compile operators into typed nodes")
    void shouldCompileTypedTree() {
        assertEquals(NodeType.NARY_LOGIC, validator.validate(Map.of("and", List.of(true, false))).expression().getType());
        assertEquals(NodeType.BINARY_OP, validator.validate(Map.of(">", List.of(Map.of("var", "x"), 1))).expression().getType());
        assertEquals(NodeType.UNARY_OP, validator.validate(Map.of("-", List.of(1))).expression().getType());
        assertEquals(NodeType.NARY_OP, validator.validate(Map.of("+", List.of(1, 2, 3))).expression().getType());
        assertEquals(NodeType.CONDITIONAL, validator.validate(Map.of("if", List.of(true, 1, 2))).expression().getType());
        assertEquals(NodeType.VARIABLE_REF, validator.validate(Map.of("var", "x")).expression().getType());
        assertEquals(NodeType.ARRAY_LITERAL, validator.validate(List.of(1, 2)).expression().getType());
    }

    @Test
    @DisplayName("Should name unknown operators and their path")
    void shouldRejectUnknownOperator() {
        ValidationResult result = validator.validate(Map.of("and", List.of(true, Map.of("map", List.of(1)))));

        assertFalse(result.ok());
        assertEquals(List.of("Unknown operator 'map' at $.and[1]"), result.errors());
    }

    @Test
    @DisplayName("Should collect every problem in one pass")
    void shouldCollectAllErrors() {
        ValidationResult result = validator.validate(Map.of("or", List.of(
                Map.of("filter", List.of()),
                Map.of("reduce", List.of()))));

        assertEquals(2, result.errors().size());
    }

    @Test
    @DisplayName("Should enforce the nesting depth limit of 20")
    void shouldEnforceDepthLimit() {
        assertTrue(validator.validate(nestedNot(20)).ok());

        ValidationResult tooDeep = validator.validate(nestedNot(21));
        assertFalse(tooDeep.ok());
        assertTrue(tooDeep.errors().get(0).startsWith("Expression too deeply nested"));
    }

    @Test
    @DisplayName("Should enforce the node budget")
    void shouldEnforceNodeBudget() {
        List<Object> operands = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            operands.add(i);
        }
        ValidationResult result = new ExpressionValidator(20, 10).validate(Map.of("+", operands));

        assertFalse(result.ok());
        assertEquals(List.of("Expression too complex (max nodes: 10)"), result.errors());
    }

    @Test
    @DisplayName("Should check operator arity")
    void shouldCheckArity() {
        ValidationResult result = validator.validate(Map.of("/", List.of(1)));

        assertFalse(result.ok());
        assertTrue(result.errors().get(0).contains("expects 2 argument(s), got 1"));
        assertTrue(validator.validate(Map.of("-", List.of(1))).ok());
        assertFalse(validator.validate(Map.of("-", List.of(1, 2, 3))).ok());
    }

    @Test
    @DisplayName("Should reject objects with more than one operator key")
    void shouldRejectMultipleKeys() {
        Map<String, Object> expression = new LinkedHashMap<>();
        expression.put("==", List.of(1, 1));
        expression.put("!=", List.of(1, 2));

        ValidationResult result = validator.validate(expression);

        assertFalse(result.ok());
        assertTrue(result.errors().get(0).contains("multiple keys"));
    }

    @Test
    @DisplayName("Should reject var defaults and blank names")
    void shouldValidateVariableReferences() {
        assertTrue(validator.validate(Map.of("var", List.of("age", 0))).errors().get(0)
                .contains("defaults are not supported"));
        assertTrue(validator.validate(Map.of("var", "")).errors().get(0)
                .contains("must be a non-empty string"));
        assertTrue(validator.validate(Map.of("var", List.of("age"))).ok());
    }

    @Test
    @DisplayName("Should list referenced variables in first-use order")
    void shouldListVariables() {
        ValidationResult result = validator.validate(Map.of("and", List.of(
                Map.of(">=", List.of(Map.of("var", "salary"), 25000)),
                Map.of("==", List.of(Map.of("var", "passport"), true)),
                Map.of("<", List.of(Map.of("var", "salary"), 1000000)))));

        assertTrue(result.ok());
        assertEquals(List.of("salary", "passport"), List.copyOf(result.variablesReferenced()));
    }

    @Test
    @DisplayName("Should infer the type each variable's usage implies")
    void shouldInferUsage() {
        ValidationResult result = validator.validate(Map.of("and", List.of(
                Map.of(">=", List.of(Map.of("var", "salary"), 25000)),
                Map.of("==", List.of(Map.of("var", "passport"), true)),
                Map.of("<", List.of(Map.of("var", "surname"), "M")),
                Map.of("==", List.of(Map.of("var", "code"), "X1")))));

        Map<String, ValueType> usage = result.usage();
        assertEquals(ValueType.NUMBER, usage.get("salary"));
        assertEquals(ValueType.BOOLEAN, usage.get("passport"));
        assertFalse(usage.containsKey("surname"));
        assertFalse(usage.containsKey("code"));
    }

    @Test
    @DisplayName("Conflicting usages should widen to ANY")
    void shouldWidenConflictingUsage() {
        ValidationResult result = validator.validate(Map.of("and", List.of(
                Map.of("var", "flag"),
                Map.of(">", List.of(Map.of("var", "flag"), 0)))));

        assertEquals(ValueType.ANY, result.usage().get("flag"));
    }
}
