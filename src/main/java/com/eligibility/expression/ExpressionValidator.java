package com.eligibility.expression;

import com.eligibility.expression.ast.ArrayLiteral;
import com.eligibility.expression.ast.BinaryOp;
import com.eligibility.expression.ast.Conditional;
import com.eligibility.expression.ast.Constant;
import com.eligibility.expression.ast.Expression;
import com.eligibility.expression.ast.NaryLogic;
import com.eligibility.expression.ast.NaryOp;
import com.eligibility.expression.ast.UnaryOp;
import com.eligibility.expression.ast.VariableRef;
import com.eligibility.fact.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural validator and compiler for JSON-logic style requirement expressions.
 * <p>
 * Walks the raw tree (maps, lists and scalars as produced by Jackson or SnakeYAML)
 * with a depth and node budget, checks every operator token against
 * {@link Operator} and its arity, and builds the typed {@link Expression} tree.
 * All problems are collected; each message names the offending path, with
 * {@code $} as the root (e.g. {@code $.and[1].>=[0]}).
 * <p>
 * The validator also records which variables are referenced and what type
 * their usage implies, which drives fact coercion and missing-fact detection.
 */
public class ExpressionValidator {

    public static final int DEFAULT_MAX_DEPTH = 20;
    public static final int DEFAULT_MAX_NODES = 1000;

    private static final String ROOT = "$";

    private final int maxDepth;
    private final int maxNodes;

    public ExpressionValidator() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES);
    }

    public ExpressionValidator(int maxDepth, int maxNodes) {
        if (maxDepth < 1 || maxNodes < 1) {
            throw new IllegalArgumentException("maxDepth and maxNodes must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    /**
     * Validate and compile an expression.
     *
     * @param expression Raw expression (Map, List or scalar)
     * @return Validation result, carrying the compiled tree when valid
     */
    public ValidationResult validate(Object expression) {
        if (expression == null) {
            return ValidationResult.invalid("Expression is null");
        }
        if (expression instanceof Map<?, ?> map && map.isEmpty()
                || expression instanceof List<?> list && list.isEmpty()) {
            return ValidationResult.invalid("Expression cannot be empty");
        }

        Walk walk = new Walk();
        Expression tree = walk.build(expression, ROOT, 0);
        if (tree == null || !walk.errors.isEmpty()) {
            return ValidationResult.invalid(walk.errors, walk.variables);
        }
        return ValidationResult.valid(tree, walk.variables, walk.usage);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    /**
     * State of one validation pass.
     */
    private class Walk {
        private final List<String> errors = new ArrayList<>();
        private final Set<String> variables = new LinkedHashSet<>();
        private final Map<String, ValueType> usage = new LinkedHashMap<>();
        private int nodes;
        private boolean nodeBudgetExceeded;

        Expression build(Object raw, String path, int depth) {
            if (depth > maxDepth) {
                errors.add("Expression too deeply nested at " + path + " (max depth: " + maxDepth + ")");
                return null;
            }
            if (++nodes > maxNodes) {
                if (!nodeBudgetExceeded) {
                    errors.add("Expression too complex (max nodes: " + maxNodes + ")");
                    nodeBudgetExceeded = true;
                }
                return null;
            }

            if (raw == null) {
                return new Constant(null);
            }
            if (raw instanceof Boolean b) {
                return b ? Constant.TRUE : Constant.FALSE;
            }
            if (raw instanceof Number n) {
                if (!Double.isFinite(n.doubleValue())) {
                    errors.add("Non-finite number literal at " + path);
                    return null;
                }
                return new Constant(n);
            }
            if (raw instanceof String) {
                return new Constant(raw);
            }
            if (raw instanceof List<?> list) {
                List<Expression> items = buildAll(list, path, depth);
                return items == null ? null : new ArrayLiteral(items);
            }
            if (raw instanceof Map<?, ?> map) {
                return buildOperation(map, path, depth);
            }

            errors.add("Unsupported value of type " + raw.getClass().getSimpleName() + " at " + path);
            return null;
        }

        private List<Expression> buildAll(List<?> raw, String path, int depth) {
            List<Expression> built = new ArrayList<>(raw.size());
            boolean failed = false;
            for (int i = 0; i < raw.size(); i++) {
                Expression child = build(raw.get(i), path + "[" + i + "]", depth + 1);
                if (child == null) {
                    failed = true;
                }
                built.add(child);
            }
            return failed ? null : built;
        }

        private Expression buildOperation(Map<?, ?> map, String path, int depth) {
            if (map.isEmpty()) {
                errors.add("Empty object at " + path);
                return null;
            }
            if (map.size() > 1) {
                errors.add("Expression object at " + path + " has multiple keys " + map.keySet()
                        + "; an expression must have a single operator key");
                return null;
            }

            Map.Entry<?, ?> entry = map.entrySet().iterator().next();
            String token = String.valueOf(entry.getKey());
            Optional<Operator> found = Operator.fromSymbol(token);
            if (found.isEmpty()) {
                errors.add("Unknown operator '" + token + "' at " + path);
                return null;
            }

            Operator operator = found.get();
            List<?> args = entry.getValue() instanceof List<?> list
                    ? list
                    : Collections.singletonList(entry.getValue());
            String operatorPath = path + "." + token;

            if (operator == Operator.VAR) {
                return buildVariable(args, operatorPath);
            }
            if (!operator.acceptsArity(args.size())) {
                errors.add("Operator '" + token + "' at " + path + " expects " + describeArity(operator)
                        + " argument(s), got " + args.size());
                return null;
            }

            List<Expression> operands = buildAll(args, operatorPath, depth);
            if (operands == null) {
                return null;
            }
            inferUsage(operator, operands);
            return assemble(operator, operands);
        }

        private Expression buildVariable(List<?> args, String path) {
            if (args.size() != 1) {
                errors.add("Variable reference at " + path + " takes a single name; defaults are not supported");
                return null;
            }
            Object name = args.get(0);
            if (!(name instanceof String s) || s.isBlank()) {
                errors.add("Variable name at " + path + " must be a non-empty string");
                return null;
            }
            variables.add(s);
            return new VariableRef(s);
        }

        private Expression assemble(Operator operator, List<Expression> operands) {
            return switch (operator) {
                case AND, OR -> new NaryLogic(operator, operands);
                case NOT, TRUTHY, ABS -> new UnaryOp(operator, operands.get(0));
                case IF -> new Conditional(operands);
                case SUBTRACT -> operands.size() == 1
                        ? new UnaryOp(operator, operands.get(0))
                        : new BinaryOp(operator, operands.get(0), operands.get(1));
                case EQUALS, STRICT_EQUALS, NOT_EQUALS, STRICT_NOT_EQUALS,
                        GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS,
                        IN, DIVIDE, MODULO -> new BinaryOp(operator, operands.get(0), operands.get(1));
                case ADD, MULTIPLY, MIN, MAX, CONCAT -> new NaryOp(operator, operands);
                case VAR -> throw new IllegalStateException("var is compiled separately");
            };
        }

        private void inferUsage(Operator operator, List<Expression> operands) {
            if (operator == Operator.AND || operator == Operator.OR || operator == Operator.NOT) {
                operands.forEach(operand -> hint(operand, ValueType.BOOLEAN));
            } else if (operator == Operator.IF) {
                for (int i = 0; i + 1 < operands.size(); i += 2) {
                    hint(operands.get(i), ValueType.BOOLEAN);
                }
            } else if (operator.kind() == OperatorKind.ARITHMETIC) {
                operands.forEach(operand -> hint(operand, ValueType.NUMBER));
            } else if (operator.isOrdering()) {
                hintOrdering(operands.get(0), operands.get(1));
                hintOrdering(operands.get(1), operands.get(0));
            } else if (operator.isEquality()) {
                hintEquality(operands.get(0), operands.get(1));
                hintEquality(operands.get(1), operands.get(0));
            }
        }

        private void hintOrdering(Expression operand, Expression other) {
            if (other instanceof Constant c && c.value() instanceof String) {
                return;
            }
            hint(operand, ValueType.NUMBER);
        }

        private void hintEquality(Expression operand, Expression other) {
            if (other instanceof Constant c) {
                if (c.value() instanceof Number) {
                    hint(operand, ValueType.NUMBER);
                } else if (c.value() instanceof Boolean) {
                    hint(operand, ValueType.BOOLEAN);
                }
            }
        }

        private void hint(Expression operand, ValueType type) {
            if (operand instanceof VariableRef ref) {
                usage.merge(ref.name(), type, ValueType::merge);
            }
        }
    }

    private static String describeArity(Operator operator) {
        if (operator.minArity() == operator.maxArity()) {
            return String.valueOf(operator.minArity());
        }
        if (operator.maxArity() == Operator.UNBOUNDED) {
            return "at least " + operator.minArity();
        }
        return operator.minArity() + " to " + operator.maxArity();
    }
}
