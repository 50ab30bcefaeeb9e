package com.eligibility.expression.ast;

import com.eligibility.expression.EvaluationErrorKind;
import com.eligibility.expression.Operator;

import java.util.Collection;
import java.util.List;

/**
 * Typed operand handling shared by the expression nodes.
 * Incompatible operands are reported, never coerced.
 */
final class Values {

    private Values() {
    }

    static double number(Operator op, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw typeMismatch(op, "a number", value);
    }

    static boolean bool(Operator op, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw typeMismatch(op, "a boolean", value);
    }

    static double finite(Operator op, double result) {
        if (!Double.isFinite(result)) {
            throw new EvaluationException(EvaluationErrorKind.NON_FINITE_RESULT,
                    "Operator '" + op.symbol() + "' produced a non-finite result: " + result);
        }
        return result;
    }

    static boolean equal(Operator op, Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
        }
        if (left instanceof Boolean && right instanceof Boolean
                || left instanceof String && right instanceof String) {
            return left.equals(right);
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_MISMATCH,
                "Operator '" + op.symbol() + "' cannot compare " + kindOf(left) + " with " + kindOf(right));
    }

    static int compare(Operator op, Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_MISMATCH,
                "Operator '" + op.symbol() + "' cannot order " + kindOf(left) + " against " + kindOf(right));
    }

    static boolean contains(Operator op, Object needle, Object haystack) {
        if (haystack instanceof List<?> list) {
            for (Object item : list) {
                if (item == null ? needle == null : needle != null && sameKind(needle, item) && equal(op, needle, item)) {
                    return true;
                }
            }
            return false;
        }
        if (haystack instanceof String s && needle instanceof String n) {
            return s.contains(n);
        }
        throw new EvaluationException(EvaluationErrorKind.TYPE_MISMATCH,
                "Operator '" + op.symbol() + "' cannot look for " + kindOf(needle) + " in " + kindOf(haystack));
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0 && !Double.isNaN(n.doubleValue());
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    static String kindOf(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        return value.getClass().getSimpleName();
    }

    private static boolean sameKind(Object a, Object b) {
        return kindOf(a).equals(kindOf(b));
    }

    private static EvaluationException typeMismatch(Operator op, String expected, Object actual) {
        return new EvaluationException(EvaluationErrorKind.TYPE_MISMATCH,
                "Operator '" + op.symbol() + "' expects " + expected + ", got " + kindOf(actual)
                        + (actual == null ? "" : " (" + actual + ")"));
    }
}
