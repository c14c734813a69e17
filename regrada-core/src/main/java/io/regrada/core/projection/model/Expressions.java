package io.regrada.core.projection.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Prints [Expression] trees in choreography source syntax.
///
/// ```
/// binaryOp(equals, propDeref(_@self.params.id), intLit 1)  ->  _@self.params.id == 1
/// stringLit "a"                                            ->  'a'
/// ```
public final class Expressions {

    /// Pseudo event naming the event being declared.
    public static final String SELF = "_@self";

    private static final Map<String, String> OPERATORS = Map.of(
            "and", "&&",
            "or", "||",
            "equals", "==",
            "notEquals", "!=",
            "intGreaterThan", ">",
            "intLessThan", "<",
            "intAdd", "+");

    private Expressions() {}

    /// Prints an expression.
    ///
    /// @param expression expression, null prints as an empty string
    /// @return source text, never null
    public static String format(Expression expression) {
        if (expression == null) {
            return "";
        }
        if (expression instanceof Expression.BinaryOp op) {
            return format(op.left()) + " " + operator(op.op()) + " " + format(op.right());
        }
        if (expression instanceof Expression.PropDeref deref) {
            return format(deref.base()) + "." + deref.prop();
        }
        if (expression instanceof Expression.EventRef ref) {
            return ref.value();
        }
        if (expression instanceof Expression.IntLit lit) {
            return Long.toString(lit.value());
        }
        if (expression instanceof Expression.StringLit lit) {
            return "'" + lit.value() + "'";
        }
        if (expression instanceof Expression.BoolLit lit) {
            return Boolean.toString(lit.value());
        }
        if (expression instanceof Expression.FloatLit lit) {
            return Double.toString(lit.value());
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    /// Returns the textual operator for an operator name, or the name itself.
    public static String operator(String op) {
        return OPERATORS.getOrDefault(op, op);
    }

    /// Splits a conjunction into its conjuncts, left to right.
    public static List<Expression> conjuncts(Expression expression) {
        List<Expression> result = new ArrayList<>();
        collectConjuncts(expression, result);
        return result;
    }

    private static void collectConjuncts(Expression expression, List<Expression> result) {
        if (expression instanceof Expression.BinaryOp op && "and".equals(op.op())) {
            collectConjuncts(op.left(), result);
            collectConjuncts(op.right(), result);
        } else if (expression != null) {
            result.add(expression);
        }
    }

    /// Returns the parameter name when the expression reads `_@self.params.<name>`.
    ///
    /// @return parameter name, or null for any other expression
    public static String selfParameter(Expression expression) {
        if (expression instanceof Expression.PropDeref deref
                && deref.base() instanceof Expression.PropDeref params
                && "params".equals(params.prop())
                && params.base() instanceof Expression.EventRef ref
                && SELF.equals(ref.value())) {
            return deref.prop();
        }
        return null;
    }

    /// Returns the last property name of a dereference chain, or the event
    /// name of a plain reference.
    ///
    /// @return trailing name, or null for literals and operations
    public static String trailingName(Expression expression) {
        if (expression instanceof Expression.PropDeref deref) {
            return deref.prop();
        }
        if (expression instanceof Expression.EventRef ref) {
            return ref.value();
        }
        return null;
    }
}
