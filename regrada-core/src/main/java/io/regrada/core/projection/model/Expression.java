package io.regrada.core.projection.model;

import java.util.Objects;

/// Typed expression tree returned by the compile service.
///
/// Used for computation expressions, instantiation constraints and role
/// parameter values. [Expressions] prints it back into source syntax.
public sealed interface Expression
        permits Expression.BinaryOp,
                Expression.PropDeref,
                Expression.EventRef,
                Expression.IntLit,
                Expression.StringLit,
                Expression.BoolLit,
                Expression.FloatLit {

    /// Binary operation such as `and`, `equals` or `intAdd`.
    ///
    /// @param left left operand, may be null when the service omits it
    /// @param right right operand, may be null when the service omits it
    /// @param op operator name, not null
    record BinaryOp(Expression left, Expression right, String op) implements Expression {
        public BinaryOp {
            Objects.requireNonNull(op, "op must not be null");
        }
    }

    /// Property access `base.prop`.
    record PropDeref(Expression base, String prop) implements Expression {
        public PropDeref {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(prop, "prop must not be null");
        }
    }

    /// Reference to an event value, including the `_@self` pseudo event.
    record EventRef(String value) implements Expression {
        public EventRef {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record IntLit(long value) implements Expression {}

    record StringLit(String value) implements Expression {
        public StringLit {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record BoolLit(boolean value) implements Expression {}

    record FloatLit(double value) implements Expression {}
}
