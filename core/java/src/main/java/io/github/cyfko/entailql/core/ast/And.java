package io.github.cyfko.entailql.core.ast;

import io.github.cyfko.entailql.core.api.Assignment;
import io.github.cyfko.entailql.core.parsing.OperatorKind;

import java.util.Objects;

/**
 * Conjunction of two sub-expressions.
 *
 * @param left  the left operand
 * @param right the right operand
 * @since 1.0.0
 */
public record And(Expression left, Expression right) implements Expression {

    public And {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public boolean evaluate(Assignment assignment) {
        return left.evaluate(assignment) && right.evaluate(assignment);
    }

    @Override
    public String toInfix() {
        return "(" + left.toInfix() + " " + OperatorKind.AND.symbol() + " " + right.toInfix() + ")";
    }
}
