package io.github.cyfko.entailql.core.ast;

import io.github.cyfko.entailql.core.api.Assignment;
import io.github.cyfko.entailql.core.parsing.OperatorKind;

import java.util.Objects;

/**
 * Negation of a sub-expression.
 *
 * @param operand the negated expression
 * @since 1.0.0
 */
public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public boolean evaluate(Assignment assignment) {
        return !operand.evaluate(assignment);
    }

    @Override
    public String toInfix() {
        return OperatorKind.NOT.symbol() + operand.toInfix();
    }
}
