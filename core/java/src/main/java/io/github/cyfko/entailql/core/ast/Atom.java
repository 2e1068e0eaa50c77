package io.github.cyfko.entailql.core.ast;

import io.github.cyfko.entailql.core.api.Assignment;
import io.github.cyfko.entailql.core.api.Atomic;

import java.util.Objects;

/**
 * Leaf node referencing one atomic.
 *
 * @param atomic the referenced atomic
 * @since 1.0.0
 */
public record Atom(Atomic atomic) implements Expression {

    public Atom {
        Objects.requireNonNull(atomic, "atomic cannot be null");
    }

    @Override
    public boolean evaluate(Assignment assignment) {
        return assignment.valueOf(atomic);
    }

    @Override
    public String toInfix() {
        return atomic.toString();
    }
}
