package io.github.cyfko.entailql.core.api;

/**
 * Anything that can be tested against an assignment of the atomic alphabet.
 * <p>
 * The entailment engine only needs this view of a premise; {@link CompiledPremise} is the
 * implementation produced by a {@link PremiseCompiler}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Premise {

    /**
     * Tells whether this premise is true under the given assignment.
     * Implementations must be side-effect free and safe to call concurrently.
     *
     * @param assignment truth values for every atomic
     * @return {@code true} if the assignment satisfies the premise
     */
    boolean holdsUnder(Assignment assignment);
}
