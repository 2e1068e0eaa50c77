package io.github.cyfko.entailql.core.config;

/**
 * Controls how the entailment engine walks the assignment space.
 * <p>
 * Premises are immutable and verdicts merge with a commutative, associative OR, so the
 * assignments may be examined in any order or in parallel without changing the result.
 * Sequential enumeration is the default; the space is only sixteen assignments wide, so
 * parallelism pays off only for very large premises.
 * </p>
 *
 * @param parallelEnabled whether assignments are evaluated on a parallel stream
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EnumerationPolicy(boolean parallelEnabled) {

    public static EnumerationPolicy sequential() {
        return new EnumerationPolicy(false);
    }

    public static EnumerationPolicy parallel() {
        return new EnumerationPolicy(true);
    }
}
