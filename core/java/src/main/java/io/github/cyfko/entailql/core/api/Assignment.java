package io.github.cyfko.entailql.core.api;

import java.util.StringJoiner;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * A total assignment of truth values to every {@link Atomic}.
 * <p>
 * Represented canonically as an integer in {@code [0, 2^Atomic.COUNT)} whose bits, read from
 * most significant to least significant, give the truth value of each atomic in alphabet order.
 * With the four-letter alphabet, {@code 0b1010} means {@code a=true, b=false, c=true, d=false}.
 * </p>
 *
 * @param value the packed truth values
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Assignment(int value) {

    /**
     * Number of distinct assignments over the alphabet.
     */
    public static final int COUNT = 1 << Atomic.COUNT;

    public Assignment {
        if (value < 0 || value >= COUNT) {
            throw new IllegalArgumentException("Assignment value must be in [0, " + COUNT + "), got: " + value);
        }
    }

    /**
     * Returns the truth value this assignment gives to an atomic.
     *
     * @param atomic the atomic to look up
     * @return its truth value
     */
    public boolean valueOf(Atomic atomic) {
        return ((value >> atomic.bitShift()) & 1) == 1;
    }

    /**
     * Streams every assignment in ascending canonical order.
     *
     * @return the {@value #COUNT} assignments
     */
    public static Stream<Assignment> all() {
        return IntStream.range(0, COUNT).mapToObj(Assignment::new);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Atomic atomic : Atomic.alphabet()) {
            joiner.add(atomic.symbol() + "=" + (valueOf(atomic) ? "T" : "F"));
        }
        return joiner.toString();
    }
}
