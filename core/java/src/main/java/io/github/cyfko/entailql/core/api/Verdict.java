package io.github.cyfko.entailql.core.api;

/**
 * What a premise set says about one atomic.
 * <p>
 * The constants form a two-bit flag set combined with bitwise OR. While models of the premise
 * set are enumerated, each model contributes {@link #PROVEN_TRUE} to the atomics it makes true
 * and {@link #PROVEN_FALSE} to the atomics it makes false. Once every assignment has been
 * examined the accumulated bits are the verdict itself:
 * </p>
 * <ul>
 *   <li>{@link #VACUOUS} ({@code 0b00}) - the premises have no model, so every atomic is entailed
 *       in both directions</li>
 *   <li>{@link #PROVEN_TRUE} ({@code 0b01}) - the atomic is true in every model</li>
 *   <li>{@link #PROVEN_FALSE} ({@code 0b10}) - the atomic is false in every model</li>
 *   <li>{@link #UNPROVEN} ({@code 0b11}) - the atomic varies across models</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Verdict {
    VACUOUS(0b00),
    PROVEN_TRUE(0b01),
    PROVEN_FALSE(0b10),
    UNPROVEN(0b11);

    private static final Verdict[] BY_BITS = {VACUOUS, PROVEN_TRUE, PROVEN_FALSE, UNPROVEN};

    private final int bits;

    Verdict(int bits) {
        this.bits = bits;
    }

    public int bits() {
        return bits;
    }

    /**
     * Combines two verdicts. The operation is commutative, associative and idempotent,
     * with {@link #VACUOUS} as identity.
     *
     * @param other the verdict to merge in
     * @return the union of both flag sets
     */
    public Verdict or(Verdict other) {
        return fromBits(bits | other.bits);
    }

    /**
     * Returns the contribution of a single model in which an atomic has the given value.
     *
     * @param value the atomic's truth value in the model
     * @return {@link #PROVEN_TRUE} or {@link #PROVEN_FALSE}
     */
    public static Verdict observed(boolean value) {
        return value ? PROVEN_TRUE : PROVEN_FALSE;
    }

    /**
     * Decodes a two-bit flag set.
     *
     * @param bits value in {@code [0, 3]}
     * @return the matching verdict
     * @throws IllegalArgumentException if the value is out of range
     */
    public static Verdict fromBits(int bits) {
        if (bits < 0 || bits >= BY_BITS.length) {
            throw new IllegalArgumentException("Verdict bits must be in [0, 3], got: " + bits);
        }
        return BY_BITS[bits];
    }
}
