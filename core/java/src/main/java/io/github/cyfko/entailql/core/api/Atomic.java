package io.github.cyfko.entailql.core.api;

import java.util.List;

/**
 * The fixed, ordered alphabet of atomic propositions.
 * <p>
 * The alphabet size is a design constant: every entailment question is answered by
 * enumerating the {@code 2^COUNT} assignments of truth values to these atomics.
 * Declaration order is alphabet order, and alphabet order fixes the bit layout of an
 * {@link Assignment}: {@link #A} is the most significant bit.
 * </p>
 *
 * <pre>{@code
 * Atomic atomic = Atomic.fromSymbol('c');   // Atomic.C
 * char symbol = atomic.symbol();            // 'c'
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Atomic {
    A('a'),
    B('b'),
    C('c'),
    D('d');

    /**
     * Number of atomics in the alphabet.
     */
    public static final int COUNT = 4;

    private static final List<Atomic> ALPHABET = List.of(values());

    private final char symbol;

    Atomic(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the lower-case symbol used for this atomic in formulas.
     *
     * @return the symbol character
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Returns the position of this atomic's bit inside an assignment value,
     * counted from the least significant bit.
     *
     * @return the bit shift for this atomic
     */
    int bitShift() {
        return COUNT - 1 - ordinal();
    }

    /**
     * Returns every atomic in alphabet order.
     *
     * @return immutable list of all atomics
     */
    public static List<Atomic> alphabet() {
        return ALPHABET;
    }

    /**
     * Tells whether a character names an atomic, ignoring case.
     *
     * @param symbol the character to test
     * @return {@code true} if the character is an atomic symbol
     */
    public static boolean isSymbol(char symbol) {
        char lower = Character.toLowerCase(symbol);
        return lower >= 'a' && lower < 'a' + COUNT;
    }

    /**
     * Resolves an atomic from its symbol, ignoring case.
     *
     * @param symbol the symbol character
     * @return the matching atomic
     * @throws IllegalArgumentException if the character is not an atomic symbol
     */
    public static Atomic fromSymbol(char symbol) {
        if (!isSymbol(symbol)) {
            throw new IllegalArgumentException("'" + symbol + "' is not an atomic symbol");
        }
        return ALPHABET.get(Character.toLowerCase(symbol) - 'a');
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
