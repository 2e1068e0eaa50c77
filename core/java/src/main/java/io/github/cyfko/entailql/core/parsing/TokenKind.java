package io.github.cyfko.entailql.core.parsing;

/**
 * Lexical categories produced by the {@link Scanner}.
 *
 * @since 1.0.0
 */
public enum TokenKind {
    ATOMIC,
    OPERATOR,
    LEFT_PAREN,
    RIGHT_PAREN
}
