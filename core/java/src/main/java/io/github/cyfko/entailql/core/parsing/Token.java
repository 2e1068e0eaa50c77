package io.github.cyfko.entailql.core.parsing;

import io.github.cyfko.entailql.core.api.Atomic;

import java.util.Objects;

/**
 * A lexical token and the zero-based offset where it starts in the lower-cased formula.
 *
 * @param position offset of the first character of the token
 * @param kind     lexical category
 * @param text     the matched characters
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(int position, TokenKind kind, String text) {

    public Token {
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative, got: " + position);
        }
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }

    public static Token atomic(int position, Atomic atomic) {
        return new Token(position, TokenKind.ATOMIC, atomic.toString());
    }

    public static Token operator(int position, OperatorKind operator) {
        return new Token(position, TokenKind.OPERATOR, operator.symbol());
    }

    public static Token leftParen(int position) {
        return new Token(position, TokenKind.LEFT_PAREN, "(");
    }

    public static Token rightParen(int position) {
        return new Token(position, TokenKind.RIGHT_PAREN, ")");
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    /**
     * Tells whether this token closes a complete operand, i.e. an atomic or a closing parenthesis.
     *
     * @return {@code true} if an operand ends with this token
     */
    public boolean endsOperand() {
        return kind == TokenKind.ATOMIC || kind == TokenKind.RIGHT_PAREN;
    }

    /**
     * Returns the atomic named by this token.
     *
     * @return the atomic
     * @throws IllegalStateException if this is not an {@link TokenKind#ATOMIC} token
     */
    public Atomic atomic() {
        if (kind != TokenKind.ATOMIC) {
            throw new IllegalStateException("Token '" + text + "' is not an atomic");
        }
        return Atomic.fromSymbol(text.charAt(0));
    }

    /**
     * Returns the operator carried by this token.
     *
     * @return the operator
     * @throws IllegalStateException if this is not an {@link TokenKind#OPERATOR} token
     */
    public OperatorKind operator() {
        if (kind != TokenKind.OPERATOR) {
            throw new IllegalStateException("Token '" + text + "' is not an operator");
        }
        return OperatorKind.fromSymbol(text)
                .orElseThrow(() -> new IllegalStateException("Unknown operator '" + text + "'"));
    }

    @Override
    public String toString() {
        return text + "@" + position;
    }
}
