package io.github.cyfko.entailql.core.exception;

/**
 * Classes of malformed formula reported by {@link PremiseSyntaxException}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SyntaxErrorKind {
    /** The formula contains no token at all. */
    EMPTY_EXPRESSION,
    /** A character sequence matches no atomic, operator, parenthesis or whitespace. */
    INVALID_TOKEN,
    /** An operator lacks an operand on one side. */
    MISSING_OPERAND,
    /** Two operands are adjacent without a connecting operator. */
    MISSING_OPERATOR,
    /** A pair of parentheses encloses nothing. */
    EMPTY_PARENTHESES,
    /** An opening parenthesis is never closed. */
    UNMATCHED_OPEN_PAREN,
    /** A closing parenthesis has no opening counterpart. */
    UNMATCHED_CLOSE_PAREN,
    /** The formula exceeds the length allowed by the parser policy. */
    EXPRESSION_TOO_LONG
}
