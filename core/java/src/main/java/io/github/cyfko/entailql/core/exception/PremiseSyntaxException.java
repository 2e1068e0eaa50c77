package io.github.cyfko.entailql.core.exception;

import io.github.cyfko.entailql.core.api.PremiseCompiler;
import io.github.cyfko.entailql.core.parsing.OperatorKind;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Exception thrown when a premise formula cannot be compiled.
 * <p>
 * Every instance carries the {@link SyntaxErrorKind}, the zero-based character offset in the
 * lower-cased formula where the problem was detected and, when the formula was compiled as
 * part of a premise list, the index of that premise. Compilation stops at the first error;
 * no recovery is attempted.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * compiler.compile("");      // EMPTY_EXPRESSION      at 0: "empty expression"
 * compiler.compile("a & b"); // INVALID_TOKEN         at 2: "invalid token '&'"
 * compiler.compile("a ^");   // MISSING_OPERAND       at 2: "missing operand for '^'"
 * compiler.compile("a b");   // MISSING_OPERATOR      at 2: "missing operator between 'a' and 'b'"
 * compiler.compile("()");    // EMPTY_PARENTHESES     at 0: "empty parentheses"
 * compiler.compile("(a");    // UNMATCHED_OPEN_PAREN  at 0: "unpaired opening parenthesis"
 * compiler.compile("a)");    // UNMATCHED_CLOSE_PAREN at 1: "unpaired closing parenthesis"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     List<CompiledPremise> premises = compiler.compileAll(arguments);
 * } catch (PremiseSyntaxException e) {
 *     System.err.printf("arg=%d pos=%d: Syntax error: %s%n",
 *             e.getPremiseIndex().orElse(0) + 1, e.getPosition(), e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PremiseCompiler
 */
public class PremiseSyntaxException extends RuntimeException {

    private final SyntaxErrorKind kind;
    private final int position;
    private final String token;
    private final int premiseIndex;

    /**
     * Creates an exception for a formula compiled on its own.
     *
     * @param kind     the error class
     * @param position offset in the lower-cased formula
     * @param token    the offending text, or {@code null} if none applies
     * @param message  the diagnostic message
     */
    public PremiseSyntaxException(SyntaxErrorKind kind, int position, String token, String message) {
        this(kind, position, token, message, -1, null);
    }

    private PremiseSyntaxException(SyntaxErrorKind kind, int position, String token, String message,
                                   int premiseIndex, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.position = position;
        this.token = token;
        this.premiseIndex = premiseIndex;
    }

    public static PremiseSyntaxException emptyExpression() {
        return new PremiseSyntaxException(SyntaxErrorKind.EMPTY_EXPRESSION, 0, null, "empty expression");
    }

    public static PremiseSyntaxException invalidToken(int position, String text) {
        return new PremiseSyntaxException(SyntaxErrorKind.INVALID_TOKEN, position, text,
                "invalid token '" + text + "'");
    }

    public static PremiseSyntaxException missingOperand(int position, OperatorKind operator) {
        return new PremiseSyntaxException(SyntaxErrorKind.MISSING_OPERAND, position, operator.symbol(),
                "missing operand for '" + operator.symbol() + "'");
    }

    public static PremiseSyntaxException missingOperator(int position, String previous, String current) {
        return new PremiseSyntaxException(SyntaxErrorKind.MISSING_OPERATOR, position, current,
                "missing operator between '" + previous + "' and '" + current + "'");
    }

    public static PremiseSyntaxException emptyParentheses(int position) {
        return new PremiseSyntaxException(SyntaxErrorKind.EMPTY_PARENTHESES, position, "(", "empty parentheses");
    }

    public static PremiseSyntaxException unmatchedOpenParen(int position) {
        return new PremiseSyntaxException(SyntaxErrorKind.UNMATCHED_OPEN_PAREN, position, "(",
                "unpaired opening parenthesis");
    }

    public static PremiseSyntaxException unmatchedCloseParen(int position) {
        return new PremiseSyntaxException(SyntaxErrorKind.UNMATCHED_CLOSE_PAREN, position, ")",
                "unpaired closing parenthesis");
    }

    public static PremiseSyntaxException expressionTooLong(int length, int maxLength, String policyName) {
        return new PremiseSyntaxException(SyntaxErrorKind.EXPRESSION_TOO_LONG, 0, null, String.format(
                "expression too long (%d characters, max: %d). Policy applied: %s", length, maxLength, policyName));
    }

    /**
     * Returns a copy of this exception attributed to the premise at the given index.
     * The original exception becomes the cause of the copy.
     *
     * @param index zero-based index of the premise in the compiled list
     * @return the attributed exception
     */
    public PremiseSyntaxException forPremise(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("premise index must not be negative, got: " + index);
        }
        return new PremiseSyntaxException(kind, position, token, getMessage(), index, this);
    }

    public SyntaxErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Returns the offending text: the invalid characters, the operator lacking an operand,
     * the unexpected operand, or the unpaired parenthesis.
     *
     * @return the token text, or {@code null} if no single token is at fault
     */
    public String getToken() {
        return token;
    }

    public OptionalInt getPremiseIndex() {
        return premiseIndex < 0 ? OptionalInt.empty() : OptionalInt.of(premiseIndex);
    }
}
