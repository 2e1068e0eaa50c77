package io.github.cyfko.entailql.core.parsing;

import io.github.cyfko.entailql.core.api.Atomic;
import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits a lower-cased formula into positioned {@link Token}s.
 * <p>
 * The token pattern is compiled once when the scanner is constructed and reused by every
 * {@link #scan(String)} call. Each call returns a fresh, lazy, single-use iterator: tokens are
 * recognised only as they are requested, so an invalid character late in the formula is
 * reported only after every token before it has been consumed.
 * </p>
 *
 * <pre>{@code
 * Scanner scanner = new Scanner();
 * Iterator<Token> tokens = scanner.scan("a => (b v c)");
 * // a@0, =>@2, (@5, b@6, v@8, c@10, )@11
 * }</pre>
 *
 * <p>Whitespace produces no token but advances the position.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Scanner {

    private final Pattern tokenPattern;

    public Scanner() {
        String operators = OperatorKind.byPrecedence().stream()
                .map(op -> Pattern.quote(op.symbol()))
                .collect(Collectors.joining("|"));
        String atomics = Atomic.alphabet().stream()
                .map(Atomic::toString)
                .collect(Collectors.joining("", "[", "]"));
        this.tokenPattern = Pattern.compile(operators + "|" + atomics + "|\\(|\\)|\\s");
    }

    /**
     * Starts scanning a formula.
     *
     * @param expression the lower-cased formula
     * @return a lazy iterator over the formula's tokens
     * @throws PremiseSyntaxException with {@code EMPTY_EXPRESSION} if the formula is empty; the
     *                                iterator itself throws {@code INVALID_TOKEN} when it reaches an
     *                                unrecognised character
     */
    public Iterator<Token> scan(String expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        if (expression.isEmpty()) {
            throw PremiseSyntaxException.emptyExpression();
        }
        return new TokenIterator(expression, tokenPattern.matcher(expression));
    }

    private static final class TokenIterator implements Iterator<Token> {
        private final String expression;
        private final Matcher matcher;
        private int cursor;
        private Token pending;

        TokenIterator(String expression, Matcher matcher) {
            this.expression = expression;
            this.matcher = matcher;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && cursor < expression.length()) {
                matcher.region(cursor, expression.length());
                if (!matcher.lookingAt()) {
                    throw PremiseSyntaxException.invalidToken(cursor, unrecognisedText());
                }
                int start = cursor;
                String text = matcher.group();
                cursor = matcher.end();
                if (!text.isBlank()) {
                    pending = toToken(start, text);
                }
            }
            return pending != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more tokens in '" + expression + "'");
            }
            Token token = pending;
            pending = null;
            return token;
        }

        // Text from the cursor up to the next recognisable token, or to the end of input.
        private String unrecognisedText() {
            matcher.region(cursor, expression.length());
            int end = matcher.find() ? matcher.start() : expression.length();
            return expression.substring(cursor, end);
        }

        private static Token toToken(int position, String text) {
            return switch (text) {
                case "(" -> Token.leftParen(position);
                case ")" -> Token.rightParen(position);
                default -> OperatorKind.fromSymbol(text)
                        .map(op -> Token.operator(position, op))
                        .orElseGet(() -> Token.atomic(position, Atomic.fromSymbol(text.charAt(0))));
            };
        }
    }
}
