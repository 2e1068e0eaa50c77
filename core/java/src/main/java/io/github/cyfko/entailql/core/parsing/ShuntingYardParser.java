package io.github.cyfko.entailql.core.parsing;

import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Infix to postfix converter based on the shunting-yard algorithm, with full syntax validation.
 * <p>
 * Unlike a plain shunting-yard pass, every token is checked against the token that precedes it,
 * so that the first malformed spot of the formula is reported with its exact position:
 * </p>
 * <ul>
 *   <li>an atomic or {@code (} right after an atomic or {@code )} is a missing operator</li>
 *   <li>{@code ~} right after an atomic or {@code )} is a missing operator</li>
 *   <li>{@code )} right after {@code (} is an empty pair of parentheses</li>
 *   <li>{@code )} right after an operator, a binary operator right after {@code (} or after another
 *       operator, and a formula ending on an operator are missing operands</li>
 *   <li>unbalanced parentheses are reported at the unpaired parenthesis</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> postfix = ShuntingYardParser.toPostfix(new Scanner().scan("~a ^ (b v c)"));
 * // a ~ b c v ^
 * }</pre>
 *
 * <p>
 * On success, the output is well-formed postfix: evaluated left to right with an operand stack,
 * every operator finds exactly as many operands as its arity and one operand remains at the end.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ShuntingYardParser {

    private ShuntingYardParser() {}

    /**
     * Converts a token stream to postfix order.
     *
     * @param tokens tokens in formula order, typically from {@link Scanner#scan(String)}
     * @return the tokens in postfix order, parentheses removed
     * @throws PremiseSyntaxException at the first syntax error
     */
    public static List<Token> toPostfix(Iterator<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");

        List<Token> output = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();
        Token last = null;

        while (tokens.hasNext()) {
            Token token = tokens.next();

            switch (token.kind()) {
                case ATOMIC -> {
                    requireNotAfterOperand(token, last);
                    output.add(token);
                }

                case LEFT_PAREN -> {
                    requireNotAfterOperand(token, last);
                    stack.push(token);
                }

                case RIGHT_PAREN -> {
                    if (last != null && last.is(TokenKind.LEFT_PAREN)) {
                        throw PremiseSyntaxException.emptyParentheses(last.position());
                    }
                    requireNotAfterOperator(last);
                    popUntilLeftParen(token, stack, output);
                }

                case OPERATOR -> {
                    OperatorKind operator = token.operator();
                    if (operator.isUnary()) {
                        requireNotAfterOperand(token, last);
                        // Prefix operators have no left operand, nothing on the stack can bind before them.
                        stack.push(token);
                    } else {
                        // A leading binary operator is pushed; the tree builder reports its missing left operand.
                        if (last != null && last.is(TokenKind.LEFT_PAREN)) {
                            throw PremiseSyntaxException.missingOperand(token.position(), operator);
                        }
                        requireNotAfterOperator(last);
                        while (!stack.isEmpty() && bindsAtLeastAsTightly(stack.peek(), operator)) {
                            output.add(stack.pop());
                        }
                        stack.push(token);
                    }
                }
            }

            last = token;
        }

        if (last == null) {
            throw PremiseSyntaxException.emptyExpression();
        }
        requireNotAfterOperator(last);

        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top.is(TokenKind.LEFT_PAREN)) {
                throw PremiseSyntaxException.unmatchedOpenParen(top.position());
            }
            output.add(top);
        }

        return output;
    }

    private static void popUntilLeftParen(Token closing, Deque<Token> stack, List<Token> output) {
        while (!stack.isEmpty()) {
            Token top = stack.pop();
            if (top.is(TokenKind.LEFT_PAREN)) {
                return;
            }
            output.add(top);
        }
        throw PremiseSyntaxException.unmatchedCloseParen(closing.position());
    }

    private static boolean bindsAtLeastAsTightly(Token stackTop, OperatorKind operator) {
        return stackTop.is(TokenKind.OPERATOR) && stackTop.operator().precedence() >= operator.precedence();
    }

    private static void requireNotAfterOperand(Token token, Token last) {
        if (last != null && last.endsOperand()) {
            throw PremiseSyntaxException.missingOperator(token.position(), last.text(), token.text());
        }
    }

    private static void requireNotAfterOperator(Token last) {
        if (last != null && last.is(TokenKind.OPERATOR)) {
            throw PremiseSyntaxException.missingOperand(last.position(), last.operator());
        }
    }
}
