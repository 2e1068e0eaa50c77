package io.github.cyfko.entailql.core.parsing;

import io.github.cyfko.entailql.core.ast.And;
import io.github.cyfko.entailql.core.ast.Atom;
import io.github.cyfko.entailql.core.ast.Expression;
import io.github.cyfko.entailql.core.ast.Implies;
import io.github.cyfko.entailql.core.ast.Not;
import io.github.cyfko.entailql.core.ast.Or;
import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link Expression} tree from a postfix token list in a single pass.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token in postfix order:
 *   - ATOMIC: push Atom
 *   - NOT:    pop operand, push Not(operand)
 *   - binary: pop right, pop left, push Op(left, right)
 *
 * Stack must contain exactly ONE expression at the end.
 * </pre>
 *
 * <p>
 * Operand underflow is reported as a {@code MISSING_OPERAND} syntax error at the operator, so the
 * builder stays safe to use on postfix input that did not come from {@link ShuntingYardParser}.
 * Any other leftover state means the postfix list was not produced by a validating parser and is
 * reported as an {@link IllegalStateException}.
 * </p>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ShuntingYardParser
 */
public final class PostfixExpressionBuilder {

    private PostfixExpressionBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds the expression tree of a postfix token list.
     *
     * @param postfixTokens tokens in postfix order
     * @return the root of the expression tree
     * @throws PremiseSyntaxException if an operator lacks operands
     * @throws IllegalStateException  if the list is empty, holds parentheses, or leaves more than one tree
     */
    public static Expression build(List<Token> postfixTokens) {
        Objects.requireNonNull(postfixTokens, "postfixTokens cannot be null");

        Deque<Expression> stack = new ArrayDeque<>();

        for (Token token : postfixTokens) {
            switch (token.kind()) {
                case ATOMIC -> stack.push(new Atom(token.atomic()));

                case OPERATOR -> {
                    OperatorKind operator = token.operator();
                    Expression right = popOperand(stack, token);
                    if (operator.isUnary()) {
                        stack.push(new Not(right));
                    } else {
                        Expression left = popOperand(stack, token);
                        stack.push(combine(operator, left, right));
                    }
                }

                default -> throw new IllegalStateException(
                        "Malformed postfix expression: unexpected parenthesis " + token);
            }
        }

        if (stack.size() != 1) {
            throw new IllegalStateException(String.format(
                    "Malformed postfix expression: evaluation resulted in %d expressions on stack (expected 1)",
                    stack.size()));
        }

        return stack.pop();
    }

    private static Expression popOperand(Deque<Expression> stack, Token operatorToken) {
        if (stack.isEmpty()) {
            throw PremiseSyntaxException.missingOperand(operatorToken.position(), operatorToken.operator());
        }
        return stack.pop();
    }

    private static Expression combine(OperatorKind operator, Expression left, Expression right) {
        return switch (operator) {
            case AND -> new And(left, right);
            case OR -> new Or(left, right);
            case IMPLIES -> new Implies(left, right);
            case NOT -> throw new IllegalArgumentException("NOT is not a binary operator");
        };
    }
}
