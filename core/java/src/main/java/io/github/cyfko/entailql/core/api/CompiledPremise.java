package io.github.cyfko.entailql.core.api;

import io.github.cyfko.entailql.core.ast.Expression;
import io.github.cyfko.entailql.core.parsing.Token;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A premise formula compiled to an immutable expression tree.
 *
 * @param source     the formula as supplied by the caller
 * @param postfix    the validated postfix token sequence the tree was built from
 * @param expression the expression tree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompiledPremise(String source, List<Token> postfix, Expression expression) implements Premise {

    public CompiledPremise {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(expression, "expression cannot be null");
        postfix = List.copyOf(postfix);
    }

    @Override
    public boolean holdsUnder(Assignment assignment) {
        return expression.evaluate(assignment);
    }

    /**
     * Renders the premise in canonical form: fully parenthesised, without the outermost pair.
     *
     * @return e.g. {@code (a ^ b) => ~c} for the source {@code "A^B=>~C"}
     */
    public String canonicalForm() {
        String infix = expression.toInfix();
        return infix.startsWith("(") ? infix.substring(1, infix.length() - 1) : infix;
    }

    /**
     * Renders the postfix sequence, tokens separated by single spaces.
     *
     * @return e.g. {@code a b ^ c ~ =>}
     */
    public String postfixForm() {
        return postfix.stream().map(Token::text).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return canonicalForm();
    }
}
