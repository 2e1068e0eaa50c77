package io.github.cyfko.entailql.core.ast;

import io.github.cyfko.entailql.core.api.Assignment;

/**
 * Immutable propositional expression tree.
 * <p>
 * Trees are built once by {@link io.github.cyfko.entailql.core.parsing.PostfixExpressionBuilder}
 * and evaluated many times during model enumeration. No node is ever mutated after construction,
 * so a tree can be evaluated concurrently against different assignments.
 * </p>
 *
 * <h2>Evaluation</h2>
 * <p>
 * {@link #evaluate(Assignment)} reduces the tree by structural recursion:
 * </p>
 * <pre>
 * Atom(x)        -> assignment[x]
 * Not(e)         -> !e
 * And(l, r)      -> l &amp;&amp; r
 * Or(l, r)       -> l || r
 * Implies(l, r)  -> !l || r
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Expression permits Atom, Not, And, Or, Implies {

    /**
     * Evaluates this expression under a total assignment.
     *
     * @param assignment truth values for every atomic
     * @return the truth value of the expression
     */
    boolean evaluate(Assignment assignment);

    /**
     * Renders this expression in formula notation with every binary sub-expression
     * wrapped in parentheses, e.g. {@code (~a ^ (b => c))}.
     *
     * @return the fully parenthesised form
     */
    String toInfix();

    /**
     * Packs the truth table of this expression into an int: bit {@code v} is set when the
     * expression holds under {@code new Assignment(v)}.
     *
     * @return the sixteen-row truth table
     */
    default int truthTable() {
        int table = 0;
        for (int v = 0; v < Assignment.COUNT; v++) {
            if (evaluate(new Assignment(v))) {
                table |= 1 << v;
            }
        }
        return table;
    }
}
