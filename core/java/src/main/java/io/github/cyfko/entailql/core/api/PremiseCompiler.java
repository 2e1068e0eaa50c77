package io.github.cyfko.entailql.core.api;

import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles premise formulas into evaluable {@link CompiledPremise}s.
 * <p>
 * Formulas are built from the atomics {@code a}, {@code b}, {@code c}, {@code d} (any case),
 * parentheses, whitespace and the operators {@code ~}, {@code ^}, {@code v}, {@code =>}, listed
 * from tightest to loosest binding.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * PremiseCompiler compiler = new BasicPremiseCompiler();
 * CompiledPremise premise = compiler.compile("A => (B v ~C)");
 * boolean holds = premise.holdsUnder(new Assignment(0b1000)); // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface PremiseCompiler {

    /**
     * Compiles a single formula.
     *
     * @param formula the formula text
     * @return the compiled premise
     * @throws PremiseSyntaxException at the first syntax error of the formula
     */
    CompiledPremise compile(String formula) throws PremiseSyntaxException;

    /**
     * Compiles formulas in order, stopping at the first one that fails.
     *
     * @param formulas the formula texts
     * @return compiled premises, in the same order
     * @throws PremiseSyntaxException carrying the zero-based index of the failing formula
     */
    default List<CompiledPremise> compileAll(List<String> formulas) throws PremiseSyntaxException {
        Objects.requireNonNull(formulas, "formulas cannot be null");
        List<CompiledPremise> premises = new ArrayList<>(formulas.size());
        for (int i = 0; i < formulas.size(); i++) {
            try {
                premises.add(compile(formulas.get(i)));
            } catch (PremiseSyntaxException e) {
                throw e.forPremise(i);
            }
        }
        return List.copyOf(premises);
    }
}
