package io.github.cyfko.entailql.core;

import io.github.cyfko.entailql.core.api.CompiledPremise;
import io.github.cyfko.entailql.core.api.PremiseCompiler;
import io.github.cyfko.entailql.core.entailment.EntailmentEngine;
import io.github.cyfko.entailql.core.entailment.EntailmentResult;
import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;
import io.github.cyfko.entailql.core.impl.BasicPremiseCompiler;

import java.util.List;
import java.util.Objects;

/**
 * High-level facade combining premise compilation and entailment.
 *
 * <pre>{@code
 * Entailer entailer = Entailer.defaults();
 * EntailmentResult result = entailer.entail(List.of("a", "a => b"));
 * result.verdictOf(Atomic.A); // PROVEN_TRUE
 * result.verdictOf(Atomic.C); // UNPROVEN
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe as long as the supplied collaborators are.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Entailer {

    private final PremiseCompiler compiler;
    private final EntailmentEngine engine;

    private Entailer(PremiseCompiler compiler, EntailmentEngine engine) {
        this.compiler = Objects.requireNonNull(compiler, "compiler cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /**
     * Creates an entailer with a {@link BasicPremiseCompiler} and a sequential {@link EntailmentEngine}.
     *
     * @return a new entailer
     */
    public static Entailer defaults() {
        return new Entailer(new BasicPremiseCompiler(), new EntailmentEngine());
    }

    public static Entailer of(PremiseCompiler compiler, EntailmentEngine engine) {
        return new Entailer(compiler, engine);
    }

    /**
     * Compiles every formula, then computes the verdict table of their conjunction.
     *
     * @param formulas the premise formulas
     * @return the verdict table
     * @throws PremiseSyntaxException for the first formula that does not compile, carrying its index
     */
    public EntailmentResult entail(List<String> formulas) {
        return engine.entail(compile(formulas));
    }

    public List<CompiledPremise> compile(List<String> formulas) {
        return compiler.compileAll(formulas);
    }

    public EntailmentEngine engine() {
        return engine;
    }
}
