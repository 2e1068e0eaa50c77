package io.github.cyfko.entailql.core.entailment;

import io.github.cyfko.entailql.core.api.Assignment;
import io.github.cyfko.entailql.core.api.Atomic;
import io.github.cyfko.entailql.core.api.Premise;
import io.github.cyfko.entailql.core.api.Verdict;
import io.github.cyfko.entailql.core.config.EnumerationPolicy;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decides semantic entailment of every atomic by exhaustive model enumeration.
 * <p>
 * All {@value Assignment#COUNT} assignments are examined. An assignment under which every premise
 * holds is a <em>model</em>; each model ORs {@link Verdict#PROVEN_TRUE} into the verdict of every
 * atomic it makes true and {@link Verdict#PROVEN_FALSE} into the verdict of every atomic it makes
 * false. Verdicts start at {@link Verdict#VACUOUS}, so:
 * </p>
 * <ul>
 *   <li>no model at all leaves every atomic {@code VACUOUS}</li>
 *   <li>an atomic true in every model ends {@code PROVEN_TRUE}, false in every model {@code PROVEN_FALSE}</li>
 *   <li>an atomic that differs between models ends {@code UNPROVEN}</li>
 * </ul>
 * <p>
 * An empty premise list is accepted: every assignment is then a model and every atomic is
 * {@code UNPROVEN}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * EntailmentEngine engine = new EntailmentEngine();
 * EntailmentResult result = engine.entail(compiler.compileAll(List.of("a", "a => b")));
 * result.verdictOf(Atomic.B); // PROVEN_TRUE
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EntailmentEngine {

    private static final Logger log = Logger.getLogger(EntailmentEngine.class.getName());

    private final EnumerationPolicy enumerationPolicy;

    public EntailmentEngine() {
        this(EnumerationPolicy.sequential());
    }

    public EntailmentEngine(EnumerationPolicy enumerationPolicy) {
        if (enumerationPolicy == null) {
            throw new IllegalArgumentException("Enumeration policy is required");
        }
        this.enumerationPolicy = enumerationPolicy;
    }

    /**
     * Computes the verdict of every atomic under the conjunction of the given premises.
     *
     * @param premises the premises; may be empty, must not contain {@code null}
     * @return the verdict table and the models found
     * @throws NullPointerException if the list or one of its elements is null
     */
    public EntailmentResult entail(List<? extends Premise> premises) {
        Objects.requireNonNull(premises, "premises cannot be null");
        premises.forEach(premise -> Objects.requireNonNull(premise, "premises cannot contain null"));

        Stream<Assignment> assignments = Assignment.all();
        if (enumerationPolicy.parallelEnabled()) {
            assignments = assignments.parallel();
        }
        List<Assignment> models = assignments
                .filter(assignment -> isModel(premises, assignment))
                .collect(Collectors.toList());

        Map<Atomic, Verdict> verdicts = new EnumMap<>(Atomic.class);
        for (Atomic atomic : Atomic.alphabet()) {
            verdicts.put(atomic, Verdict.VACUOUS);
        }
        for (Assignment model : models) {
            for (Atomic atomic : Atomic.alphabet()) {
                verdicts.merge(atomic, Verdict.observed(model.valueOf(atomic)), Verdict::or);
            }
        }

        log.fine(() -> String.format("Entailment over %d premise(s): %d model(s), verdicts %s",
                premises.size(), models.size(), verdicts));

        return new EntailmentResult(verdicts, models);
    }

    private static boolean isModel(List<? extends Premise> premises, Assignment assignment) {
        for (Premise premise : premises) {
            if (!premise.holdsUnder(assignment)) {
                return false;
            }
        }
        return true;
    }
}
