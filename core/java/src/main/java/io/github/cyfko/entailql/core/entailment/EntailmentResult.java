package io.github.cyfko.entailql.core.entailment;

import io.github.cyfko.entailql.core.api.Assignment;
import io.github.cyfko.entailql.core.api.Atomic;
import io.github.cyfko.entailql.core.api.Verdict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Verdict table produced by {@link EntailmentEngine#entail(List)}.
 *
 * @param verdicts one verdict per atomic, iterated in alphabet order
 * @param models   the assignments satisfying every premise, in ascending order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EntailmentResult(Map<Atomic, Verdict> verdicts, List<Assignment> models) {

    public EntailmentResult {
        Objects.requireNonNull(verdicts, "verdicts cannot be null");
        if (!verdicts.keySet().containsAll(Atomic.alphabet())) {
            throw new IllegalArgumentException("A verdict is required for every atomic, got: " + verdicts.keySet());
        }
        verdicts = Collections.unmodifiableMap(new EnumMap<>(verdicts));
        models = List.copyOf(models);
    }

    public Verdict verdictOf(Atomic atomic) {
        return verdicts.get(atomic);
    }

    /**
     * Tells whether at least one assignment satisfies the premises. When it is {@code false}
     * every verdict is {@link Verdict#VACUOUS}.
     *
     * @return {@code true} if the premise set has a model
     */
    public boolean isSatisfiable() {
        return !models.isEmpty();
    }

    public int modelCount() {
        return models.size();
    }

    /**
     * Returns the atomics with the given verdict, in alphabet order.
     *
     * @param verdict the verdict to filter on
     * @return matching atomics, possibly empty
     */
    public List<Atomic> atomicsWith(Verdict verdict) {
        return verdicts.entrySet().stream()
                .filter(entry -> entry.getValue() == verdict)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
