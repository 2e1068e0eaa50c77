package io.github.cyfko.entailql.cli;

import io.github.cyfko.entailql.core.api.Atomic;
import io.github.cyfko.entailql.core.api.CompiledPremise;
import io.github.cyfko.entailql.core.api.Verdict;
import io.github.cyfko.entailql.core.entailment.EntailmentResult;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats entailment results for the terminal.
 *
 * <h2>Symbolic table</h2>
 * <pre>
 *  a [✓]	b [✓]	c [?]	d [?]
 * </pre>
 * <p>
 * Glyphs: {@code ~} vacuous, {@code ✓} proven, {@code ✗} disproven, {@code ?} unproven.
 * </p>
 *
 * <h2>Plain text</h2>
 * <pre>
 * Proven: a, b
 * Disproven: (none)
 * </pre>
 * <p>
 * With unsatisfiable premises every atomic is listed as proven, followed by {@code , vacuously}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class VerdictRenderer {

    private static final String NONE = "(none)";

    private final AnsiStyle style;

    public VerdictRenderer(AnsiStyle style) {
        this.style = style;
    }

    public String symbolic(EntailmentResult result) {
        return " " + result.verdicts().entrySet().stream()
                .map(entry -> entry.getKey() + " [" + glyph(entry.getValue()) + "]")
                .collect(Collectors.joining("\t"));
    }

    public String plainText(EntailmentResult result) {
        String proven = joinOrNone(atomicsWith(result.verdicts(), Verdict.PROVEN_TRUE, Verdict.VACUOUS));
        if (!result.isSatisfiable()) {
            proven += ", vacuously";
        }
        String disproven = joinOrNone(atomicsWith(result.verdicts(), Verdict.PROVEN_FALSE));
        return "Proven: " + proven + System.lineSeparator() + "Disproven: " + disproven;
    }

    /**
     * Lists compiled premises, one per line, numbered from 1.
     *
     * @param premises the compiled premises
     * @return the listing, headed by {@code Compiled premises:}
     */
    public String compiledPremises(List<CompiledPremise> premises) {
        StringBuilder listing = new StringBuilder("Compiled premises:");
        for (int i = 0; i < premises.size(); i++) {
            listing.append(System.lineSeparator())
                    .append(' ').append(i + 1).append(". ")
                    .append(premises.get(i).canonicalForm());
        }
        return listing.toString();
    }

    String glyph(Verdict verdict) {
        return switch (verdict) {
            case VACUOUS -> style.color("~", AnsiStyle.Color.MAGENTA);
            case PROVEN_TRUE -> style.color("✓", AnsiStyle.Color.GREEN);
            case PROVEN_FALSE -> style.color("✗", AnsiStyle.Color.RED);
            case UNPROVEN -> style.color("?", AnsiStyle.Color.YELLOW);
        };
    }

    private static List<Atomic> atomicsWith(Map<Atomic, Verdict> verdicts, Verdict... wanted) {
        List<Verdict> accepted = List.of(wanted);
        return verdicts.entrySet().stream()
                .filter(entry -> accepted.contains(entry.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static String joinOrNone(List<Atomic> atomics) {
        if (atomics.isEmpty()) {
            return NONE;
        }
        return atomics.stream().map(Atomic::toString).collect(Collectors.joining(", "));
    }
}
