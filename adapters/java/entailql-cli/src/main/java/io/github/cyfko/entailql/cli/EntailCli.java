package io.github.cyfko.entailql.cli;

import io.github.cyfko.entailql.core.Entailer;
import io.github.cyfko.entailql.core.api.CompiledPremise;
import io.github.cyfko.entailql.core.entailment.EntailmentResult;
import io.github.cyfko.entailql.core.exception.PremiseSyntaxException;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command-line entry point: lists the atomics proven or disproven by the given premises.
 *
 * <pre>
 * $ entailql a "a =&gt; b"
 *  a [✓]	b [✓]	c [?]	d [?]
 *
 * $ entailql -t a "~a"
 * Proven: a, b, c, d, vacuously
 * Disproven: (none)
 * </pre>
 *
 * <p>Exit status: 0 on success, 1 on a syntax error in a premise, 2 on a usage error.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EntailCli {

    static final String PROGRAM = "entailql";

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "usage: " + PROGRAM + " [-h] [-c] [-t] [--no-color] premise [premise ...]";

    private static final String HELP = String.join(System.lineSeparator(),
            USAGE,
            "",
            "Lists atomic propositions which are (dis)proven by given list of premises.",
            "Premises must be valid sentences built from parentheses; atomics, A, B, C,",
            "and D; and operators, '~', '^', 'v', and '=>' (standard interpretations and",
            "precedence).",
            "",
            "positional arguments:",
            "  premise               one of the logical premises",
            "",
            "options:",
            "  -h, --help            show this help message and exit",
            "  -c, --print-compiled  print the compiled premises",
            "  -t, --plain-text      print implications in plain text (vs. symbolically)",
            "  --no-color            disable ANSI colors in the output");

    private final Entailer entailer;
    private final PrintStream out;
    private final PrintStream err;

    public EntailCli(Entailer entailer, PrintStream out, PrintStream err) {
        this.entailer = entailer;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(System.err, true, StandardCharsets.UTF_8);
        System.exit(new EntailCli(Entailer.defaults(), out, err).run(args));
    }

    /**
     * Runs the command.
     *
     * @param args command-line arguments
     * @return the exit status
     */
    public int run(String... args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (CliUsageException e) {
            err.println(USAGE);
            err.println(PROGRAM + ": error: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (options.help()) {
            out.println(HELP);
            return EXIT_OK;
        }

        AnsiStyle style = options.color() ? AnsiStyle.enabled() : AnsiStyle.disabled();
        List<CompiledPremise> premises;
        try {
            premises = entailer.compile(options.premises());
        } catch (PremiseSyntaxException e) {
            err.println(syntaxError(e, style));
            return EXIT_SYNTAX_ERROR;
        }

        EntailmentResult result = entailer.engine().entail(premises);
        VerdictRenderer renderer = new VerdictRenderer(style);

        if (options.printCompiled()) {
            out.println(renderer.compiledPremises(premises));
        }
        if (options.plainText()) {
            out.println(renderer.plainText(result));
        } else {
            if (options.printCompiled()) {
                out.println("Implications:");
            }
            out.println(renderer.symbolic(result));
        }
        return EXIT_OK;
    }

    static String syntaxError(PremiseSyntaxException e, AnsiStyle style) {
        int argument = e.getPremiseIndex().orElse(0) + 1;
        return PROGRAM + ": "
                + style.bold("arg=" + argument + " pos=" + e.getPosition(), AnsiStyle.Color.WHITE) + ": "
                + style.bold("Syntax error:", AnsiStyle.Color.RED) + " "
                + e.getMessage();
    }
}
