package io.github.cyfko.entailql.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsed command line.
 *
 * @param premises      premise formulas, in argument order
 * @param printCompiled whether to echo the compiled premises
 * @param plainText     whether to print a plain-text summary instead of the symbolic table
 * @param color         whether to emit ANSI colours
 * @param help          whether help was requested
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CliOptions(List<String> premises, boolean printCompiled, boolean plainText, boolean color, boolean help) {

    public CliOptions {
        premises = List.copyOf(premises);
    }

    /**
     * Interprets the command-line arguments.
     * <p>
     * Options may appear anywhere; {@code --} ends option processing so that later arguments
     * are always taken as premises.
     * </p>
     *
     * @param args the raw arguments
     * @return the parsed options
     * @throws CliUsageException on an unknown option, or when no premise is given and help was not requested
     */
    public static CliOptions parse(String... args) {
        Objects.requireNonNull(args, "args cannot be null");

        List<String> premises = new ArrayList<>();
        boolean printCompiled = false;
        boolean plainText = false;
        boolean color = true;
        boolean help = false;
        boolean optionsEnded = false;

        for (String arg : args) {
            if (optionsEnded || !arg.startsWith("-") || arg.length() == 1) {
                premises.add(arg);
                continue;
            }
            switch (arg) {
                case "--" -> optionsEnded = true;
                case "-c", "--print-compiled" -> printCompiled = true;
                case "-t", "--plain-text" -> plainText = true;
                case "--no-color" -> color = false;
                case "-h", "--help" -> help = true;
                default -> throw new CliUsageException("unrecognized argument: " + arg);
            }
        }

        if (premises.isEmpty() && !help) {
            throw new CliUsageException("the following arguments are required: premise");
        }
        return new CliOptions(premises, printCompiled, plainText, color, help);
    }
}
