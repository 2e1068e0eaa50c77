package io.github.cyfko.entailql.cli;

/**
 * Thrown when the command line cannot be interpreted.
 *
 * @since 1.0.0
 */
public class CliUsageException extends RuntimeException {

    public CliUsageException(String message) {
        super(message);
    }
}
