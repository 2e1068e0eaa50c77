package io.github.cyfko.entailql.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * ANSI terminal styling. A disabled style returns text unchanged.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class AnsiStyle {

    public enum Color {
        BLACK, RED, GREEN, YELLOW, BLUE, MAGENTA, CYAN, WHITE
    }

    private static final String ESCAPE = "\033[";
    private static final String RESET = ESCAPE + "m";

    private final boolean enabled;

    private AnsiStyle(boolean enabled) {
        this.enabled = enabled;
    }

    public static AnsiStyle enabled() {
        return new AnsiStyle(true);
    }

    public static AnsiStyle disabled() {
        return new AnsiStyle(false);
    }

    /**
     * Colours text with the bright variant of a colour.
     *
     * @param text  the text to style
     * @param color the foreground colour
     * @return the styled text
     */
    public String color(String text, Color color) {
        return format(text, color, false);
    }

    public String bold(String text, Color color) {
        return format(text, color, true);
    }

    private String format(String text, Color color, boolean bold) {
        if (!enabled) {
            return text;
        }
        List<String> params = new ArrayList<>(2);
        if (bold) {
            params.add("1");
        }
        params.add("9" + color.ordinal());
        return ESCAPE + String.join(";", params) + "m" + text + RESET;
    }
}
