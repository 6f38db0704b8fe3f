package typesafeschwalbe.lunac.compiler;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * ANSI select-graphic-rendition attributes used when rendering
 * diagnostics for a terminal.
 */
public enum Color {
    BOLD(1),
    RED(31),
    GREEN(32),
    WHITE(37),
    GRAY(90),
    BRIGHT_BLUE(94);

    private final int code;

    private Color(int code) {
        this.code = code;
    }

    /**
     * The escape sequence that resets all attributes and then applies the
     * given ones. Without arguments it only resets.
     */
    public static String from(Color... attributes) {
        return Arrays.stream(attributes)
            .map(attribute -> ";" + attribute.code)
            .collect(Collectors.joining("", "\033[0", "m"));
    }

}
