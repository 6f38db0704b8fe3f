package typesafeschwalbe.lunac.compiler;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public record Error(
    Kind kind,
    String message,
    Marking[] markings,
    Optional<Function<Boolean, String>> appended
) {

    public enum Kind {
        UNSUPPORTED_CONSTRUCT("unsupported construct"),
        FOREIGN_IMPORT_UNSUPPORTED("unsupported foreign import"),
        META_EXECUTION("compile-time error"),
        INVALID_CONFIG_VALUE("invalid configuration");

        public final String description;

        private Kind(String description) {
            this.description = description;
        }
    }

    public static record Marking(Type type, Source location, String note) {

        private enum Type {
            ERROR('^', Color.from(Color.RED)),
            INFO('~', Color.from(Color.BRIGHT_BLUE)),
            HELP('*', Color.from(Color.GREEN));

            private final char marker;
            private final String color;

            private Type(char marker, String color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

        public static Marking help(Source location, String note) {
            return new Marking(Type.HELP, location, note);
        }

    }

    public Error(Kind kind, String message, Marking... markings) {
        this(kind, message, markings, Optional.empty());
    }

    public Error(
        Kind kind, String message, Function<Boolean, String> appended,
        Marking... markings
    ) {
        this(kind, message, markings, Optional.of(appended));
    }

    /**
     * The location of the first marking, which is where the error was
     * detected.
     */
    public Optional<Source> location() {
        if(this.markings.length == 0) { return Optional.empty(); }
        return Optional.of(this.markings[0].location());
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.kind == other.kind
            && this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings)
            && this.appended.equals(other.appended);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.kind, this.message, Arrays.hashCode(this.markings),
            this.appended
        );
    }

    @Override
    public String toString() {
        return this.render(Map.of(), false);
    }

    public String render(Map<String, String> files, boolean colored) {
        String errorWordColor = colored
            ? Color.from(Color.BOLD, Color.RED) : "";
        String errorMessageColor = colored
            ? Color.from(Color.RED) : "";
        String locationColor = colored
            ? Color.from(Color.GRAY) : "";
        String separationLineColor = colored
            ? Color.from(Color.GRAY) : "";
        String lineColor = colored
            ? Color.from() : "";
        StringBuilder output = new StringBuilder();
        output.append(errorWordColor);
        output.append("error[");
        output.append(this.kind.description);
        output.append("]: ");
        output.append(errorMessageColor);
        output.append(this.message);
        output.append("\n");
        for(Marking marked: this.markings) {
            Source location = marked.location();
            String markingColor = colored ? marked.type().color : "";
            String lineNumber = String.valueOf(location.line());
            String padding = " ".repeat(lineNumber.length() + 2);
            output.append(padding);
            output.append(separationLineColor);
            output.append("╭─ ");
            output.append(locationColor);
            output.append(location);
            output.append("\n");
            String lineText = location.lineText(files);
            if(lineText != null) {
                output.append(" ");
                output.append(lineNumber);
                output.append(separationLineColor);
                output.append(" │ ");
                output.append(lineColor);
                output.append(lineText);
                output.append("\n");
            }
            output.append(padding);
            output.append(separationLineColor);
            output.append("┊ ");
            output.append(" ".repeat(Math.max(0, location.column() - 1)));
            output.append(markingColor);
            output.append(marked.type().marker);
            output.append(" ");
            output.append(marked.note());
            output.append("\n");
        }
        if(colored) {
            output.append(Color.from());
        }
        if(this.appended.isPresent()) {
            output.append(this.appended.get().apply(colored));
        }
        if(colored) {
            output.append(Color.from());
        }
        return output.toString();
    }

}
