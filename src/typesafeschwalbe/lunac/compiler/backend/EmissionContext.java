package typesafeschwalbe.lunac.compiler.backend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one emission: the indentation depth and everything that is
 * collected while walking the tree and ends up in the preamble.
 * Dependencies and foreign declarations are deduplicated per unit.
 */
public class EmissionContext {

    public static final String INDENTATION = "  ";

    private static record ForeignKey(String symbol, Optional<String> origin) {}

    private int depth;
    private final Set<String> modules;
    private final Set<String> libraries;
    private final Map<ForeignKey, String> foreignDeclarations;
    private final List<String> declarations;

    public EmissionContext() {
        this.depth = 0;
        this.modules = new LinkedHashSet<>();
        this.libraries = new LinkedHashSet<>();
        this.foreignDeclarations = new LinkedHashMap<>();
        this.declarations = new ArrayList<>();
    }

    public int depth() {
        return this.depth;
    }

    public void enterBlock() {
        this.depth += 1;
    }

    public void exitBlock() {
        this.depth -= 1;
    }

    /**
     * Starts a new line at the current depth. Nothing is inserted before
     * the first line of the output.
     */
    public void newLine(StringBuilder out) {
        if(out.length() > 0) {
            out.append("\n");
        }
        out.append(INDENTATION.repeat(this.depth));
    }

    public void requireModule(String name) {
        this.modules.add(name);
    }

    public Collection<String> modules() {
        return Collections.unmodifiableCollection(this.modules);
    }

    public void requireLibrary(String name) {
        this.libraries.add(name);
    }

    public Collection<String> libraries() {
        return Collections.unmodifiableCollection(this.libraries);
    }

    /**
     * Records a foreign declaration unless the same symbol was already
     * declared for the same origin.
     */
    public void declareForeign(
        String symbol, Optional<String> origin, String declaration
    ) {
        this.foreignDeclarations.putIfAbsent(
            new ForeignKey(symbol, origin), declaration
        );
    }

    public Collection<String> foreignDeclarations() {
        return Collections.unmodifiableCollection(
            new LinkedHashSet<>(this.foreignDeclarations.values())
        );
    }

    public boolean usesForeignInterface() {
        return !this.libraries.isEmpty()
            || !this.foreignDeclarations.isEmpty();
    }

    public void addDeclaration(String text) {
        this.declarations.add(text);
    }

    public List<String> declarations() {
        return Collections.unmodifiableList(this.declarations);
    }

}
