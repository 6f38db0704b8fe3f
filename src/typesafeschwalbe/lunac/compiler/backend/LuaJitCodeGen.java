package typesafeschwalbe.lunac.compiler.backend;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * Renders LuaJIT, which binds native symbols through its FFI library.
 */
public class LuaJitCodeGen extends LuaCodeGen {

    private final Map<String, String> libraryHandles = new HashMap<>();
    private final Set<String> takenNames = new HashSet<>();

    public LuaJitCodeGen(Config config) {
        super(config);
    }

    static String libraryHandle(String library) {
        StringBuilder handle = new StringBuilder("__lib_");
        for(char c: library.toCharArray()) {
            handle.append(Character.isLetterOrDigit(c) && c < 128? c : '_');
        }
        return handle.toString();
    }

    @Override
    public String generate(AstNode chunk) throws ErrorException {
        this.takenNames.addAll(TemporaryNames.usedNames(chunk));
        return super.generate(chunk);
    }

    /**
     * Loads the given library and returns the local that holds it. Names
     * that would map to the same handle get a numbered one.
     */
    private String loadLibrary(String library) {
        this.context.requireLibrary(library);
        String existing = this.libraryHandles.get(library);
        if(existing != null) { return existing; }
        String base = LuaJitCodeGen.libraryHandle(library);
        String handle = base;
        int suffix = 2;
        while(this.takenNames.contains(handle)) {
            handle = base + suffix;
            suffix += 1;
        }
        this.takenNames.add(handle);
        this.libraryHandles.put(library, handle);
        return handle;
    }

    static String declaration(AstNode.ForeignImport data) {
        StringBuilder out = new StringBuilder();
        out.append(data.returnType());
        out.append(" ");
        if(!data.convention().keyword.isEmpty()) {
            out.append(data.convention().keyword);
            out.append(" ");
        }
        out.append(data.symbol());
        out.append("(");
        out.append(
            data.parameterTypes().isEmpty()
                ? "void"
                : String.join(", ", data.parameterTypes())
        );
        out.append(");");
        return out.toString();
    }

    @Override
    protected void emitInteropSetup(List<String> sections) {
        if(!this.context.usesForeignInterface()) { return; }
        sections.add("local ffi = require \"ffi\"");
        for(String library: this.context.libraries()) {
            sections.add(
                "local " + this.libraryHandles.get(library)
                    + " = ffi.load("
                    + Literals.renderString(
                        library.getBytes(StandardCharsets.UTF_8)
                    )
                    + ")"
            );
        }
        if(this.context.foreignDeclarations().isEmpty()) { return; }
        StringBuilder cdef = new StringBuilder("ffi.cdef[[");
        for(String declaration: this.context.foreignDeclarations()) {
            cdef.append("\n");
            cdef.append(declaration);
        }
        cdef.append("\n]]");
        sections.add(cdef.toString());
    }

    @Override
    protected void emitForeignImport(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        AstNode.ForeignImport data = node.getValue();
        this.context.declareForeign(
            data.symbol(), data.origin(), LuaJitCodeGen.declaration(data)
        );
        String namespace = "ffi.C";
        if(data.origin().isPresent()) {
            namespace = this.loadLibrary(data.origin().get());
        }
        this.context.newLine(out);
        out.append("local ");
        out.append(data.symbol());
        out.append(" = ");
        out.append(namespace);
        out.append(".");
        out.append(data.symbol());
    }

    @Override
    protected void requireLibrary(
        AstNode.Dependency dependency, AstNode node
    ) {
        this.loadLibrary(dependency.name());
    }

    @Override
    protected void checkGotoSupport(AstNode node) {}

}
