package typesafeschwalbe.lunac.compiler.backend;

import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

public interface CodeGen {

    @FunctionalInterface
    public static interface Constructor {
        CodeGen create(Config config);
    }

    /**
     * Renders a lowered chunk. The chunk may not contain any compile-time
     * directives or switches.
     */
    String generate(AstNode chunk) throws ErrorException;

}
