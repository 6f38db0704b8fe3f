package typesafeschwalbe.lunac.compiler.backend;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * A rewrite of a whole chunk. Applying a pass to its own output leaves
 * the output unchanged.
 */
public interface LoweringPass {

    AstNode lower(AstNode chunk) throws ErrorException;

}
