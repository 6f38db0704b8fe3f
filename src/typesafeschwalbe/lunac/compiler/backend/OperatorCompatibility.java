package typesafeschwalbe.lunac.compiler.backend;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Replaces operators the target version lacks by library calls.
 */
public class OperatorCompatibility extends TreeRewriter
    implements LoweringPass {

    private final TargetVersion version;

    public OperatorCompatibility(TargetVersion version) {
        this.version = version;
    }

    @Override
    public AstNode lower(AstNode chunk) throws ErrorException {
        return this.rewrite(chunk);
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        AstNode rewritten = this.rewriteChildren(node);
        switch(rewritten.type) {
            case UNARY_OP: {
                return OperatorRules.lowerUnary(rewritten, this.version)
                    .orElse(rewritten);
            }
            case BINARY_OP: {
                return OperatorRules.lowerBinary(rewritten, this.version)
                    .orElse(rewritten);
            }
            default: {
                return rewritten;
            }
        }
    }

}
