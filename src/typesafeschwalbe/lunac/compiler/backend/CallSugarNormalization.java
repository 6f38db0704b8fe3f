package typesafeschwalbe.lunac.compiler.backend;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Turns {@code f "s"} and {@code f {}} into calls with an explicit
 * argument list. Method calls stay method calls.
 */
public class CallSugarNormalization extends TreeRewriter
    implements LoweringPass {

    @Override
    public AstNode lower(AstNode chunk) throws ErrorException {
        return this.rewrite(chunk);
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        AstNode rewritten = this.rewriteChildren(node);
        switch(rewritten.type) {
            case CALL: {
                AstNode.Call data = rewritten.getValue();
                if(!data.juxtaposed()) { return rewritten; }
                return rewritten.withValue(new AstNode.Call(
                    data.called(), data.arguments(), false
                ));
            }
            case METHOD_CALL: {
                AstNode.MethodCall data = rewritten.getValue();
                if(!data.juxtaposed()) { return rewritten; }
                return rewritten.withValue(new AstNode.MethodCall(
                    data.receiver(), data.methodName(), data.arguments(),
                    false
                ));
            }
            default: {
                return rewritten;
            }
        }
    }

}
