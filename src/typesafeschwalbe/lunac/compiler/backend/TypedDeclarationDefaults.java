package typesafeschwalbe.lunac.compiler.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.Nodes;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Gives declarations without values the zero values of their declared
 * types, so {@code local a: integer} becomes {@code local a = 0}.
 */
public class TypedDeclarationDefaults extends TreeRewriter
    implements LoweringPass {

    @Override
    public AstNode lower(AstNode chunk) throws ErrorException {
        return this.rewrite(chunk);
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        AstNode rewritten = this.rewriteChildren(node);
        if(rewritten.type != AstNode.Type.DECLARATION) { return rewritten; }
        AstNode.Declaration data = rewritten.getValue();
        if(!data.values().isEmpty()) { return rewritten; }
        List<AstNode> values = new ArrayList<>(data.variables().size());
        boolean hasDefault = false;
        for(AstNode.Variable variable: data.variables()) {
            Optional<AstNode> zero = variable.type().isPresent()
                ? variable.type().get().zeroValue(rewritten.source)
                : Optional.empty();
            hasDefault |= zero.isPresent();
            values.add(zero.orElseGet(() -> Nodes.nil(rewritten.source)));
        }
        if(!hasDefault) { return rewritten; }
        return rewritten.withValue(
            new AstNode.Declaration(data.variables(), values)
        );
    }

}
