package typesafeschwalbe.lunac.compiler.backend;

import java.util.List;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

public class TypeAnnotationStripping extends TreeRewriter
    implements LoweringPass {

    @Override
    public AstNode lower(AstNode chunk) throws ErrorException {
        return this.rewrite(chunk);
    }

    private static List<AstNode.Variable> untyped(
        List<AstNode.Variable> variables
    ) {
        return variables.stream()
            .map(TypeAnnotationStripping::untyped)
            .toList();
    }

    private static AstNode.Variable untyped(AstNode.Variable variable) {
        return new AstNode.Variable(variable.name(), Optional.empty());
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        AstNode rewritten = this.rewriteChildren(node);
        switch(rewritten.type) {
            case DECLARATION: {
                AstNode.Declaration data = rewritten.getValue();
                return rewritten.withValue(new AstNode.Declaration(
                    TypeAnnotationStripping.untyped(data.variables()),
                    data.values()
                ));
            }
            case FUNCTION: {
                AstNode.Function data = rewritten.getValue();
                return rewritten.withValue(new AstNode.Function(
                    TypeAnnotationStripping.untyped(data.parameters()),
                    data.isVariadic(), data.body(), List.of()
                ));
            }
            case NUMERIC_FOR: {
                AstNode.NumericFor data = rewritten.getValue();
                return rewritten.withValue(new AstNode.NumericFor(
                    TypeAnnotationStripping.untyped(data.variable()),
                    data.start(), data.limit(), data.step(), data.body()
                ));
            }
            case GENERIC_FOR: {
                AstNode.GenericFor data = rewritten.getValue();
                return rewritten.withValue(new AstNode.GenericFor(
                    TypeAnnotationStripping.untyped(data.variables()),
                    data.iterators(), data.body()
                ));
            }
            default: {
                return rewritten;
            }
        }
    }

}
