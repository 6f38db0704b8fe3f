package typesafeschwalbe.lunac.compiler.backend;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.Nodes;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Pads value lists that are shorter than their target lists with 'nil',
 * so that {@code local a, b = 1} becomes {@code local a, b = 1, nil}.
 * Declarations without any values are left alone.
 */
public class ArityPadding extends TreeRewriter implements LoweringPass {

    @Override
    public AstNode lower(AstNode chunk) throws ErrorException {
        return this.rewrite(chunk);
    }

    static List<AstNode> padded(List<AstNode> values, int targetCount) {
        if(values.isEmpty() || values.size() >= targetCount) {
            return values;
        }
        AstNode last = values.get(values.size() - 1);
        if(last.isMultiValue()) { return values; }
        List<AstNode> padded = new ArrayList<>(values);
        while(padded.size() < targetCount) {
            padded.add(Nodes.nil(last.source));
        }
        return padded;
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        AstNode rewritten = this.rewriteChildren(node);
        switch(rewritten.type) {
            case ASSIGNMENT: {
                AstNode.Assignment data = rewritten.getValue();
                return rewritten.withValue(new AstNode.Assignment(
                    data.targets(),
                    ArityPadding.padded(data.values(), data.targets().size())
                ));
            }
            case DECLARATION: {
                AstNode.Declaration data = rewritten.getValue();
                return rewritten.withValue(new AstNode.Declaration(
                    data.variables(),
                    ArityPadding.padded(
                        data.values(), data.variables().size()
                    )
                ));
            }
            default: {
                return rewritten;
            }
        }
    }

}
