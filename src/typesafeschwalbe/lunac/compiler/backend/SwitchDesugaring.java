package typesafeschwalbe.lunac.compiler.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.Nodes;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Replaces each switch by a temporary holding the switched value and an
 * if/elseif chain comparing the temporary against every case value.
 */
public class SwitchDesugaring extends TreeRewriter implements LoweringPass {

    public static final String TEMPORARY_PREFIX = "__switchval";

    private TemporaryNames names;

    @Override
    public AstNode lower(AstNode chunk) throws ErrorException {
        this.names = new TemporaryNames(TemporaryNames.usedNames(chunk));
        return this.rewrite(chunk);
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        if(node.type != AstNode.Type.FUNCTION) {
            return this.rewriteChildren(node);
        }
        this.names.enterFunction();
        AstNode rewritten = this.rewriteChildren(node);
        this.names.exitFunction();
        return rewritten;
    }

    @Override
    protected List<AstNode> rewriteStatement(
        AstNode node
    ) throws ErrorException {
        if(node.type != AstNode.Type.SWITCH) {
            return super.rewriteStatement(node);
        }
        AstNode.Switch data = node.getValue();
        String temporary = this.names.allocate(TEMPORARY_PREFIX);
        List<AstNode> lowered = new ArrayList<>();
        lowered.add(Nodes.local(
            List.of(Nodes.variable(temporary)),
            List.of(this.rewrite(data.value())),
            node.source
        ));
        List<AstNode> conditions = new ArrayList<>();
        for(AstNode caseValue: data.caseValues()) {
            conditions.add(Nodes.binary(
                AstNode.BinaryOperator.EQUALS,
                Nodes.id(temporary, caseValue.source),
                this.rewrite(caseValue),
                caseValue.source
            ));
        }
        List<List<AstNode>> bodies = new ArrayList<>();
        for(List<AstNode> caseBody: data.caseBodies()) {
            bodies.add(this.rewriteBlock(caseBody));
        }
        Optional<List<AstNode>> elseBody = Optional.empty();
        if(data.elseBody().isPresent()) {
            elseBody = Optional.of(this.rewriteBlock(data.elseBody().get()));
        }
        if(conditions.isEmpty()) {
            if(elseBody.isPresent()) {
                lowered.add(Nodes.doBlock(elseBody.get(), node.source));
            }
            return lowered;
        }
        lowered.add(Nodes.ifChain(conditions, bodies, elseBody, node.source));
        return lowered;
    }

}
