package typesafeschwalbe.lunac.compiler.meta;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.Error;
import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.Nodes;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Runs the compile-time directives of a chunk in source order and
 * replaces them by what they produced. Blocks become the text they
 * emitted, conditionals become their selected branch, and spliced values
 * become literals.
 */
public class MetaExecutor extends TreeRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        MetaExecutor.class
    );

    private final Interpreter interpreter;

    public MetaExecutor(Config config) {
        this.interpreter = new Interpreter(config);
    }

    /**
     * The configuration after all directives executed so far.
     */
    public Config config() {
        return this.interpreter.config();
    }

    public AstNode execute(AstNode chunk) throws ErrorException {
        return this.rewrite(chunk);
    }

    @Override
    protected List<AstNode> rewriteStatement(
        AstNode node
    ) throws ErrorException {
        switch(node.type) {
            case META_BLOCK: {
                AstNode.Block data = node.getValue();
                LOGGER.debug("Executing compile-time block at {}", node.source);
                this.interpreter.executeBlock(data.body());
                return this.applyEffects();
            }
            case META_CONDITIONAL: {
                AstNode.If data = node.getValue();
                LOGGER.debug(
                    "Selecting compile-time branch at {}", node.source
                );
                List<AstNode> selected = data.elseBody().orElse(List.of());
                for(
                    int branchI = 0;
                    branchI < data.conditions().size();
                    branchI += 1
                ) {
                    if(this.evaluatePredicate(data.conditions().get(branchI))) {
                        selected = data.bodies().get(branchI);
                        break;
                    }
                }
                List<AstNode> spliced = this.applyEffects();
                spliced.addAll(this.rewriteBlock(selected));
                return spliced;
            }
            default: {
                return super.rewriteStatement(node);
            }
        }
    }

    @Override
    public AstNode rewrite(AstNode node) throws ErrorException {
        if(node.type != AstNode.Type.META_VALUE) {
            return this.rewriteChildren(node);
        }
        AstNode expression = node.<AstNode.MonoOp>getValue().value();
        Value value = this.interpreter.evaluate(expression);
        if(!this.interpreter.takeEffects().isEmpty()) {
            throw new ErrorException(new Error(
                Error.Kind.META_EXECUTION,
                "Compile-time value with side effects",
                Error.Marking.error(
                    node.source,
                    "a spliced value may not emit code or change the"
                        + " configuration"
                )
            ));
        }
        return MetaExecutor.literalOf(value, node.source);
    }

    private boolean evaluatePredicate(
        AstNode predicate
    ) throws ErrorException {
        Value value = this.interpreter.evaluate(predicate);
        if(!(value instanceof Value.Bool)) {
            throw new ErrorException(new Error(
                Error.Kind.META_EXECUTION,
                "Invalid compile-time condition",
                Error.Marking.error(
                    predicate.source,
                    "this evaluates to a " + value.typeName()
                        + ", but conditions must be booleans"
                )
            ));
        }
        return value.<Value.Bool>getValue().value;
    }

    /**
     * Turns the effects requested so far into nodes placed where the
     * directive was.
     */
    private List<AstNode> applyEffects() {
        List<AstNode> nodes = new ArrayList<>();
        for(MetaEffect effect: this.interpreter.takeEffects()) {
            if(effect instanceof MetaEffect.Emit) {
                MetaEffect.Emit emit = (MetaEffect.Emit) effect;
                nodes.add(Nodes.verbatim(
                    emit.text(), emit.insertionPoint(), List.of(),
                    emit.source()
                ));
            } else if(effect instanceof MetaEffect.RequireDependency) {
                MetaEffect.RequireDependency require
                    = (MetaEffect.RequireDependency) effect;
                nodes.add(Nodes.verbatim(
                    "", AstNode.InsertionPoint.STATEMENT,
                    List.of(require.dependency()), require.source()
                ));
            } else if(effect instanceof MetaEffect.ConfigUpdate) {
                LOGGER.debug(
                    "Configuration update from {} applied", effect.source()
                );
            }
        }
        return nodes;
    }

    static AstNode literalOf(
        Value value, Source source
    ) throws ErrorException {
        if(value instanceof Value.Nil) {
            return Nodes.nil(source);
        }
        if(value instanceof Value.Bool) {
            return Nodes.bool(value.<Value.Bool>getValue().value, source);
        }
        if(value instanceof Value.Int) {
            return Nodes.integer(value.<Value.Int>getValue().value, source);
        }
        if(value instanceof Value.Str) {
            return Nodes.string(value.<Value.Str>getValue().value, source);
        }
        if(value instanceof Value.Float) {
            double number = value.<Value.Float>getValue().value;
            if(Double.isInfinite(number)) {
                return Nodes.number(number > 0? "1e999" : "-1e999", source);
            }
            if(!Double.isNaN(number)) {
                return Nodes.number(value.asString(), source);
            }
        }
        throw new ErrorException(new Error(
            Error.Kind.META_EXECUTION,
            "Compile-time value can not be spliced",
            Error.Marking.error(
                source,
                "this evaluates to " + value.asString() + ", which has no"
                    + " literal form"
            )
        ));
    }

}
