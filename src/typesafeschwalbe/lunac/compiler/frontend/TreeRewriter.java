package typesafeschwalbe.lunac.compiler.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.ErrorException;

/**
 * Rebuilds a tree, giving subclasses the chance to replace expressions
 * with {@link #rewrite} and statements with {@link #rewriteStatement}.
 * Children are visited in source order.
 */
public abstract class TreeRewriter {

    public List<AstNode> rewriteBlock(
        List<AstNode> block
    ) throws ErrorException {
        List<AstNode> rewritten = new ArrayList<>(block.size());
        for(AstNode statement: block) {
            rewritten.addAll(this.rewriteStatement(statement));
        }
        return rewritten;
    }

    /**
     * Replaces a statement by any number of statements.
     */
    protected List<AstNode> rewriteStatement(
        AstNode node
    ) throws ErrorException {
        return List.of(this.rewrite(node));
    }

    public AstNode rewrite(AstNode node) throws ErrorException {
        return this.rewriteChildren(node);
    }

    protected List<AstNode> rewriteAll(
        List<AstNode> nodes
    ) throws ErrorException {
        List<AstNode> rewritten = new ArrayList<>(nodes.size());
        for(AstNode node: nodes) {
            rewritten.add(this.rewrite(node));
        }
        return rewritten;
    }

    private Optional<List<AstNode>> rewriteOptionalBlock(
        Optional<List<AstNode>> block
    ) throws ErrorException {
        if(block.isEmpty()) { return block; }
        return Optional.of(this.rewriteBlock(block.get()));
    }

    protected final AstNode rewriteChildren(
        AstNode node
    ) throws ErrorException {
        switch(node.type) {
            case CHUNK: {
                AstNode.Chunk data = node.getValue();
                return node.withValue(
                    new AstNode.Chunk(this.rewriteBlock(data.body()))
                );
            }
            case NUMBER_LITERAL:
            case STRING_LITERAL:
            case BOOLEAN_LITERAL:
            case NIL_LITERAL:
            case VARARGS:
            case IDENTIFIER:
            case GOTO:
            case LABEL:
            case BREAK:
            case FOREIGN_IMPORT:
            case VERBATIM: {
                return node;
            }
            case INDEX: {
                AstNode.Index data = node.getValue();
                return node.withValue(new AstNode.Index(
                    this.rewrite(data.indexed()), this.rewrite(data.key())
                ));
            }
            case FIELD: {
                AstNode.Field data = node.getValue();
                return node.withValue(new AstNode.Field(
                    this.rewrite(data.indexed()), data.name()
                ));
            }
            case CALL: {
                AstNode.Call data = node.getValue();
                return node.withValue(new AstNode.Call(
                    this.rewrite(data.called()),
                    this.rewriteAll(data.arguments()),
                    data.juxtaposed()
                ));
            }
            case METHOD_CALL: {
                AstNode.MethodCall data = node.getValue();
                return node.withValue(new AstNode.MethodCall(
                    this.rewrite(data.receiver()),
                    data.methodName(),
                    this.rewriteAll(data.arguments()),
                    data.juxtaposed()
                ));
            }
            case TABLE: {
                AstNode.Table data = node.getValue();
                List<AstNode.TableField> fields = new ArrayList<>();
                for(AstNode.TableField field: data.fields()) {
                    Optional<AstNode> key = field.key().isPresent()
                        ? Optional.of(this.rewrite(field.key().get()))
                        : Optional.empty();
                    fields.add(new AstNode.TableField(
                        field.name(), key, this.rewrite(field.value())
                    ));
                }
                return node.withValue(new AstNode.Table(fields));
            }
            case FUNCTION: {
                AstNode.Function data = node.getValue();
                return node.withValue(new AstNode.Function(
                    data.parameters(),
                    data.isVariadic(),
                    this.rewriteBlock(data.body()),
                    data.returnTypes()
                ));
            }
            case UNARY_OP: {
                AstNode.UnaryOp data = node.getValue();
                return node.withValue(new AstNode.UnaryOp(
                    data.operator(), this.rewrite(data.operand())
                ));
            }
            case BINARY_OP: {
                AstNode.BinaryOp data = node.getValue();
                return node.withValue(new AstNode.BinaryOp(
                    data.operator(),
                    this.rewrite(data.left()),
                    this.rewrite(data.right())
                ));
            }
            case PAREN:
            case META_VALUE: {
                AstNode.MonoOp data = node.getValue();
                return node.withValue(
                    new AstNode.MonoOp(this.rewrite(data.value()))
                );
            }
            case DO:
            case META_BLOCK: {
                AstNode.Block data = node.getValue();
                return node.withValue(
                    new AstNode.Block(this.rewriteBlock(data.body()))
                );
            }
            case IF:
            case META_CONDITIONAL: {
                AstNode.If data = node.getValue();
                List<AstNode> conditions = new ArrayList<>();
                List<List<AstNode>> bodies = new ArrayList<>();
                for(
                    int branchI = 0;
                    branchI < data.conditions().size();
                    branchI += 1
                ) {
                    conditions.add(
                        this.rewrite(data.conditions().get(branchI))
                    );
                    bodies.add(this.rewriteBlock(data.bodies().get(branchI)));
                }
                return node.withValue(new AstNode.If(
                    conditions, bodies,
                    this.rewriteOptionalBlock(data.elseBody())
                ));
            }
            case SWITCH: {
                AstNode.Switch data = node.getValue();
                AstNode value = this.rewrite(data.value());
                List<AstNode> caseValues = new ArrayList<>();
                List<List<AstNode>> caseBodies = new ArrayList<>();
                for(
                    int caseI = 0;
                    caseI < data.caseValues().size();
                    caseI += 1
                ) {
                    caseValues.add(this.rewrite(data.caseValues().get(caseI)));
                    caseBodies.add(
                        this.rewriteBlock(data.caseBodies().get(caseI))
                    );
                }
                return node.withValue(new AstNode.Switch(
                    value, caseValues, caseBodies,
                    this.rewriteOptionalBlock(data.elseBody())
                ));
            }
            case WHILE: {
                AstNode.Loop data = node.getValue();
                AstNode condition = this.rewrite(data.condition());
                return node.withValue(new AstNode.Loop(
                    condition, this.rewriteBlock(data.body())
                ));
            }
            case REPEAT: {
                AstNode.Loop data = node.getValue();
                List<AstNode> body = this.rewriteBlock(data.body());
                return node.withValue(new AstNode.Loop(
                    this.rewrite(data.condition()), body
                ));
            }
            case NUMERIC_FOR: {
                AstNode.NumericFor data = node.getValue();
                AstNode start = this.rewrite(data.start());
                AstNode limit = this.rewrite(data.limit());
                Optional<AstNode> step = data.step().isPresent()
                    ? Optional.of(this.rewrite(data.step().get()))
                    : Optional.empty();
                return node.withValue(new AstNode.NumericFor(
                    data.variable(), start, limit, step,
                    this.rewriteBlock(data.body())
                ));
            }
            case GENERIC_FOR: {
                AstNode.GenericFor data = node.getValue();
                List<AstNode> iterators = this.rewriteAll(data.iterators());
                return node.withValue(new AstNode.GenericFor(
                    data.variables(), iterators,
                    this.rewriteBlock(data.body())
                ));
            }
            case ASSIGNMENT: {
                AstNode.Assignment data = node.getValue();
                List<AstNode> targets = this.rewriteAll(data.targets());
                return node.withValue(new AstNode.Assignment(
                    targets, this.rewriteAll(data.values())
                ));
            }
            case DECLARATION: {
                AstNode.Declaration data = node.getValue();
                return node.withValue(new AstNode.Declaration(
                    data.variables(), this.rewriteAll(data.values())
                ));
            }
            case FUNCTION_DEFINITION: {
                AstNode.FunctionDefinition data = node.getValue();
                return node.withValue(new AstNode.FunctionDefinition(
                    data.isLocal(), data.path(), data.methodName(),
                    this.rewrite(data.function())
                ));
            }
            case RETURN: {
                AstNode.Return data = node.getValue();
                return node.withValue(
                    new AstNode.Return(this.rewriteAll(data.values()))
                );
            }
            default: {
                throw new IllegalStateException("unhandled node type!");
            }
        }
    }

}
