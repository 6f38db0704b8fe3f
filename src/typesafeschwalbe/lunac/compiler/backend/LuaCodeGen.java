package typesafeschwalbe.lunac.compiler.backend;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.Error;
import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

public class LuaCodeGen implements CodeGen {

    protected final Config config;
    protected final EmissionContext context;
    private boolean statementBefore = false;

    public LuaCodeGen(Config config) {
        this.config = config;
        this.context = new EmissionContext();
    }

    @Override
    public String generate(AstNode chunk) throws ErrorException {
        if(chunk.type != AstNode.Type.CHUNK) {
            throw new IllegalStateException("expected a chunk!");
        }
        AstNode.Chunk data = chunk.getValue();
        StringBuilder body = new StringBuilder();
        this.emitBlock(data.body(), body);
        List<String> sections = new ArrayList<>();
        for(String module: this.context.modules()) {
            sections.add("require " + Literals.renderString(
                module.getBytes(StandardCharsets.UTF_8)
            ));
        }
        this.emitInteropSetup(sections);
        sections.addAll(this.context.declarations());
        if(sections.isEmpty()) {
            return body.toString();
        }
        StringBuilder out = new StringBuilder(String.join("\n", sections));
        if(body.length() > 0) {
            out.append("\n");
            int start = out.length();
            out.append(body);
            LuaCodeGen.separateCall(out, start);
        }
        return out.toString();
    }

    /**
     * Adds the lines that set up the native interface to the preamble.
     */
    protected void emitInteropSetup(List<String> sections) {}

    protected void emitForeignImport(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        AstNode.ForeignImport data = node.getValue();
        throw new ErrorException(new Error(
            Error.Kind.FOREIGN_IMPORT_UNSUPPORTED,
            "Foreign import on a backend without native interop",
            Error.Marking.error(
                node.source,
                "the native symbol '" + data.symbol() + "' can not be"
                    + " imported when targeting '" + this.config.backend()
                    + "'"
            )
        ));
    }

    protected void requireLibrary(
        AstNode.Dependency dependency, AstNode node
    ) throws ErrorException {
        throw new ErrorException(new Error(
            Error.Kind.FOREIGN_IMPORT_UNSUPPORTED,
            "Native library dependency on a backend without native interop",
            Error.Marking.error(
                node.source,
                "the native library '" + dependency.name() + "' can not be"
                    + " loaded when targeting '" + this.config.backend()
                    + "'"
            )
        ));
    }

    protected void checkGotoSupport(AstNode node) throws ErrorException {
        if(this.config.targetVersion().isAtLeast(TargetVersion.LUA_52)) {
            return;
        }
        throw new ErrorException(new Error(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            "Usage of 'goto' or a label on an unsupported target",
            Error.Marking.error(
                node.source,
                "Lua " + this.config.targetVersion()
                    + " does not support 'goto' and labels"
            ),
            Error.Marking.help(
                node.source,
                "target version 5.2 or later, or the 'luajit' backend"
            )
        ));
    }

    // statements

    protected void emitBlock(
        List<AstNode> block, StringBuilder out
    ) throws ErrorException {
        for(AstNode statement: block) {
            this.emitStatement(statement, out);
        }
    }

    private void emitNestedBlock(
        List<AstNode> block, StringBuilder out
    ) throws ErrorException {
        boolean outerStatementBefore = this.statementBefore;
        this.statementBefore = false;
        this.context.enterBlock();
        this.emitBlock(block, out);
        this.context.exitBlock();
        this.statementBefore = outerStatementBefore;
    }

    protected void emitStatement(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        switch(node.type) {
            case VERBATIM: {
                this.emitVerbatim(node, out);
                return;
            }
            case FOREIGN_IMPORT: {
                this.emitForeignImport(node, out);
                this.statementBefore = true;
                return;
            }
            default: break;
        }
        this.context.newLine(out);
        int start = out.length();
        this.emitPlainStatement(node, out);
        if(this.statementBefore) {
            LuaCodeGen.separateCall(out, start);
        }
        this.statementBefore = true;
    }

    /**
     * Prefixes a statement starting at the given offset with a semicolon if
     * it opens with a parenthesis, which would otherwise continue the
     * previous statement as a call. Lua 5.1 only accepts the semicolon
     * after another statement.
     */
    static void separateCall(StringBuilder out, int start) {
        if(out.length() <= start || out.charAt(start) != '(') {
            return;
        }
        int previous = start - 1;
        while(previous >= 0 && Character.isWhitespace(out.charAt(previous))) {
            previous -= 1;
        }
        if(previous >= 0 && out.charAt(previous) == ';') {
            return;
        }
        out.insert(start, ';');
    }

    private void emitPlainStatement(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        switch(node.type) {
            case CALL:
            case METHOD_CALL: {
                this.emitExpression(node, out);
            } break;
            case DO: {
                AstNode.Block data = node.getValue();
                out.append("do");
                this.emitNestedBlock(data.body(), out);
                this.emitEnd(out);
            } break;
            case IF: {
                AstNode.If data = node.getValue();
                for(
                    int branchI = 0;
                    branchI < data.conditions().size();
                    branchI += 1
                ) {
                    if(branchI > 0) {
                        this.context.newLine(out);
                        out.append("else");
                    }
                    out.append("if ");
                    this.emitExpression(data.conditions().get(branchI), out);
                    out.append(" then");
                    this.emitNestedBlock(data.bodies().get(branchI), out);
                }
                if(data.elseBody().isPresent()) {
                    this.context.newLine(out);
                    out.append("else");
                    this.emitNestedBlock(data.elseBody().get(), out);
                }
                this.emitEnd(out);
            } break;
            case WHILE: {
                AstNode.Loop data = node.getValue();
                out.append("while ");
                this.emitExpression(data.condition(), out);
                out.append(" do");
                this.emitNestedBlock(data.body(), out);
                this.emitEnd(out);
            } break;
            case REPEAT: {
                AstNode.Loop data = node.getValue();
                out.append("repeat");
                this.emitNestedBlock(data.body(), out);
                this.context.newLine(out);
                out.append("until ");
                this.emitExpression(data.condition(), out);
            } break;
            case NUMERIC_FOR: {
                AstNode.NumericFor data = node.getValue();
                out.append("for ");
                out.append(data.variable().name());
                out.append("=");
                this.emitExpression(data.start(), out);
                out.append(",");
                this.emitExpression(data.limit(), out);
                if(data.step().isPresent()) {
                    out.append(",");
                    this.emitExpression(data.step().get(), out);
                }
                out.append(" do");
                this.emitNestedBlock(data.body(), out);
                this.emitEnd(out);
            } break;
            case GENERIC_FOR: {
                AstNode.GenericFor data = node.getValue();
                out.append("for ");
                this.emitNames(data.variables(), out);
                out.append(" in ");
                this.emitExpressions(data.iterators(), out);
                out.append(" do");
                this.emitNestedBlock(data.body(), out);
                this.emitEnd(out);
            } break;
            case ASSIGNMENT: {
                AstNode.Assignment data = node.getValue();
                this.emitExpressions(data.targets(), out);
                out.append(" = ");
                this.emitExpressions(data.values(), out);
            } break;
            case DECLARATION: {
                AstNode.Declaration data = node.getValue();
                out.append("local ");
                this.emitNames(data.variables(), out);
                if(!data.values().isEmpty()) {
                    out.append(" = ");
                    this.emitExpressions(data.values(), out);
                }
            } break;
            case FUNCTION_DEFINITION: {
                AstNode.FunctionDefinition data = node.getValue();
                if(data.isLocal()) {
                    out.append("local ");
                }
                out.append("function ");
                out.append(String.join(".", data.path()));
                if(data.methodName().isPresent()) {
                    out.append(":");
                    out.append(data.methodName().get());
                }
                AstNode.Function function = data.function().getValue();
                this.emitParameters(function, out);
                this.emitNestedBlock(function.body(), out);
                this.emitEnd(out);
            } break;
            case GOTO: {
                this.checkGotoSupport(node);
                out.append("goto ");
                out.append(node.<AstNode.Name>getValue().name());
            } break;
            case LABEL: {
                this.checkGotoSupport(node);
                out.append("::");
                out.append(node.<AstNode.Name>getValue().name());
                out.append("::");
            } break;
            case BREAK: {
                out.append("break");
            } break;
            case RETURN: {
                AstNode.Return data = node.getValue();
                out.append("return");
                if(!data.values().isEmpty()) {
                    out.append(" ");
                    this.emitExpressions(data.values(), out);
                }
            } break;
            case SWITCH:
            case META_BLOCK:
            case META_CONDITIONAL:
            case META_VALUE: {
                throw new IllegalStateException(
                    "'" + node.type + "' should have been lowered!"
                );
            }
            default: {
                throw new ErrorException(new Error(
                    Error.Kind.UNSUPPORTED_CONSTRUCT,
                    "Expression used as a statement",
                    Error.Marking.error(
                        node.source,
                        "only calls may be used as statements"
                    )
                ));
            }
        }
    }

    private void emitEnd(StringBuilder out) {
        this.context.newLine(out);
        out.append("end");
    }

    private void emitVerbatim(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        AstNode.Verbatim data = node.getValue();
        for(AstNode.Dependency dependency: data.dependencies()) {
            switch(dependency.kind()) {
                case MODULE: {
                    this.context.requireModule(dependency.name());
                } break;
                case LIBRARY: {
                    this.requireLibrary(dependency, node);
                } break;
            }
        }
        String text = data.text().strip();
        if(text.isEmpty()) { return; }
        if(data.insertionPoint() == AstNode.InsertionPoint.DECLARATION) {
            this.context.addDeclaration(text);
            return;
        }
        // later lines may sit inside a long string and stay untouched
        this.context.newLine(out);
        out.append(text);
        this.statementBefore = true;
    }

    // expressions

    protected void emitExpression(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        switch(node.type) {
            case NUMBER_LITERAL: {
                out.append(Literals.renderNumber(
                    node.getValue(), this.config.targetVersion()
                ));
            } break;
            case STRING_LITERAL: {
                out.append(Literals.renderString(
                    node.<AstNode.StringLiteral>getValue().bytes()
                ));
            } break;
            case BOOLEAN_LITERAL: {
                boolean value = node.<AstNode.BooleanLiteral>getValue()
                    .value();
                out.append(value? "true" : "false");
            } break;
            case NIL_LITERAL: {
                out.append("nil");
            } break;
            case VARARGS: {
                out.append("...");
            } break;
            case IDENTIFIER: {
                out.append(node.<AstNode.Name>getValue().name());
            } break;
            case INDEX: {
                AstNode.Index data = node.getValue();
                this.emitPrefix(data.indexed(), out);
                out.append("[");
                this.emitExpression(data.key(), out);
                out.append("]");
            } break;
            case FIELD: {
                AstNode.Field data = node.getValue();
                this.emitPrefix(data.indexed(), out);
                out.append(".");
                out.append(data.name());
            } break;
            case CALL: {
                AstNode.Call data = node.getValue();
                this.emitPrefix(data.called(), out);
                out.append("(");
                this.emitExpressions(data.arguments(), out);
                out.append(")");
            } break;
            case METHOD_CALL: {
                AstNode.MethodCall data = node.getValue();
                this.emitPrefix(data.receiver(), out);
                out.append(":");
                out.append(data.methodName());
                out.append("(");
                this.emitExpressions(data.arguments(), out);
                out.append(")");
            } break;
            case TABLE: {
                AstNode.Table data = node.getValue();
                out.append("{");
                boolean hadField = false;
                for(AstNode.TableField field: data.fields()) {
                    if(hadField) {
                        out.append(", ");
                    }
                    hadField = true;
                    if(field.name().isPresent()) {
                        out.append(field.name().get());
                        out.append(" = ");
                    } else if(field.key().isPresent()) {
                        out.append("[");
                        this.emitExpression(field.key().get(), out);
                        out.append("] = ");
                    }
                    this.emitExpression(field.value(), out);
                }
                out.append("}");
            } break;
            case FUNCTION: {
                AstNode.Function data = node.getValue();
                out.append("function");
                this.emitParameters(data, out);
                if(data.body().isEmpty()) {
                    out.append(" end");
                } else {
                    this.emitNestedBlock(data.body(), out);
                    this.emitEnd(out);
                }
            } break;
            case UNARY_OP: {
                AstNode.UnaryOp data = node.getValue();
                StringBuilder operand = new StringBuilder();
                boolean grouped = LuaCodeGen.precedenceOf(data.operand())
                    < AstNode.UnaryOperator.PRECEDENCE;
                this.emitOperand(data.operand(), grouped, operand);
                out.append(data.operator().symbol);
                if(data.operator() == AstNode.UnaryOperator.NEGATE
                    && operand.charAt(0) == '-') {
                    out.append(" ");
                }
                out.append(operand);
            } break;
            case BINARY_OP: {
                AstNode.BinaryOp data = node.getValue();
                AstNode.BinaryOperator operator = data.operator();
                this.emitOperand(
                    data.left(),
                    LuaCodeGen.needsGrouping(data.left(), operator, true),
                    out
                );
                out.append(" ");
                out.append(operator.symbol);
                out.append(" ");
                this.emitOperand(
                    data.right(),
                    LuaCodeGen.needsGrouping(data.right(), operator, false),
                    out
                );
            } break;
            case PAREN: {
                out.append("(");
                this.emitExpression(
                    node.<AstNode.MonoOp>getValue().value(), out
                );
                out.append(")");
            } break;
            default: {
                throw new IllegalStateException(
                    "'" + node.type + "' is not an expression!"
                );
            }
        }
    }

    private static boolean isUnaryLike(AstNode node) {
        return LuaCodeGen.precedenceOf(node)
            == AstNode.UnaryOperator.PRECEDENCE;
    }

    private static int precedenceOf(AstNode node) {
        switch(node.type) {
            case BINARY_OP:
                return node.<AstNode.BinaryOp>getValue().operator()
                    .precedence;
            case UNARY_OP:
                return AstNode.UnaryOperator.PRECEDENCE;
            case NUMBER_LITERAL:
                return node.<AstNode.NumberLiteral>getValue().negative()
                    ? AstNode.UnaryOperator.PRECEDENCE
                    : Integer.MAX_VALUE;
            default:
                return Integer.MAX_VALUE;
        }
    }

    /**
     * Whether an operand has to be parenthesized so that the target
     * parses it as the operand of the given operator.
     */
    private static boolean needsGrouping(
        AstNode operand, AstNode.BinaryOperator operator, boolean isLeft
    ) {
        // unary operators are read at the start of any operand, but bind
        // looser than the exponentiation to their right
        if(LuaCodeGen.isUnaryLike(operand)) {
            return isLeft && operator.precedence
                > AstNode.UnaryOperator.PRECEDENCE;
        }
        int precedence = LuaCodeGen.precedenceOf(operand);
        if(precedence != operator.precedence) {
            return precedence < operator.precedence;
        }
        return isLeft == operator.isRightAssociative;
    }

    private void emitOperand(
        AstNode operand, boolean grouped, StringBuilder out
    ) throws ErrorException {
        if(grouped) {
            out.append("(");
        }
        this.emitExpression(operand, out);
        if(grouped) {
            out.append(")");
        }
    }

    /**
     * Emits an expression that is called, indexed or used as a method
     * receiver.
     */
    private void emitPrefix(
        AstNode node, StringBuilder out
    ) throws ErrorException {
        this.emitOperand(node, !node.isPrefixExpression(), out);
    }

    protected void emitExpressions(
        List<AstNode> nodes, StringBuilder out
    ) throws ErrorException {
        for(int nodeI = 0; nodeI < nodes.size(); nodeI += 1) {
            if(nodeI > 0) {
                out.append(", ");
            }
            this.emitExpression(nodes.get(nodeI), out);
        }
    }

    private void emitNames(
        List<AstNode.Variable> variables, StringBuilder out
    ) {
        for(int varI = 0; varI < variables.size(); varI += 1) {
            if(varI > 0) {
                out.append(", ");
            }
            out.append(variables.get(varI).name());
        }
    }

    private void emitParameters(AstNode.Function function, StringBuilder out) {
        out.append("(");
        this.emitNames(function.parameters(), out);
        if(function.isVariadic()) {
            if(!function.parameters().isEmpty()) {
                out.append(", ");
            }
            out.append("...");
        }
        out.append(")");
    }

}
