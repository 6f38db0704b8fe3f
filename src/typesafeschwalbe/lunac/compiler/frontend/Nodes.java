package typesafeschwalbe.lunac.compiler.frontend;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.backend.Literals;

/**
 * Factory methods for tree nodes. Nodes created without an explicit
 * source are marked with {@link Source#NONE}.
 */
public final class Nodes {

    private Nodes() {}

    public static AstNode chunk(AstNode... body) {
        return Nodes.chunk(List.of(body));
    }

    public static AstNode chunk(List<AstNode> body) {
        return new AstNode(
            AstNode.Type.CHUNK, new AstNode.Chunk(body), Source.NONE
        );
    }

    // literals

    public static AstNode number(String text) {
        return Nodes.number(text, Source.NONE);
    }

    public static AstNode number(String text, Source source) {
        return new AstNode(
            AstNode.Type.NUMBER_LITERAL, Literals.parseNumber(text), source
        );
    }

    public static AstNode integer(long value, Source source) {
        String digits = String.valueOf(value);
        boolean negative = digits.startsWith("-");
        return new AstNode(
            AstNode.Type.NUMBER_LITERAL,
            new AstNode.NumberLiteral(
                negative, 10, negative? digits.substring(1) : digits,
                "", Optional.empty()
            ),
            source
        );
    }

    public static AstNode string(String content) {
        return Nodes.string(content, Source.NONE);
    }

    public static AstNode string(String content, Source source) {
        return new AstNode(
            AstNode.Type.STRING_LITERAL,
            AstNode.StringLiteral.of(content),
            source
        );
    }

    public static AstNode bytes(byte[] bytes) {
        return new AstNode(
            AstNode.Type.STRING_LITERAL,
            new AstNode.StringLiteral(bytes),
            Source.NONE
        );
    }

    /**
     * A string literal given in any of the quoted or long-bracket source
     * forms.
     */
    public static AstNode quoted(String literalText) {
        return new AstNode(
            AstNode.Type.STRING_LITERAL,
            Literals.parseString(literalText),
            Source.NONE
        );
    }

    public static AstNode bool(boolean value) {
        return Nodes.bool(value, Source.NONE);
    }

    public static AstNode bool(boolean value, Source source) {
        return new AstNode(
            AstNode.Type.BOOLEAN_LITERAL,
            new AstNode.BooleanLiteral(value),
            source
        );
    }

    public static AstNode nil() {
        return Nodes.nil(Source.NONE);
    }

    public static AstNode nil(Source source) {
        return new AstNode(AstNode.Type.NIL_LITERAL, null, source);
    }

    public static AstNode varargs() {
        return new AstNode(AstNode.Type.VARARGS, null, Source.NONE);
    }

    // expressions

    public static AstNode id(String name) {
        return Nodes.id(name, Source.NONE);
    }

    public static AstNode id(String name, Source source) {
        return new AstNode(
            AstNode.Type.IDENTIFIER, new AstNode.Name(name), source
        );
    }

    public static AstNode index(AstNode indexed, AstNode key) {
        return new AstNode(
            AstNode.Type.INDEX, new AstNode.Index(indexed, key), Source.NONE
        );
    }

    public static AstNode field(AstNode indexed, String name) {
        return Nodes.field(indexed, name, Source.NONE);
    }

    public static AstNode field(AstNode indexed, String name, Source source) {
        return new AstNode(
            AstNode.Type.FIELD, new AstNode.Field(indexed, name), source
        );
    }

    /**
     * A dotted path like {@code math.floor}.
     */
    public static AstNode path(Source source, String first, String... rest) {
        AstNode path = Nodes.id(first, source);
        for(String element: rest) {
            path = Nodes.field(path, element, source);
        }
        return path;
    }

    public static AstNode call(AstNode called, AstNode... arguments) {
        return Nodes.call(called, List.of(arguments), Source.NONE);
    }

    public static AstNode call(
        AstNode called, List<AstNode> arguments, Source source
    ) {
        return new AstNode(
            AstNode.Type.CALL,
            new AstNode.Call(called, arguments, false),
            source
        );
    }

    /**
     * A call written as {@code f "text"} or {@code f {...}}.
     */
    public static AstNode juxtaposedCall(AstNode called, AstNode argument) {
        return new AstNode(
            AstNode.Type.CALL,
            new AstNode.Call(called, List.of(argument), true),
            Source.NONE
        );
    }

    public static AstNode methodCall(
        AstNode receiver, String methodName, AstNode... arguments
    ) {
        return new AstNode(
            AstNode.Type.METHOD_CALL,
            new AstNode.MethodCall(
                receiver, methodName, List.of(arguments), false
            ),
            Source.NONE
        );
    }

    public static AstNode juxtaposedMethodCall(
        AstNode receiver, String methodName, AstNode argument
    ) {
        return new AstNode(
            AstNode.Type.METHOD_CALL,
            new AstNode.MethodCall(
                receiver, methodName, List.of(argument), true
            ),
            Source.NONE
        );
    }

    public static AstNode table(AstNode.TableField... fields) {
        return new AstNode(
            AstNode.Type.TABLE, new AstNode.Table(List.of(fields)),
            Source.NONE
        );
    }

    public static AstNode table(Source source) {
        return new AstNode(
            AstNode.Type.TABLE, new AstNode.Table(List.of()), source
        );
    }

    public static AstNode.TableField positional(AstNode value) {
        return new AstNode.TableField(
            Optional.empty(), Optional.empty(), value
        );
    }

    public static AstNode.TableField named(String name, AstNode value) {
        return new AstNode.TableField(
            Optional.of(name), Optional.empty(), value
        );
    }

    public static AstNode.TableField keyed(AstNode key, AstNode value) {
        return new AstNode.TableField(
            Optional.empty(), Optional.of(key), value
        );
    }

    public static AstNode.Variable variable(String name) {
        return new AstNode.Variable(name, Optional.empty());
    }

    public static AstNode.Variable typed(String name, StaticType type) {
        return new AstNode.Variable(name, Optional.of(type));
    }

    public static List<AstNode.Variable> variables(String... names) {
        return Arrays.stream(names).map(Nodes::variable).toList();
    }

    public static AstNode function(
        List<AstNode.Variable> parameters, AstNode... body
    ) {
        return Nodes.function(parameters, false, List.of(), List.of(body));
    }

    public static AstNode function(
        List<AstNode.Variable> parameters, boolean isVariadic,
        List<StaticType> returnTypes, List<AstNode> body
    ) {
        return new AstNode(
            AstNode.Type.FUNCTION,
            new AstNode.Function(parameters, isVariadic, body, returnTypes),
            Source.NONE
        );
    }

    public static AstNode unary(AstNode.UnaryOperator op, AstNode operand) {
        return new AstNode(
            AstNode.Type.UNARY_OP, new AstNode.UnaryOp(op, operand),
            Source.NONE
        );
    }

    public static AstNode binary(
        AstNode.BinaryOperator op, AstNode left, AstNode right
    ) {
        return Nodes.binary(op, left, right, Source.NONE);
    }

    public static AstNode binary(
        AstNode.BinaryOperator op, AstNode left, AstNode right, Source source
    ) {
        return new AstNode(
            AstNode.Type.BINARY_OP, new AstNode.BinaryOp(op, left, right),
            source
        );
    }

    public static AstNode paren(AstNode value) {
        return new AstNode(
            AstNode.Type.PAREN, new AstNode.MonoOp(value), Source.NONE
        );
    }

    // statements

    public static AstNode doBlock(AstNode... body) {
        return Nodes.doBlock(List.of(body), Source.NONE);
    }

    public static AstNode doBlock(List<AstNode> body, Source source) {
        return new AstNode(AstNode.Type.DO, new AstNode.Block(body), source);
    }

    public static AstNode ifThen(AstNode condition, AstNode... body) {
        return Nodes.ifChain(
            List.of(condition), List.of(List.of(body)), Optional.empty(),
            Source.NONE
        );
    }

    public static AstNode ifChain(
        List<AstNode> conditions, List<List<AstNode>> bodies,
        Optional<List<AstNode>> elseBody, Source source
    ) {
        return new AstNode(
            AstNode.Type.IF,
            new AstNode.If(conditions, bodies, elseBody),
            source
        );
    }

    public static AstNode switchOn(
        AstNode value, List<AstNode> caseValues,
        List<List<AstNode>> caseBodies, Optional<List<AstNode>> elseBody
    ) {
        return new AstNode(
            AstNode.Type.SWITCH,
            new AstNode.Switch(value, caseValues, caseBodies, elseBody),
            Source.NONE
        );
    }

    public static AstNode whileLoop(AstNode condition, AstNode... body) {
        return new AstNode(
            AstNode.Type.WHILE, new AstNode.Loop(condition, List.of(body)),
            Source.NONE
        );
    }

    public static AstNode repeatLoop(AstNode condition, AstNode... body) {
        return new AstNode(
            AstNode.Type.REPEAT, new AstNode.Loop(condition, List.of(body)),
            Source.NONE
        );
    }

    public static AstNode numericFor(
        String variable, AstNode start, AstNode limit,
        Optional<AstNode> step, AstNode... body
    ) {
        return new AstNode(
            AstNode.Type.NUMERIC_FOR,
            new AstNode.NumericFor(
                Nodes.variable(variable), start, limit, step, List.of(body)
            ),
            Source.NONE
        );
    }

    public static AstNode genericFor(
        List<String> variables, List<AstNode> iterators, AstNode... body
    ) {
        return new AstNode(
            AstNode.Type.GENERIC_FOR,
            new AstNode.GenericFor(
                variables.stream().map(Nodes::variable).toList(),
                iterators, List.of(body)
            ),
            Source.NONE
        );
    }

    public static AstNode assign(List<AstNode> targets, List<AstNode> values) {
        return new AstNode(
            AstNode.Type.ASSIGNMENT,
            new AstNode.Assignment(targets, values),
            Source.NONE
        );
    }

    public static AstNode local(String name, AstNode... values) {
        return Nodes.local(List.of(Nodes.variable(name)), values);
    }

    public static AstNode local(
        List<AstNode.Variable> variables, AstNode... values
    ) {
        return Nodes.local(variables, List.of(values), Source.NONE);
    }

    public static AstNode local(
        List<AstNode.Variable> variables, List<AstNode> values, Source source
    ) {
        return new AstNode(
            AstNode.Type.DECLARATION,
            new AstNode.Declaration(variables, values),
            source
        );
    }

    public static AstNode localFunction(String name, AstNode function) {
        return new AstNode(
            AstNode.Type.FUNCTION_DEFINITION,
            new AstNode.FunctionDefinition(
                true, List.of(name), Optional.empty(), function
            ),
            Source.NONE
        );
    }

    public static AstNode functionDefinition(
        List<String> path, Optional<String> methodName, AstNode function
    ) {
        return new AstNode(
            AstNode.Type.FUNCTION_DEFINITION,
            new AstNode.FunctionDefinition(
                false, path, methodName, function
            ),
            Source.NONE
        );
    }

    public static AstNode gotoLabel(String label) {
        return new AstNode(
            AstNode.Type.GOTO, new AstNode.Name(label), Source.NONE
        );
    }

    public static AstNode label(String name) {
        return new AstNode(
            AstNode.Type.LABEL, new AstNode.Name(name), Source.NONE
        );
    }

    public static AstNode breakLoop() {
        return new AstNode(AstNode.Type.BREAK, null, Source.NONE);
    }

    public static AstNode returning(AstNode... values) {
        return new AstNode(
            AstNode.Type.RETURN, new AstNode.Return(List.of(values)),
            Source.NONE
        );
    }

    public static AstNode foreignImport(
        String symbol, Optional<String> origin,
        AstNode.CallingConvention convention,
        String returnType, List<String> parameterTypes, Source source
    ) {
        return new AstNode(
            AstNode.Type.FOREIGN_IMPORT,
            new AstNode.ForeignImport(
                symbol, origin, convention, returnType, parameterTypes
            ),
            source
        );
    }

    // compile-time directives

    public static AstNode metaBlock(AstNode... body) {
        return Nodes.metaBlock(List.of(body), Source.NONE);
    }

    public static AstNode metaBlock(List<AstNode> body, Source source) {
        return new AstNode(
            AstNode.Type.META_BLOCK, new AstNode.Block(body), source
        );
    }

    public static AstNode metaIf(
        List<AstNode> predicates, List<List<AstNode>> branches,
        Optional<List<AstNode>> elseBranch
    ) {
        return new AstNode(
            AstNode.Type.META_CONDITIONAL,
            new AstNode.If(predicates, branches, elseBranch),
            Source.NONE
        );
    }

    public static AstNode metaValue(AstNode expression) {
        return new AstNode(
            AstNode.Type.META_VALUE, new AstNode.MonoOp(expression),
            Source.NONE
        );
    }

    public static AstNode verbatim(
        String text, AstNode.InsertionPoint insertionPoint,
        List<AstNode.Dependency> dependencies, Source source
    ) {
        return new AstNode(
            AstNode.Type.VERBATIM,
            new AstNode.Verbatim(text, insertionPoint, dependencies),
            source
        );
    }

}
