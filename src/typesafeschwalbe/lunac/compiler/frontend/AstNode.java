package typesafeschwalbe.lunac.compiler.frontend;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.Source;

/**
 * A node of the resolved tree handed to the backend. Overloads, optional
 * parameters and other variants have already been resolved by the type
 * checker, so every node is in its final shape. Nodes are never shared;
 * rewrites build new nodes.
 */
public class AstNode {

    public static record Chunk(
        List<AstNode> body
    ) {}

    public static record NumberLiteral(
        boolean negative,
        int base,
        String integerDigits,
        String fractionalDigits,
        Optional<Integer> exponent
    ) {
        /**
         * Whether the literal is written with a fraction or an exponent.
         */
        public boolean hasFloatForm() {
            return !this.fractionalDigits.isEmpty()
                || this.exponent.isPresent();
        }
    }

    public static record StringLiteral(
        byte[] bytes
    ) {
        public static StringLiteral of(String content) {
            return new StringLiteral(
                content.getBytes(StandardCharsets.UTF_8)
            );
        }

        @Override
        public boolean equals(Object otherRaw) {
            if(!(otherRaw instanceof StringLiteral)) { return false; }
            StringLiteral other = (StringLiteral) otherRaw;
            return Arrays.equals(this.bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(this.bytes);
        }

        @Override
        public String toString() {
            return "StringLiteral["
                + new String(this.bytes, StandardCharsets.ISO_8859_1) + "]";
        }
    }

    public static record BooleanLiteral(
        boolean value
    ) {}

    public static record Name(
        String name
    ) {}

    public static record Index(
        AstNode indexed,
        AstNode key
    ) {}

    public static record Field(
        AstNode indexed,
        String name
    ) {}

    public static record Call(
        AstNode called,
        List<AstNode> arguments,
        boolean juxtaposed
    ) {}

    public static record MethodCall(
        AstNode receiver,
        String methodName,
        List<AstNode> arguments,
        boolean juxtaposed
    ) {}

    public static record TableField(
        Optional<String> name,
        Optional<AstNode> key,
        AstNode value
    ) {}

    public static record Table(
        List<TableField> fields
    ) {}

    public static record Variable(
        String name,
        Optional<StaticType> type
    ) {}

    public static record Function(
        List<Variable> parameters,
        boolean isVariadic,
        List<AstNode> body,
        List<StaticType> returnTypes
    ) {}

    public static record UnaryOp(
        UnaryOperator operator,
        AstNode operand
    ) {}

    public static record BinaryOp(
        BinaryOperator operator,
        AstNode left,
        AstNode right
    ) {}

    public static record MonoOp(
        AstNode value
    ) {}

    public static record Block(
        List<AstNode> body
    ) {}

    public static record If(
        List<AstNode> conditions,
        List<List<AstNode>> bodies,
        Optional<List<AstNode>> elseBody
    ) {}

    public static record Switch(
        AstNode value,
        List<AstNode> caseValues,
        List<List<AstNode>> caseBodies,
        Optional<List<AstNode>> elseBody
    ) {}

    public static record Loop(
        AstNode condition,
        List<AstNode> body
    ) {}

    public static record NumericFor(
        Variable variable,
        AstNode start,
        AstNode limit,
        Optional<AstNode> step,
        List<AstNode> body
    ) {}

    public static record GenericFor(
        List<Variable> variables,
        List<AstNode> iterators,
        List<AstNode> body
    ) {}

    public static record Assignment(
        List<AstNode> targets,
        List<AstNode> values
    ) {}

    public static record Declaration(
        List<Variable> variables,
        List<AstNode> values
    ) {}

    public static record FunctionDefinition(
        boolean isLocal,
        List<String> path,
        Optional<String> methodName,
        AstNode function
    ) {}

    public static record Return(
        List<AstNode> values
    ) {}

    public static record ForeignImport(
        String symbol,
        Optional<String> origin,
        CallingConvention convention,
        String returnType,
        List<String> parameterTypes
    ) {}

    public static record Dependency(
        Dependency.Kind kind,
        String name
    ) {
        public enum Kind {
            MODULE,  // a module loaded with 'require'
            LIBRARY  // a native shared library
        }
    }

    public static record Verbatim(
        String text,
        InsertionPoint insertionPoint,
        List<Dependency> dependencies
    ) {}

    public enum InsertionPoint {
        DECLARATION,
        STATEMENT
    }

    public enum CallingConvention {
        CDECL(""),
        STDCALL("__stdcall"),
        FASTCALL("__fastcall");

        public final String keyword;

        private CallingConvention(String keyword) {
            this.keyword = keyword;
        }
    }

    /**
     * Binary operators with their binding strength. A larger precedence
     * binds tighter.
     */
    public enum BinaryOperator {
        OR("or", 1),
        AND("and", 2),
        LESS_THAN("<", 3),
        GREATER_THAN(">", 3),
        LESS_THAN_EQUAL("<=", 3),
        GREATER_THAN_EQUAL(">=", 3),
        NOT_EQUALS("~=", 3),
        EQUALS("==", 3),
        BITWISE_OR("|", 4),
        BITWISE_XOR("~", 5),
        BITWISE_AND("&", 6),
        SHIFT_LEFT("<<", 7),
        SHIFT_RIGHT(">>", 7),
        CONCAT("..", 8, true),
        ADD("+", 9),
        SUBTRACT("-", 9),
        MULTIPLY("*", 10),
        DIVIDE("/", 10),
        FLOOR_DIVIDE("//", 10),
        MODULO("%", 10),
        POWER("^", 12, true);

        public final String symbol;
        public final int precedence;
        public final boolean isRightAssociative;

        private BinaryOperator(String symbol, int precedence) {
            this(symbol, precedence, false);
        }

        private BinaryOperator(
            String symbol, int precedence, boolean isRightAssociative
        ) {
            this.symbol = symbol;
            this.precedence = precedence;
            this.isRightAssociative = isRightAssociative;
        }
    }

    public enum UnaryOperator {
        NOT("not "),
        NEGATE("-"),
        BITWISE_NOT("~"),
        LENGTH("#");

        public static final int PRECEDENCE = 11;

        public final String symbol;

        private UnaryOperator(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum Type {
        CHUNK,                   // Chunk
        NUMBER_LITERAL,          // NumberLiteral
        STRING_LITERAL,          // StringLiteral
        BOOLEAN_LITERAL,         // BooleanLiteral
        NIL_LITERAL,             // = null
        VARARGS,                 // = null
        IDENTIFIER,              // Name
        INDEX,                   // Index
        FIELD,                   // Field
        CALL,                    // Call
        METHOD_CALL,             // MethodCall
        TABLE,                   // Table
        FUNCTION,                // Function
        UNARY_OP,                // UnaryOp
        BINARY_OP,               // BinaryOp
        PAREN,                   // MonoOp
        DO,                      // Block
        IF,                      // If
        SWITCH,                  // Switch
        WHILE,                   // Loop
        REPEAT,                  // Loop
        NUMERIC_FOR,             // NumericFor
        GENERIC_FOR,             // GenericFor
        ASSIGNMENT,              // Assignment
        DECLARATION,             // Declaration
        FUNCTION_DEFINITION,     // FunctionDefinition
        GOTO,                    // Name
        LABEL,                   // Name
        BREAK,                   // = null
        RETURN,                  // Return
        FOREIGN_IMPORT,          // ForeignImport
        META_BLOCK,              // Block
        META_CONDITIONAL,        // If
        META_VALUE,              // MonoOp
        VERBATIM                 // Verbatim
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public AstNode(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public AstNode withValue(Object value) {
        return new AstNode(this.type, value, this.source);
    }

    /**
     * Whether the expression may produce more than one value when it is
     * the last element of an expression list.
     */
    public boolean isMultiValue() {
        switch(this.type) {
            case CALL:
            case METHOD_CALL:
            case VARARGS:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether the expression may be called or indexed without being
     * wrapped in parentheses.
     */
    public boolean isPrefixExpression() {
        switch(this.type) {
            case IDENTIFIER:
            case INDEX:
            case FIELD:
            case CALL:
            case METHOD_CALL:
            case PAREN:
                return true;
            default:
                return false;
        }
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof AstNode)) { return false; }
        AstNode other = (AstNode) otherRaw;
        return this.type == other.type
            && Objects.equals(this.value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value);
    }

    @Override
    public String toString() {
        return this.type + (this.value == null? "" : "(" + this.value + ")");
    }

}
