package typesafeschwalbe.lunac.compiler.backend;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.Nodes;

/**
 * The first version supporting each operator natively, and the library
 * call replacing it on older versions. Operators without a rule are
 * native everywhere.
 */
public final class OperatorRules {

    @FunctionalInterface
    private static interface UnaryShim {
        AstNode lower(AstNode operand, Source source);
    }

    @FunctionalInterface
    private static interface BinaryShim {
        AstNode lower(AstNode left, AstNode right, Source source);
    }

    private static record UnaryRule(
        TargetVersion nativeSince, UnaryShim shim
    ) {}

    private static record BinaryRule(
        TargetVersion nativeSince, BinaryShim shim
    ) {}

    private static final Map<AstNode.UnaryOperator, UnaryRule> UNARY
        = new EnumMap<>(AstNode.UnaryOperator.class);
    private static final Map<AstNode.BinaryOperator, BinaryRule> BINARY
        = new EnumMap<>(AstNode.BinaryOperator.class);

    private static AstNode libraryCall(
        String library, String function, List<AstNode> arguments,
        Source source
    ) {
        return Nodes.call(
            Nodes.path(source, library, function), arguments, source
        );
    }

    private static void addBinaryCall(
        AstNode.BinaryOperator operator, String library, String function
    ) {
        BINARY.put(operator, new BinaryRule(
            TargetVersion.LUA_53,
            (left, right, source) -> OperatorRules.libraryCall(
                library, function, List.of(left, right), source
            )
        ));
    }

    static {
        UNARY.put(AstNode.UnaryOperator.BITWISE_NOT, new UnaryRule(
            TargetVersion.LUA_53,
            (operand, source) -> OperatorRules.libraryCall(
                "bit", "bnot", List.of(operand), source
            )
        ));
        BINARY.put(AstNode.BinaryOperator.FLOOR_DIVIDE, new BinaryRule(
            TargetVersion.LUA_53,
            (left, right, source) -> OperatorRules.libraryCall(
                "math", "floor",
                List.of(Nodes.binary(
                    AstNode.BinaryOperator.DIVIDE, left, right, source
                )),
                source
            )
        ));
        OperatorRules.addBinaryCall(
            AstNode.BinaryOperator.POWER, "math", "pow"
        );
        OperatorRules.addBinaryCall(
            AstNode.BinaryOperator.BITWISE_OR, "bit", "bor"
        );
        OperatorRules.addBinaryCall(
            AstNode.BinaryOperator.BITWISE_XOR, "bit", "bxor"
        );
        OperatorRules.addBinaryCall(
            AstNode.BinaryOperator.BITWISE_AND, "bit", "band"
        );
        OperatorRules.addBinaryCall(
            AstNode.BinaryOperator.SHIFT_LEFT, "bit", "lshift"
        );
        OperatorRules.addBinaryCall(
            AstNode.BinaryOperator.SHIFT_RIGHT, "bit", "rshift"
        );
    }

    private OperatorRules() {}

    public static boolean isNative(
        AstNode.BinaryOperator operator, TargetVersion version
    ) {
        BinaryRule rule = BINARY.get(operator);
        return rule == null || version.isAtLeast(rule.nativeSince());
    }

    public static boolean isNative(
        AstNode.UnaryOperator operator, TargetVersion version
    ) {
        UnaryRule rule = UNARY.get(operator);
        return rule == null || version.isAtLeast(rule.nativeSince());
    }

    /**
     * The replacement of a unary operation, if the operator is not native
     * in the given version.
     */
    public static Optional<AstNode> lowerUnary(
        AstNode node, TargetVersion version
    ) {
        AstNode.UnaryOp data = node.getValue();
        if(OperatorRules.isNative(data.operator(), version)) {
            return Optional.empty();
        }
        return Optional.of(UNARY.get(data.operator()).shim().lower(
            data.operand(), node.source
        ));
    }

    /**
     * The replacement of a binary operation, if the operator is not
     * native in the given version.
     */
    public static Optional<AstNode> lowerBinary(
        AstNode node, TargetVersion version
    ) {
        AstNode.BinaryOp data = node.getValue();
        if(OperatorRules.isNative(data.operator(), version)) {
            return Optional.empty();
        }
        return Optional.of(BINARY.get(data.operator()).shim().lower(
            data.left(), data.right(), node.source
        ));
    }

}
