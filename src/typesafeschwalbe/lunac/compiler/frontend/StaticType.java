package typesafeschwalbe.lunac.compiler.frontend;

import java.util.Optional;

import typesafeschwalbe.lunac.compiler.Source;

/**
 * A static type annotation as resolved by the type checker. The generated
 * code is untyped; types only decide default values.
 */
public record StaticType(Kind kind, String name) {

    public enum Kind {
        INTEGER,
        FLOAT,
        NUMBER,
        BOOLEAN,
        STRING,
        TABLE,
        RECORD,
        ARRAY,
        FUNCTION,
        POINTER,
        ANY
    }

    public static StaticType of(Kind kind) {
        return new StaticType(kind, kind.name().toLowerCase());
    }

    public boolean isNumeric() {
        switch(this.kind) {
            case INTEGER:
            case FLOAT:
            case NUMBER:
                return true;
            default:
                return false;
        }
    }

    public boolean isAggregate() {
        switch(this.kind) {
            case TABLE:
            case RECORD:
            case ARRAY:
                return true;
            default:
                return false;
        }
    }

    /**
     * The expression an uninitialized variable of this type holds.
     */
    public Optional<AstNode> zeroValue(Source source) {
        if(this.isNumeric()) {
            return Optional.of(Nodes.integer(0, source));
        }
        if(this.kind == Kind.BOOLEAN) {
            return Optional.of(Nodes.bool(false, source));
        }
        if(this.isAggregate()) {
            return Optional.of(Nodes.table(source));
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return this.name;
    }

}
