package typesafeschwalbe.lunac.compiler.meta;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import typesafeschwalbe.lunac.compiler.backend.Literals;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * A value of compile-time code.
 */
public abstract class Value {

    private Value() {}

    @SuppressWarnings("unchecked")
    public <T extends Value> T getValue() {
        try {
            return (T) this;
        } catch(ClassCastException e) {
            throw new RuntimeException("Value has invalid type!");
        }
    }

    /**
     * The name returned by the 'type' intrinsic.
     */
    public abstract String typeName();

    public boolean isTruthy() {
        return true;
    }

    public String asString() {
        return "<" + this.typeName() + ">";
    }

    public static class Nil extends Value {
        private Nil() {}

        @Override
        public String typeName() { return "nil"; }

        @Override
        public boolean isTruthy() { return false; }

        @Override
        public String asString() { return "nil"; }

        @Override
        public boolean equals(Object otherRaw) {
            return otherRaw instanceof Nil;
        }

        @Override
        public int hashCode() {
            return 0;
        }
    }
    public static final Nil NIL = new Nil();

    public static class Bool extends Value {
        public final boolean value;

        public Bool(boolean value) {
            this.value = value;
        }

        @Override
        public String typeName() { return "boolean"; }

        @Override
        public boolean isTruthy() { return this.value; }

        @Override
        public String asString() { return String.valueOf(this.value); }

        @Override
        public boolean equals(Object otherRaw) {
            if(!(otherRaw instanceof Bool)) { return false; }
            Bool other = (Bool) otherRaw;
            return this.value == other.value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(this.value);
        }
    }
    public static final Bool TRUE = new Bool(true);
    public static final Bool FALSE = new Bool(false);

    public static Bool of(boolean value) {
        return value? TRUE : FALSE;
    }

    /**
     * Integers and floats compare equal when they have the same
     * mathematical value, as they do in Lua.
     */
    public static class Int extends Value {
        public final long value;

        public Int(long value) {
            this.value = value;
        }

        @Override
        public String typeName() { return "number"; }

        @Override
        public String asString() { return String.valueOf(this.value); }

        @Override
        public boolean equals(Object otherRaw) {
            if(otherRaw instanceof Float) {
                return ((Float) otherRaw).equalsInteger(this.value);
            }
            if(!(otherRaw instanceof Int)) { return false; }
            Int other = (Int) otherRaw;
            return this.value == other.value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(this.value);
        }
    }

    public static class Float extends Value {
        public final double value;

        public Float(double value) {
            this.value = value;
        }

        @Override
        public String typeName() { return "number"; }

        @Override
        public String asString() {
            if(Double.isNaN(this.value)) {
                return "nan";
            }
            if(Double.isInfinite(this.value)) {
                return this.value > 0? "inf" : "-inf";
            }
            String rendered = Literals.renderDouble(this.value);
            if(rendered.matches("-?[0-9]+")) {
                rendered += ".0";
            }
            return rendered;
        }

        private boolean isIntegral() {
            return this.value == Math.rint(this.value)
                && !Double.isInfinite(this.value);
        }

        private boolean equalsInteger(long integer) {
            // 2^63 itself is the first double outside of the range
            return this.isIntegral()
                && this.value >= -0x1p63 && this.value < 0x1p63
                && (long) this.value == integer;
        }

        @Override
        public boolean equals(Object otherRaw) {
            if(otherRaw instanceof Int) {
                return this.equalsInteger(((Int) otherRaw).value);
            }
            if(!(otherRaw instanceof Float)) { return false; }
            Float other = (Float) otherRaw;
            return this.value == other.value;
        }

        @Override
        public int hashCode() {
            if(this.isIntegral()) {
                return Long.hashCode((long) this.value);
            }
            return Double.hashCode(this.value);
        }
    }

    public static class Str extends Value {
        public final String value;

        public Str(String value) {
            this.value = value;
        }

        @Override
        public String typeName() { return "string"; }

        @Override
        public String asString() { return this.value; }

        @Override
        public boolean equals(Object otherRaw) {
            if(!(otherRaw instanceof Str)) { return false; }
            Str other = (Str) otherRaw;
            return this.value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return this.value.hashCode();
        }
    }

    /**
     * Tables are compared by identity.
     */
    public static class Table extends Value {
        public final Map<Value, Value> value;

        public Table() {
            this.value = new LinkedHashMap<>();
        }

        @Override
        public String typeName() { return "table"; }

        public Value get(Value key) {
            return this.value.getOrDefault(key, NIL);
        }

        public void set(Value key, Value value) {
            if(value instanceof Nil) {
                this.value.remove(key);
            } else {
                this.value.put(key, value);
            }
        }

        /**
         * The length of the sequence starting at index 1.
         */
        public long length() {
            long length = 0;
            while(this.value.containsKey(new Int(length + 1))) {
                length += 1;
            }
            return length;
        }
    }

    public static class Closure extends Value {
        public final List<AstNode.Variable> parameters;
        public final boolean isVariadic;
        public final List<AstNode> body;
        public final int frame;

        public Closure(
            List<AstNode.Variable> parameters, boolean isVariadic,
            List<AstNode> body, int frame
        ) {
            this.parameters = parameters;
            this.isVariadic = isVariadic;
            this.body = body;
            this.frame = frame;
        }

        @Override
        public String typeName() { return "function"; }
    }

    public static class BuiltIn extends Value {
        public final String name;
        public final Interpreter.BuiltInProcedure procedure;

        public BuiltIn(String name, Interpreter.BuiltInProcedure procedure) {
            this.name = name;
            this.procedure = procedure;
        }

        @Override
        public String typeName() { return "function"; }

        @Override
        public String asString() { return "<builtin " + this.name + ">"; }
    }

    /**
     * The 'config' global, which reads and writes the configuration of
     * the compilation unit.
     */
    public static class ConfigView extends Value {
        private ConfigView() {}

        @Override
        public String typeName() { return "table"; }

        @Override
        public String asString() { return "<config>"; }
    }
    public static final ConfigView CONFIG = new ConfigView();

    public static class FlagsView extends Value {
        private FlagsView() {}

        @Override
        public String typeName() { return "table"; }

        @Override
        public String asString() { return "<config flags>"; }
    }
    public static final FlagsView FLAGS = new FlagsView();

}
