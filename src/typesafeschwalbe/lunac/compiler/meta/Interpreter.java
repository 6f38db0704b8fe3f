package typesafeschwalbe.lunac.compiler.meta;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.lunac.compiler.Backend;
import typesafeschwalbe.lunac.compiler.Color;
import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.Error;
import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.backend.Literals;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * Evaluates compile-time code. Requests to change the configuration, to
 * emit text or to require dependencies are recorded as
 * {@link MetaEffect}s in the order they were made.
 */
public class Interpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        Interpreter.class
    );

    public static final int MAX_CALL_DEPTH = 200;

    public static final String CONFIG_GLOBAL = "config";
    public static final String TARGET_VERSION_FIELD = "target_version";
    public static final String TARGET_BACKEND_FIELD = "target_backend";
    public static final String FLAGS_FIELD = "flags";

    private static record CallTraceEntry(String name, Source source) {}

    @FunctionalInterface
    public static interface BuiltInProcedure {
        List<Value> call(List<Value> args, Source src) throws ErrorException;
    }

    private final MetaScope scope;
    private Config config;
    private final List<MetaEffect> effects;
    private final List<CallTraceEntry> callTrace;
    private int frame;
    private List<Value> varargs;
    private Optional<List<Value>> returnedValues;
    private boolean broken;

    public Interpreter(Config config) {
        this.scope = new MetaScope();
        this.config = config;
        this.effects = new ArrayList<>();
        this.callTrace = new LinkedList<>();
        this.frame = MetaScope.ROOT;
        this.varargs = List.of();
        this.returnedValues = Optional.empty();
        this.broken = false;
        this.scope.define(MetaScope.ROOT, CONFIG_GLOBAL, Value.CONFIG);
        this.addBuiltIns();
    }

    private void addBuiltIn(String name, BuiltInProcedure procedure) {
        this.scope.define(
            MetaScope.ROOT, name, new Value.BuiltIn(name, procedure)
        );
    }

    private static Value arg(List<Value> args, int index) {
        return index < args.size()? args.get(index) : Value.NIL;
    }

    private String expectString(
        List<Value> args, int index, String function, Source source
    ) throws ErrorException {
        Value value = Interpreter.arg(args, index);
        if(value instanceof Value.Str
            || value instanceof Value.Int
            || value instanceof Value.Float) {
            return value.asString();
        }
        throw this.error(
            "bad argument #" + (index + 1) + " to '" + function
                + "' (string expected, got " + value.typeName() + ")",
            source
        );
    }

    private Value.Table expectTable(
        List<Value> args, int index, String function, Source source
    ) throws ErrorException {
        Value value = Interpreter.arg(args, index);
        if(value instanceof Value.Table) {
            return value.getValue();
        }
        throw this.error(
            "bad argument #" + (index + 1) + " to '" + function
                + "' (table expected, got " + value.typeName() + ")",
            source
        );
    }

    private void addBuiltIns() {
        this.addBuiltIn("emit", (args, src) -> {
            this.effects.add(new MetaEffect.Emit(
                this.expectString(args, 0, "emit", src),
                AstNode.InsertionPoint.STATEMENT, src
            ));
            return List.of();
        });
        this.addBuiltIn("emit_decl", (args, src) -> {
            this.effects.add(new MetaEffect.Emit(
                this.expectString(args, 0, "emit_decl", src),
                AstNode.InsertionPoint.DECLARATION, src
            ));
            return List.of();
        });
        this.addBuiltIn("require_module", (args, src) -> {
            this.effects.add(new MetaEffect.RequireDependency(
                new AstNode.Dependency(
                    AstNode.Dependency.Kind.MODULE,
                    this.expectString(args, 0, "require_module", src)
                ),
                src
            ));
            return List.of();
        });
        this.addBuiltIn("require_library", (args, src) -> {
            this.effects.add(new MetaEffect.RequireDependency(
                new AstNode.Dependency(
                    AstNode.Dependency.Kind.LIBRARY,
                    this.expectString(args, 0, "require_library", src)
                ),
                src
            ));
            return List.of();
        });
        this.addBuiltIn("print", (args, src) -> {
            LOGGER.info(
                args.stream()
                    .map(Value::asString)
                    .collect(Collectors.joining("\t"))
            );
            return List.of();
        });
        this.addBuiltIn("tostring", (args, src) -> List.of(
            new Value.Str(Interpreter.arg(args, 0).asString())
        ));
        this.addBuiltIn("tonumber", (args, src) -> {
            Value value = Interpreter.arg(args, 0);
            if(value instanceof Value.Int || value instanceof Value.Float) {
                return List.of(value);
            }
            if(!(value instanceof Value.Str)) {
                return List.of(Value.NIL);
            }
            try {
                return List.of(Interpreter.numberValue(
                    Literals.parseNumber(value.<Value.Str>getValue().value)
                ));
            } catch(IllegalArgumentException e) {
                LOGGER.debug("'tonumber' could not parse: {}", e.getMessage());
                return List.of(Value.NIL);
            }
        });
        this.addBuiltIn("type", (args, src) -> List.of(
            new Value.Str(Interpreter.arg(args, 0).typeName())
        ));
        this.addBuiltIn("error", (args, src) -> {
            throw this.error(Interpreter.arg(args, 0).asString(), src);
        });
        this.addBuiltIn("assert", (args, src) -> {
            if(Interpreter.arg(args, 0).isTruthy()) {
                return args;
            }
            throw this.error(
                args.size() > 1
                    ? args.get(1).asString()
                    : "assertion failed!",
                src
            );
        });
        BuiltInProcedure next = (args, src) -> {
            Value.Table table = this.expectTable(args, 0, "next", src);
            Value key = Interpreter.arg(args, 1);
            Iterator<Map.Entry<Value, Value>> entries = table.value
                .entrySet().iterator();
            if(!(key instanceof Value.Nil)) {
                while(entries.hasNext()) {
                    if(entries.next().getKey().equals(key)) { break; }
                }
            }
            if(!entries.hasNext()) {
                return List.of(Value.NIL);
            }
            Map.Entry<Value, Value> entry = entries.next();
            return List.of(entry.getKey(), entry.getValue());
        };
        this.addBuiltIn("next", next);
        this.addBuiltIn("pairs", (args, src) -> List.of(
            new Value.BuiltIn("next", next),
            this.expectTable(args, 0, "pairs", src),
            Value.NIL
        ));
        BuiltInProcedure inext = (args, src) -> {
            Value.Table table = this.expectTable(args, 0, "ipairs", src);
            long index = this.toInteger(Interpreter.arg(args, 1), src) + 1;
            Value value = table.get(new Value.Int(index));
            if(value instanceof Value.Nil) {
                return List.of(Value.NIL);
            }
            return List.of(new Value.Int(index), value);
        };
        this.addBuiltIn("ipairs", (args, src) -> List.of(
            new Value.BuiltIn("ipairs_next", inext),
            this.expectTable(args, 0, "ipairs", src),
            new Value.Int(0)
        ));
        this.addBuiltIn("select", (args, src) -> {
            Value selector = Interpreter.arg(args, 0);
            int count = args.size() - 1;
            if(selector instanceof Value.Str
                && selector.<Value.Str>getValue().value.equals("#")) {
                return List.of(new Value.Int(count));
            }
            if(!(selector instanceof Value.Int)) {
                throw this.error(
                    "bad argument #1 to 'select' (number expected, got "
                        + selector.typeName() + ")",
                    src
                );
            }
            long index = selector.<Value.Int>getValue().value;
            if(index < 0) {
                index = count + index + 1;
            }
            if(index < 1) {
                throw this.error(
                    "bad argument #1 to 'select' (index out of range)", src
                );
            }
            if(index > count) {
                return List.of();
            }
            return args.subList((int) index, args.size());
        });
        this.addBuiltIn("os_time", (args, src) -> List.of(
            new Value.Int(System.currentTimeMillis() / 1000)
        ));
        this.addBuiltIn("getenv", (args, src) -> {
            String value = System.getenv(
                this.expectString(args, 0, "getenv", src)
            );
            return List.of(value == null? Value.NIL : new Value.Str(value));
        });
    }

    public Config config() {
        return this.config;
    }

    /**
     * Returns the effects requested since the last call and forgets them.
     */
    public List<MetaEffect> takeEffects() {
        List<MetaEffect> taken = new ArrayList<>(this.effects);
        this.effects.clear();
        return taken;
    }

    int frameCount() {
        return this.scope.size();
    }

    /**
     * Runs a directive body in its own frame below the globals.
     */
    public void executeBlock(List<AstNode> body) throws ErrorException {
        int previousFrame = this.frame;
        this.frame = this.scope.push(MetaScope.ROOT);
        this.evaluateBlock(body);
        this.scope.release(this.frame);
        this.frame = previousFrame;
        this.returnedValues = Optional.empty();
        this.broken = false;
    }

    private void enterCall(String name, Source source) throws ErrorException {
        this.callTrace.add(new CallTraceEntry(name, source));
        if(this.callTrace.size() > MAX_CALL_DEPTH) {
            throw this.error(
                "maximum compile-time call depth of " + MAX_CALL_DEPTH
                    + " exceeded",
                source
            );
        }
    }

    private void exitCall() {
        this.callTrace.remove(this.callTrace.size() - 1);
    }

    private ErrorException error(String reason, Source source) {
        List<CallTraceEntry> trace = new ArrayList<>(this.callTrace);
        return new ErrorException(new Error(
            Error.Kind.META_EXECUTION,
            reason,
            colored -> {
                if(trace.isEmpty()) { return ""; }
                String errorNoteColor = colored
                    ? Color.from(Color.GRAY) : "";
                String errorFunctionColor = colored
                    ? Color.from(Color.GREEN, Color.BOLD) : "";
                String errorFileNameColor = colored
                    ? Color.from(Color.WHITE) : "";
                StringBuilder out = new StringBuilder();
                out.append(errorNoteColor);
                out.append("Compile-time call trace (latest call first):\n");
                for(int callI = trace.size() - 1; callI >= 0; callI -= 1) {
                    CallTraceEntry entry = trace.get(callI);
                    out.append(errorNoteColor);
                    out.append(" ");
                    out.append(callI);
                    out.append(" ");
                    out.append(errorFunctionColor);
                    out.append(entry.name());
                    out.append(errorNoteColor);
                    out.append(" at ");
                    out.append(errorFileNameColor);
                    out.append(entry.source());
                    out.append("\n");
                }
                return out.toString();
            },
            Error.Marking.error(source, "the compile-time code failed here")
        ));
    }

    static Value numberValue(AstNode.NumberLiteral literal) {
        BigDecimal exact = Literals.exactValue(literal);
        if(!literal.hasFloatForm() && Literals.fitsNativeInteger(
            exact, TargetVersion.LUA_54
        )) {
            return new Value.Int(exact.longValueExact());
        }
        return new Value.Float(exact.doubleValue());
    }

    // statements

    private void evaluateBlock(List<AstNode> body) throws ErrorException {
        for(AstNode node: body) {
            if(this.returnedValues.isPresent() || this.broken) { return; }
            this.evaluateStatement(node);
        }
    }

    private void evaluateScopedBlock(
        List<AstNode> body
    ) throws ErrorException {
        int previousFrame = this.frame;
        this.frame = this.scope.push(previousFrame);
        this.evaluateBlock(body);
        this.scope.release(this.frame);
        this.frame = previousFrame;
    }

    /**
     * Runs a loop body and reports whether the loop should go on.
     */
    private boolean evaluateLoopBody(
        List<AstNode> body, int bodyFrame
    ) throws ErrorException {
        int previousFrame = this.frame;
        this.frame = bodyFrame;
        this.evaluateBlock(body);
        this.frame = previousFrame;
        if(this.broken) {
            this.broken = false;
            return false;
        }
        return this.returnedValues.isEmpty();
    }

    private void evaluateStatement(AstNode node) throws ErrorException {
        switch(node.type) {
            case CALL:
            case METHOD_CALL: {
                this.evaluateMulti(node);
            } break;
            case DO: {
                AstNode.Block data = node.getValue();
                this.evaluateScopedBlock(data.body());
            } break;
            case IF: {
                AstNode.If data = node.getValue();
                for(
                    int branchI = 0;
                    branchI < data.conditions().size();
                    branchI += 1
                ) {
                    Value condition = this.evaluate(
                        data.conditions().get(branchI)
                    );
                    if(!condition.isTruthy()) { continue; }
                    this.evaluateScopedBlock(data.bodies().get(branchI));
                    return;
                }
                if(data.elseBody().isPresent()) {
                    this.evaluateScopedBlock(data.elseBody().get());
                }
            } break;
            case SWITCH: {
                AstNode.Switch data = node.getValue();
                Value value = this.evaluate(data.value());
                for(
                    int branchI = 0;
                    branchI < data.caseValues().size();
                    branchI += 1
                ) {
                    Value branchValue = this.evaluate(
                        data.caseValues().get(branchI)
                    );
                    if(!branchValue.equals(value)) { continue; }
                    this.evaluateScopedBlock(data.caseBodies().get(branchI));
                    return;
                }
                if(data.elseBody().isPresent()) {
                    this.evaluateScopedBlock(data.elseBody().get());
                }
            } break;
            case WHILE: {
                AstNode.Loop data = node.getValue();
                while(this.evaluate(data.condition()).isTruthy()) {
                    int bodyFrame = this.scope.push(this.frame);
                    boolean goOn = this.evaluateLoopBody(
                        data.body(), bodyFrame
                    );
                    this.scope.release(bodyFrame);
                    if(!goOn) { break; }
                }
            } break;
            case REPEAT: {
                AstNode.Loop data = node.getValue();
                while(true) {
                    int bodyFrame = this.scope.push(this.frame);
                    if(!this.evaluateLoopBody(data.body(), bodyFrame)) {
                        this.scope.release(bodyFrame);
                        break;
                    }
                    // the condition sees the locals of the body
                    int previousFrame = this.frame;
                    this.frame = bodyFrame;
                    boolean done = this.evaluate(data.condition())
                        .isTruthy();
                    this.frame = previousFrame;
                    this.scope.release(bodyFrame);
                    if(done) { break; }
                }
            } break;
            case NUMERIC_FOR: {
                this.evaluateNumericFor(node);
            } break;
            case GENERIC_FOR: {
                this.evaluateGenericFor(node);
            } break;
            case ASSIGNMENT: {
                AstNode.Assignment data = node.getValue();
                List<Value> values = this.evaluateList(data.values());
                for(
                    int targetI = 0;
                    targetI < data.targets().size();
                    targetI += 1
                ) {
                    this.evaluateAssignment(
                        data.targets().get(targetI),
                        Interpreter.arg(values, targetI)
                    );
                }
            } break;
            case DECLARATION: {
                AstNode.Declaration data = node.getValue();
                List<Value> values = this.evaluateList(data.values());
                for(
                    int varI = 0;
                    varI < data.variables().size();
                    varI += 1
                ) {
                    this.scope.define(
                        this.frame,
                        data.variables().get(varI).name(),
                        Interpreter.arg(values, varI)
                    );
                }
            } break;
            case FUNCTION_DEFINITION: {
                this.evaluateFunctionDefinition(node);
            } break;
            case RETURN: {
                AstNode.Return data = node.getValue();
                this.returnedValues = Optional.of(
                    this.evaluateList(data.values())
                );
            } break;
            case BREAK: {
                this.broken = true;
            } break;
            default: {
                throw this.error(
                    "'" + node.type.name().toLowerCase()
                        + "' can not be used in compile-time code",
                    node.source
                );
            }
        }
    }

    private void evaluateNumericFor(AstNode node) throws ErrorException {
        AstNode.NumericFor data = node.getValue();
        Value start = this.evaluate(data.start());
        Value limit = this.evaluate(data.limit());
        Value step = data.step().isPresent()
            ? this.evaluate(data.step().get())
            : new Value.Int(1);
        for(Value bound: List.of(start, limit, step)) {
            if(!Interpreter.isNumber(bound)) {
                throw this.error(
                    "'for' bounds must be numbers, got a "
                        + bound.typeName(),
                    node.source
                );
            }
        }
        String name = data.variable().name();
        if(start instanceof Value.Int && limit instanceof Value.Int
            && step instanceof Value.Int) {
            long i = start.<Value.Int>getValue().value;
            long l = limit.<Value.Int>getValue().value;
            long s = step.<Value.Int>getValue().value;
            if(s == 0) {
                throw this.error("'for' step is zero", node.source);
            }
            while(s > 0? i <= l : i >= l) {
                int bodyFrame = this.scope.push(this.frame);
                this.scope.define(bodyFrame, name, new Value.Int(i));
                boolean goOn = this.evaluateLoopBody(data.body(), bodyFrame);
                this.scope.release(bodyFrame);
                if(!goOn) { break; }
                i += s;
            }
            return;
        }
        double i = Interpreter.toDouble(start);
        double l = Interpreter.toDouble(limit);
        double s = Interpreter.toDouble(step);
        if(s == 0) {
            throw this.error("'for' step is zero", node.source);
        }
        while(s > 0? i <= l : i >= l) {
            int bodyFrame = this.scope.push(this.frame);
            this.scope.define(bodyFrame, name, new Value.Float(i));
            boolean goOn = this.evaluateLoopBody(data.body(), bodyFrame);
            this.scope.release(bodyFrame);
            if(!goOn) { break; }
            i += s;
        }
    }

    private void evaluateGenericFor(AstNode node) throws ErrorException {
        AstNode.GenericFor data = node.getValue();
        List<Value> initial = this.evaluateList(data.iterators());
        Value function = Interpreter.arg(initial, 0);
        Value state = Interpreter.arg(initial, 1);
        Value control = Interpreter.arg(initial, 2);
        while(true) {
            List<Value> values = this.callValue(
                function, List.of(state, control), "for iterator",
                node.source
            );
            control = Interpreter.arg(values, 0);
            if(control instanceof Value.Nil) { break; }
            int bodyFrame = this.scope.push(this.frame);
            for(int varI = 0; varI < data.variables().size(); varI += 1) {
                this.scope.define(
                    bodyFrame,
                    data.variables().get(varI).name(),
                    Interpreter.arg(values, varI)
                );
            }
            boolean goOn = this.evaluateLoopBody(data.body(), bodyFrame);
            this.scope.release(bodyFrame);
            if(!goOn) { break; }
        }
    }

    private void evaluateFunctionDefinition(
        AstNode node
    ) throws ErrorException {
        AstNode.FunctionDefinition data = node.getValue();
        AstNode.Function function = data.function().getValue();
        List<AstNode.Variable> parameters = function.parameters();
        if(data.methodName().isPresent()) {
            parameters = new ArrayList<>();
            parameters.add(new AstNode.Variable("self", Optional.empty()));
            parameters.addAll(function.parameters());
        }
        Value.Closure closure = new Value.Closure(
            parameters, function.isVariadic(), function.body(), this.frame
        );
        this.scope.capture(this.frame);
        List<String> path = data.path();
        if(data.isLocal()) {
            this.scope.define(this.frame, path.get(0), closure);
            return;
        }
        String key = data.methodName().orElse(path.get(path.size() - 1));
        List<String> containerPath = data.methodName().isPresent()
            ? path
            : path.subList(0, path.size() - 1);
        if(containerPath.isEmpty()) {
            this.scope.assign(this.frame, key, closure);
            return;
        }
        Value container = this.lookup(containerPath.get(0), node.source);
        for(String element: containerPath.subList(1, containerPath.size())) {
            container = this.index(
                container, new Value.Str(element), node.source
            );
        }
        this.setIndex(container, new Value.Str(key), closure, node.source);
    }

    private void evaluateAssignment(
        AstNode target, Value value
    ) throws ErrorException {
        switch(target.type) {
            case IDENTIFIER: {
                this.scope.assign(
                    this.frame, target.<AstNode.Name>getValue().name(), value
                );
            } break;
            case INDEX: {
                AstNode.Index data = target.getValue();
                this.setIndex(
                    this.evaluate(data.indexed()), this.evaluate(data.key()),
                    value, target.source
                );
            } break;
            case FIELD: {
                AstNode.Field data = target.getValue();
                this.setIndex(
                    this.evaluate(data.indexed()), new Value.Str(data.name()),
                    value, target.source
                );
            } break;
            default: {
                throw this.error(
                    "cannot assign to '" + target.type.name().toLowerCase()
                        + "'",
                    target.source
                );
            }
        }
    }

    // configuration

    private Value configField(String name) {
        switch(name) {
            case TARGET_VERSION_FIELD:
                return new Value.Str(this.config.targetVersion().versionName);
            case TARGET_BACKEND_FIELD:
                return new Value.Str(this.config.backend().backendName);
            case FLAGS_FIELD:
                return Value.FLAGS;
            default:
                return Value.NIL;
        }
    }

    private void updateConfig(Config updated, Source source) {
        LOGGER.debug("Configuration changed at {} to {}", source, updated);
        this.config = updated;
        this.effects.add(new MetaEffect.ConfigUpdate(updated, source));
    }

    private ErrorException invalidConfig(
        ErrorException cause, Source source
    ) {
        return new ErrorException(new Error(
            Error.Kind.INVALID_CONFIG_VALUE,
            cause.error.message(),
            Error.Marking.error(source, "the invalid value is set here")
        ));
    }

    private void setConfigField(
        String name, Value value, Source source
    ) throws ErrorException {
        switch(name) {
            case TARGET_VERSION_FIELD: {
                if(!(value instanceof Value.Str)) { break; }
                try {
                    this.updateConfig(
                        this.config.withTargetVersion(TargetVersion.fromName(
                            value.<Value.Str>getValue().value
                        )),
                        source
                    );
                } catch(ErrorException e) {
                    throw this.invalidConfig(e, source);
                }
                return;
            }
            case TARGET_BACKEND_FIELD: {
                if(!(value instanceof Value.Str)) { break; }
                try {
                    this.updateConfig(
                        this.config.withBackend(Backend.fromName(
                            value.<Value.Str>getValue().value
                        )),
                        source
                    );
                } catch(ErrorException e) {
                    throw this.invalidConfig(e, source);
                }
                return;
            }
            default: {
                throw this.error(
                    "the configuration has no writable field '" + name + "'",
                    source
                );
            }
        }
        throw new ErrorException(new Error(
            Error.Kind.INVALID_CONFIG_VALUE,
            "the configuration field '" + name + "' must be a string, got a "
                + value.typeName(),
            Error.Marking.error(source, "the invalid value is set here")
        ));
    }

    private void setFlag(
        String name, Value value, Source source
    ) throws ErrorException {
        if(!(value instanceof Value.Bool)) {
            throw new ErrorException(new Error(
                Error.Kind.INVALID_CONFIG_VALUE,
                "the configuration flag '" + name + "' must be a boolean,"
                    + " got a " + value.typeName(),
                Error.Marking.error(source, "the invalid value is set here")
            ));
        }
        this.updateConfig(
            this.config.withFlag(name, value.<Value.Bool>getValue().value),
            source
        );
    }

    // expressions

    private Value lookup(String name, Source source) throws ErrorException {
        Optional<Value> value = this.scope.lookup(this.frame, name);
        if(value.isEmpty()) {
            throw this.error(
                "'" + name + "' is not defined at compile time", source
            );
        }
        return value.get();
    }

    private Value index(
        Value indexed, Value key, Source source
    ) throws ErrorException {
        if(indexed instanceof Value.Table) {
            return indexed.<Value.Table>getValue().get(key);
        }
        if(indexed instanceof Value.ConfigView && key instanceof Value.Str) {
            return this.configField(key.<Value.Str>getValue().value);
        }
        if(indexed instanceof Value.FlagsView && key instanceof Value.Str) {
            Optional<Boolean> flag = this.config.flag(
                key.<Value.Str>getValue().value
            );
            return flag.isPresent()? Value.of(flag.get()) : Value.NIL;
        }
        throw this.error(
            "attempt to index a " + indexed.typeName() + " value", source
        );
    }

    private void setIndex(
        Value indexed, Value key, Value value, Source source
    ) throws ErrorException {
        if(indexed instanceof Value.Table) {
            if(key instanceof Value.Nil) {
                throw this.error("table index is nil", source);
            }
            indexed.<Value.Table>getValue().set(key, value);
            return;
        }
        if(indexed instanceof Value.ConfigView && key instanceof Value.Str) {
            this.setConfigField(key.<Value.Str>getValue().value, value, source);
            return;
        }
        if(indexed instanceof Value.FlagsView && key instanceof Value.Str) {
            this.setFlag(key.<Value.Str>getValue().value, value, source);
            return;
        }
        throw this.error(
            "attempt to index a " + indexed.typeName() + " value", source
        );
    }

    private static String describeCallee(AstNode called) {
        switch(called.type) {
            case IDENTIFIER:
                return called.<AstNode.Name>getValue().name();
            case FIELD: {
                AstNode.Field data = called.getValue();
                return Interpreter.describeCallee(data.indexed())
                    + "." + data.name();
            }
            default:
                return "<function>";
        }
    }

    private List<Value> callValue(
        Value called, List<Value> arguments, String name, Source source
    ) throws ErrorException {
        if(called instanceof Value.BuiltIn) {
            Value.BuiltIn builtIn = called.getValue();
            this.enterCall(builtIn.name, source);
            List<Value> returned = builtIn.procedure.call(arguments, source);
            this.exitCall();
            return returned;
        }
        if(!(called instanceof Value.Closure)) {
            throw this.error(
                "attempt to call a " + called.typeName() + " value ('"
                    + name + "')",
                source
            );
        }
        Value.Closure closure = called.getValue();
        this.enterCall(name, source);
        int previousFrame = this.frame;
        List<Value> previousVarargs = this.varargs;
        this.frame = this.scope.push(closure.frame);
        for(
            int paramI = 0;
            paramI < closure.parameters.size();
            paramI += 1
        ) {
            this.scope.define(
                this.frame,
                closure.parameters.get(paramI).name(),
                Interpreter.arg(arguments, paramI)
            );
        }
        this.varargs = closure.isVariadic
            && arguments.size() > closure.parameters.size()
            ? List.copyOf(arguments.subList(
                closure.parameters.size(), arguments.size()
            ))
            : List.of();
        this.evaluateBlock(closure.body);
        this.scope.release(this.frame);
        this.frame = previousFrame;
        this.varargs = previousVarargs;
        List<Value> returned = this.returnedValues.orElse(List.of());
        this.returnedValues = Optional.empty();
        this.broken = false;
        this.exitCall();
        return returned;
    }

    /**
     * Evaluates an expression list, expanding all values of its last
     * expression.
     */
    private List<Value> evaluateList(
        List<AstNode> nodes
    ) throws ErrorException {
        List<Value> values = new ArrayList<>();
        for(int nodeI = 0; nodeI < nodes.size(); nodeI += 1) {
            AstNode node = nodes.get(nodeI);
            if(nodeI == nodes.size() - 1) {
                values.addAll(this.evaluateMulti(node));
            } else {
                values.add(this.evaluate(node));
            }
        }
        return values;
    }

    private List<Value> evaluateMulti(AstNode node) throws ErrorException {
        switch(node.type) {
            case CALL: {
                AstNode.Call data = node.getValue();
                Value called = this.evaluate(data.called());
                List<Value> arguments = this.evaluateList(data.arguments());
                return this.callValue(
                    called, arguments,
                    Interpreter.describeCallee(data.called()), node.source
                );
            }
            case METHOD_CALL: {
                AstNode.MethodCall data = node.getValue();
                Value receiver = this.evaluate(data.receiver());
                Value called = this.index(
                    receiver, new Value.Str(data.methodName()), node.source
                );
                List<Value> arguments = new ArrayList<>();
                arguments.add(receiver);
                arguments.addAll(this.evaluateList(data.arguments()));
                return this.callValue(
                    called, arguments,
                    Interpreter.describeCallee(data.receiver()) + ":"
                        + data.methodName(),
                    node.source
                );
            }
            case VARARGS: {
                return this.varargs;
            }
            default: {
                return List.of(this.evaluate(node));
            }
        }
    }

    /**
     * Evaluates an expression in the current frame, keeping only its first
     * value.
     */
    public Value evaluate(AstNode node) throws ErrorException {
        switch(node.type) {
            case NUMBER_LITERAL: {
                return Interpreter.numberValue(node.getValue());
            }
            case STRING_LITERAL: {
                return new Value.Str(new String(
                    node.<AstNode.StringLiteral>getValue().bytes(),
                    StandardCharsets.UTF_8
                ));
            }
            case BOOLEAN_LITERAL: {
                return Value.of(
                    node.<AstNode.BooleanLiteral>getValue().value()
                );
            }
            case NIL_LITERAL: {
                return Value.NIL;
            }
            case IDENTIFIER: {
                return this.lookup(
                    node.<AstNode.Name>getValue().name(), node.source
                );
            }
            case INDEX: {
                AstNode.Index data = node.getValue();
                Value indexed = this.evaluate(data.indexed());
                return this.index(
                    indexed, this.evaluate(data.key()), node.source
                );
            }
            case FIELD: {
                AstNode.Field data = node.getValue();
                return this.index(
                    this.evaluate(data.indexed()), new Value.Str(data.name()),
                    node.source
                );
            }
            case CALL:
            case METHOD_CALL:
            case VARARGS: {
                return Interpreter.arg(this.evaluateMulti(node), 0);
            }
            case TABLE: {
                AstNode.Table data = node.getValue();
                Value.Table table = new Value.Table();
                long nextIndex = 1;
                for(
                    int fieldI = 0;
                    fieldI < data.fields().size();
                    fieldI += 1
                ) {
                    AstNode.TableField field = data.fields().get(fieldI);
                    if(field.name().isPresent()) {
                        table.set(
                            new Value.Str(field.name().get()),
                            this.evaluate(field.value())
                        );
                    } else if(field.key().isPresent()) {
                        Value key = this.evaluate(field.key().get());
                        if(key instanceof Value.Nil) {
                            throw this.error("table index is nil", node.source);
                        }
                        table.set(key, this.evaluate(field.value()));
                    } else if(fieldI == data.fields().size() - 1) {
                        for(Value value: this.evaluateMulti(field.value())) {
                            table.set(new Value.Int(nextIndex), value);
                            nextIndex += 1;
                        }
                    } else {
                        table.set(
                            new Value.Int(nextIndex),
                            this.evaluate(field.value())
                        );
                        nextIndex += 1;
                    }
                }
                return table;
            }
            case FUNCTION: {
                AstNode.Function data = node.getValue();
                this.scope.capture(this.frame);
                return new Value.Closure(
                    data.parameters(), data.isVariadic(), data.body(),
                    this.frame
                );
            }
            case UNARY_OP: {
                AstNode.UnaryOp data = node.getValue();
                return this.evaluateUnary(
                    data.operator(), this.evaluate(data.operand()),
                    node.source
                );
            }
            case BINARY_OP: {
                AstNode.BinaryOp data = node.getValue();
                Value left = this.evaluate(data.left());
                switch(data.operator()) {
                    case AND: {
                        return left.isTruthy()
                            ? this.evaluate(data.right()) : left;
                    }
                    case OR: {
                        return left.isTruthy()
                            ? left : this.evaluate(data.right());
                    }
                    default: {
                        return this.evaluateBinary(
                            data.operator(), left,
                            this.evaluate(data.right()), node.source
                        );
                    }
                }
            }
            case PAREN: {
                return this.evaluate(node.<AstNode.MonoOp>getValue().value());
            }
            default: {
                throw this.error(
                    "'" + node.type.name().toLowerCase()
                        + "' can not be used in compile-time code",
                    node.source
                );
            }
        }
    }

    private static boolean isNumber(Value value) {
        return value instanceof Value.Int || value instanceof Value.Float;
    }

    private static double toDouble(Value value) {
        if(value instanceof Value.Int) {
            return value.<Value.Int>getValue().value;
        }
        return value.<Value.Float>getValue().value;
    }

    private long toInteger(Value value, Source source) throws ErrorException {
        if(value instanceof Value.Int) {
            return value.<Value.Int>getValue().value;
        }
        if(value instanceof Value.Float) {
            double number = value.<Value.Float>getValue().value;
            if(number == Math.rint(number) && !Double.isInfinite(number)) {
                return (long) number;
            }
            throw this.error(
                "number has no integer representation", source
            );
        }
        throw this.error(
            "attempt to perform bitwise operation on a " + value.typeName()
                + " value",
            source
        );
    }

    private Value evaluateUnary(
        AstNode.UnaryOperator operator, Value operand, Source source
    ) throws ErrorException {
        switch(operator) {
            case NOT: {
                return Value.of(!operand.isTruthy());
            }
            case NEGATE: {
                if(operand instanceof Value.Int) {
                    return new Value.Int(-operand.<Value.Int>getValue().value);
                }
                if(operand instanceof Value.Float) {
                    return new Value.Float(
                        -operand.<Value.Float>getValue().value
                    );
                }
                throw this.error(
                    "attempt to perform arithmetic on a "
                        + operand.typeName() + " value",
                    source
                );
            }
            case LENGTH: {
                if(operand instanceof Value.Str) {
                    return new Value.Int(
                        operand.<Value.Str>getValue().value
                            .getBytes(StandardCharsets.UTF_8).length
                    );
                }
                if(operand instanceof Value.Table) {
                    return new Value.Int(
                        operand.<Value.Table>getValue().length()
                    );
                }
                throw this.error(
                    "attempt to get length of a " + operand.typeName()
                        + " value",
                    source
                );
            }
            case BITWISE_NOT: {
                return new Value.Int(~this.toInteger(operand, source));
            }
            default: {
                throw new IllegalStateException("unhandled operator!");
            }
        }
    }

    private Value evaluateBinary(
        AstNode.BinaryOperator operator, Value left, Value right,
        Source source
    ) throws ErrorException {
        switch(operator) {
            case EQUALS: {
                return Value.of(left.equals(right));
            }
            case NOT_EQUALS: {
                return Value.of(!left.equals(right));
            }
            case LESS_THAN:
            case GREATER_THAN:
            case LESS_THAN_EQUAL:
            case GREATER_THAN_EQUAL: {
                int comparison;
                if(Interpreter.isNumber(left) && Interpreter.isNumber(right)) {
                    comparison = left instanceof Value.Int
                        && right instanceof Value.Int
                        ? Long.compare(
                            left.<Value.Int>getValue().value,
                            right.<Value.Int>getValue().value
                        )
                        : Double.compare(
                            Interpreter.toDouble(left),
                            Interpreter.toDouble(right)
                        );
                } else if(left instanceof Value.Str
                    && right instanceof Value.Str) {
                    comparison = left.<Value.Str>getValue().value.compareTo(
                        right.<Value.Str>getValue().value
                    );
                } else {
                    throw this.error(
                        "attempt to compare " + left.typeName() + " with "
                            + right.typeName(),
                        source
                    );
                }
                switch(operator) {
                    case LESS_THAN: return Value.of(comparison < 0);
                    case GREATER_THAN: return Value.of(comparison > 0);
                    case LESS_THAN_EQUAL: return Value.of(comparison <= 0);
                    default: return Value.of(comparison >= 0);
                }
            }
            case CONCAT: {
                for(Value operand: List.of(left, right)) {
                    if(!Interpreter.isNumber(operand)
                        && !(operand instanceof Value.Str)) {
                        throw this.error(
                            "attempt to concatenate a " + operand.typeName()
                                + " value",
                            source
                        );
                    }
                }
                return new Value.Str(left.asString() + right.asString());
            }
            case BITWISE_OR:
            case BITWISE_XOR:
            case BITWISE_AND:
            case SHIFT_LEFT:
            case SHIFT_RIGHT: {
                long a = this.toInteger(left, source);
                long b = this.toInteger(right, source);
                switch(operator) {
                    case BITWISE_OR: return new Value.Int(a | b);
                    case BITWISE_XOR: return new Value.Int(a ^ b);
                    case BITWISE_AND: return new Value.Int(a & b);
                    case SHIFT_LEFT: return new Value.Int(
                        Interpreter.shiftLeft(a, b)
                    );
                    default: return new Value.Int(
                        Interpreter.shiftLeft(a, -b)
                    );
                }
            }
            default: break;
        }
        for(Value operand: List.of(left, right)) {
            if(!Interpreter.isNumber(operand)) {
                throw this.error(
                    "attempt to perform arithmetic on a "
                        + operand.typeName() + " value",
                    source
                );
            }
        }
        boolean integers = left instanceof Value.Int
            && right instanceof Value.Int;
        if(integers) {
            long a = left.<Value.Int>getValue().value;
            long b = right.<Value.Int>getValue().value;
            switch(operator) {
                case ADD: return new Value.Int(a + b);
                case SUBTRACT: return new Value.Int(a - b);
                case MULTIPLY: return new Value.Int(a * b);
                case FLOOR_DIVIDE: {
                    if(b == 0) {
                        throw this.error("attempt to perform 'n//0'", source);
                    }
                    return new Value.Int(Math.floorDiv(a, b));
                }
                case MODULO: {
                    if(b == 0) {
                        throw this.error("attempt to perform 'n%0'", source);
                    }
                    return new Value.Int(Math.floorMod(a, b));
                }
                default: break;
            }
        }
        double a = Interpreter.toDouble(left);
        double b = Interpreter.toDouble(right);
        switch(operator) {
            case ADD: return new Value.Float(a + b);
            case SUBTRACT: return new Value.Float(a - b);
            case MULTIPLY: return new Value.Float(a * b);
            case DIVIDE: return new Value.Float(a / b);
            case POWER: return new Value.Float(Math.pow(a, b));
            case FLOOR_DIVIDE: return new Value.Float(Math.floor(a / b));
            case MODULO: {
                double remainder = a % b;
                if(remainder != 0 && (remainder < 0) != (b < 0)) {
                    remainder += b;
                }
                return new Value.Float(remainder);
            }
            default: {
                throw new IllegalStateException("unhandled operator!");
            }
        }
    }

    private static long shiftLeft(long value, long shift) {
        if(shift <= -64 || shift >= 64) { return 0; }
        if(shift >= 0) { return value << shift; }
        return value >>> -shift;
    }

}
