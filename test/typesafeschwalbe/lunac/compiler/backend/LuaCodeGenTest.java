package typesafeschwalbe.lunac.compiler.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static typesafeschwalbe.lunac.compiler.frontend.AstNode.BinaryOperator.*;
import static typesafeschwalbe.lunac.compiler.frontend.AstNode.UnaryOperator.*;
import static typesafeschwalbe.lunac.compiler.frontend.Nodes.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.lunac.compiler.Backend;
import typesafeschwalbe.lunac.compiler.Compiler;
import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.Error;
import typesafeschwalbe.lunac.compiler.Result;
import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.StaticType;

class LuaCodeGenTest {

    static final Config LUA_54 = new Config(
        TargetVersion.LUA_54, Backend.LUA, Map.of()
    );
    static final Config LUA_51 = LUA_54.withTargetVersion(
        TargetVersion.LUA_51
    );

    static String generate(Config config, AstNode... body) {
        Result<String> result = Compiler.generate(chunk(body), config);
        assertThat(result.isValue())
            .as(() -> result.getDiagnostic().toString())
            .isTrue();
        return result.getValue();
    }

    static String generate(AstNode... body) {
        return generate(LUA_54, body);
    }

    static Error fail(Config config, AstNode... body) {
        Result<String> result = Compiler.generate(chunk(body), config);
        assertThat(result.isError()).isTrue();
        return result.getDiagnostic();
    }

    static AstNode localNames(String... names) {
        return local(variables(names));
    }

    @Test
    void emptyChunk() {
        assertThat(generate()).isEmpty();
    }

    @Test
    void returnStatements() {
        assertThat(generate(returning())).isEqualTo("return");
        assertThat(generate(returning(number("1")))).isEqualTo("return 1");
        assertThat(generate(returning(number("1"), number("2"))))
            .isEqualTo("return 1, 2");
    }

    @Nested
    class LiteralForms {

        @Test
        void decimalAndHexNumbers() {
            assertThat(generate(returning(
                number("1"), number("1.2"), number("1e2"), number("1.2e3"),
                number("0x1f"), number("0b10")
            ))).isEqualTo("return 1, 1.2, 1e2, 1.2e3, 0x1f, 0x2");
        }

        @Test
        void hexFractionsAreEvaluatedExactly() {
            assertThat(generate(returning(
                number("0x3p5"), number("0x3.5"), number("0x3.5p7"),
                number("0xfa.d7p-5"), number("0b11.11p2")
            ))).isEqualTo("return 0x60, 3.3125, 0x1a8, 7.8387451171875, 0xf");
            assertThat(generate(returning(number("0x0"), number("0xffffp4"))))
                .isEqualTo("return 0x0, 0xffff0");
        }

        @Test
        void outOfRangeBecomesFloat() {
            assertThat(generate(returning(number("0xffffffffffffffff.001"))))
                .isEqualTo("return 1.8446744073709552e+19");
        }

        @Test
        void stringsUseDoubleQuotes() {
            assertThat(generate(returning(
                quoted("'a'"), quoted("\"b\""), quoted("[=[c]=]")
            ))).isEqualTo("return \"a\", \"b\", \"c\"");
            assertThat(generate(returning(quoted("\"'\""), quoted("'\"'"))))
                .isEqualTo("return \"'\", \"\\\"\"");
            assertThat(generate(returning(
                quoted("\"'\\001\""), quoted("'\"\\001'")
            ))).isEqualTo("return \"'\\001\", \"\\\"\\001\"");
        }

        @Test
        void booleansNilAndVarargs() {
            assertThat(generate(returning(bool(true), bool(false))))
                .isEqualTo("return true, false");
            assertThat(generate(returning(nil()))).isEqualTo("return nil");
            assertThat(generate(returning(varargs())))
                .isEqualTo("return ...");
        }

    }

    @Test
    void tables() {
        assertThat(generate(returning(table()))).isEqualTo("return {}");
        assertThat(generate(
            localNames("a"),
            returning(table(
                positional(id("a")), positional(string("b")),
                positional(number("1"))
            ))
        )).isEqualTo("local a\nreturn {a, \"b\", 1}");
        assertThat(generate(returning(table(
            named("a", number("1")), keyed(number("1"), number("2"))
        )))).isEqualTo("return {a = 1, [1] = 2}");
    }

    @Test
    void functionExpressions() {
        assertThat(generate(returning(function(List.of()))))
            .isEqualTo("return function() end");
        assertThat(generate(returning(function(List.of(), returning()))))
            .isEqualTo("return function()\n  return\nend");
        assertThat(generate(returning(function(variables("a", "b", "c")))))
            .isEqualTo("return function(a, b, c) end");
        assertThat(generate(returning(function(
            variables("a"), true, List.of(), List.of()
        )))).isEqualTo("return function(a, ...) end");
    }

    @Test
    void indexing() {
        assertThat(generate(localNames("a"), returning(field(id("a"), "b"))))
            .isEqualTo("local a\nreturn a.b");
        assertThat(generate(
            localNames("a", "b"),
            returning(index(id("a"), id("b")), index(id("a"), number("1")))
        )).isEqualTo("local a, b\nreturn a[b], a[1]");
        assertThat(generate(returning(index(paren(table()), number("1")))))
            .isEqualTo("return ({})[1]");
        assertThat(generate(returning(field(paren(table()), "a"))))
            .isEqualTo("return ({}).a");
    }

    @Test
    void synthesizedReceiversAreParenthesized() {
        assertThat(generate(returning(index(table(), number("1")))))
            .isEqualTo("return ({})[1]");
        assertThat(generate(methodCall(string("a"), "len")))
            .isEqualTo("(\"a\"):len()");
    }

    @Nested
    class Calls {

        @Test
        void plainCalls() {
            assertThat(generate(localNames("f"), call(id("f"))))
                .isEqualTo("local f\nf()");
            assertThat(generate(localNames("f"), returning(call(id("f")))))
                .isEqualTo("local f\nreturn f()");
            assertThat(generate(
                localNames("f", "g"), call(id("f"), call(id("g")))
            )).isEqualTo("local f, g\nf(g())");
            assertThat(generate(
                localNames("f", "a"), call(id("f"), id("a"), number("1"))
            )).isEqualTo("local f, a\nf(a, 1)");
        }

        @Test
        void juxtaposedCallsGetParentheses() {
            assertThat(generate(
                localNames("f"), juxtaposedCall(id("f"), quoted("'a'"))
            )).isEqualTo("local f\nf(\"a\")");
            assertThat(generate(
                localNames("f"), juxtaposedCall(id("f"), table())
            )).isEqualTo("local f\nf({})");
            assertThat(generate(
                localNames("a"),
                juxtaposedCall(field(id("a"), "f"), string("s"))
            )).isEqualTo("local a\na.f(\"s\")");
            assertThat(generate(
                localNames("a"),
                juxtaposedMethodCall(id("a"), "f", table())
            )).isEqualTo("local a\na:f({})");
        }

        @Test
        void methodCalls() {
            assertThat(generate(localNames("a"), methodCall(id("a"), "f")))
                .isEqualTo("local a\na:f()");
            assertThat(generate(
                localNames("a"), returning(methodCall(id("a"), "f"))
            )).isEqualTo("local a\nreturn a:f()");
            assertThat(generate(
                localNames("a"),
                methodCall(id("a"), "f", id("a"), number("1"))
            )).isEqualTo("local a\na:f(a, 1)");
        }

        @Test
        void callResultsStayCallable() {
            assertThat(generate(localNames("g"), call(call(id("g")))))
                .isEqualTo("local g\ng()()");
            assertThat(generate(call(paren(table())))).isEqualTo("({})()");
            assertThat(generate(
                localNames("g"), methodCall(call(id("g")), "f")
            )).isEqualTo("local g\ng():f()");
            assertThat(generate(methodCall(paren(table()), "f")))
                .isEqualTo("({}):f()");
        }

        @Test
        void parenthesizedStatementsAreSeparated() {
            assertThat(generate(local("a", id("b")), call(table())))
                .isEqualTo("local a = b\n;({})()");
            assertThat(generate(call(id("g")), call(paren(id("f")))))
                .isEqualTo("g()\n;(f)()");
            assertThat(generate(LUA_51, doBlock(call(paren(id("f"))))))
                .isEqualTo("do\n  (f)()\nend");
            assertThat(generate(
                call(id("g")), doBlock(call(paren(id("f"))))
            )).isEqualTo("g()\ndo\n  (f)()\nend");
        }

        @Test
        void parenthesizedStatementsAfterThePreamble() {
            assertThat(generate(
                verbatim(
                    "local M = {}", AstNode.InsertionPoint.DECLARATION,
                    List.of(), Source.NONE
                ),
                call(paren(id("f")))
            )).isEqualTo("local M = {}\n;(f)()");
            assertThat(generate(
                verbatim(
                    "x = 1;", AstNode.InsertionPoint.STATEMENT,
                    List.of(), Source.NONE
                ),
                call(paren(id("f")))
            )).isEqualTo("x = 1;\n(f)()");
        }

    }

    @Test
    void ifChains() {
        assertThat(generate(localNames("a"), ifThen(id("a"))))
            .isEqualTo("local a\nif a then\nend");
        assertThat(generate(
            localNames("a", "b"),
            ifChain(
                List.of(id("a"), id("b")), List.of(List.of(), List.of()),
                Optional.empty(), Source.NONE
            )
        )).isEqualTo("local a, b\nif a then\nelseif b then\nend");
        assertThat(generate(
            localNames("a", "b"),
            ifChain(
                List.of(id("a"), id("b")), List.of(List.of(), List.of()),
                Optional.of(List.of()), Source.NONE
            )
        )).isEqualTo("local a, b\nif a then\nelseif b then\nelse\nend");
    }

    @Test
    void switchWithElse() {
        assertThat(generate(switchOn(
            number("0"), List.of(number("1")), List.of(List.of()),
            Optional.of(List.of())
        ))).isEqualTo(
            "local __switchval1 = 0\n"
                + "if __switchval1 == 1 then\n"
                + "else\n"
                + "end"
        );
    }

    @Test
    void switchWithBodies() {
        assertThat(generate(switchOn(
            number("0"),
            List.of(number("1"), number("2")),
            List.of(
                List.of(localNames("f"), call(id("f"))),
                List.of(localNames("g"), call(id("g")))
            ),
            Optional.of(List.of(localNames("h"), call(id("h"))))
        ))).isEqualTo(
            "local __switchval1 = 0\n"
                + "if __switchval1 == 1 then\n"
                + "  local f\n"
                + "  f()\n"
                + "elseif __switchval1 == 2 then\n"
                + "  local g\n"
                + "  g()\n"
                + "else\n"
                + "  local h\n"
                + "  h()\n"
                + "end"
        );
    }

    @Test
    void loopsAndBlocks() {
        assertThat(generate(doBlock(returning())))
            .isEqualTo("do\n  return\nend");
        assertThat(generate(localNames("a"), whileLoop(id("a"))))
            .isEqualTo("local a\nwhile a do\nend");
        assertThat(generate(localNames("a"), repeatLoop(id("a"))))
            .isEqualTo("local a\nrepeat\nuntil a");
        assertThat(generate(whileLoop(bool(true), breakLoop())))
            .isEqualTo("while true do\n  break\nend");
    }

    @Test
    void forLoops() {
        assertThat(generate(numericFor(
            "i", number("1"), number("10"), Optional.empty()
        ))).isEqualTo("for i=1,10 do\nend");
        assertThat(generate(numericFor(
            "i", number("1"), number("10"), Optional.of(number("2"))
        ))).isEqualTo("for i=1,10,2 do\nend");
        assertThat(generate(
            localNames("a", "f"),
            genericFor(List.of("i"), List.of(id("a"), call(id("f"))))
        )).isEqualTo("local a, f\nfor i in a, f() do\nend");
        assertThat(generate(
            localNames("f"),
            genericFor(List.of("i", "j", "k"), List.of(call(id("f"))))
        )).isEqualTo("local f\nfor i, j, k in f() do\nend");
    }

    @Test
    void nestedBlocksIndentByTwoSpaces() {
        assertThat(generate(doBlock(
            whileLoop(bool(true), ifThen(bool(false), breakLoop()))
        ))).isEqualTo(
            "do\n"
                + "  while true do\n"
                + "    if false then\n"
                + "      break\n"
                + "    end\n"
                + "  end\n"
                + "end"
        );
    }

    @Test
    void gotoAndLabels() {
        assertThat(generate(label("mylabel"), gotoLabel("mylabel")))
            .isEqualTo("::mylabel::\ngoto mylabel");
        Error error = fail(LUA_51, label("mylabel"), gotoLabel("mylabel"));
        assertThat(error.kind()).isEqualTo(Error.Kind.UNSUPPORTED_CONSTRUCT);
        Config luajit = LUA_51.withBackend(Backend.LUAJIT);
        assertThat(generate(luajit, gotoLabel("continue")))
            .isEqualTo("goto continue");
    }

    @Test
    void declarations() {
        assertThat(generate(localNames("a"))).isEqualTo("local a");
        assertThat(generate(local("a", number("1"))))
            .isEqualTo("local a = 1");
        assertThat(generate(local(
            variables("a", "b", "c"), number("1"), number("2"), nil()
        ))).isEqualTo("local a, b, c = 1, 2, nil");
        assertThat(generate(local(variables("a", "b"), number("1"))))
            .isEqualTo("local a, b = 1, nil");
        assertThat(generate(localFunction(
            "f", function(List.of(), localNames("a"))
        ))).isEqualTo("local function f()\n  local a\nend");
    }

    @Test
    void multiValueTailIsNotPadded() {
        assertThat(generate(
            localNames("f"), local(variables("a", "b"), call(id("f")))
        )).isEqualTo("local f\nlocal a, b = f()");
    }

    @Test
    void assignments() {
        assertThat(generate(
            local(List.of(typed("a", StaticType.of(StaticType.Kind.ANY)))),
            assign(List.of(id("a")), List.of(number("1")))
        )).isEqualTo("local a\na = 1");
        assertThat(generate(
            localNames("a", "b"),
            assign(List.of(id("a"), id("b")), List.of(number("1")))
        )).isEqualTo("local a, b\na, b = 1, nil");
        assertThat(generate(
            localNames("a", "x", "y"),
            assign(
                List.of(field(id("a"), "b"), index(id("a"), number("1"))),
                List.of(id("x"), id("y"))
            )
        )).isEqualTo("local a, x, y\na.b, a[1] = x, y");
    }

    @Test
    void functionDefinitions() {
        assertThat(generate(localFunction("f", function(List.of()))))
            .isEqualTo("local function f()\nend");
        assertThat(generate(localFunction(
            "f", function(variables("a", "b", "c"))
        ))).isEqualTo("local function f(a, b, c)\nend");
        assertThat(generate(
            localNames("a"),
            functionDefinition(
                List.of("a", "b"), Optional.empty(), function(List.of())
            )
        )).isEqualTo("local a\nfunction a.b()\nend");
        assertThat(generate(
            localNames("a"),
            functionDefinition(
                List.of("a", "b"), Optional.of("f"), function(List.of())
            )
        )).isEqualTo("local a\nfunction a.b:f()\nend");
        StaticType integer = StaticType.of(StaticType.Kind.INTEGER);
        assertThat(generate(localFunction("f", function(
            List.of(typed("a", integer)), false, List.of(integer),
            List.of(returning(number("1")))
        )))).isEqualTo("local function f(a)\n  return 1\nend");
    }

    @Test
    void unaryOperators() {
        assertThat(generate(localNames("a"), returning(unary(NOT, id("a")))))
            .isEqualTo("local a\nreturn not a");
        assertThat(generate(
            localNames("a"), returning(unary(NEGATE, id("a")))
        )).isEqualTo("local a\nreturn -a");
        assertThat(generate(
            localNames("a"), returning(unary(BITWISE_NOT, id("a")))
        )).isEqualTo("local a\nreturn ~a");
        assertThat(generate(
            localNames("a"), returning(unary(LENGTH, id("a")))
        )).isEqualTo("local a\nreturn #a");
    }

    @Test
    void binaryOperators() {
        AstNode.BinaryOperator[] operators = {
            OR, AND, NOT_EQUALS, EQUALS, LESS_THAN_EQUAL, GREATER_THAN_EQUAL,
            LESS_THAN, GREATER_THAN, BITWISE_OR, BITWISE_XOR, BITWISE_AND,
            SHIFT_LEFT, SHIFT_RIGHT, ADD, SUBTRACT, MULTIPLY, DIVIDE,
            FLOOR_DIVIDE, MODULO, POWER, CONCAT
        };
        for(AstNode.BinaryOperator operator: operators) {
            assertThat(generate(
                localNames("a", "b"),
                returning(binary(operator, id("a"), id("b")))
            )).isEqualTo("local a, b\nreturn a " + operator.symbol + " b");
        }
    }

    @Test
    void lua51CompatibilityCalls() {
        assertThat(generate(
            LUA_51, localNames("a"), returning(unary(BITWISE_NOT, id("a")))
        )).isEqualTo("local a\nreturn bit.bnot(a)");
        String[][] expected = {
            { "//", "math.floor(a / b)" },
            { "^", "math.pow(a, b)" },
            { "|", "bit.bor(a, b)" },
            { "&", "bit.band(a, b)" },
            { "~", "bit.bxor(a, b)" },
            { "<<", "bit.lshift(a, b)" },
            { ">>", "bit.rshift(a, b)" }
        };
        for(String[] pair: expected) {
            AstNode.BinaryOperator operator = List
                .of(AstNode.BinaryOperator.values())
                .stream()
                .filter(o -> o.symbol.equals(pair[0]))
                .findFirst()
                .get();
            assertThat(generate(
                LUA_51,
                localNames("a", "b"),
                returning(binary(operator, id("a"), id("b")))
            )).isEqualTo("local a, b\nreturn " + pair[1]);
        }
    }

    @Test
    void typedDeclarationsGetZeroValues() {
        assertThat(generate(local(List.of(
            typed("a", StaticType.of(StaticType.Kind.INTEGER))
        )))).isEqualTo("local a = 0");
        assertThat(generate(local(List.of(
            typed("a", StaticType.of(StaticType.Kind.BOOLEAN))
        )))).isEqualTo("local a = false");
        assertThat(generate(local(List.of(
            typed("a", StaticType.of(StaticType.Kind.TABLE))
        )))).isEqualTo("local a = {}");
        assertThat(generate(local(List.of(
            typed("a", StaticType.of(StaticType.Kind.FLOAT)),
            typed("s", StaticType.of(StaticType.Kind.STRING))
        )))).isEqualTo("local a, s = 0, nil");
    }

    @Test
    void expressionStatementIsRejected() {
        Error error = fail(LUA_54, id("a"));
        assertThat(error.kind()).isEqualTo(Error.Kind.UNSUPPORTED_CONSTRUCT);
        assertThat(error.message()).isEqualTo("Expression used as a statement");
    }

    @Nested
    class Verbatim {

        @Test
        void statementTextStartsAtTheIndentation() {
            assertThat(generate(doBlock(verbatim(
                "x = 1\ny = 2\n", AstNode.InsertionPoint.STATEMENT,
                List.of(), Source.NONE
            )))).isEqualTo("do\n  x = 1\ny = 2\nend");
        }

        @Test
        void longStringContentsAreKept() {
            assertThat(generate(doBlock(verbatim(
                "s = [[a  \nb]]", AstNode.InsertionPoint.STATEMENT,
                List.of(), Source.NONE
            )))).isEqualTo("do\n  s = [[a  \nb]]\nend");
            assertThat(generate(verbatim(
                "s = [[\n  x\n]]", AstNode.InsertionPoint.DECLARATION,
                List.of(), Source.NONE
            ))).isEqualTo("s = [[\n  x\n]]");
        }

        @Test
        void declarationTextGoesToThePreamble() {
            assertThat(generate(
                returning(id("M")),
                verbatim(
                    "local M = {}", AstNode.InsertionPoint.DECLARATION,
                    List.of(), Source.NONE
                )
            )).isEqualTo("local M = {}\nreturn M");
        }

        @Test
        void modulesAreRequiredOnce() {
            AstNode.Dependency socket = new AstNode.Dependency(
                AstNode.Dependency.Kind.MODULE, "socket"
            );
            assertThat(generate(
                verbatim(
                    "a()", AstNode.InsertionPoint.STATEMENT,
                    List.of(socket), Source.NONE
                ),
                verbatim(
                    "", AstNode.InsertionPoint.STATEMENT,
                    List.of(socket), Source.NONE
                )
            )).isEqualTo("require \"socket\"\na()");
        }

        @Test
        void libraryDependencyNeedsInterop() {
            Error error = fail(LUA_54, verbatim(
                "", AstNode.InsertionPoint.STATEMENT,
                List.of(new AstNode.Dependency(
                    AstNode.Dependency.Kind.LIBRARY, "m"
                )),
                new Source("main.nl", 3, 1)
            ));
            assertThat(error.kind())
                .isEqualTo(Error.Kind.FOREIGN_IMPORT_UNSUPPORTED);
            assertThat(error.location())
                .contains(new Source("main.nl", 3, 1));
        }

    }

}
