package typesafeschwalbe.lunac.compiler.meta;

import static org.assertj.core.api.Assertions.assertThat;
import static typesafeschwalbe.lunac.compiler.frontend.AstNode.BinaryOperator.*;
import static typesafeschwalbe.lunac.compiler.frontend.Nodes.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.lunac.compiler.Backend;
import typesafeschwalbe.lunac.compiler.Compiler;
import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.Error;
import typesafeschwalbe.lunac.compiler.Result;
import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.TargetVersion;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

class MetaExecutorTest {

    static final Config LINUX = new Config(
        TargetVersion.LUA_54, Backend.LUA,
        Map.of("is_linux", true, "is_windows", false)
    );

    static String generate(AstNode... body) {
        Result<String> result = Compiler.generate(chunk(body), LINUX);
        assertThat(result.isValue())
            .as(() -> result.getDiagnostic().toString())
            .isTrue();
        return result.getValue();
    }

    static Error fail(AstNode... body) {
        Result<String> result = Compiler.generate(chunk(body), LINUX);
        assertThat(result.isError()).isTrue();
        return result.getDiagnostic();
    }

    static AstNode intrinsic(String name, AstNode... arguments) {
        return call(id(name), arguments);
    }

    static AstNode configField(String name) {
        return field(id(Interpreter.CONFIG_GLOBAL), name);
    }

    static AstNode flag(String name) {
        return field(configField("flags"), name);
    }

    @Test
    void emittedTextReplacesTheBlock() {
        assertThat(generate(
            call(id("before")),
            metaBlock(
                intrinsic("emit", string("first()")),
                intrinsic("emit", string("second()"))
            ),
            call(id("after"))
        )).isEqualTo("before()\nfirst()\nsecond()\nafter()");
    }

    @Test
    void loopsEmitInOrder() {
        assertThat(generate(metaBlock(numericFor(
            "i", number("1"), number("3"), Optional.empty(),
            intrinsic("emit", binary(CONCAT, string("x"), id("i")))
        )))).isEqualTo("x1\nx2\nx3");
    }

    @Test
    void declarationsAndModules() {
        assertThat(generate(
            returning(id("M")),
            metaBlock(
                intrinsic("require_module", string("socket")),
                intrinsic("emit_decl", string("local M = {}")),
                intrinsic("require_module", string("socket"))
            )
        )).isEqualTo("require \"socket\"\nlocal M = {}\nreturn M");
    }

    @Test
    void globalsPersistAcrossDirectives() {
        assertThat(generate(
            metaBlock(assign(List.of(id("x")), List.of(number("2")))),
            returning(metaValue(binary(MULTIPLY, id("x"), number("21"))))
        )).isEqualTo("return 42");
    }

    @Test
    void blockLocalsStayInTheirBlock() {
        Error error = fail(
            metaBlock(local("x", number("2"))),
            returning(metaValue(id("x")))
        );
        assertThat(error.kind()).isEqualTo(Error.Kind.META_EXECUTION);
        assertThat(error.message())
            .isEqualTo("'x' is not defined at compile time");
    }

    @Test
    void splicedValuesBecomeLiterals() {
        assertThat(generate(returning(
            metaValue(binary(CONCAT, string("a"), string("b"))),
            metaValue(binary(DIVIDE, number("1"), number("4"))),
            metaValue(binary(EQUALS, number("1"), number("2"))),
            metaValue(nil())
        ))).isEqualTo("return \"ab\", 0.25, false, nil");
    }

    @Test
    void tablesCanNotBeSpliced() {
        Error error = fail(returning(metaValue(table())));
        assertThat(error.kind()).isEqualTo(Error.Kind.META_EXECUTION);
        assertThat(error.message())
            .isEqualTo("Compile-time value can not be spliced");
    }

    @Test
    void splicedValuesMayNotHaveEffects() {
        Error error = fail(returning(
            metaValue(intrinsic("emit", string("x()")))
        ));
        assertThat(error.message())
            .isEqualTo("Compile-time value with side effects");
    }

    @Test
    void conditionalsSelectOneBranch() {
        AstNode conditional = metaIf(
            List.of(flag("is_windows"), flag("is_linux")),
            List.of(
                List.of(
                    call(id("windows")),
                    metaBlock(intrinsic("error", string("unreachable")))
                ),
                List.of(call(id("linux")))
            ),
            Optional.of(List.of(number("1")))
        );
        assertThat(generate(conditional)).isEqualTo("linux()");
    }

    @Test
    void conditionalsFallBackToTheElseBranch() {
        assertThat(generate(metaIf(
            List.of(flag("is_windows")),
            List.of(List.of(call(id("windows")))),
            Optional.of(List.of(call(id("other"))))
        ))).isEqualTo("other()");
        assertThat(generate(metaIf(
            List.of(flag("is_windows")),
            List.of(List.of(call(id("windows")))),
            Optional.empty()
        ))).isEmpty();
    }

    @Test
    void conditionsMustBeBooleans() {
        Error error = fail(metaIf(
            List.of(flag("is_macos")),
            List.of(List.of(call(id("mac")))),
            Optional.empty()
        ));
        assertThat(error.kind()).isEqualTo(Error.Kind.META_EXECUTION);
        assertThat(error.message()).isEqualTo("Invalid compile-time condition");
    }

    @Test
    void branchConditionsObserveEarlierBranchBodies() {
        AstNode setN = metaBlock(
            assign(List.of(id("n")), List.of(number("2")))
        );
        assertThat(generate(
            metaBlock(assign(List.of(id("n")), List.of(number("1")))),
            ifChain(
                List.of(metaValue(id("n")), metaValue(id("n"))),
                List.of(List.of(setN), List.of(call(id("f")))),
                Optional.empty(), Source.NONE
            )
        )).isEqualTo("if 1 then\nelseif 2 then\n  f()\nend");
    }

    @Test
    void caseValuesObserveEarlierCaseBodies() {
        assertThat(generate(
            metaBlock(assign(List.of(id("n")), List.of(number("1")))),
            switchOn(
                id("v"),
                List.of(metaValue(id("n")), metaValue(id("n"))),
                List.of(
                    List.of(metaBlock(
                        assign(List.of(id("n")), List.of(number("3")))
                    )),
                    List.of(call(id("g")))
                ),
                Optional.empty()
            )
        )).isEqualTo(
            "local __switchval1 = v\n"
                + "if __switchval1 == 1 then\n"
                + "elseif __switchval1 == 3 then\n"
                + "  g()\n"
                + "end"
        );
    }

    @Test
    void versionChangesAffectLowering() {
        AstNode floorDivision = returning(
            binary(FLOOR_DIVIDE, id("a"), id("b"))
        );
        assertThat(generate(floorDivision)).isEqualTo("return a // b");
        assertThat(generate(
            metaBlock(assign(
                List.of(configField("target_version")),
                List.of(string("5.1"))
            )),
            floorDivision
        )).isEqualTo("return math.floor(a / b)");
    }

    @Test
    void backendChangesEnableForeignImports() {
        assertThat(generate(
            metaBlock(assign(
                List.of(configField("target_backend")),
                List.of(string("luajit"))
            )),
            foreignImport(
                "abs", Optional.empty(), AstNode.CallingConvention.CDECL,
                "int", List.of("int"), Source.NONE
            )
        )).isEqualTo(
            "local ffi = require \"ffi\"\n"
                + "ffi.cdef[[\n"
                + "int abs(int);\n"
                + "]]\n"
                + "local abs = ffi.C.abs"
        );
    }

    @Test
    void invalidConfigurationValuesAbort() {
        Error backend = fail(metaBlock(assign(
            List.of(configField("target_backend")), List.of(string("python"))
        )));
        assertThat(backend.kind()).isEqualTo(Error.Kind.INVALID_CONFIG_VALUE);
        assertThat(backend.message()).contains("'python'");
        Error version = fail(metaBlock(assign(
            List.of(configField("target_version")), List.of(number("5.1"))
        )));
        assertThat(version.kind()).isEqualTo(Error.Kind.INVALID_CONFIG_VALUE);
    }

    @Test
    void flagsWrittenByOneDirectiveAreSeenByTheNext() {
        assertThat(generate(
            metaBlock(assign(List.of(flag("debug")), List.of(bool(true)))),
            metaIf(
                List.of(flag("debug")),
                List.of(List.of(call(id("trace")))),
                Optional.empty()
            )
        )).isEqualTo("trace()");
    }

}
