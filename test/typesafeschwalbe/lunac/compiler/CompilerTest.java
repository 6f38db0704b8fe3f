package typesafeschwalbe.lunac.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static typesafeschwalbe.lunac.compiler.frontend.Nodes.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.lunac.compiler.frontend.AstNode;

class CompilerTest {

    static final Config CONFIG = new Config(
        TargetVersion.LUA_54, Backend.LUA, Map.of()
    );

    static AstNode setVersion(String version) {
        return metaBlock(assign(
            List.of(field(id("config"), "target_version")),
            List.of(string(version))
        ));
    }

    @Test
    void successfulChunksCommitTheirConfiguration() {
        Session session = new Session(CONFIG);
        Result<String> first = Compiler.generate(
            chunk(setVersion("5.2")), session
        );
        assertThat(first.isValue()).isTrue();
        assertThat(session.config().targetVersion())
            .isEqualTo(TargetVersion.LUA_52);
        Result<String> second = Compiler.generate(
            chunk(returning(
                metaValue(field(id("config"), "target_version"))
            )),
            session
        );
        assertThat(second.getValue()).isEqualTo("return \"5.2\"");
    }

    @Test
    void failedChunksLeaveTheSessionUntouched() {
        Session session = new Session(CONFIG);
        Result<String> result = Compiler.generate(
            chunk(setVersion("5.1"), label("top"), gotoLabel("top")),
            session
        );
        assertThat(result.isError()).isTrue();
        assertThat(result.getDiagnostic().kind())
            .isEqualTo(Error.Kind.UNSUPPORTED_CONSTRUCT);
        assertThat(session.config()).isEqualTo(CONFIG);
    }

    @Test
    void generationIsDeterministic() {
        AstNode chunk = chunk(
            local("t", table(
                named("b", number("2")), named("a", number("1"))
            )),
            metaBlock(genericFor(
                List.of("k", "v"),
                List.of(call(id("pairs"), table(
                    named("x", number("1")), named("y", number("2"))
                ))),
                call(id("emit"), id("k"))
            ))
        );
        String first = Compiler.generate(chunk, CONFIG).getValue();
        for(int run = 0; run < 5; run += 1) {
            assertThat(Compiler.generate(chunk, CONFIG).getValue())
                .isEqualTo(first);
        }
        assertThat(first).endsWith("x\ny");
    }

    @Test
    void resultsRefuseTheWrongAccessor() {
        Result<String> value = Result.ofValue("x");
        assertThat(value.isError()).isFalse();
        assertThatThrownBy(value::getError)
            .isInstanceOf(IllegalStateException.class);
        Result<String> error = Result.ofError(new Error(
            Error.Kind.META_EXECUTION, "boom"
        ));
        assertThatThrownBy(error::getValue)
            .isInstanceOf(IllegalStateException.class);
    }

}
