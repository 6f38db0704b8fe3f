package typesafeschwalbe.lunac.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigTest {

    @Test
    void namesSelectVersionsAndBackends() throws ErrorException {
        Config config = Config.of("5.3", "luajit", Map.of("fast", true));
        assertThat(config.targetVersion()).isEqualTo(TargetVersion.LUA_53);
        assertThat(config.backend()).isEqualTo(Backend.LUAJIT);
        assertThat(config.flag("fast")).contains(true);
        assertThat(config.flag("slow")).isEmpty();
    }

    @Test
    void unknownNamesAreInvalidValues() {
        assertThatThrownBy(() -> TargetVersion.fromName("5.5"))
            .isInstanceOf(ErrorException.class)
            .hasMessage(
                "'5.5' is not a valid target version (expected one of"
                    + " '5.1', '5.2', '5.3', '5.4')"
            )
            .extracting(e -> ((ErrorException) e).error.kind())
            .isEqualTo(Error.Kind.INVALID_CONFIG_VALUE);
        assertThatThrownBy(() -> Backend.fromName("LuaJIT"))
            .isInstanceOf(ErrorException.class)
            .hasMessageContaining("'lua', 'luajit'");
    }

    @Test
    void updatesReturnCopies() {
        Config original = new Config(
            TargetVersion.LUA_54, Backend.LUA, Map.of("a", true)
        );
        Config updated = original
            .withTargetVersion(TargetVersion.LUA_51)
            .withBackend(Backend.LUAJIT)
            .withFlag("a", false)
            .withFlag("b", true);
        assertThat(original.targetVersion()).isEqualTo(TargetVersion.LUA_54);
        assertThat(original.flags()).containsOnly(Map.entry("a", true));
        assertThat(updated).isEqualTo(new Config(
            TargetVersion.LUA_51, Backend.LUAJIT,
            Map.of("a", false, "b", true)
        ));
    }

    @Test
    void flagsAreCopiedAndFrozen() {
        Map<String, Boolean> flags = new HashMap<>();
        flags.put("a", true);
        Config config = new Config(TargetVersion.LUA_54, Backend.LUA, flags);
        flags.put("b", true);
        assertThat(config.flag("b")).isEmpty();
        assertThatThrownBy(() -> config.flags().put("c", true))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void versionsAreOrdered() {
        assertThat(TargetVersion.LUA_53.isAtLeast(TargetVersion.LUA_52))
            .isTrue();
        assertThat(TargetVersion.LUA_51.isAtLeast(TargetVersion.LUA_52))
            .isFalse();
        assertThat(TargetVersion.LUA_54.isAtLeast(TargetVersion.LUA_54))
            .isTrue();
    }

    @Test
    void defaultsDescribeTheHost() {
        Config defaults = Config.defaults();
        assertThat(defaults.targetVersion()).isEqualTo(TargetVersion.LUA_54);
        assertThat(defaults.backend()).isEqualTo(Backend.LUA);
        assertThat(defaults.flags()).containsKeys(
            Platform.IS_WINDOWS, Platform.IS_UNIX, Platform.IS_LINUX,
            Platform.IS_MACOS, Platform.IS_64BIT
        );
    }

}
