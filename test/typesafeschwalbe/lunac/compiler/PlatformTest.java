package typesafeschwalbe.lunac.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;

class PlatformTest {

    @Test
    void linux() {
        assertThat(Platform.fromProperties("Linux", "amd64")).isEqualTo(Map.of(
            Platform.IS_WINDOWS, false,
            Platform.IS_UNIX, true,
            Platform.IS_LINUX, true,
            Platform.IS_MACOS, false,
            Platform.IS_64BIT, true
        ));
    }

    @Test
    void windows() {
        Map<String, Boolean> flags = Platform.fromProperties(
            "Windows 10", "x86"
        );
        assertThat(flags.get(Platform.IS_WINDOWS)).isTrue();
        assertThat(flags.get(Platform.IS_UNIX)).isFalse();
        assertThat(flags.get(Platform.IS_64BIT)).isFalse();
    }

    @Test
    void macos() {
        Map<String, Boolean> flags = Platform.fromProperties(
            "Mac OS X", "aarch64"
        );
        assertThat(flags.get(Platform.IS_MACOS)).isTrue();
        assertThat(flags.get(Platform.IS_UNIX)).isTrue();
        assertThat(flags.get(Platform.IS_LINUX)).isFalse();
        assertThat(flags.get(Platform.IS_64BIT)).isTrue();
    }

}
