package typesafeschwalbe.lunac.compiler;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Configuration snapshot read by every stage of the pipeline. Instances
 * never change; the "with" methods return updated copies.
 */
public record Config(
    TargetVersion targetVersion,
    Backend backend,
    Map<String, Boolean> flags
) {

    public Config {
        flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    }

    public static Config defaults() {
        return new Config(
            TargetVersion.LUA_54, Backend.LUA, Platform.detect()
        );
    }

    public static Config of(
        String version, String backend, Map<String, Boolean> flags
    ) throws ErrorException {
        return new Config(
            TargetVersion.fromName(version), Backend.fromName(backend), flags
        );
    }

    public Config withTargetVersion(TargetVersion targetVersion) {
        return new Config(targetVersion, this.backend, this.flags);
    }

    public Config withBackend(Backend backend) {
        return new Config(this.targetVersion, backend, this.flags);
    }

    public Config withFlag(String name, boolean value) {
        Map<String, Boolean> flags = new LinkedHashMap<>(this.flags);
        flags.put(name, value);
        return new Config(this.targetVersion, this.backend, flags);
    }

    public Optional<Boolean> flag(String name) {
        return Optional.ofNullable(this.flags.get(name));
    }

    static String describeChoices(Object[] values) {
        return Arrays.stream(values)
            .map(v -> "'" + v + "'")
            .collect(Collectors.joining(", "));
    }

}
