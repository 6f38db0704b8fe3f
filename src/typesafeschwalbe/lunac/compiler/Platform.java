package typesafeschwalbe.lunac.compiler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Host platform flags, offered to compile-time predicates through the
 * configuration.
 */
public class Platform {

    public static final String IS_WINDOWS = "is_windows";
    public static final String IS_UNIX = "is_unix";
    public static final String IS_LINUX = "is_linux";
    public static final String IS_MACOS = "is_macos";
    public static final String IS_64BIT = "is_64bit";

    public static Map<String, Boolean> detect() {
        return Platform.fromProperties(
            System.getProperty("os.name", ""),
            System.getProperty("os.arch", "")
        );
    }

    static Map<String, Boolean> fromProperties(String osName, String osArch) {
        String os = osName.toLowerCase();
        boolean windows = os.contains("win");
        boolean macos = os.contains("mac") || os.contains("darwin");
        boolean linux = os.contains("linux");
        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put(IS_WINDOWS, windows);
        flags.put(IS_UNIX, !windows);
        flags.put(IS_LINUX, linux);
        flags.put(IS_MACOS, macos);
        flags.put(IS_64BIT, osArch.contains("64"));
        return flags;
    }

    private Platform() {}

}
