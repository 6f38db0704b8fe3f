package typesafeschwalbe.lunac.compiler;

/**
 * Language version of the generated code. Constants are declared in
 * ascending order, so {@link #compareTo} orders versions.
 */
public enum TargetVersion {
    LUA_51("5.1"),
    LUA_52("5.2"),
    LUA_53("5.3"),
    LUA_54("5.4");

    public final String versionName;

    private TargetVersion(String versionName) {
        this.versionName = versionName;
    }

    public boolean isAtLeast(TargetVersion other) {
        return this.compareTo(other) >= 0;
    }

    public static TargetVersion fromName(String name) throws ErrorException {
        for(TargetVersion version: TargetVersion.values()) {
            if(version.versionName.equals(name)) {
                return version;
            }
        }
        throw new ErrorException(new Error(
            Error.Kind.INVALID_CONFIG_VALUE,
            "'" + name + "' is not a valid target version (expected one of "
                + Config.describeChoices(TargetVersion.values()) + ")"
        ));
    }

    @Override
    public String toString() {
        return this.versionName;
    }
}
