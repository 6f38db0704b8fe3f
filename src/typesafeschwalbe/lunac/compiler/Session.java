package typesafeschwalbe.lunac.compiler;

/**
 * Caller-owned state shared by the compilation units of one run.
 * Configuration changes made by compile-time directives of a successful
 * unit stay visible to the units generated after it.
 */
public class Session {

    private Config config;

    public Session(Config config) {
        this.config = config;
    }

    public Config config() {
        return this.config;
    }

    void commit(Config config) {
        this.config = config;
    }

}
