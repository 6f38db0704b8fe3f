package typesafeschwalbe.lunac.compiler;

import typesafeschwalbe.lunac.compiler.backend.CodeGen;
import typesafeschwalbe.lunac.compiler.backend.LuaCodeGen;
import typesafeschwalbe.lunac.compiler.backend.LuaJitCodeGen;

public enum Backend {
    LUA("lua", LuaCodeGen::new),
    LUAJIT("luajit", LuaJitCodeGen::new);

    public final String backendName; // name visible to meta code
    public final CodeGen.Constructor codeGen;

    private Backend(
        String backendName, CodeGen.Constructor codeGen
    ) {
        this.backendName = backendName;
        this.codeGen = codeGen;
    }

    public static Backend fromName(String name) throws ErrorException {
        for(Backend backend: Backend.values()) {
            if(backend.backendName.equals(name)) {
                return backend;
            }
        }
        throw new ErrorException(new Error(
            Error.Kind.INVALID_CONFIG_VALUE,
            "'" + name + "' is not a valid target backend (expected one of "
                + Config.describeChoices(Backend.values()) + ")"
        ));
    }

    @Override
    public String toString() {
        return this.backendName;
    }
}
