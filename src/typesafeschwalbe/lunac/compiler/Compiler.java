package typesafeschwalbe.lunac.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.lunac.compiler.backend.CodeGen;
import typesafeschwalbe.lunac.compiler.backend.Lowerer;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.meta.MetaExecutor;

public class Compiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        Compiler.class
    );

    /**
     * Generates the code of a single chunk with a fixed configuration.
     */
    public static Result<String> generate(AstNode chunk, Config config) {
        return Compiler.generate(chunk, new Session(config));
    }

    /**
     * Generates the code of a chunk. Configuration changes made by the
     * chunk's compile-time directives are kept in the session if the chunk
     * compiles, and discarded if it does not.
     */
    public static Result<String> generate(AstNode chunk, Session session) {
        Config config = session.config();
        String output;
        try {
            LOGGER.debug("Executing compile-time directives");
            MetaExecutor executor = new MetaExecutor(config);
            AstNode expanded = executor.execute(chunk);
            config = executor.config();
            LOGGER.debug(
                "Lowering for Lua {} ({})",
                config.targetVersion(), config.backend()
            );
            AstNode lowered = new Lowerer(config).lower(expanded);
            LOGGER.debug("Generating code");
            CodeGen codeGen = config.backend().codeGen.create(config);
            output = codeGen.generate(lowered);
        } catch(ErrorException e) {
            LOGGER.debug("Compilation failed: {}", e.getMessage());
            return Result.ofError(e.error);
        }
        session.commit(config);
        return Result.ofValue(output);
    }

}
