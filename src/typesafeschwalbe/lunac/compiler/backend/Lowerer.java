package typesafeschwalbe.lunac.compiler.backend;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * Runs the lowering passes in their fixed order.
 */
public class Lowerer {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        Lowerer.class
    );

    private final Config config;

    public Lowerer(Config config) {
        this.config = config;
    }

    public List<LoweringPass> passes() {
        return List.of(
            new SwitchDesugaring(),
            new CallSugarNormalization(),
            new ArityPadding(),
            new TypedDeclarationDefaults(),
            new TypeAnnotationStripping(),
            new OperatorCompatibility(this.config.targetVersion())
        );
    }

    public AstNode lower(AstNode chunk) throws ErrorException {
        AstNode lowered = chunk;
        for(LoweringPass pass: this.passes()) {
            LOGGER.debug("Running {}", pass.getClass().getSimpleName());
            lowered = pass.lower(lowered);
        }
        return lowered;
    }

}
