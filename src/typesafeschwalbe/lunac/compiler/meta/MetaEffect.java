package typesafeschwalbe.lunac.compiler.meta;

import typesafeschwalbe.lunac.compiler.Config;
import typesafeschwalbe.lunac.compiler.Source;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;

/**
 * Something compile-time code asked the compiler to do. Effects are
 * collected in the order they were requested and applied by the
 * {@link MetaExecutor}.
 */
public interface MetaEffect {

    Source source();

    public static record ConfigUpdate(
        Config config, Source source
    ) implements MetaEffect {}

    public static record Emit(
        String text, AstNode.InsertionPoint insertionPoint, Source source
    ) implements MetaEffect {}

    public static record RequireDependency(
        AstNode.Dependency dependency, Source source
    ) implements MetaEffect {}

}
