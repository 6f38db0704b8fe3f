package typesafeschwalbe.lunac.compiler.backend;

import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

import typesafeschwalbe.lunac.compiler.ErrorException;
import typesafeschwalbe.lunac.compiler.frontend.AstNode;
import typesafeschwalbe.lunac.compiler.frontend.TreeRewriter;

/**
 * Allocates synthetic names like {@code __switchval1}. Each function has
 * its own counter, and names that the unit already uses are skipped.
 */
public class TemporaryNames {

    private static class NameCollector extends TreeRewriter {
        private final Set<String> names = new HashSet<>();

        private void addAll(List<AstNode.Variable> variables) {
            for(AstNode.Variable variable: variables) {
                this.names.add(variable.name());
            }
        }

        @Override
        public AstNode rewrite(AstNode node) throws ErrorException {
            switch(node.type) {
                case IDENTIFIER: {
                    this.names.add(node.<AstNode.Name>getValue().name());
                } break;
                case DECLARATION: {
                    this.addAll(
                        node.<AstNode.Declaration>getValue().variables()
                    );
                } break;
                case FUNCTION: {
                    this.addAll(
                        node.<AstNode.Function>getValue().parameters()
                    );
                } break;
                case NUMERIC_FOR: {
                    this.names.add(
                        node.<AstNode.NumericFor>getValue().variable().name()
                    );
                } break;
                case GENERIC_FOR: {
                    this.addAll(
                        node.<AstNode.GenericFor>getValue().variables()
                    );
                } break;
                case FUNCTION_DEFINITION: {
                    this.names.addAll(
                        node.<AstNode.FunctionDefinition>getValue().path()
                    );
                } break;
                case FOREIGN_IMPORT: {
                    this.names.add(
                        node.<AstNode.ForeignImport>getValue().symbol()
                    );
                } break;
                default: break;
            }
            return this.rewriteChildren(node);
        }
    }

    /**
     * Collects every name bound or referenced anywhere in the given tree.
     */
    public static Set<String> usedNames(AstNode root) throws ErrorException {
        NameCollector collector = new NameCollector();
        collector.rewrite(root);
        return collector.names;
    }

    private final Set<String> taken;
    private final LinkedList<Integer> counters;

    public TemporaryNames(Set<String> taken) {
        this.taken = taken;
        this.counters = new LinkedList<>();
        this.counters.push(1);
    }

    public void enterFunction() {
        this.counters.push(1);
    }

    public void exitFunction() {
        this.counters.pop();
    }

    public String allocate(String prefix) {
        while(true) {
            int number = this.counters.pop();
            this.counters.push(number + 1);
            String name = prefix + number;
            if(!this.taken.contains(name)) {
                return name;
            }
        }
    }

}
