package org.evochora.linker.scope;

import org.evochora.linker.model.Environment;
import org.evochora.linker.model.ImportNode;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.ParameterizedTypeNode;
import org.evochora.linker.model.ReferenceNode;
import org.evochora.linker.scope.rules.IVisibilityRule;
import org.evochora.linker.scope.rules.VisibilityRuleRegistry;

/**
 * Builds the scope graph of a stamped {@link Environment}.
 * It performs two passes over the whole tree: one to create every node's scope and register
 * its contribution into the parent's scope, and a second to apply the visibility rules
 * (global packages, imports, inheritance), which need every scope of the first pass.
 *
 * <p>Parent back-references must already be assigned.
 */
public class ScopeBuilder {

    private final VisibilityRuleRegistry registry;

    public ScopeBuilder(VisibilityRuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * Assigns scopes to every node of the environment.
     * @param environment The stamped environment.
     */
    public void build(Environment environment) {
        createScopes(environment);
        applyVisibilityRules(environment);
    }

    /**
     * Pass 1: creates scopes along the lexical nesting and collects contributions.
     */
    private void createScopes(Environment environment) {
        environment.forEach((node, parent) -> {
            node.setScope(new LocalScope(containerScopeFor(node, parent)));
            if (parent != null) parent.scope().register(ScopeContributions.of(node));
        });
    }

    /**
     * Pass 2: wires cross-cutting visibility.
     */
    private void applyVisibilityRules(Environment environment) {
        environment.forEach((node, parent) -> {
            for (IVisibilityRule rule : registry.resolveRules(node.getClass())) {
                rule.apply(node);
            }
        });
    }

    /**
     * Imports and references applied as types skip one nesting level, so that they are never
     * resolved from within the node they belong to.
     */
    static Scope containerScopeFor(Node node, Node parent) {
        if (parent == null) return null;
        if (node instanceof ImportNode || node instanceof ReferenceNode && parent instanceof ParameterizedTypeNode) {
            Node grandparent = parent.parent();
            return grandparent == null ? null : grandparent.scope();
        }
        return parent.scope();
    }
}
