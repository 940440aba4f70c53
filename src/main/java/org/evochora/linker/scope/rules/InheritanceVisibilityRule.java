package org.evochora.linker.scope.rules;

import org.evochora.linker.hierarchy.HierarchyProvider;
import org.evochora.linker.model.ModuleNode;
import org.evochora.linker.model.Node;
import org.evochora.linker.scope.Scope;

import java.util.ArrayList;
import java.util.List;

/**
 * Includes the scopes of every ancestor of a {@link ModuleNode}, in linearization order, so that
 * member lookup also finds inherited declarations. The linearization is trusted as given.
 */
public class InheritanceVisibilityRule implements IVisibilityRule {

    private final HierarchyProvider hierarchyProvider;

    public InheritanceVisibilityRule(HierarchyProvider hierarchyProvider) {
        this.hierarchyProvider = hierarchyProvider;
    }

    @Override
    public void apply(Node node) {
        ModuleNode module = (ModuleNode) node;
        List<ModuleNode> hierarchy = hierarchyProvider.hierarchyOf(module);

        List<Scope> ancestorScopes = new ArrayList<>();
        for (ModuleNode supertype : hierarchy.subList(Math.min(1, hierarchy.size()), hierarchy.size())) {
            ancestorScopes.add(supertype.scope());
        }
        module.scope().include(ancestorScopes);
    }
}
