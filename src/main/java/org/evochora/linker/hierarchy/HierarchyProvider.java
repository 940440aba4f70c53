package org.evochora.linker.hierarchy;

import org.evochora.linker.model.ModuleNode;

import java.util.List;

/**
 * Source of supertype linearizations. The linker consumes linearizations, it never computes
 * or validates them itself.
 */
@FunctionalInterface
public interface HierarchyProvider {

    /**
     * Returns the linearized hierarchy of a module.
     * <p>
     * Called during the second scope pass: every node already owns its scope, but inherited and
     * imported scopes may not all be wired yet.
     *
     * @param module A module of a linked environment.
     * @return The module followed by its ancestors in lookup order. The first element is always
     *         {@code module} itself.
     */
    List<ModuleNode> hierarchyOf(ModuleNode module);
}
