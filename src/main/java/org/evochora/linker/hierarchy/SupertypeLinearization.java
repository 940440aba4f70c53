package org.evochora.linker.hierarchy;

import org.evochora.linker.model.ModuleNode;
import org.evochora.linker.model.ParameterizedTypeNode;
import org.evochora.linker.model.ReferenceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Default {@link HierarchyProvider} computing the linearization from the declared supertypes.
 *
 * <p>Supertypes are visited depth-first starting with the last declared one, so that a mixin
 * listed later takes precedence over earlier ones and over the superclass. A module reached more
 * than once keeps its last position, which places a shared ancestor after all of its subtypes.
 * A module already on the current path is skipped, which stops cyclic declarations.
 * Supertypes that do not resolve to a module are left out.
 */
public class SupertypeLinearization implements HierarchyProvider {

    private static final Logger log = LoggerFactory.getLogger(SupertypeLinearization.class);

    @Override
    public List<ModuleNode> hierarchyOf(ModuleNode module) {
        List<ModuleNode> linearization = new ArrayList<>();
        linearize(module, new HashSet<>(), linearization);
        return linearization;
    }

    private void linearize(ModuleNode module, Set<ModuleNode> path, List<ModuleNode> linearization) {
        if (!path.add(module)) return;
        linearization.remove(module);
        linearization.add(module);

        List<ParameterizedTypeNode> supertypes = module.supertypes();
        for (int i = supertypes.size() - 1; i >= 0; i--) {
            resolveSupertype(supertypes.get(i)).ifPresent(supertype -> linearize(supertype, path, linearization));
        }
        path.remove(module);
    }

    private Optional<ModuleNode> resolveSupertype(ParameterizedTypeNode supertype) {
        ReferenceNode reference = supertype.reference();
        if (reference.scope() == null) return Optional.empty();

        Optional<ModuleNode> resolved = reference.scope().resolve(reference.name(), ModuleNode.class);
        if (resolved.isEmpty()) {
            log.debug("Supertype '{}' does not resolve to a module", reference.name());
        }
        return resolved;
    }
}
