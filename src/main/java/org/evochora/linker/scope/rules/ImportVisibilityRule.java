package org.evochora.linker.scope.rules;

import org.evochora.linker.model.ImportNode;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;
import org.evochora.linker.scope.Contribution;
import org.evochora.linker.scope.LocalScope;
import org.evochora.linker.scope.ScopeContributions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Includes the entities named by the imports of a {@link PackageNode} into its scope.
 *
 * <p>Imports are resolved from the import node's own scope, which is attached outside the
 * importing package. A generic import includes a snapshot of every direct contribution of the
 * target (one level only); a plain import includes a single binding from the target's name to
 * the target. Unresolved imports contribute nothing.
 */
public class ImportVisibilityRule implements IVisibilityRule {

    private static final Logger log = LoggerFactory.getLogger(ImportVisibilityRule.class);

    @Override
    public void apply(Node node) {
        PackageNode pkg = (PackageNode) node;
        for (ImportNode importNode : pkg.imports()) {
            String target = importNode.entity().name();
            Optional<Node> entity = importNode.scope().resolve(target);
            if (entity.isEmpty()) {
                log.trace("Import '{}' of package '{}' does not resolve", target, pkg.name());
                continue;
            }

            Node imported = entity.get();
            if (importNode.isGeneric()) {
                pkg.scope().include(List.of(new LocalScope(null, imported.scope().localContributions())));
            } else {
                String name = ScopeContributions.nameOf(imported);
                if (name == null) continue;
                pkg.scope().include(List.of(new LocalScope(null, List.of(new Contribution(name, imported)))));
            }
        }
    }
}
