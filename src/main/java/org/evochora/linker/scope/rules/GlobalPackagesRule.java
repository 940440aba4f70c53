package org.evochora.linker.scope.rules;

import org.evochora.linker.model.Environment;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;
import org.evochora.linker.scope.ScopeContributions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Makes the members of the global library packages visible unqualified from everywhere by
 * registering them directly into the root scope of the {@link Environment}.
 */
public class GlobalPackagesRule implements IVisibilityRule {

    private static final Logger log = LoggerFactory.getLogger(GlobalPackagesRule.class);

    private final List<String> globalPackages;

    /**
     * @param globalPackages Fully qualified package names, in registration order.
     */
    public GlobalPackagesRule(List<String> globalPackages) {
        this.globalPackages = List.copyOf(globalPackages);
    }

    @Override
    public void apply(Node node) {
        Environment environment = (Environment) node;
        for (String globalName : globalPackages) {
            Optional<PackageNode> globalPackage = environment.scope().resolve(globalName, PackageNode.class);
            if (globalPackage.isEmpty()) {
                log.debug("Global package '{}' is not part of the environment", globalName);
                continue;
            }
            for (Node member : globalPackage.get().members()) {
                environment.scope().register(ScopeContributions.of(member));
            }
        }
    }
}
