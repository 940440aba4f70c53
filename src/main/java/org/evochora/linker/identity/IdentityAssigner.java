package org.evochora.linker.identity;

import org.evochora.linker.model.Environment;
import org.evochora.linker.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Stamps a merged environment: rebuilds the whole tree with a fresh id on every node, then
 * wires parent and environment back-references and fills the id cache of the new root.
 *
 * <p>Every node is stamped, including subtrees untouched by the merge, so ids never survive
 * a relink.
 */
public class IdentityAssigner {

    private static final Logger log = LoggerFactory.getLogger(IdentityAssigner.class);

    private final IdGenerator ids;

    public IdentityAssigner(IdGenerator ids) {
        this.ids = ids;
    }

    /**
     * @param merged The merged environment. It is left untouched.
     * @return A stamped copy of {@code merged}.
     */
    public Environment assign(Environment merged) {
        Environment environment = (Environment) merged.transform(node -> {
            node.setId(ids.next());
            return node;
        });

        Map<String, Node> nodeCache = new HashMap<>();
        environment.forEach((node, parent) -> {
            nodeCache.put(node.id(), node);
            node.setEnvironment(environment);
            if (parent != null) node.setParent(parent);
        });
        environment.setNodeCache(nodeCache);

        log.debug("Stamped {} nodes", nodeCache.size());
        return environment;
    }
}
