package org.evochora.linker.scope.rules;

import org.evochora.linker.model.Node;

/**
 * A cross-cutting visibility rule applied during the second scope pass, once every node of the
 * environment owns its scope and has registered its contribution.
 * Each rule is responsible for a specific type of node.
 */
public interface IVisibilityRule {

    /**
     * Wires additional visibility into the scope of the given node.
     * @param node The node whose scope is extended.
     */
    void apply(Node node);
}
