package org.evochora.linker.scope;

import org.evochora.linker.model.Node;

/**
 * A binding from a name to the node declaring it.
 *
 * @param name The name the node is visible under.
 * @param node The declaring node.
 */
public record Contribution(String name, Node node) {
}
