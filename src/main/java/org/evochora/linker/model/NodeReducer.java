package org.evochora.linker.model;

/**
 * Folding function used by {@link Node#reduce(NodeReducer, Object)}.
 *
 * @param <T> The accumulator type.
 */
@FunctionalInterface
public interface NodeReducer<T> {

    /**
     * @param acc    The accumulator produced by the previously visited node.
     * @param node   The node being visited.
     * @param parent The parent of {@code node} in this traversal, or null for the start node.
     * @return The accumulator handed to the next visited node.
     */
    T reduce(T acc, Node node, Node parent);
}
