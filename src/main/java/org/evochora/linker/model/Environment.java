package org.evochora.linker.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Root of a merged and linked program tree. Holds every top-level {@link PackageNode} and a cache
 * from node id to node, filled when the linker stamps identities.
 */
public final class Environment extends Node {

    private final List<PackageNode> members;
    private Map<String, Node> nodeCache = Map.of();

    public Environment(List<PackageNode> members) {
        this.members = List.copyOf(members);
    }

    public List<PackageNode> members() {
        return members;
    }

    @Override
    public List<Node> children() {
        return childrenOf(members);
    }

    @Override
    protected Environment rebuild(UnaryOperator<Node> childMapper) {
        return new Environment(mapAll(members, childMapper));
    }

    /**
     * The environment of the root is the root itself.
     */
    @Override
    public Environment environment() {
        return this;
    }

    /**
     * Looks up a node of this environment by its id.
     * @param id The node id assigned by the last link.
     * @return The node, or empty if no node carries that id.
     */
    public Optional<Node> getNodeById(String id) {
        return Optional.ofNullable(nodeCache.get(id));
    }

    /**
     * Replaces the id cache. Called once by the linker after stamping.
     * @param nodeCache Map from id to node.
     */
    public void setNodeCache(Map<String, Node> nodeCache) {
        this.nodeCache = Collections.unmodifiableMap(new HashMap<>(nodeCache));
    }

    /**
     * @return The number of cached nodes.
     */
    public int nodeCount() {
        return nodeCache.size();
    }
}
