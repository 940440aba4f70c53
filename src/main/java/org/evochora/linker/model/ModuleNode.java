package org.evochora.linker.model;

import java.util.List;

/**
 * A class-like declaration: it declares supertypes and members and exposes, through a
 * {@link org.evochora.linker.hierarchy.HierarchyProvider}, a linearized list of ancestors.
 */
public abstract class ModuleNode extends Node implements Entity {

    private final String name;
    private final List<ParameterizedTypeNode> supertypes;
    private final List<Node> members;

    protected ModuleNode(String name, List<ParameterizedTypeNode> supertypes, List<? extends Node> members) {
        this.name = name;
        this.supertypes = List.copyOf(supertypes);
        this.members = List.copyOf(members);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * @return The declared supertypes in source order.
     */
    public List<ParameterizedTypeNode> supertypes() {
        return supertypes;
    }

    public List<Node> members() {
        return members;
    }

    @Override
    public List<Node> children() {
        return childrenOf(supertypes, members);
    }
}
