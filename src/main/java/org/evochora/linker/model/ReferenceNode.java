package org.evochora.linker.model;

import org.evochora.linker.scope.Scope;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * A use site of a (possibly qualified) name.
 */
public final class ReferenceNode extends Node implements Expression {

    private final String name;

    public ReferenceNode(String name) {
        this.name = name;
    }

    /**
     * @return The referenced name as written, possibly dotted.
     */
    public String name() {
        return name;
    }

    /**
     * Resolves this reference from its own scope.
     * @return The referenced node, or empty if unlinked or unresolved.
     */
    public Optional<Node> target() {
        Scope scope = scope();
        return scope == null ? Optional.empty() : scope.resolve(name);
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    protected ReferenceNode rebuild(UnaryOperator<Node> childMapper) {
        return new ReferenceNode(name);
    }

    @Override
    public String toString() {
        return "Reference(" + name + ")";
    }
}
