package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Application of a module as a type, e.g. a supertype of a {@link ModuleNode} or the
 * instantiated class of a {@link NewNode}.
 */
public final class ParameterizedTypeNode extends Node {

    private final ReferenceNode reference;

    public ParameterizedTypeNode(ReferenceNode reference) {
        this.reference = reference;
    }

    public ReferenceNode reference() {
        return reference;
    }

    @Override
    public List<Node> children() {
        return childrenOf(reference);
    }

    @Override
    protected ParameterizedTypeNode rebuild(UnaryOperator<Node> childMapper) {
        return new ParameterizedTypeNode(map(reference, childMapper));
    }
}
