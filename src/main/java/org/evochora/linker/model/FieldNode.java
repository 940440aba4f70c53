package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An attribute of a module, optionally initialized.
 */
public final class FieldNode extends Node {

    private final String name;
    private final boolean constant;
    private final Node value;

    public FieldNode(String name, boolean constant, Node value) {
        this.name = name;
        this.constant = constant;
        this.value = value;
    }

    public String name() {
        return name;
    }

    public boolean isConstant() {
        return constant;
    }

    /**
     * @return The initializer expression, or null.
     */
    public Node value() {
        return value;
    }

    @Override
    public List<Node> children() {
        return childrenOf(value);
    }

    @Override
    protected FieldNode rebuild(UnaryOperator<Node> childMapper) {
        return new FieldNode(name, constant, map(value, childMapper));
    }

    @Override
    public String toString() {
        return "FieldNode(" + name + ")";
    }
}
