package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A variable or constant declaration. Declared at package level it is a global entity,
 * inside a body it is a local sentence.
 */
public final class VariableNode extends Node implements Entity, Sentence {

    private final String name;
    private final boolean constant;
    private final Node value;

    public VariableNode(String name, boolean constant, Node value) {
        this.name = name;
        this.constant = constant;
        this.value = value;
    }

    @Override
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
    protected VariableNode rebuild(UnaryOperator<Node> childMapper) {
        return new VariableNode(name, constant, map(value, childMapper));
    }
}
