package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A constant value (number, string, boolean or null).
 */
public final class LiteralNode extends Node implements Expression {

    private final Object value;

    public LiteralNode(Object value) {
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    protected LiteralNode rebuild(UnaryOperator<Node> childMapper) {
        return new LiteralNode(value);
    }
}
