package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

public final class ReturnNode extends Node implements Sentence {

    private final Node value;

    public ReturnNode(Node value) {
        this.value = value;
    }

    /**
     * @return The returned expression, or null for a bare return.
     */
    public Node value() {
        return value;
    }

    @Override
    public List<Node> children() {
        return childrenOf(value);
    }

    @Override
    protected ReturnNode rebuild(UnaryOperator<Node> childMapper) {
        return new ReturnNode(map(value, childMapper));
    }
}
