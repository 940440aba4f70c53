package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

public final class SelfNode extends Node implements Expression {

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    protected SelfNode rebuild(UnaryOperator<Node> childMapper) {
        return new SelfNode();
    }
}
