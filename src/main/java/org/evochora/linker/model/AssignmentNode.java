package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

public final class AssignmentNode extends Node implements Sentence {

    private final ReferenceNode variable;
    private final Node value;

    public AssignmentNode(ReferenceNode variable, Node value) {
        this.variable = variable;
        this.value = value;
    }

    public ReferenceNode variable() {
        return variable;
    }

    public Node value() {
        return value;
    }

    @Override
    public List<Node> children() {
        return childrenOf(variable, value);
    }

    @Override
    protected AssignmentNode rebuild(UnaryOperator<Node> childMapper) {
        return new AssignmentNode(map(variable, childMapper), map(value, childMapper));
    }
}
