package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Instantiation of a class: {@code new C(args)}.
 */
public final class NewNode extends Node implements Expression {

    private final ParameterizedTypeNode instantiated;
    private final List<Node> args;

    public NewNode(ParameterizedTypeNode instantiated, List<? extends Node> args) {
        this.instantiated = instantiated;
        this.args = List.copyOf(args);
    }

    public ParameterizedTypeNode instantiated() {
        return instantiated;
    }

    public List<Node> args() {
        return args;
    }

    @Override
    public List<Node> children() {
        return childrenOf(instantiated, args);
    }

    @Override
    protected NewNode rebuild(UnaryOperator<Node> childMapper) {
        return new NewNode(map(instantiated, childMapper), mapAll(args, childMapper));
    }
}
