package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An executable entry point of a package.
 */
public final class ProgramNode extends Node implements Entity {

    private final String name;
    private final BodyNode body;

    public ProgramNode(String name, BodyNode body) {
        this.name = name;
        this.body = body;
    }

    @Override
    public String name() {
        return name;
    }

    public BodyNode body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return childrenOf(body);
    }

    @Override
    protected ProgramNode rebuild(UnaryOperator<Node> childMapper) {
        return new ProgramNode(name, map(body, childMapper));
    }
}
