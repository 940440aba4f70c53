package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A single test case, at package level or inside a describe.
 */
public final class TestNode extends Node implements Entity {

    private final String name;
    private final BodyNode body;

    public TestNode(String name, BodyNode body) {
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
    protected TestNode rebuild(UnaryOperator<Node> childMapper) {
        return new TestNode(name, map(body, childMapper));
    }
}
