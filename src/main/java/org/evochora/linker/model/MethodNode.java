package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A method of a module. Abstract and native methods carry no body.
 */
public final class MethodNode extends Node {

    private final String name;
    private final List<ParameterNode> parameters;
    private final BodyNode body;

    public MethodNode(String name, List<ParameterNode> parameters, BodyNode body) {
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.body = body;
    }

    public String name() {
        return name;
    }

    public List<ParameterNode> parameters() {
        return parameters;
    }

    /**
     * @return The body, or null if the method is abstract.
     */
    public BodyNode body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return childrenOf(parameters, body);
    }

    @Override
    protected MethodNode rebuild(UnaryOperator<Node> childMapper) {
        return new MethodNode(name, mapAll(parameters, childMapper), map(body, childMapper));
    }

    @Override
    public String toString() {
        return "MethodNode(" + name + ")";
    }
}
