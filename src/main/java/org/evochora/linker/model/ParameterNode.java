package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A formal parameter of a {@link MethodNode}.
 */
public final class ParameterNode extends Node {

    private final String name;
    private final boolean varArg;

    public ParameterNode(String name, boolean varArg) {
        this.name = name;
        this.varArg = varArg;
    }

    public ParameterNode(String name) {
        this(name, false);
    }

    public String name() {
        return name;
    }

    public boolean isVarArg() {
        return varArg;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }

    @Override
    protected ParameterNode rebuild(UnaryOperator<Node> childMapper) {
        return new ParameterNode(name, varArg);
    }

    @Override
    public String toString() {
        return "ParameterNode(" + name + ")";
    }
}
