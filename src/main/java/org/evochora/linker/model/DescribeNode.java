package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A group of tests sharing fields and fixtures.
 */
public final class DescribeNode extends ModuleNode {

    public DescribeNode(String name, List<ParameterizedTypeNode> supertypes, List<? extends Node> members) {
        super(name, supertypes, members);
    }

    public DescribeNode(String name, List<? extends Node> members) {
        this(name, List.of(), members);
    }

    @Override
    protected DescribeNode rebuild(UnaryOperator<Node> childMapper) {
        return new DescribeNode(name(), mapAll(supertypes(), childMapper), mapAll(members(), childMapper));
    }
}
