package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A named or anonymous object declaration.
 */
public final class SingletonNode extends ModuleNode {

    public SingletonNode(String name, List<ParameterizedTypeNode> supertypes, List<? extends Node> members) {
        super(name, supertypes, members);
    }

    public SingletonNode(String name, List<? extends Node> members) {
        this(name, List.of(), members);
    }

    @Override
    protected SingletonNode rebuild(UnaryOperator<Node> childMapper) {
        return new SingletonNode(name(), mapAll(supertypes(), childMapper), mapAll(members(), childMapper));
    }
}
