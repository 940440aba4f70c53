package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A class declaration.
 */
public final class ClassNode extends ModuleNode {

    public ClassNode(String name, List<ParameterizedTypeNode> supertypes, List<? extends Node> members) {
        super(name, supertypes, members);
    }

    public ClassNode(String name, List<? extends Node> members) {
        this(name, List.of(), members);
    }

    @Override
    protected ClassNode rebuild(UnaryOperator<Node> childMapper) {
        return new ClassNode(name(), mapAll(supertypes(), childMapper), mapAll(members(), childMapper));
    }
}
