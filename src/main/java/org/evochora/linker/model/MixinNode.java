package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A mixin declaration, linearized into the modules that include it.
 */
public final class MixinNode extends ModuleNode {

    public MixinNode(String name, List<ParameterizedTypeNode> supertypes, List<? extends Node> members) {
        super(name, supertypes, members);
    }

    public MixinNode(String name, List<? extends Node> members) {
        this(name, List.of(), members);
    }

    @Override
    protected MixinNode rebuild(UnaryOperator<Node> childMapper) {
        return new MixinNode(name(), mapAll(supertypes(), childMapper), mapAll(members(), childMapper));
    }
}
