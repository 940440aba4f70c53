package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An import declaration of a {@link PackageNode}.
 * A generic import ({@code import p.*}) exposes every direct member of the target entity,
 * a plain import exposes only the target itself under its own name.
 */
public final class ImportNode extends Node {

    private final ReferenceNode entity;
    private final boolean generic;

    public ImportNode(ReferenceNode entity, boolean generic) {
        this.entity = entity;
        this.generic = generic;
    }

    public ReferenceNode entity() {
        return entity;
    }

    public boolean isGeneric() {
        return generic;
    }

    @Override
    public List<Node> children() {
        return childrenOf(entity);
    }

    @Override
    protected ImportNode rebuild(UnaryOperator<Node> childMapper) {
        return new ImportNode(map(entity, childMapper), generic);
    }
}
