package org.evochora.linker.scope;

import org.evochora.linker.model.Entity;
import org.evochora.linker.model.FieldNode;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.ParameterNode;

import java.util.List;

/**
 * Decides what a node contributes to the scope it is declared in.
 */
public final class ScopeContributions {

    private ScopeContributions() {
    }

    /**
     * Entities, fields and parameters can be referenced by name.
     */
    public static boolean canBeReferenced(Node node) {
        return node instanceof Entity || node instanceof FieldNode || node instanceof ParameterNode;
    }

    /**
     * @param contributor A node of the program tree.
     * @return A single binding from the node's name to the node if it is referenceable and named,
     *         an empty list otherwise.
     */
    public static List<Contribution> of(Node contributor) {
        if (!canBeReferenced(contributor)) return List.of();
        String name = nameOf(contributor);
        return name == null ? List.of() : List.of(new Contribution(name, contributor));
    }

    /**
     * @return The declared name of an entity, field or parameter, or null for any other node.
     */
    public static String nameOf(Node node) {
        if (node instanceof Entity entity) return entity.name();
        if (node instanceof FieldNode field) return field.name();
        if (node instanceof ParameterNode parameter) return parameter.name();
        return null;
    }
}
