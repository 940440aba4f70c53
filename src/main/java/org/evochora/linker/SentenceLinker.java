package org.evochora.linker;

import org.evochora.linker.identity.IdGenerator;
import org.evochora.linker.model.Environment;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.Sentence;
import org.evochora.linker.scope.LocalScope;
import org.evochora.linker.scope.Scope;
import org.evochora.linker.scope.ScopeContributions;

import java.util.Objects;

/**
 * Attaches a single freshly parsed sentence to an already linked node, without relinking the
 * rest of the environment.
 *
 * <p>The sentence's own contribution is registered into the context's scope. Its nodes are then
 * visited in pre-order, each one getting a fresh id, a new scope chained to the scope of the
 * previously visited node and holding its own contribution, the context's environment and a
 * parent (the context for the sentence itself).
 */
public class SentenceLinker {

    private final IdGenerator ids;

    public SentenceLinker(IdGenerator ids) {
        this.ids = ids;
    }

    /**
     * @param sentence The unlinked sentence.
     * @param context A node of a linked environment.
     * @param <S> The sentence type.
     * @throws IllegalStateException if {@code context} has not been linked.
     */
    public <S extends Node & Sentence> void link(S sentence, Node context) {
        Objects.requireNonNull(sentence, "sentence");
        Objects.requireNonNull(context, "context");
        Scope contextScope = context.scope();
        if (contextScope == null) {
            throw new IllegalStateException("Cannot attach a sentence to unlinked node " + context);
        }
        Environment environment = context.environment();

        contextScope.register(ScopeContributions.of(sentence));

        sentence.reduce((Scope parentScope, Node node, Node parent) -> {
            LocalScope localScope = new LocalScope(parentScope, ScopeContributions.of(node));
            node.setId(ids.next());
            node.setScope(localScope);
            node.setEnvironment(environment);
            node.setParent(parent != null ? parent : context);
            return localScope;
        }, contextScope);
    }
}
