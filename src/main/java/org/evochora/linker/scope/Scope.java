package org.evochora.linker.scope;

import org.evochora.linker.model.Node;

import java.util.List;
import java.util.Optional;

/**
 * Name lookup structure owned by a single node.
 * <p>
 * A scope has its own contributions (name to declaring node), an ordered list of included
 * scopes consulted in a single hop, and an optional container scope that continues the lexical
 * walk outwards.
 */
public interface Scope {

    /**
     * Resolves a possibly qualified name ({@code a.b.c}).
     * <p>
     * The first segment is looked up in the own contributions. When {@code allowLookup} is set
     * and nothing is found there, each included scope is asked for the segment without lookup,
     * and then the container scope is asked with lookup. The remaining segments are resolved
     * strictly as members, each one in the scope of the node found for the previous segment.
     *
     * @param qualifiedName The dotted name to resolve.
     * @param allowLookup Whether included and container scopes may be consulted for the first segment.
     * @return The resolved node, or empty if the name is not visible.
     */
    Optional<Node> resolve(String qualifiedName, boolean allowLookup);

    /**
     * Resolves a possibly qualified name with lookup enabled.
     * @see #resolve(String, boolean)
     */
    default Optional<Node> resolve(String qualifiedName) {
        return resolve(qualifiedName, true);
    }

    /**
     * Resolves a name and keeps the result only if it is of the given kind.
     * @param qualifiedName The dotted name to resolve.
     * @param kind The expected node type.
     * @param <N> The expected node type.
     * @return The resolved node, or empty if unresolved or of another kind.
     */
    default <N extends Node> Optional<N> resolve(String qualifiedName, Class<N> kind) {
        return resolve(qualifiedName).filter(kind::isInstance).map(kind::cast);
    }

    /**
     * Registers bindings into this scope. A name that is already bound keeps its first binding,
     * except that a package from a test file is replaced by a same-named non-test package.
     * @param contributions The bindings to register.
     */
    void register(List<Contribution> contributions);

    /**
     * Appends scopes to the included list.
     * @param others The scopes to include, consulted in the given order after earlier inclusions.
     */
    void include(List<? extends Scope> others);

    /**
     * @return A snapshot of the bindings registered directly in this scope.
     */
    List<Contribution> localContributions();

    /**
     * @return The scopes included into this one, in consultation order.
     */
    List<Scope> includedScopes();

    /**
     * @return The lexically enclosing scope, or null for a root scope.
     */
    Scope containerScope();
}
