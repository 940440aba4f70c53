package org.evochora.linker.scope;

import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link Scope}: a hash map of own contributions, a list of included scopes and a link
 * to the container scope. Neither the container nor the included scopes are owned.
 */
public class LocalScope implements Scope {

    private final Scope containerScope;
    private final Map<String, Node> contributions = new HashMap<>();
    private final List<Scope> includedScopes = new ArrayList<>();

    /**
     * @param containerScope The enclosing scope, or null for a root scope.
     * @param contributions Initial bindings.
     */
    public LocalScope(Scope containerScope, List<Contribution> contributions) {
        this.containerScope = containerScope;
        register(contributions);
    }

    public LocalScope(Scope containerScope) {
        this(containerScope, List.of());
    }

    @Override
    public Optional<Node> resolve(String qualifiedName, boolean allowLookup) {
        int dot = qualifiedName.indexOf('.');
        String start = dot < 0 ? qualifiedName : qualifiedName.substring(0, dot);
        String rest = dot < 0 ? "" : qualifiedName.substring(dot + 1);

        Optional<Node> step = allowLookup ? lookup(start) : Optional.ofNullable(contributions.get(start));
        if (rest.isEmpty() || step.isEmpty()) return step;

        Scope memberScope = step.get().scope();
        return memberScope == null ? Optional.empty() : memberScope.resolve(rest, false);
    }

    private Optional<Node> lookup(String name) {
        Node own = contributions.get(name);
        if (own != null) return Optional.of(own);

        for (Scope included : includedScopes) {
            Optional<Node> found = included.resolve(name, false);
            if (found.isPresent()) return found;
        }

        return containerScope == null ? Optional.empty() : containerScope.resolve(name, true);
    }

    @Override
    public void register(List<Contribution> newContributions) {
        for (Contribution contribution : newContributions) {
            Node alreadyRegistered = contributions.get(contribution.name());
            if (alreadyRegistered == null || shouldBeOverridden(alreadyRegistered, contribution.node())) {
                contributions.put(contribution.name(), contribution.node());
            }
        }
    }

    /**
     * Declarations from a test file give way to production declarations of the same name.
     */
    private static boolean shouldBeOverridden(Node older, Node newer) {
        return older instanceof PackageNode olderPackage
                && newer instanceof PackageNode newerPackage
                && olderPackage.isTestFile()
                && !newerPackage.isTestFile();
    }

    @Override
    public void include(List<? extends Scope> others) {
        includedScopes.addAll(others);
    }

    @Override
    public List<Contribution> localContributions() {
        List<Contribution> snapshot = new ArrayList<>(contributions.size());
        contributions.forEach((name, node) -> snapshot.add(new Contribution(name, node)));
        return Collections.unmodifiableList(snapshot);
    }

    @Override
    public List<Scope> includedScopes() {
        return Collections.unmodifiableList(includedScopes);
    }

    @Override
    public Scope containerScope() {
        return containerScope;
    }
}
