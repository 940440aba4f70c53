package org.evochora.linker.merge;

import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;
import org.evochora.linker.scope.ScopeContributions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciles freshly parsed packages with the members of a previously linked environment.
 *
 * <ul>
 *   <li>A member that is not a package replaces every existing member of the same name and
 *       is appended at the end.</li>
 *   <li>A package with no existing package of equal name and file name is appended.</li>
 *   <li>A package matching an existing one replaces it (appended at the end). The replacement
 *       keeps the existing sub-packages, recursively merged with the incoming ones, followed by
 *       the incoming non-package members. The existing non-package members are dropped, and
 *       imports and problems come from the incoming package only.</li>
 * </ul>
 * Inputs are never modified.
 */
public class PackageMerger {

    /**
     * Folds every incoming member into the existing members, left to right.
     * @param existing The current sibling list.
     * @param incoming The members to merge in.
     * @return The merged sibling list.
     */
    public List<Node> mergeAll(List<? extends Node> existing, List<? extends Node> incoming) {
        List<Node> members = new ArrayList<>(existing);
        for (Node isolated : incoming) {
            members = merge(members, isolated);
        }
        return members;
    }

    /**
     * Merges a single member into a sibling list.
     * @param members The current sibling list.
     * @param isolated The member to merge in.
     * @return A new sibling list.
     */
    public List<Node> merge(List<? extends Node> members, Node isolated) {
        List<Node> merged = new ArrayList<>(members.size() + 1);

        if (!(isolated instanceof PackageNode incoming)) {
            String name = ScopeContributions.nameOf(isolated);
            for (Node member : members) {
                if (!Objects.equals(ScopeContributions.nameOf(member), name)) merged.add(member);
            }
            merged.add(isolated);
            return merged;
        }

        Optional<PackageNode> existent = findSamePackage(members, incoming);
        if (existent.isEmpty()) {
            merged.addAll(members);
            merged.add(incoming);
            return merged;
        }

        PackageNode existing = existent.get();
        for (Node member : members) {
            if (member != existing) merged.add(member);
        }

        List<Node> contents = mergeAll(subPackages(existing), subPackages(incoming));
        contents.addAll(declarations(incoming));
        merged.add(existing.withContents(incoming.imports(), contents, incoming.problems()));
        return merged;
    }

    private static Optional<PackageNode> findSamePackage(List<? extends Node> members, PackageNode incoming) {
        for (Node member : members) {
            if (member instanceof PackageNode candidate
                    && Objects.equals(candidate.name(), incoming.name())
                    && Objects.equals(candidate.fileName(), incoming.fileName())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static List<Node> subPackages(PackageNode pkg) {
        return pkg.members().stream().filter(PackageNode.class::isInstance).toList();
    }

    private static List<Node> declarations(PackageNode pkg) {
        return pkg.members().stream().filter(member -> !(member instanceof PackageNode)).toList();
    }
}
