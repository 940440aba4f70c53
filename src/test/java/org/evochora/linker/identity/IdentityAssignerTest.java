package org.evochora.linker.identity;

import org.evochora.linker.model.ClassNode;
import org.evochora.linker.model.Environment;
import org.evochora.linker.model.FieldNode;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evochora.linker.Trees.cls;
import static org.evochora.linker.Trees.field;
import static org.evochora.linker.Trees.find;
import static org.evochora.linker.Trees.pkg;

/**
 * Unit tests for {@link IdentityAssigner}.
 */
@Tag("unit")
class IdentityAssignerTest {

    private final IdentityAssigner assigner = new IdentityAssigner(new SequentialIdGenerator());

    private static Environment sample() {
        return new Environment(List.of(
                pkg("p", "p.wlk", cls("A", field("x")), cls("B")),
                pkg("q", "q.wlk", pkg("inner", "q.wlk", cls("C")))));
    }

    @Test
    void everyNodeGetsADistinctId() {
        Environment environment = assigner.assign(sample());

        List<Node> nodes = environment.descendantsAndSelf();
        Set<String> ids = nodes.stream().map(Node::id).collect(Collectors.toSet());

        assertThat(nodes).allSatisfy(node -> assertThat(node.id()).isNotNull());
        assertThat(ids).hasSize(nodes.size());
        assertThat(environment.nodeCount()).isEqualTo(nodes.size());
    }

    @Test
    void backReferencesPointIntoTheStampedTree() {
        Environment environment = assigner.assign(sample());
        PackageNode p = environment.members().get(0);
        ClassNode a = find(environment, ClassNode.class, "A");
        FieldNode x = find(environment, FieldNode.class, "x");

        assertThat(environment.parent()).isNull();
        assertThat(p.parent()).isSameAs(environment);
        assertThat(a.parent()).isSameAs(p);
        assertThat(x.parent()).isSameAs(a);
        assertThat(environment.descendantsAndSelf()).allSatisfy(node -> assertThat(node.environment()).isSameAs(environment));
    }

    @Test
    void nodeCacheFindsEveryNodeById() {
        Environment environment = assigner.assign(sample());

        for (Node node : environment.descendantsAndSelf()) {
            assertThat(environment.getNodeById(node.id())).containsSame(node);
        }
        assertThat(environment.getNodeById("unknown")).isEmpty();
    }

    @Test
    void restampingReplacesEveryIdAndLeavesTheInputUntouched() {
        Environment first = assigner.assign(sample());
        Set<String> firstIds = first.descendantsAndSelf().stream().map(Node::id).collect(Collectors.toSet());
        PackageNode firstP = first.members().get(0);

        Environment second = assigner.assign(first);

        assertThat(second.descendantsAndSelf()).noneMatch(node -> firstIds.contains(node.id()));
        assertThat(second.members().get(0)).isNotSameAs(firstP);
        assertThat(firstP.parent()).isSameAs(first);
        assertThat(first.getNodeById(firstP.id())).containsSame(firstP);
    }
}
