package org.evochora.linker.scope;

import org.evochora.linker.hierarchy.HierarchyProvider;
import org.evochora.linker.hierarchy.SupertypeLinearization;
import org.evochora.linker.identity.IdentityAssigner;
import org.evochora.linker.identity.SequentialIdGenerator;
import org.evochora.linker.model.ClassNode;
import org.evochora.linker.model.Environment;
import org.evochora.linker.model.FieldNode;
import org.evochora.linker.model.ImportNode;
import org.evochora.linker.model.ModuleNode;
import org.evochora.linker.model.NewNode;
import org.evochora.linker.model.PackageNode;
import org.evochora.linker.model.ParameterizedTypeNode;
import org.evochora.linker.model.ReferenceNode;
import org.evochora.linker.model.SingletonNode;
import org.evochora.linker.model.VariableNode;
import org.evochora.linker.scope.rules.VisibilityRuleRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.evochora.linker.Trees.cls;
import static org.evochora.linker.Trees.field;
import static org.evochora.linker.Trees.find;
import static org.evochora.linker.Trees.genericImport;
import static org.evochora.linker.Trees.pkg;
import static org.evochora.linker.Trees.pkgWithImports;
import static org.evochora.linker.Trees.singleImport;
import static org.evochora.linker.Trees.subclass;
import static org.evochora.linker.Trees.type;

/**
 * Tests scope creation and the visibility rules wired by {@link ScopeBuilder}.
 */
@Tag("unit")
class ScopeBuilderTest {

    private static final HierarchyProvider NO_INHERITANCE = List::of;

    private static Environment build(List<String> globalPackages, HierarchyProvider hierarchy, PackageNode... packages) {
        Environment environment = new IdentityAssigner(new SequentialIdGenerator())
                .assign(new Environment(List.of(packages)));
        new ScopeBuilder(VisibilityRuleRegistry.initializeWithDefaults(globalPackages, hierarchy)).build(environment);
        return environment;
    }

    private static Environment build(PackageNode... packages) {
        return build(List.of(), NO_INHERITANCE, packages);
    }

    @Test
    void everyNodeOwnsAScopeChainedToItsParent() {
        Environment environment = build(pkg("p", "p.wlk", cls("A", field("x"))));
        PackageNode p = environment.members().get(0);
        ClassNode a = find(environment, ClassNode.class, "A");
        FieldNode x = find(environment, FieldNode.class, "x");

        assertThat(environment.descendantsAndSelf()).allSatisfy(node -> assertThat(node.scope()).isNotNull());
        assertThat(environment.scope().containerScope()).isNull();
        assertThat(p.scope().containerScope()).isSameAs(environment.scope());
        assertThat(a.scope().containerScope()).isSameAs(p.scope());
        assertThat(x.scope().containerScope()).isSameAs(a.scope());
    }

    @Test
    void contributionsAreRegisteredIntoTheParentScope() {
        Environment environment = build(pkg("p", "p.wlk", cls("A", field("x"))));
        PackageNode p = environment.members().get(0);
        ClassNode a = find(environment, ClassNode.class, "A");

        assertThat(environment.scope().localContributions()).extracting(Contribution::name).containsExactly("p");
        assertThat(p.scope().localContributions()).extracting(Contribution::node).containsExactly(a);
        assertThat(a.scope().localContributions()).extracting(Contribution::name).containsExactly("x");
    }

    @Test
    void qualifiedNameResolvesFromTheEnvironment() {
        Environment environment = build(pkg("p", "p.wlk", cls("A", field("x"))));

        assertThat(environment.scope().resolve("p.A.x")).containsSame(find(environment, FieldNode.class, "x"));
        assertThat(environment.scope().resolve("p.A.y")).isEmpty();
    }

    @Test
    void importsAttachOutsideTheirPackage() {
        Environment environment = build(pkgWithImports("q", "q.wlk", List.of(genericImport("p"))),
                pkg("p", "p.wlk"));
        PackageNode q = find(environment, PackageNode.class, "q");
        ImportNode importNode = q.imports().get(0);

        assertThat(importNode.scope().containerScope()).isSameAs(environment.scope());
        assertThat(importNode.entity().scope().containerScope()).isSameAs(importNode.scope());
    }

    @Test
    void referenceAppliedAsTypeAttachesToTheGrandparent() {
        NewNode instantiation = new NewNode(type("A"), List.of());
        Environment environment = build(pkg("p", "p.wlk",
                cls("A"),
                new SingletonNode("factory", List.of(new FieldNode("made", true, instantiation)))));
        NewNode linked = (NewNode) find(environment, FieldNode.class, "made").value();

        ParameterizedTypeNode applied = linked.instantiated();
        assertThat(applied.reference().scope().containerScope()).isSameAs(linked.scope());
        assertThat(applied.reference().target()).containsSame(find(environment, ClassNode.class, "A"));
    }

    @Test
    void genericImportExposesDirectMembersOnly() {
        Environment environment = build(
                pkg("p", "p.wlk", cls("A"), cls("B"), pkg("inner", "p.wlk", cls("C"))),
                pkgWithImports("q", "q.wlk", List.of(genericImport("p"))));
        PackageNode q = find(environment, PackageNode.class, "q");

        assertThat(q.scope().resolve("A")).containsSame(find(environment, ClassNode.class, "A"));
        assertThat(q.scope().resolve("B")).containsSame(find(environment, ClassNode.class, "B"));
        assertThat(q.scope().resolve("inner")).containsSame(find(environment, PackageNode.class, "inner"));
        assertThat(q.scope().resolve("C")).isEmpty();
        assertThat(q.scope().resolve("inner.C")).containsSame(find(environment, ClassNode.class, "C"));
    }

    @Test
    void singleImportExposesOnlyTheImportedEntity() {
        Environment environment = build(
                pkg("p", "p.wlk", cls("A", field("x")), cls("B")),
                pkgWithImports("q", "q.wlk", List.of(singleImport("p.A"))));
        PackageNode q = find(environment, PackageNode.class, "q");

        assertThat(q.scope().resolve("A")).containsSame(find(environment, ClassNode.class, "A"));
        assertThat(q.scope().resolve("A.x")).containsSame(find(environment, FieldNode.class, "x"));
        assertThat(q.scope().resolve("B")).isEmpty();
        assertThat(q.scope().resolve("x")).isEmpty();
    }

    @Test
    void unresolvedImportContributesNothing() {
        Environment environment = build(pkgWithImports("q", "q.wlk", List.of(genericImport("missing"), singleImport("p.Missing"))),
                pkg("p", "p.wlk"));
        PackageNode q = find(environment, PackageNode.class, "q");

        assertThat(q.scope().includedScopes()).isEmpty();
    }

    @Test
    void importIsNotResolvedFromInsideTheImportingPackage() {
        // "A" is declared in q itself, but the import is resolved from outside q
        Environment environment = build(pkgWithImports("q", "q.wlk", List.of(singleImport("A")), cls("A")));
        PackageNode q = find(environment, PackageNode.class, "q");

        assertThat(q.scope().includedScopes()).isEmpty();
    }

    @Test
    void globalPackagesAreVisibleUnqualifiedEverywhere() {
        Environment environment = build(List.of("std.lang", "std.missing"), NO_INHERITANCE,
                pkg("std", null, pkg("lang", "lang.wlk", cls("Object"), cls("List"))),
                pkg("p", "p.wlk", cls("A", field("x"))));
        FieldNode x = find(environment, FieldNode.class, "x");

        assertThat(x.scope().resolve("List")).containsSame(find(environment, ClassNode.class, "List"));
        assertThat(environment.scope().localContributions()).extracting(Contribution::name)
                .containsExactlyInAnyOrder("std", "p", "Object", "List");
    }

    @Test
    void globalPackageMembersDoNotOverrideEarlierRootBindings() {
        Environment environment = build(List.of("std.lang"), NO_INHERITANCE,
                pkg("p", "p.wlk"),
                pkg("std", null, pkg("lang", "lang.wlk", cls("p"))));

        assertThat(environment.scope().resolve("p")).containsSame(environment.members().get(0));
    }

    @Test
    void moduleIncludesAncestorScopesAfterItself() {
        HierarchyProvider fixed = module -> {
            if (!"Dog".equals(module.name())) return List.of(module);
            Environment environment = module.environment();
            return List.of(module,
                    find(environment, ClassNode.class, "Animal"),
                    find(environment, ClassNode.class, "Object"));
        };
        Environment environment = build(List.of(), fixed,
                pkg("zoo", "zoo.wlk", cls("Object", field("identity")), cls("Animal", field("bark")), cls("Dog")));
        ClassNode dog = find(environment, ClassNode.class, "Dog");

        assertThat(dog.scope().includedScopes()).containsExactly(
                find(environment, ClassNode.class, "Animal").scope(),
                find(environment, ClassNode.class, "Object").scope());
        assertThat(dog.scope().resolve("bark")).containsSame(find(environment, FieldNode.class, "bark"));
        assertThat(dog.scope().resolve("identity")).containsSame(find(environment, FieldNode.class, "identity"));
    }

    @Test
    void ancestorMembersShadowOuterDeclarations() {
        Environment environment = build(List.of(), new SupertypeLinearization(),
                pkg("zoo", "zoo.wlk", new VariableNode("bark", true, null), cls("Animal", field("bark")), subclass("Dog", "Animal", field("name"))));
        FieldNode name = find(environment, FieldNode.class, "name");
        ClassNode animal = find(environment, ClassNode.class, "Animal");

        assertThat(name.scope().resolve("bark")).containsSame(animal.members().get(0));
        assertThat(find(environment, ModuleNode.class, "Dog").scope().resolve("Animal"))
                .containsSame(animal);
    }

    @Test
    void referenceTargetIsAbsentWhenUnresolved() {
        ReferenceNode unknown = new ReferenceNode("Nowhere");
        Environment environment = build(pkg("p", "p.wlk", new VariableNode("f", false, unknown)));
        ReferenceNode linked = (ReferenceNode) find(environment, VariableNode.class, "f").value();

        assertThat(linked.target()).isEmpty();
        assertThat(unknown.target()).isEmpty();
    }
}
