package org.evochora.linker;

import com.typesafe.config.Config;
import org.evochora.linker.config.LinkerOptions;
import org.evochora.linker.hierarchy.HierarchyProvider;
import org.evochora.linker.hierarchy.SupertypeLinearization;
import org.evochora.linker.identity.IdGenerator;
import org.evochora.linker.identity.IdentityAssigner;
import org.evochora.linker.merge.PackageMerger;
import org.evochora.linker.model.Environment;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;
import org.evochora.linker.model.Sentence;
import org.evochora.linker.scope.ScopeBuilder;
import org.evochora.linker.scope.rules.VisibilityRuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the linking phase. Merges parsed packages into a program model, stamps
 * identities and back-references, and builds the scope graph used for name resolution.
 *
 * <p>Instances are not thread-safe: scope registration mutates shared state, so calls on the
 * same environment lineage must be serialized by the caller.
 */
public class Linker {

    private static final Logger log = LoggerFactory.getLogger(Linker.class);

    private final PackageMerger merger = new PackageMerger();
    private final IdentityAssigner identityAssigner;
    private final ScopeBuilder scopeBuilder;
    private final SentenceLinker sentenceLinker;

    /**
     * Creates a linker with the options of the classpath configuration.
     */
    public Linker() {
        this(LinkerOptions.defaults());
    }

    /**
     * Creates a linker reading its options from the given configuration.
     * @param config The application configuration.
     */
    public Linker(Config config) {
        this(LinkerOptions.fromConfig(config));
    }

    public Linker(LinkerOptions options) {
        this(options, options.idStrategy().createGenerator(), new SupertypeLinearization());
    }

    /**
     * @param options           The linker options.
     * @param ids               The id generator, shared by every link and attach of this linker.
     * @param hierarchyProvider The source of module linearizations.
     */
    public Linker(LinkerOptions options, IdGenerator ids, HierarchyProvider hierarchyProvider) {
        this.identityAssigner = new IdentityAssigner(ids);
        this.scopeBuilder = new ScopeBuilder(
                VisibilityRuleRegistry.initializeWithDefaults(options.globalPackages(), hierarchyProvider));
        this.sentenceLinker = new SentenceLinker(ids);
    }

    /**
     * Links packages into a fresh environment.
     * @param newPackages The parsed packages.
     * @return The linked environment.
     */
    public Environment link(List<PackageNode> newPackages) {
        return link(newPackages, null);
    }

    /**
     * Links packages on top of a previously linked environment. The base environment is not
     * modified; every node of the result, including those carried over, gets a new id.
     *
     * @param newPackages     The parsed packages, merged in order.
     * @param baseEnvironment The previous environment, or null.
     * @return The linked environment.
     */
    public Environment link(List<PackageNode> newPackages, Environment baseEnvironment) {
        Objects.requireNonNull(newPackages, "newPackages");
        List<? extends Node> baseMembers = baseEnvironment == null ? List.of() : baseEnvironment.members();

        List<PackageNode> members = new ArrayList<>();
        for (Node member : merger.mergeAll(baseMembers, newPackages)) {
            members.add((PackageNode) member);
        }

        Environment environment = identityAssigner.assign(new Environment(members));
        scopeBuilder.build(environment);

        log.debug("Linked {} package(s) into an environment of {} top-level package(s) and {} node(s)",
                newPackages.size(), members.size(), environment.nodeCount());
        return environment;
    }

    /**
     * Attaches a freshly parsed sentence to a node of a linked environment, in place.
     * @param newSentence The unlinked sentence.
     * @param context     The linked node the sentence is evaluated in.
     * @param <S>         The sentence type.
     */
    public <S extends Node & Sentence> void attachSentence(S newSentence, Node context) {
        sentenceLinker.link(newSentence, context);
    }
}
