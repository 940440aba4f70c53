package org.evochora.linker.scope.rules;

import org.evochora.linker.hierarchy.HierarchyProvider;
import org.evochora.linker.model.Environment;
import org.evochora.linker.model.ModuleNode;
import org.evochora.linker.model.Node;
import org.evochora.linker.model.PackageNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry mapping node classes to the visibility rules of the second scope pass.
 * Rules registered for a superclass also apply to its subclasses.
 */
public final class VisibilityRuleRegistry {

    private final Map<Class<? extends Node>, List<IVisibilityRule>> rules = new HashMap<>();

    /**
     * Registers a rule for the given node class.
     *
     * @param nodeType The node class (or superclass) the rule applies to.
     * @param rule     The rule instance.
     * @param <T>      Node type parameter.
     */
    public <T extends Node> void register(Class<T> nodeType, IVisibilityRule rule) {
        rules.computeIfAbsent(nodeType, type -> new ArrayList<>()).add(rule);
    }

    /**
     * Resolves all rules applying to the given node class, most general class first.
     *
     * @param nodeType The concrete node class.
     * @return The applicable rules, possibly empty.
     */
    public List<IVisibilityRule> resolveRules(Class<? extends Node> nodeType) {
        List<IVisibilityRule> applicable = new ArrayList<>();
        for (Class<?> type = nodeType; type != null && Node.class.isAssignableFrom(type); type = type.getSuperclass()) {
            List<IVisibilityRule> registered = rules.get(type);
            if (registered != null) applicable.addAll(0, registered);
        }
        return applicable;
    }

    /**
     * Creates a registry pre-populated with the default rules.
     *
     * @param globalPackages    The global library package names, in registration order.
     * @param hierarchyProvider The source of module linearizations.
     * @return A fully initialized registry.
     */
    public static VisibilityRuleRegistry initializeWithDefaults(List<String> globalPackages,
                                                                HierarchyProvider hierarchyProvider) {
        VisibilityRuleRegistry registry = new VisibilityRuleRegistry();
        registry.register(Environment.class, new GlobalPackagesRule(globalPackages));
        registry.register(PackageNode.class, new ImportVisibilityRule());
        registry.register(ModuleNode.class, new InheritanceVisibilityRule(hierarchyProvider));
        return registry;
    }
}
