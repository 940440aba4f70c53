package org.evochora.linker.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.evochora.linker.identity.IdStrategy;

import java.util.List;

/**
 * Immutable linker settings, read from the {@code linker} section of a HOCON configuration.
 * Defaults are declared in {@code reference.conf}.
 *
 * @param globalPackages Fully qualified names of the packages whose members are visible
 *                       unqualified everywhere, in registration order.
 * @param idStrategy     How node ids are generated.
 */
public record LinkerOptions(List<String> globalPackages, IdStrategy idStrategy) {

    /** Global library packages registered when no configuration overrides them. */
    public static final List<String> DEFAULT_GLOBAL_PACKAGES = List.of("wollok.lang", "wollok.lib", "wollok.game");

    private static final String GLOBAL_PACKAGES_PATH = "linker.global-packages";
    private static final String ID_GENERATOR_PATH = "linker.id-generator";

    public LinkerOptions {
        globalPackages = List.copyOf(globalPackages);
    }

    /**
     * Reads the options from a configuration. Missing keys fall back to the built-in defaults.
     *
     * @param config The application configuration.
     * @return The linker options.
     * @throws IllegalArgumentException if {@code linker.id-generator} names an unknown strategy.
     * @throws com.typesafe.config.ConfigException if a key has the wrong type.
     */
    public static LinkerOptions fromConfig(Config config) {
        List<String> globalPackages = config.hasPath(GLOBAL_PACKAGES_PATH)
                ? config.getStringList(GLOBAL_PACKAGES_PATH)
                : DEFAULT_GLOBAL_PACKAGES;
        IdStrategy idStrategy = config.hasPath(ID_GENERATOR_PATH)
                ? IdStrategy.fromName(config.getString(ID_GENERATOR_PATH))
                : IdStrategy.UUID;
        return new LinkerOptions(globalPackages, idStrategy);
    }

    /**
     * @return The options of the classpath configuration ({@code application.conf} over
     *         {@code reference.conf}).
     */
    public static LinkerOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }
}
