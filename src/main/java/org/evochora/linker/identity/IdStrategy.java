package org.evochora.linker.identity;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Selectable id generation strategies, as named in configuration.
 */
public enum IdStrategy {
    /** Random UUIDs. */
    UUID,
    /** Monotonic counter. */
    SEQUENTIAL;

    /**
     * Parses a configured strategy name, ignoring case.
     * @param name The configured value.
     * @return The matching strategy.
     * @throws IllegalArgumentException if no strategy has that name.
     */
    public static IdStrategy fromName(String name) {
        for (IdStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(name)) return strategy;
        }
        throw new IllegalArgumentException("Unknown id generator '" + name + "'. Expected one of: "
                + Arrays.stream(values()).map(s -> s.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")));
    }

    /**
     * @return A new generator implementing this strategy.
     */
    public IdGenerator createGenerator() {
        return switch (this) {
            case UUID -> new RandomIdGenerator();
            case SEQUENTIAL -> new SequentialIdGenerator();
        };
    }
}
