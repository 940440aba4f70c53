package org.evochora.linker.model;

/**
 * A declaration that can be referenced by name from elsewhere in the program.
 * Packages, programs, tests, variables and modules are entities.
 */
public interface Entity {

    /**
     * @return The declared name, or null for anonymous entities.
     */
    String name();
}
