package org.evochora.linker.identity;

/**
 * Source of node identities. Every returned id must differ from every id previously returned
 * by the same generator.
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * @return A fresh, unique id.
     */
    String next();
}
