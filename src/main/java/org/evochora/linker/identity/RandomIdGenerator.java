package org.evochora.linker.identity;

import java.util.UUID;

/**
 * Generates random 128-bit ids in UUID text form.
 */
public class RandomIdGenerator implements IdGenerator {

    @Override
    public String next() {
        return UUID.randomUUID().toString();
    }
}
