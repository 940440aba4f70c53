package org.evochora.linker.identity;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates ids from a monotonic counter. Ids are unique for the lifetime of the generator,
 * so one instance should be shared by every link of the same environment lineage.
 */
public class SequentialIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    public SequentialIdGenerator() {
        this("n");
    }

    @Override
    public String next() {
        return prefix + counter.incrementAndGet();
    }
}
