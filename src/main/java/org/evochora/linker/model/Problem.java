package org.evochora.linker.model;

import java.util.List;
import java.util.Optional;

/**
 * A diagnostic attached to the program model, consumed by reporting frameworks.
 */
public interface Problem {

    /**
     * @return The symbolic name of the problem.
     */
    String code();

    Level level();

    /**
     * @return The values interpolated into the message template of {@link #code()}.
     */
    List<String> values();

    /**
     * @return Where the problem was found, if known.
     */
    Optional<SourceMap> sourceMap();
}
