package org.evochora.linker;

import org.evochora.linker.model.Level;
import org.evochora.linker.model.Problem;
import org.evochora.linker.model.SourceMap;

import java.util.List;
import java.util.Optional;

/**
 * A linking problem for diagnostic frameworks. Always an error, without values or position.
 * The linker does not create these for unresolved names; later validation stages do.
 *
 * @param code The symbolic name of the problem.
 */
public record LinkError(String code) implements Problem {

    @Override
    public Level level() {
        return Level.ERROR;
    }

    @Override
    public List<String> values() {
        return List.of();
    }

    @Override
    public Optional<SourceMap> sourceMap() {
        return Optional.empty();
    }
}
