package org.evochora.linker.model;

/**
 * Severity of a {@link Problem}.
 */
public enum Level {
    WARNING,
    ERROR
}
