package org.evochora.linker.model;

/**
 * Region of a source file a node or problem was produced from.
 *
 * @param fileName The source file identifier.
 * @param startLine First line (1-based).
 * @param startColumn First column (1-based).
 * @param endLine Last line (1-based).
 * @param endColumn Last column (1-based, exclusive).
 */
public record SourceMap(String fileName, int startLine, int startColumn, int endLine, int endColumn) {
}
