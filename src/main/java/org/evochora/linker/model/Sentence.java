package org.evochora.linker.model;

/**
 * Marker for nodes that can appear as statements in a {@link Body}.
 */
public interface Sentence {
}
