package org.evochora.linker.model;

/**
 * Marker for nodes that evaluate to a value. Every expression is also a sentence.
 */
public interface Expression extends Sentence {
}
