package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An ordered sequence of sentences.
 */
public final class BodyNode extends Node {

    private final List<Node> sentences;

    public BodyNode(List<? extends Node> sentences) {
        this.sentences = List.copyOf(sentences);
    }

    public List<Node> sentences() {
        return sentences;
    }

    @Override
    public List<Node> children() {
        return childrenOf(sentences);
    }

    @Override
    protected BodyNode rebuild(UnaryOperator<Node> childMapper) {
        return new BodyNode(mapAll(sentences, childMapper));
    }
}
