package org.evochora.linker.model;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A message send: {@code receiver.message(args)}.
 */
public final class SendNode extends Node implements Expression {

    private final Node receiver;
    private final String message;
    private final List<Node> args;

    public SendNode(Node receiver, String message, List<? extends Node> args) {
        this.receiver = receiver;
        this.message = message;
        this.args = List.copyOf(args);
    }

    public Node receiver() {
        return receiver;
    }

    public String message() {
        return message;
    }

    public List<Node> args() {
        return args;
    }

    @Override
    public List<Node> children() {
        return childrenOf(receiver, args);
    }

    @Override
    protected SendNode rebuild(UnaryOperator<Node> childMapper) {
        return new SendNode(map(receiver, childMapper), message, mapAll(args, childMapper));
    }
}
