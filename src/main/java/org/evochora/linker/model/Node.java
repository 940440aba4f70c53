package org.evochora.linker.model;

import org.evochora.linker.scope.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;

/**
 * Base class of every element of a program tree.
 * <p>
 * The structural part of a node (its name, flags and child nodes) is fixed at construction.
 * The link state ({@link #id()}, {@link #scope()}, {@link #parent()} and {@link #environment()})
 * is filled in by the linker after the tree has been merged.
 */
public abstract class Node {

    private String id;
    private Scope scope;
    private Node parent;
    private Environment environment;

    /**
     * Returns the direct children of this node in declaration order.
     * @return An immutable list of child nodes, never null.
     */
    public abstract List<Node> children();

    /**
     * Creates a copy of this node whose children are replaced by {@code childMapper} applied
     * to each of the current children.
     * @param childMapper Function producing the replacement of each child.
     * @return A new node of the same type.
     */
    protected abstract Node rebuild(UnaryOperator<Node> childMapper);

    /**
     * Creates a structural copy of this node sharing its children. The copy keeps the id but none
     * of the scope, parent or environment links.
     * @return A new node of the same type.
     */
    public Node copy() {
        Node copy = rebuild(UnaryOperator.identity());
        copy.id = id;
        return copy;
    }

    /**
     * Rebuilds the whole subtree bottom-up, applying {@code fn} to every rebuilt node.
     * The original tree is left untouched.
     * @param fn Function applied to each fresh copy, children first.
     * @return The transformed root of the subtree.
     */
    public Node transform(UnaryOperator<Node> fn) {
        Node rebuilt = rebuild(child -> child.transform(fn));
        rebuilt.id = id;
        return fn.apply(rebuilt);
    }

    /**
     * Visits this node and all its descendants in pre-order.
     * @param visitor Receives each node and its parent in this traversal (null for this node).
     */
    public void forEach(BiConsumer<Node, Node> visitor) {
        visit(this, null, visitor);
    }

    private static void visit(Node node, Node parent, BiConsumer<Node, Node> visitor) {
        visitor.accept(node, parent);
        for (Node child : node.children()) {
            visit(child, node, visitor);
        }
    }

    /**
     * Folds this subtree in pre-order, threading a single accumulator through every node in
     * sequence (siblings see the value produced by the previous sibling's subtree).
     * @param reducer The folding function.
     * @param initial The initial accumulator.
     * @param <T> The accumulator type.
     * @return The accumulator after the last visited node.
     */
    public <T> T reduce(NodeReducer<T> reducer, T initial) {
        return fold(this, null, reducer, initial);
    }

    private static <T> T fold(Node node, Node parent, NodeReducer<T> reducer, T acc) {
        T next = reducer.reduce(acc, node, parent);
        for (Node child : node.children()) {
            next = fold(child, node, reducer, next);
        }
        return next;
    }

    /**
     * Returns every node of this subtree in pre-order, this node included.
     */
    public List<Node> descendantsAndSelf() {
        List<Node> nodes = new ArrayList<>();
        forEach((node, parent) -> nodes.add(node));
        return nodes;
    }

    public String id() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Scope scope() {
        return scope;
    }

    public void setScope(Scope scope) {
        this.scope = scope;
    }

    public Node parent() {
        return parent;
    }

    public void setParent(Node parent) {
        this.parent = parent;
    }

    public Environment environment() {
        return environment;
    }

    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }

    // --- helpers for subclasses ---

    @SuppressWarnings("unchecked")
    protected static <T extends Node> T map(T node, UnaryOperator<Node> fn) {
        return node == null ? null : (T) fn.apply(node);
    }

    @SuppressWarnings("unchecked")
    protected static <T extends Node> List<T> mapAll(List<T> nodes, UnaryOperator<Node> fn) {
        List<T> mapped = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            mapped.add((T) fn.apply(node));
        }
        return Collections.unmodifiableList(mapped);
    }

    protected static List<Node> childrenOf(Object... parts) {
        List<Node> children = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                children.add(node);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    children.add((Node) element);
                }
            }
        }
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + (this instanceof Entity entity && entity.name() != null ? "(" + entity.name() + ")" : "");
    }
}
