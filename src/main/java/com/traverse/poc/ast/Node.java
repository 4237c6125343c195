package com.traverse.poc.ast;

import java.util.Objects;

/**
 * Base class for the tagged union of AST nodes stored in a {@link NodeArena}.
 * Each subclass wraps one value produced by the Trino parser, unmodified.
 * <p>
 * The constructor is package-private and every subclass is final, so the set of
 * kinds is closed: adding a kind means adding a subclass here and a method to
 * {@link NodeVisitor}, which every dispatcher then has to implement.
 *
 * @param <T> Type of the wrapped parser value.
 */
public abstract class Node<T> {
    private final T value;

    Node(T value) {
        this.value = Objects.requireNonNull(value, "value is null");
    }

    /**
     * @return The wrapped parser value.
     */
    public T getValue() {
        return value;
    }

    /**
     * Get the kind tag of this node.
     */
    public abstract NodeKind getNodeKind();

    /**
     * Accepts a visitor according to the visitor pattern.
     * @param visitor The visitor implementation.
     * @param context A context object to pass to the visitor method (can be null).
     * @return The result returned by the visitor's specific visit method.
     * @param <R> The return type of the visitor.
     * @param <C> The type of the context object.
     */
    public abstract <R, C> R accept(NodeVisitor<R, C> visitor, C context);

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node<?> that = (Node<?>) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getNodeKind(), value);
    }

    @Override
    public String toString() {
        return getNodeKind() + "(" + value.getClass().getSimpleName() + ")";
    }
}
