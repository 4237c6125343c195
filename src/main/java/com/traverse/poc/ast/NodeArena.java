package com.traverse.poc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only storage for AST nodes, addressed by dense zero-based ids.
 * <p>
 * An id handed out by {@link #allocate(Node)} stays valid for the lifetime of the arena:
 * slots are never removed or overwritten. Ids only mean something relative to the arena
 * that produced them, so concurrent traversals must each own their arena.
 * Not thread-safe.
 */
public class NodeArena {
    private final List<Node<?>> nodes = new ArrayList<>();

    /**
     * Appends a node.
     * @param node The node to store.
     * @return The id of the new node, equal to {@link #size()} before the call.
     */
    public int allocate(Node<?> node) {
        Objects.requireNonNull(node, "node is null");
        int id = nodes.size();
        nodes.add(node);
        return id;
    }

    /**
     * Looks up a node by id.
     * @param id The node id.
     * @return The node, or empty if the id is outside {@code 0..size()}.
     */
    public Optional<Node<?>> get(int id) {
        if (id < 0 || id >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(id));
    }

    /**
     * @return Number of stored nodes, which is also the id the next allocation gets.
     */
    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return An unmodifiable view of all nodes in id order.
     */
    public List<Node<?>> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NodeArena[");
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(i).append('=').append(nodes.get(i));
        }
        return sb.append(']').toString();
    }
}
