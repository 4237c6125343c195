package com.traverse.poc.traversal;

import com.traverse.poc.ast.Node;
import com.traverse.poc.ast.NodeArena;

import java.util.Objects;
import java.util.Optional;

/**
 * One element of a pre-order traversal: a node id and its depth below the root.
 */
public final class VisitedNode {
    private final int depth;
    private final int nodeId;

    public VisitedNode(int depth, int nodeId) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative, got " + depth);
        }
        this.depth = depth;
        this.nodeId = nodeId;
    }

    public int getDepth() {
        return depth;
    }

    public int getNodeId() {
        return nodeId;
    }

    /**
     * Resolves the id against the arena the traversal ran over.
     * @param arena The arena that produced this id.
     * @return The node, or empty if the id does not belong to the arena.
     */
    public Optional<Node<?>> resolve(NodeArena arena) {
        return Objects.requireNonNull(arena, "arena is null").get(nodeId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VisitedNode that = (VisitedNode) o;
        return depth == that.depth && nodeId == that.nodeId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(depth, nodeId);
    }

    @Override
    public String toString() {
        return "(" + depth + ", #" + nodeId + ")";
    }
}
