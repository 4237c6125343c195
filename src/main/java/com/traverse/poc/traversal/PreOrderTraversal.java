package com.traverse.poc.traversal;

import com.traverse.poc.ast.NodeArena;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Depth-first pre-order walk over the nodes reachable from a root in a {@link NodeArena}.
 * <p>
 * Children are discovered lazily through a {@link ChildEnumerator}: a node is yielded before
 * any of its children, and a child is only materialized into the arena when the walk reaches
 * it. Each node is yielded exactly once.
 * <p>
 * Single forward pass: once consumed the traversal cannot be restarted. Dropping it midway
 * leaves the unvisited part of the tree unallocated and nothing else running.
 */
public class PreOrderTraversal implements Iterator<VisitedNode> {

    /**
     * A node on the current root-to-leaf path together with its own enumeration state.
     */
    private static final class Frame {
        private final int depth;
        private final EnumerationCursor cursor;
        private boolean yielded;

        Frame(int depth, EnumerationCursor cursor) {
            this.depth = depth;
            this.cursor = cursor;
        }
    }

    private final ChildEnumerator enumerator;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private VisitedNode pending;
    private int visitedCount;

    /**
     * Creates a traversal that enumerates children into the given arena.
     * @param arena The arena holding the root. Children are appended to it.
     * @param rootId Id of the root node.
     * @throws IllegalArgumentException if the root is not in the arena.
     */
    public PreOrderTraversal(NodeArena arena, int rootId) {
        this(new ChildEnumerator(arena), rootId);
    }

    public PreOrderTraversal(ChildEnumerator enumerator, int rootId) {
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator is null");
        if (enumerator.getArena().get(rootId).isEmpty()) {
            throw new IllegalArgumentException("Root node " + rootId + " is not in the arena (size "
                    + enumerator.getArena().size() + ")");
        }
        stack.push(new Frame(0, new EnumerationCursor(rootId)));
    }

    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = computeNext();
        }
        return pending != null;
    }

    @Override
    public VisitedNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Traversal is exhausted");
        }
        VisitedNode result = pending;
        pending = null;
        visitedCount++;
        return result;
    }

    /**
     * @return Number of nodes handed out by {@link #next()} so far.
     */
    public int getVisitedCount() {
        return visitedCount;
    }

    /**
     * @return The remaining nodes as a sequential, ordered stream backed by this traversal.
     */
    public Stream<VisitedNode> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Drains the traversal.
     * @return All remaining nodes in pre-order.
     */
    public List<VisitedNode> traverseAll() {
        List<VisitedNode> visited = new ArrayList<>();
        forEachRemaining(visited::add);
        return visited;
    }

    private VisitedNode computeNext() {
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (!top.yielded) {
                top.yielded = true;
                return new VisitedNode(top.depth, top.cursor.getNodeId());
            }
            OptionalInt child = enumerator.next(top.cursor);
            if (child.isPresent()) {
                stack.push(new Frame(top.depth + 1, new EnumerationCursor(child.getAsInt())));
            } else {
                // Exhausted: backtrack to the parent.
                stack.pop();
            }
        }
        return null;
    }
}
