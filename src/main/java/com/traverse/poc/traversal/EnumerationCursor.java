package com.traverse.poc.traversal;

/**
 * Per-branch enumeration state: the node being expanded and how many of its
 * children have been produced so far.
 * <p>
 * A cursor belongs to exactly one traversal frame and is dropped when the
 * traversal backtracks out of its node. Never share one between frames.
 */
public class EnumerationCursor {
    private final int nodeId;
    private int step;
    private boolean exhausted;

    public EnumerationCursor(int nodeId) {
        if (nodeId < 0) {
            throw new IllegalArgumentException("nodeId must be non-negative, got " + nodeId);
        }
        this.nodeId = nodeId;
    }

    public int getNodeId() {
        return nodeId;
    }

    /**
     * @return Number of children produced for this node so far.
     */
    public int getStep() {
        return step;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    void advance() {
        step++;
    }

    // Once set, the enumerator never produces another child for this cursor.
    void markExhausted() {
        exhausted = true;
    }

    @Override
    public String toString() {
        return "EnumerationCursor{nodeId=" + nodeId + ", step=" + step + (exhausted ? ", exhausted" : "") + "}";
    }
}
