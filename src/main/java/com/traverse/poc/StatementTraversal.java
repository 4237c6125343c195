package com.traverse.poc;

import com.traverse.poc.ast.NodeArena;
import com.traverse.poc.traversal.PreOrderTraversal;
import io.trino.sql.tree.Statement;

import java.util.Objects;

/**
 * A parsed statement ready to be walked: the arena seeded with its root node
 * and the traversal over it. Every instance owns its arena.
 */
public class StatementTraversal {
    private final Statement statement;
    private final NodeArena arena;
    private final int rootId;
    private final PreOrderTraversal traversal;

    public StatementTraversal(Statement statement, NodeArena arena, int rootId) {
        this.statement = Objects.requireNonNull(statement, "statement is null");
        this.arena = Objects.requireNonNull(arena, "arena is null");
        this.rootId = rootId;
        this.traversal = new PreOrderTraversal(arena, rootId);
    }

    public Statement getStatement() {
        return statement;
    }

    public NodeArena getArena() {
        return arena;
    }

    public int getRootId() {
        return rootId;
    }

    /**
     * @return The single-pass traversal over this statement.
     */
    public PreOrderTraversal getTraversal() {
        return traversal;
    }
}
