package com.traverse.poc.ast;

import io.trino.sql.tree.Statement;

/**
 * A whole parsed SQL statement. The root of every traversal.
 */
public final class StatementNode extends Node<Statement> {

    public StatementNode(Statement statement) {
        super(statement);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.STATEMENT;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitStatement(this, context);
    }
}
