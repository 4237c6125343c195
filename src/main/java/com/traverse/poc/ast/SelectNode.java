package com.traverse.poc.ast;

import io.trino.sql.tree.QuerySpecification;

/**
 * A single SELECT block (projection, FROM, WHERE, GROUP BY, ...).
 */
public final class SelectNode extends Node<QuerySpecification> {

    public SelectNode(QuerySpecification select) {
        super(select);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.SELECT;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSelect(this, context);
    }
}
