package com.traverse.poc.ast;

import io.trino.sql.tree.Relation;

/**
 * One entry of a FROM list together with the explicit joins attached to it.
 * For {@code FROM a JOIN b ON ..., c} the entries are {@code a JOIN b ON ...} and {@code c}.
 */
public final class TableWithJoinsNode extends Node<Relation> {

    public TableWithJoinsNode(Relation relation) {
        super(relation);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.TABLE_WITH_JOINS;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitTableWithJoins(this, context);
    }
}
