package com.traverse.poc.ast;

import io.trino.sql.tree.SelectItem;

/**
 * One projected item of a SELECT list: a single column expression or {@code *}.
 */
public final class SelectItemNode extends Node<SelectItem> {

    public SelectItemNode(SelectItem item) {
        super(item);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.SELECT_ITEM;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSelectItem(this, context);
    }
}
