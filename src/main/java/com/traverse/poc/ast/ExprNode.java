package com.traverse.poc.ast;

import io.trino.sql.tree.Expression;

/**
 * A scalar expression.
 */
public final class ExprNode extends Node<Expression> {

    public ExprNode(Expression expression) {
        super(expression);
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.EXPR;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitExpr(this, context);
    }
}
