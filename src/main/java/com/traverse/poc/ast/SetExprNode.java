package com.traverse.poc.ast;

import io.trino.sql.tree.QueryBody;
import io.trino.sql.tree.QuerySpecification;
import io.trino.sql.tree.SetOperation;

/**
 * The body of a query: a single SELECT block, a set operation (UNION, INTERSECT, EXCEPT),
 * VALUES, a bare TABLE reference or a parenthesized nested query.
 */
public final class SetExprNode extends Node<QueryBody> {

    public SetExprNode(QueryBody body) {
        super(body);
    }

    /**
     * @return True if this body is a plain SELECT block.
     */
    public boolean isSelect() {
        return getValue() instanceof QuerySpecification;
    }

    /**
     * @return True if this body is a UNION, INTERSECT or EXCEPT.
     */
    public boolean isSetOperation() {
        return getValue() instanceof SetOperation;
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.SET_EXPR;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitSetExpr(this, context);
    }
}
