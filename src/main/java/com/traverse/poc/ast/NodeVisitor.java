package com.traverse.poc.ast;

/**
 * Visitor over the closed set of {@link Node} kinds.
 * No default methods: every implementation handles every kind.
 *
 * @param <R> Return type of the visit methods.
 * @param <C> Type of the context object passed during traversal.
 */
public interface NodeVisitor<R, C> {

    R visitStatement(StatementNode node, C context);

    R visitSetExpr(SetExprNode node, C context);

    R visitSelect(SelectNode node, C context);

    R visitSelectItem(SelectItemNode node, C context);

    R visitTableWithJoins(TableWithJoinsNode node, C context);

    R visitExpr(ExprNode node, C context);

    R visitBinaryOperator(BinaryOperatorNode node, C context);
}
