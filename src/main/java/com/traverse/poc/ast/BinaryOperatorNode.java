package com.traverse.poc.ast;

import io.trino.sql.tree.ArithmeticBinaryExpression;
import io.trino.sql.tree.ComparisonExpression;
import io.trino.sql.tree.LogicalExpression;

/**
 * The operator token of a binary expression.
 * Trino keeps a separate operator enum per expression type, so the wrapped value is
 * one of {@link ArithmeticBinaryExpression.Operator}, {@link ComparisonExpression.Operator}
 * or {@link LogicalExpression.Operator}.
 */
public final class BinaryOperatorNode extends Node<Enum<?>> {

    private BinaryOperatorNode(Enum<?> operator) {
        super(operator);
    }

    public static BinaryOperatorNode of(ArithmeticBinaryExpression.Operator operator) {
        return new BinaryOperatorNode(operator);
    }

    public static BinaryOperatorNode of(ComparisonExpression.Operator operator) {
        return new BinaryOperatorNode(operator);
    }

    public static BinaryOperatorNode of(LogicalExpression.Operator operator) {
        return new BinaryOperatorNode(operator);
    }

    /**
     * @return The SQL token for the operator, e.g. {@code +}, {@code >=} or {@code AND}.
     */
    public String getSymbol() {
        Enum<?> operator = getValue();
        if (operator instanceof ArithmeticBinaryExpression.Operator) {
            return ((ArithmeticBinaryExpression.Operator) operator).getValue();
        }
        if (operator instanceof ComparisonExpression.Operator) {
            return ((ComparisonExpression.Operator) operator).getValue();
        }
        return operator.name();
    }

    @Override
    public NodeKind getNodeKind() {
        return NodeKind.BINARY_OPERATOR;
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryOperator(this, context);
    }

    @Override
    public String toString() {
        return getNodeKind() + "(" + getSymbol() + ")";
    }
}
