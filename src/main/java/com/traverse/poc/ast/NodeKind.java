package com.traverse.poc.ast;

/**
 * The closed set of AST node kinds the traversal understands.
 */
public enum NodeKind {
    STATEMENT,
    SET_EXPR,
    SELECT,
    SELECT_ITEM,
    TABLE_WITH_JOINS,
    EXPR,
    BINARY_OPERATOR
}
