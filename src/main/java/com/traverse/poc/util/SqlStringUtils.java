package com.traverse.poc.util;

import io.trino.sql.SqlFormatter;
import io.trino.sql.tree.Node;

/**
 * Utility methods for rendering Trino AST values as short, single-line SQL strings.
 */
public final class SqlStringUtils {

    private SqlStringUtils() {}

    /**
     * Formats a Trino AST Node back into a canonical SQL string representation.
     * @param node The AST Node (Statement, Relation, Expression, etc.).
     * @return Formatted SQL String. Returns node.toString() as fallback on error.
     */
    public static String formatSql(Node node) {
        if (node == null) {
            return "NULL";
        }
        try {
            return SqlFormatter.formatSql(node);
        } catch (RuntimeException e) {
            // SqlFormatter only covers part of the tree (statements, relations, expressions)
            System.err.println("WARN: Failed to format " + node.getClass().getSimpleName()
                    + " using SqlFormatter (" + e.getMessage() + "). Returning node.toString()");
            return node.toString();
        }
    }

    /**
     * Collapses all whitespace runs to single spaces and cuts the result to a maximum width.
     * @param text The text to shorten.
     * @param maxWidth Maximum length of the result, at least 4.
     * @return The single-line text, ending in "..." if it was cut.
     */
    public static String abbreviate(String text, int maxWidth) {
        if (maxWidth < 4) {
            throw new IllegalArgumentException("maxWidth must be at least 4, got " + maxWidth);
        }
        String singleLine = text.strip().replaceAll("\\s+", " ");
        if (singleLine.length() <= maxWidth) {
            return singleLine;
        }
        return singleLine.substring(0, maxWidth - 3) + "...";
    }
}
