package com.traverse.poc;

import com.traverse.poc.ast.NodeArena;
import com.traverse.poc.ast.StatementNode;
import io.trino.sql.parser.ParsingException;
import io.trino.sql.parser.SqlParser;
import io.trino.sql.tree.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns SQL text into statements and seeds a traversal for each of them.
 * Input may hold several statements separated by {@code ;}; a trailing statement
 * without terminator counts as well.
 */
public class SqlStatementParser {

    private final SqlParser sqlParser;

    public SqlStatementParser() {
        this(new SqlParser());
    }

    public SqlStatementParser(SqlParser sqlParser) {
        this.sqlParser = Objects.requireNonNull(sqlParser, "sqlParser is null");
    }

    /**
     * Parses every statement in the input.
     * @param sql The SQL text.
     * @return The parsed statements in source order, empty for blank input.
     * @throws QueryParseException if any statement is invalid. Nothing is returned for the others.
     */
    public List<Statement> parse(String sql) {
        Objects.requireNonNull(sql, "SQL text cannot be null");
        List<String> texts = split(sql);
        List<Statement> statements = new ArrayList<>(texts.size());
        for (String text : texts) {
            statements.add(parseStatement(text));
        }
        return statements;
    }

    /**
     * Parses the input and prepares one traversal per statement.
     * Each traversal gets a fresh arena whose root, the statement node, has id 0.
     * @param sql The SQL text.
     * @return One traversal per statement, in source order.
     * @throws QueryParseException if any statement is invalid.
     */
    public List<StatementTraversal> traverse(String sql) {
        List<StatementTraversal> traversals = new ArrayList<>();
        for (Statement statement : parse(sql)) {
            NodeArena arena = new NodeArena();
            int rootId = arena.allocate(new StatementNode(statement));
            traversals.add(new StatementTraversal(statement, arena, rootId));
        }
        return traversals;
    }

    private Statement parseStatement(String text) {
        try {
            return sqlParser.createStatement(text);
        } catch (ParsingException e) {
            throw new QueryParseException(text, e);
        }
    }

    /**
     * Splits SQL text on {@code ;} terminators. Semicolons inside string literals,
     * quoted identifiers and comments do not terminate a statement. Pieces holding only
     * whitespace and comments are dropped. An unterminated literal or comment runs to the
     * end of the input and is left to the parser to reject.
     */
    static List<String> split(String sql) {
        List<String> texts = new ArrayList<>();
        int start = 0;
        boolean hasContent = false;
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(sql, i, c);
                hasContent = true;
            } else if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? length : end + 1;
            } else if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
            } else if (c == ';') {
                if (hasContent) {
                    texts.add(sql.substring(start, i).strip());
                }
                i++;
                start = i;
                hasContent = false;
            } else {
                if (!Character.isWhitespace(c)) {
                    hasContent = true;
                }
                i++;
            }
        }
        if (hasContent) {
            texts.add(sql.substring(start).strip());
        }
        return texts;
    }

    // Returns the index just past the closing quote; a doubled quote is an escaped quote.
    private static int skipQuoted(String sql, int open, char quote) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
