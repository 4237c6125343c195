package com.traverse.poc;

import io.trino.sql.parser.ParsingException;

import java.util.Objects;

/**
 * Thrown when SQL text cannot be parsed. Wraps the Trino {@link ParsingException}
 * and keeps its diagnostic: message and position in the input.
 * Parsing never recovers, so the whole input is rejected.
 */
public class QueryParseException extends RuntimeException {
    private final String sql;
    private final String errorMessage;
    private final int lineNumber;
    private final int columnNumber;

    public QueryParseException(String sql, ParsingException cause) {
        super("SQL Statement Parsing Error: " + Objects.requireNonNull(cause, "cause is null").getMessage(), cause);
        this.sql = sql;
        this.errorMessage = cause.getErrorMessage();
        this.lineNumber = cause.getLineNumber();
        this.columnNumber = cause.getColumnNumber();
    }

    /**
     * @return The statement text that failed to parse.
     */
    public String getSql() {
        return sql;
    }

    /**
     * @return The parser's message without position information.
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }
}
