package com.nyct.transitgraph;

/**
 * Thrown when a timetable feed lacks a required table or column. Raised before any graph is assembled.
 */
public class FeedSchemaException extends RuntimeException {
    public FeedSchemaException(String message) {
        super(message);
    }

    static FeedSchemaException missingColumn(String table, String column, int row) {
        return new FeedSchemaException(String.format("%s: required column '%s' missing in row %d", table, column, row));
    }
}
