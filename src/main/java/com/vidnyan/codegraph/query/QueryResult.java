package com.vidnyan.codegraph.query;

import java.util.List;

/**
 * @param columns RETURN item aliases, in order
 */
public record QueryResult(List<String> columns, List<QueryRow> rows, long durationMs) {

    public QueryResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
