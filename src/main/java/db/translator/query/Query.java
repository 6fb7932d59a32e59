package db.translator.query;

import java.util.List;

/**
 * Parsed SELECT statement.
 * columns: projection in SELECT order; empty list means SELECT *.
 * predicate: null means no WHERE (match all).
 * limit / offset: null when absent; LIMIT 0 is kept as 0.
 */
public record Query(List<String> columns, String table, Predicate predicate, Integer limit, Integer offset) {

    public Query {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        if (table == null || table.isEmpty()) throw new IllegalArgumentException("table must not be empty");
        if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be non-negative");
        if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be non-negative");
        columns = List.copyOf(columns);
    }

    public boolean selectsAll() { return columns.isEmpty(); }
}
