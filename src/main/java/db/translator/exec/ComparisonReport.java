package db.translator.exec;

import java.util.LinkedHashMap;
import java.util.Map;

import db.translator.document.DocumentQuery;

/**
 * Outcome of running one SQL query on both backends.
 * documentQuery is null when translation failed.
 */
public record ComparisonReport(String sql, DocumentQuery documentQuery, BackendOutcome relational,
                               BackendOutcome document, long totalNanos) {

    public boolean bothSucceeded() {
        return relational.isOk() && document.isOk();
    }

    public boolean rowCountsMatch() {
        return bothSucceeded() && relational.rowCount() == document.rowCount();
    }

    /** Flat summary, one block per backend. */
    public Map<String, Object> summary() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("total_parallel_ms", totalNanos / 1_000_000.0);
        out.put("relational", describe(relational));
        out.put("document", describe(document));
        out.put("row_counts_match", rowCountsMatch());
        return out;
    }

    private static Map<String, Object> describe(BackendOutcome o) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("backend", o.backend());
        m.put("status", o.status().name());
        m.put("time_ms", o.elapsedMillis());
        m.put("count", o.rowCount());
        if (o.error() != null) m.put("error", o.error());
        return m;
    }
}
