package db.translator.bench;

import java.util.EnumMap;
import java.util.Map;

import db.translator.exec.BackendOutcome;
import db.translator.exec.ComparisonReport;

/**
 * Per-query accumulation across benchmark runs: timings per backend, last row counts and
 * non-OK outcomes by status.
 */
public class QueryStats {
    final String sql;
    final StatsAggregator relational = new StatsAggregator();
    final StatsAggregator document = new StatsAggregator();
    final StatsAggregator total = new StatsAggregator();
    final Map<BackendOutcome.Status, Integer> relationalProblems = new EnumMap<>(BackendOutcome.Status.class);
    final Map<BackendOutcome.Status, Integer> documentProblems = new EnumMap<>(BackendOutcome.Status.class);
    int relationalRows = -1;
    int documentRows = -1;
    String documentFilter;

    public QueryStats(String sql) {
        this.sql = sql;
    }

    public void record(ComparisonReport report) {
        total.add(report.totalNanos());
        track(report.relational(), relational, relationalProblems, true);
        track(report.document(), document, documentProblems, false);
        if (report.documentQuery() != null) documentFilter = report.documentQuery().toJson();
    }

    private void track(BackendOutcome o, StatsAggregator agg, Map<BackendOutcome.Status, Integer> problems, boolean rel) {
        if (!o.isOk()) {
            problems.merge(o.status(), 1, Integer::sum);
            return;
        }
        agg.add(o.elapsedNanos());
        if (rel) relationalRows = o.rowCount(); else documentRows = o.rowCount();
    }

    public StatsAggregator relational() { return relational; }
    public StatsAggregator document() { return document; }
    public StatsAggregator total() { return total; }
}
