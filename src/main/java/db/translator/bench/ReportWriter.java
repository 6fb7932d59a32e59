package db.translator.bench;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes one timestamped JSON report per benchmark run (timings in milliseconds).
 */
public class ReportWriter {
    private final Path outDir;

    public ReportWriter(Path outDir) {
        this.outDir = outDir;
    }

    public Path writeJson(Map<String, QueryStats> statsPerQuery, BenchmarkConfig cfg) throws IOException {
        if (!Files.exists(outDir)) Files.createDirectories(outDir);
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path json = outDir.resolve("speedtest_" + ts + ".json");

        Map<String, Object> root = new LinkedHashMap<>();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("rows", cfg.rows);
        config.put("runs", cfg.runs);
        config.put("warmup", cfg.warmup);
        config.put("seed", cfg.seed);
        config.put("jdbc_url", cfg.jdbcUrl);
        config.put("timeout_ms", cfg.timeoutMillis);
        root.put("config", config);

        Map<String, Object> queries = new LinkedHashMap<>();
        for (Map.Entry<String, QueryStats> e : statsPerQuery.entrySet()) {
            QueryStats s = e.getValue();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("sql", s.sql);
            entry.put("document_query", s.documentFilter);
            entry.put("relational", timings(s.relational, s.relationalRows, s.relationalProblems));
            entry.put("document", timings(s.document, s.documentRows, s.documentProblems));
            entry.put("total_parallel", timings(s.total, -1, Map.of()));
            entry.put("row_counts_match", s.relationalRows >= 0 && s.relationalRows == s.documentRows);
            queries.put(e.getKey(), entry);
        }
        root.put("queries", queries);

        // Readable SQL and operator keys in the output
        Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
        Files.writeString(json, gson.toJson(root));
        return json;
    }

    private static Map<String, Object> timings(StatsAggregator s, int rows, Map<?, Integer> problems) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("count", s.count());
        m.put("mean_ms", round(s.mean() / 1_000_000.0, 100.0));
        m.put("median_ms", round(s.median() / 1_000_000.0, 1000.0));
        m.put("p95_ms", round(s.percentile(95) / 1_000_000.0, 1000.0));
        m.put("min_ms", round(s.min() / 1_000_000.0, 1000.0));
        m.put("max_ms", round(s.max() / 1_000_000.0, 1000.0));
        m.put("stddev_ms", round(s.stddev() / 1_000_000.0, 100.0));
        if (rows >= 0) m.put("rows", rows);
        if (!problems.isEmpty()) m.put("problems", problems);
        return m;
    }

    private static double round(double v, double scale) {
        return Math.round(v * scale) / scale;
    }
}
