package db.translator.bench;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import db.translator.exec.ComparisonRunner;

/**
 * Settings shared by the speed test and the interactive prompt, overridable with
 * --rows= --runs= --warmup= --seed= --jdbc-url= --timeout-ms= --query= flags.
 * Each --query= replaces the built-in query set on first use and is named custom1, custom2, ...
 */
public class BenchmarkConfig {
    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";

    public final int rows;
    public final int runs;
    public final int warmup;
    public final long seed;
    public final String jdbcUrl;
    public final long timeoutMillis;
    public final Path benchRoot;
    public final Map<String, String> queries; // name -> SQL, run in insertion order

    public BenchmarkConfig(int rows,
                           int runs,
                           int warmup,
                           long seed,
                           String jdbcUrl,
                           long timeoutMillis,
                           Path benchRoot,
                           Map<String, String> queries) {
        this.rows = rows;
        this.runs = runs;
        this.warmup = warmup;
        this.seed = seed;
        this.jdbcUrl = jdbcUrl;
        this.timeoutMillis = timeoutMillis;
        this.benchRoot = benchRoot;
        this.queries = Collections.unmodifiableMap(new LinkedHashMap<>(queries));
    }

    public static Map<String, String> defaultQueries() {
        Map<String, String> q = new LinkedHashMap<>();
        q.put("scan", "SELECT * FROM users");
        q.put("equality", "SELECT * FROM users WHERE age = 42");
        q.put("range", "SELECT name, age FROM users WHERE age > 30 AND age < 40");
        q.put("disjunction", "SELECT name FROM users WHERE age < 20 OR age >= 85");
        q.put("nested", "SELECT * FROM users WHERE age >= 50 AND (name = 'abcdefg' OR age < 55)");
        q.put("limit", "SELECT * FROM users WHERE age != 18 LIMIT 100");
        return q;
    }

    public static BenchmarkConfig defaultConfig(Path benchRoot) {
        return new BenchmarkConfig(10_000, 20, 3, 42L, DEFAULT_JDBC_URL,
            ComparisonRunner.DEFAULT_TIMEOUT_MILLIS, benchRoot, defaultQueries());
    }

    public static BenchmarkConfig fromArgs(Path benchRoot, String[] args) {
        int rows = 10_000;
        int runs = 20;
        int warmup = 3;
        long seed = 42L;
        String jdbcUrl = DEFAULT_JDBC_URL;
        long timeoutMillis = ComparisonRunner.DEFAULT_TIMEOUT_MILLIS;
        Map<String, String> custom = new LinkedHashMap<>();

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--rows=")) {
                rows = (int) parseNonNegative("--rows", s.substring("--rows=".length()));
            } else if (s.startsWith("--runs=")) {
                runs = (int) parseNonNegative("--runs", s.substring("--runs=".length()));
            } else if (s.startsWith("--warmup=")) {
                warmup = (int) parseNonNegative("--warmup", s.substring("--warmup=".length()));
            } else if (s.startsWith("--seed=")) {
                seed = parseLong("--seed", s.substring("--seed=".length()));
            } else if (s.startsWith("--jdbc-url=")) {
                jdbcUrl = s.substring("--jdbc-url=".length());
            } else if (s.startsWith("--timeout-ms=")) {
                timeoutMillis = parseNonNegative("--timeout-ms", s.substring("--timeout-ms=".length()));
                if (timeoutMillis == 0) throw new IllegalArgumentException("--timeout-ms must be positive");
            } else if (s.startsWith("--query=")) {
                custom.put("custom" + (custom.size() + 1), s.substring("--query=".length()));
            }
        }
        return new BenchmarkConfig(rows, runs, warmup, seed, jdbcUrl, timeoutMillis, benchRoot,
            custom.isEmpty() ? defaultQueries() : custom);
    }

    private static long parseNonNegative(String flag, String raw) {
        long v = parseLong(flag, raw);
        if (v < 0 || v > Integer.MAX_VALUE) throw new IllegalArgumentException(flag + " out of range: " + raw);
        return v;
    }

    private static long parseLong(String flag, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + flag + ": " + raw, e);
        }
    }
}
