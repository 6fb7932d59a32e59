package db.translator;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;
import java.util.Map;
import java.util.Scanner;

import db.translator.bench.BenchmarkConfig;
import db.translator.bench.SampleData;
import db.translator.cli.TablePrinter;
import db.translator.document.DocumentQuery;
import db.translator.document.DocumentQueryTranslator;
import db.translator.document.InMemoryDocumentStore;
import db.translator.exec.ComparisonReport;
import db.translator.exec.ComparisonRunner;
import db.translator.exec.JdbcRelationalExecutor;
import db.translator.query.SqlSyntaxException;
import db.translator.query.UnsupportedFeatureException;

public class Main {
    private static final int PREVIEW_ROWS = 10;

    public static void main(String[] args) throws Exception {
        BenchmarkConfig cfg = BenchmarkConfig.fromArgs(Paths.get("benchdata"), args);
        DocumentQueryTranslator translator = new DocumentQueryTranslator();

        try (Connection conn = DriverManager.getConnection(cfg.jdbcUrl)) {
            List<Map<String, Object>> users = SampleData.generateUsers(cfg.rows, cfg.seed);
            InMemoryDocumentStore store = new InMemoryDocumentStore();
            SampleData.loadRelational(conn, users, SampleData.DEFAULT_BATCH_SIZE);
            SampleData.loadDocuments(store, users);
            System.out.println("Loaded " + users.size() + " users into both stores\n");

            try (ComparisonRunner runner = new ComparisonRunner(new JdbcRelationalExecutor(conn, "jdbc"), store,
                    translator, cfg.timeoutMillis);
                 Scanner scanner = new Scanner(System.in)) {
                while (true) {
                    System.out.print("sql> ");
                    if (!scanner.hasNextLine()) break;
                    String line = scanner.nextLine().trim();
                    if (line.equalsIgnoreCase("exit")) {
                        System.out.println("Bye");
                        break;
                    }
                    if (line.isEmpty()) continue;
                    showTranslation(translator, line);
                    ComparisonReport report = runner.compare(line);
                    TablePrinter.printReport(report, System.out);
                    if (report.document().isOk()) {
                        List<Map<String, Object>> docs = report.document().rows();
                        TablePrinter.printDocuments(docs.subList(0, Math.min(PREVIEW_ROWS, docs.size())), System.out);
                    }
                }
            }
        }
    }

    private static void showTranslation(DocumentQueryTranslator translator, String sql) {
        try {
            DocumentQuery dq = translator.translate(sql);
            System.out.println(dq.toJson());
        } catch (UnsupportedFeatureException e) {
            System.out.println("UnsupportedFeature: " + e.feature() + (e.offset() >= 0 ? " at offset " + e.offset() : ""));
        } catch (SqlSyntaxException e) {
            System.out.println("SyntaxError at offset " + e.offset() + ": " + e.getMessage());
        }
    }
}

/* -------------------------------------------------------------------------
 * Example queries against users(id, name, age):
 *
 * 1. SELECT * FROM users LIMIT 5
 * 2. SELECT name, age FROM users WHERE age > 30 AND age < 40
 * 3. SELECT * FROM users WHERE age = 42 AND (name = 'abcdefg' OR age IS NOT NULL)
 * 4. SELECT name FROM users WHERE NOT age >= 20 LIMIT 10 OFFSET 5
 *
 * Rejected:
 *    SELECT * FROM users WHERE name LIKE 'ab%'       (UnsupportedFeature: LIKE)
 *    SELECT * FROM users ORDER BY age                (UnsupportedFeature: ORDER BY)
 *    SELECT * FROM users WHERE age =                 (SyntaxError)
 * ------------------------------------------------------------------------- */
