package db.translator.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import db.translator.document.DocumentQueryTranslator;
import db.translator.exec.BackendOutcome;
import db.translator.exec.ComparisonReport;

public class ReportWriterTest {

    @TempDir
    Path tmp;

    @Test
    void writesTimestampedJsonReport() throws IOException {
        String sql = "SELECT * FROM users WHERE age < 30";
        QueryStats stats = new QueryStats(sql);
        List<Map<String, Object>> rows = List.of(Map.of("age", 20L), Map.of("age", 25L));
        stats.record(new ComparisonReport(sql, new DocumentQueryTranslator().translate(sql),
            BackendOutcome.ok("rel", rows, 2_000_000L), BackendOutcome.ok("doc", rows, 1_000_000L), 2_500_000L));
        stats.record(new ComparisonReport(sql, null,
            BackendOutcome.ok("rel", rows, 4_000_000L), BackendOutcome.timedOut("doc", 5_000_000L), 5_000_000L));

        Map<String, QueryStats> all = new LinkedHashMap<>();
        all.put("young", stats);
        Path out = tmp.resolve("reports");
        BenchmarkConfig cfg = BenchmarkConfig.defaultConfig(out);
        Path file = new ReportWriter(out).writeJson(all, cfg);

        assertTrue(file.getFileName().toString().matches("speedtest_\\d{8}_\\d{6}\\.json"));
        JsonObject root = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
        assertEquals(10_000, root.getAsJsonObject("config").get("rows").getAsInt());

        JsonObject young = root.getAsJsonObject("queries").getAsJsonObject("young");
        assertEquals(sql, young.get("sql").getAsString());
        assertTrue(young.get("document_query").getAsString().contains("\"$lt\":30"));
        JsonObject rel = young.getAsJsonObject("relational");
        assertEquals(2, rel.get("count").getAsInt());
        assertEquals(3.0, rel.get("mean_ms").getAsDouble(), 1e-9);
        assertEquals(2, rel.get("rows").getAsInt());
        JsonObject doc = young.getAsJsonObject("document");
        assertEquals(1, doc.get("count").getAsInt());
        assertEquals(1, doc.getAsJsonObject("problems").get("TIMED_OUT").getAsInt());
        assertTrue(young.get("row_counts_match").getAsBoolean());
    }
}
