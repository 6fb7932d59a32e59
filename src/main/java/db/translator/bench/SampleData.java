package db.translator.bench;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.translator.document.InMemoryDocumentStore;

/**
 * Generates the users data set and loads identical copies into both stores.
 * Each user is {id, name: 7 random lowercase letters, age: 18..90}.
 */
public final class SampleData {
    private static final Logger log = LoggerFactory.getLogger(SampleData.class);

    public static final String USERS = "users";
    public static final int DEFAULT_BATCH_SIZE = 5_000;

    private SampleData() {}

    public static List<Map<String, Object>> generateUsers(int count, long seed) {
        Random rnd = new Random(seed);
        List<Map<String, Object>> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("id", (long) i);
            doc.put("name", randomName(rnd, 7));
            doc.put("age", (long) (18 + rnd.nextInt(73)));
            out.add(doc);
        }
        return out;
    }

    /**
     * Drops and recreates the users table, then inserts in batches.
     */
    public static void loadRelational(Connection conn, List<Map<String, Object>> users, int batchSize) throws SQLException {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        try (Statement st = conn.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + USERS);
            st.execute("CREATE TABLE " + USERS + " (id BIGINT PRIMARY KEY, name VARCHAR(100), age BIGINT)");
        }
        int batches = (users.size() + batchSize - 1) / batchSize;
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO " + USERS + " (id, name, age) VALUES (?, ?, ?)")) {
            for (int b = 0; b < batches; b++) {
                int end = Math.min(users.size(), (b + 1) * batchSize);
                for (Map<String, Object> u : users.subList(b * batchSize, end)) {
                    ps.setLong(1, (Long) u.get("id"));
                    ps.setString(2, (String) u.get("name"));
                    ps.setLong(3, (Long) u.get("age"));
                    ps.addBatch();
                }
                ps.executeBatch();
                log.info("Inserted relational batch {}/{}", b + 1, batches);
            }
        }
    }

    public static void loadDocuments(InMemoryDocumentStore store, List<Map<String, Object>> users) {
        store.drop(USERS);
        store.insertMany(USERS, users);
        log.info("Inserted {} documents into '{}'", users.size(), USERS);
    }

    private static String randomName(Random rnd, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) sb.append((char) ('a' + rnd.nextInt(26)));
        return sb.toString();
    }
}
