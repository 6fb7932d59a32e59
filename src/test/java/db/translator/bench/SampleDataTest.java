package db.translator.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import db.translator.document.InMemoryDocumentStore;

public class SampleDataTest {

    @Test
    void generatedUsersFollowTheShape() {
        List<Map<String, Object>> users = SampleData.generateUsers(1_000, 1L);
        assertEquals(1_000, users.size());
        for (int i = 0; i < users.size(); i++) {
            Map<String, Object> u = users.get(i);
            assertEquals((long) (i + 1), u.get("id"));
            assertTrue(((String) u.get("name")).matches("[a-z]{7}"));
            long age = (Long) u.get("age");
            assertTrue(age >= 18 && age <= 90, "age " + age);
        }
    }

    @Test
    void sameSeedSameData() {
        assertEquals(SampleData.generateUsers(50, 9L), SampleData.generateUsers(50, 9L));
        assertNotEquals(SampleData.generateUsers(50, 9L), SampleData.generateUsers(50, 10L));
    }

    @Test
    void bothStoresReceiveTheSameRows() throws SQLException {
        List<Map<String, Object>> users = SampleData.generateUsers(1_234, 3L);
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        SampleData.loadDocuments(store, users);
        SampleData.loadDocuments(store, users);
        assertEquals(1_234, store.count(SampleData.USERS));

        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:")) {
            SampleData.loadRelational(conn, users, 500);
            SampleData.loadRelational(conn, users, 500);
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery("SELECT COUNT(*), MIN(age), MAX(age) FROM users")) {
                assertTrue(rs.next());
                assertEquals(1_234, rs.getLong(1));
                assertTrue(rs.getLong(2) >= 18);
                assertTrue(rs.getLong(3) <= 90);
            }
        }
    }

    @Test
    void batchSizeMustBePositive() throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:")) {
            assertThrows(IllegalArgumentException.class,
                () -> SampleData.loadRelational(conn, List.of(), 0));
        }
    }
}
