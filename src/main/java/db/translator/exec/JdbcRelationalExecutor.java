package db.translator.exec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes SQL over a single JDBC connection. Calls are serialized on the connection; the
 * connection's lifecycle belongs to the caller.
 */
public class JdbcRelationalExecutor implements RelationalExecutor {
    private final Connection connection;
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    // Only set while the lock is held
    private volatile Statement inFlight;

    public JdbcRelationalExecutor(Connection connection) {
        this(connection, "relational");
    }

    public JdbcRelationalExecutor(Connection connection, String name) {
        if (connection == null) throw new IllegalArgumentException("connection must not be null");
        this.connection = connection;
        this.name = name;
    }

    /**
     * Rows come back as column label -> value maps in column order. Statements that produce no
     * result set return an empty list. A caller interrupted while queued behind another statement
     * gets an SQLException and never touches the connection.
     */
    @Override
    public List<Map<String, Object>> execute(String sql) throws SQLException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for the connection", e);
        }
        try (Statement st = connection.createStatement()) {
            inFlight = st;
            if (!st.execute(sql)) return List.of();
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ResultSet rs = st.getResultSet()) {
                ResultSetMetaData md = rs.getMetaData();
                int cols = md.getColumnCount();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= cols; i++) row.put(md.getColumnLabel(i), rs.getObject(i));
                    rows.add(row);
                }
            }
            return rows;
        } finally {
            inFlight = null;
            lock.unlock();
        }
    }

    @Override
    public void cancel() throws SQLException {
        Statement st = inFlight;
        if (st != null) st.cancel();
    }

    @Override
    public String name() { return name; }
}
