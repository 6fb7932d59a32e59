package db.translator.exec;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Runs the original, untranslated SQL against a relational store.
 */
public interface RelationalExecutor {

    List<Map<String, Object>> execute(String sql) throws SQLException;

    /**
     * Aborts the statement currently executing, if any. Called when a caller gives up waiting;
     * the aborted {@link #execute} call then fails with its own exception.
     */
    default void cancel() throws SQLException {}

    default String name() { return "relational"; }
}
