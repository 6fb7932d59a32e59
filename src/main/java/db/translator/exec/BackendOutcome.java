package db.translator.exec;

import java.util.List;
import java.util.Map;

/**
 * Result of one backend within a comparison. rows is empty unless status is OK;
 * error is null when status is OK.
 */
public record BackendOutcome(String backend, Status status, List<Map<String, Object>> rows,
                             long elapsedNanos, String error) {

    public enum Status {
        OK,
        FAILED,
        TIMED_OUT,
        /** Query could not be translated, so the backend was never called. */
        REJECTED
    }

    public BackendOutcome {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static BackendOutcome ok(String backend, List<Map<String, Object>> rows, long elapsedNanos) {
        return new BackendOutcome(backend, Status.OK, rows, elapsedNanos, null);
    }

    public static BackendOutcome failed(String backend, long elapsedNanos, String error) {
        return new BackendOutcome(backend, Status.FAILED, null, elapsedNanos, error);
    }

    public static BackendOutcome timedOut(String backend, long elapsedNanos) {
        return new BackendOutcome(backend, Status.TIMED_OUT, null, elapsedNanos,
            "no result within " + (elapsedNanos / 1_000_000) + " ms");
    }

    public static BackendOutcome rejected(String backend, String error) {
        return new BackendOutcome(backend, Status.REJECTED, null, 0L, error);
    }

    public boolean isOk() { return status == Status.OK; }

    public int rowCount() { return rows.size(); }

    public double elapsedMillis() { return elapsedNanos / 1_000_000.0; }
}
