package db.translator.exec;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.translator.document.DocumentExecutor;
import db.translator.document.DocumentQuery;
import db.translator.document.DocumentQueryTranslator;
import db.translator.query.QueryTranslationException;

/**
 * Runs a SQL query natively on the relational backend and, translated, on the document backend.
 * Both run concurrently and are awaited with a shared deadline. A failure, rejection or timeout
 * on one side is reported in that side's outcome and never affects the other.
 */
public class ComparisonRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ComparisonRunner.class);

    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000;

    @FunctionalInterface
    private interface BackendCall {
        List<Map<String, Object>> run() throws Exception;
    }

    private final RelationalExecutor relational;
    private final DocumentExecutor document;
    private final DocumentQueryTranslator translator;
    private final long timeoutMillis;
    private final ExecutorService pool;

    public ComparisonRunner(RelationalExecutor relational, DocumentExecutor document) {
        this(relational, document, new DocumentQueryTranslator(), DEFAULT_TIMEOUT_MILLIS);
    }

    public ComparisonRunner(RelationalExecutor relational, DocumentExecutor document,
                            DocumentQueryTranslator translator, long timeoutMillis) {
        if (relational == null || document == null) throw new IllegalArgumentException("both executors are required");
        if (translator == null) throw new IllegalArgumentException("translator must not be null");
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be positive");
        this.relational = relational;
        this.document = document;
        this.translator = translator;
        this.timeoutMillis = timeoutMillis;
        this.pool = Executors.newCachedThreadPool(new BackendThreadFactory());
    }

    public ComparisonReport compare(String sql) {
        if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
        long start = System.nanoTime();

        DocumentQuery documentQuery = null;
        String rejection = null;
        try {
            documentQuery = translator.translate(sql);
        } catch (QueryTranslationException e) {
            rejection = e.getMessage();
            log.debug("Query not translatable, running relational side only: {}", rejection);
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        Future<BackendOutcome> relFuture = pool.submit(() -> timed(relational.name(), () -> relational.execute(sql)));
        Future<BackendOutcome> docFuture = null;
        if (documentQuery != null) {
            DocumentQuery dq = documentQuery;
            docFuture = pool.submit(() -> timed(document.name(), () -> document.find(dq)));
        }
        log.debug("Dispatched '{}' to {} backend(s)", sql, docFuture == null ? 1 : 2);

        BackendOutcome relOutcome = await(relFuture, relational.name(), deadline, this::cancelRelational);
        BackendOutcome docOutcome = docFuture == null
            ? BackendOutcome.rejected(document.name(), rejection)
            : await(docFuture, document.name(), deadline, () -> { });
        return new ComparisonReport(sql, documentQuery, relOutcome, docOutcome, System.nanoTime() - start);
    }

    private static BackendOutcome timed(String backend, BackendCall call) {
        long t0 = System.nanoTime();
        try {
            List<Map<String, Object>> rows = call.run();
            return BackendOutcome.ok(backend, rows, System.nanoTime() - t0);
        } catch (Exception e) {
            log.warn("Backend '{}' failed", backend, e);
            return BackendOutcome.failed(backend, System.nanoTime() - t0, e.getMessage());
        }
    }

    /**
     * Waits until the shared deadline. On timeout the task is interrupted and onTimeout aborts
     * whatever the backend is still running on its side.
     */
    private BackendOutcome await(Future<BackendOutcome> future, String backend, long deadline, Runnable onTimeout) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            onTimeout.run();
            log.warn("Backend '{}' timed out after {} ms", backend, timeoutMillis);
            return BackendOutcome.timedOut(backend, TimeUnit.MILLISECONDS.toNanos(timeoutMillis));
        } catch (ExecutionException e) {
            log.warn("Backend '{}' task crashed", backend, e.getCause());
            return BackendOutcome.failed(backend, 0L, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return BackendOutcome.failed(backend, 0L, "interrupted while waiting for result");
        }
    }

    private void cancelRelational() {
        try {
            relational.cancel();
        } catch (SQLException e) {
            log.warn("Could not cancel statement on '{}'", relational.name(), e);
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private static final class BackendThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "backend-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
