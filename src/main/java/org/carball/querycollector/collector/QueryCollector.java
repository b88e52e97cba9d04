package org.carball.querycollector.collector;

import lombok.extern.slf4j.Slf4j;
import org.carball.querycollector.analyzer.QueryLogAnalyzer;
import org.carball.querycollector.config.CollectorConfig;
import org.carball.querycollector.model.query.CallSiteFrame;
import org.carball.querycollector.model.query.CapturedQuery;
import org.carball.querycollector.model.query.CollectionSummary;
import org.carball.querycollector.model.query.NPlusOneCandidate;
import org.carball.querycollector.model.query.QueryOutcome;
import org.carball.querycollector.model.query.QueryType;
import org.carball.querycollector.parser.SqlClassifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Records every statement passing through {@link #intercept} while collection is active.
 *
 * <p>One collector serves one analysis session at a time. {@link #startCollection()} clears the log and
 * activates capture, {@link #stopCollection()} deactivates it and leaves the log alone, {@link #clear()} empties
 * the log in either state. The caller is responsible for registering the hook with its driver.
 *
 * <p>The collector is safe to share between threads. While inactive the hook costs one volatile read. While
 * active, each call claims a start sequence number under the collector's lock, so the log is ordered by the
 * time executions began even when they complete out of order. An execution that began before the most recent
 * {@link #startCollection()} or {@link #clear()} is not added to the new log.
 */
@Slf4j
public class QueryCollector {

    private final CollectorConfig config;
    private final Object lock = new Object();

    // guarded by lock
    private final List<Sequenced> entries = new ArrayList<>();
    private long nextSequence;
    private long generation;
    private Instant collectionStartedAt;
    private long windowStartNanos;
    private long windowStopNanos;

    private volatile boolean active;

    public QueryCollector() {
        this(CollectorConfig.defaults());
    }

    public QueryCollector(CollectorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Runs {@code next} and, when collection is active, records the execution.
     *
     * <p>The result of {@code next} is returned as-is. Anything {@code next} throws is recorded with
     * status {@code ERROR} and then rethrown unchanged.
     */
    public <C, R> R intercept(StatementExecutor<C, R> next, String sql, List<?> params, boolean batch, C context)
            throws Exception {
        Objects.requireNonNull(next, "next");
        if (!active) {
            return next.execute(sql, params, batch, context);
        }

        Ticket ticket = claimTicket();
        if (ticket == null) {
            return next.execute(sql, params, batch, context);
        }

        List<CallSiteFrame> stackTrace = config.isCaptureStackTraces()
                ? CallSiteCapture.capture(config.getMaxStackDepth())
                : List.of();
        QueryType queryType = SqlClassifier.classify(sql);
        List<String> tableNames = SqlClassifier.extractTableNames(sql);

        Instant timestamp = Instant.now();
        long start = System.nanoTime();
        QueryOutcome outcome = QueryOutcome.success();
        try {
            return next.execute(sql, params, batch, context);
        } catch (Throwable t) {
            outcome = QueryOutcome.failure(t);
            throw t;
        } finally {
            CapturedQuery captured = CapturedQuery.builder()
                    .sql(sql)
                    .params(params == null ? List.of() : new ArrayList<>(params))
                    .duration(Duration.ofNanos(System.nanoTime() - start))
                    .timestamp(timestamp)
                    .stackTrace(stackTrace)
                    .queryType(queryType)
                    .tableNames(tableNames)
                    .outcome(outcome)
                    .build();
            append(ticket, captured);
        }
    }

    /**
     * Returns {@code next} wrapped so that every call goes through {@link #intercept}.
     */
    public <C, R> StatementExecutor<C, R> wrap(StatementExecutor<C, R> next) {
        Objects.requireNonNull(next, "next");
        return (sql, params, batch, context) -> intercept(next, sql, params, batch, context);
    }

    public void startCollection() {
        synchronized (lock) {
            entries.clear();
            generation++;
            collectionStartedAt = Instant.now();
            windowStartNanos = System.nanoTime();
            windowStopNanos = 0;
            active = true;
        }
        log.info("Query collection started");
    }

    public void stopCollection() {
        int captured;
        synchronized (lock) {
            if (!active) {
                return;
            }
            active = false;
            windowStopNanos = System.nanoTime();
            captured = entries.size();
        }
        log.info("Query collection stopped, {} statement(s) captured", captured);
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
            generation++;
        }
        log.debug("Query log cleared");
    }

    public boolean isActive() {
        return active;
    }

    public CollectorConfig getConfig() {
        return config;
    }

    /**
     * Wall-clock start of the current or most recent collection window.
     */
    public Optional<Instant> getCollectionStartedAt() {
        synchronized (lock) {
            return Optional.ofNullable(collectionStartedAt);
        }
    }

    /**
     * Length of the current window so far, or of the most recent one once stopped.
     */
    public Duration getCollectionElapsed() {
        synchronized (lock) {
            if (collectionStartedAt == null) {
                return Duration.ZERO;
            }
            long end = active ? System.nanoTime() : windowStopNanos;
            return Duration.ofNanos(Math.max(0, end - windowStartNanos));
        }
    }

    /**
     * Snapshot of the log in execution-start order.
     */
    public List<CapturedQuery> getQueries() {
        synchronized (lock) {
            List<CapturedQuery> snapshot = new ArrayList<>(entries.size());
            for (Sequenced entry : entries) {
                snapshot.add(entry.query());
            }
            return List.copyOf(snapshot);
        }
    }

    public int getQueryCount() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public Duration getTotalDuration() {
        return QueryLogAnalyzer.totalDuration(getQueries());
    }

    public Map<QueryType, List<CapturedQuery>> getQueriesByType() {
        return QueryLogAnalyzer.groupByType(getQueries());
    }

    public Map<String, List<CapturedQuery>> getDuplicateQueries() {
        return QueryLogAnalyzer.findDuplicates(getQueries());
    }

    public Map<String, List<CapturedQuery>> getSimilarQueries() {
        return QueryLogAnalyzer.findSimilar(getQueries());
    }

    public List<CapturedQuery> getSlowQueries() {
        return QueryLogAnalyzer.findSlow(getQueries(), Duration.ofMillis(config.getSlowQueryThresholdMs()));
    }

    public List<CapturedQuery> getFailedQueries() {
        return QueryLogAnalyzer.findFailed(getQueries());
    }

    public Map<String, Long> getTableAccessCounts() {
        return QueryLogAnalyzer.tableAccessCounts(getQueries());
    }

    public List<NPlusOneCandidate> findNPlusOneCandidates() {
        return QueryLogAnalyzer.findNPlusOneCandidates(
                getQueries(), Math.max(1, config.getNPlusOneThreshold()), config.getIgnoredFramePrefixes());
    }

    public CollectionSummary summarize() {
        return QueryLogAnalyzer.summarize(getQueries(), config);
    }

    private Ticket claimTicket() {
        synchronized (lock) {
            if (!active) {
                return null;
            }
            return new Ticket(nextSequence++, generation);
        }
    }

    private void append(Ticket ticket, CapturedQuery captured) {
        synchronized (lock) {
            if (ticket.generation() != generation) {
                log.debug("Dropping statement from a cleared collection window: {}", captured.sql());
                return;
            }
            int position = entries.size();
            while (position > 0 && entries.get(position - 1).sequence() > ticket.sequence()) {
                position--;
            }
            entries.add(position, new Sequenced(ticket.sequence(), captured));
        }
        log.debug("Captured {} statement in {} ms ({})",
                captured.queryType(), captured.durationMillis(), captured.status());
    }

    private record Ticket(long sequence, long generation) {
    }

    private record Sequenced(long sequence, CapturedQuery query) {
    }
}
