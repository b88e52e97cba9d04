package org.carball.querycollector.model.query;

import lombok.Builder;
import org.carball.querycollector.parser.SqlPatternNormalizer;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One statement execution observed while collection was active.
 *
 * <p>Instances are fully populated before they are appended to a collector's log and never change afterwards.
 * {@code params} may hold {@code null} elements (bound SQL NULLs), so it is copied rather than passed to
 * {@link List#copyOf}.
 */
@Builder
public record CapturedQuery(
        String sql,
        List<Object> params,
        Duration duration,
        Instant timestamp,
        List<CallSiteFrame> stackTrace,
        QueryType queryType,
        List<String> tableNames,
        QueryOutcome outcome
) {

    public CapturedQuery {
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
        tableNames = tableNames == null ? List.of() : List.copyOf(tableNames);
        duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        Objects.requireNonNull(timestamp, "timestamp");
        queryType = queryType == null ? QueryType.OTHER : queryType;
        outcome = outcome == null ? QueryOutcome.success() : outcome;
    }

    public QueryStatus status() {
        return outcome.status();
    }

    public boolean isError() {
        return outcome.status() == QueryStatus.ERROR;
    }

    /**
     * The error raised by the statement, present only when {@link #status()} is {@link QueryStatus#ERROR}.
     */
    public Optional<Throwable> exception() {
        if (outcome instanceof QueryOutcome.Failure failure) {
            return Optional.of(failure.error());
        }
        return Optional.empty();
    }

    public double durationMillis() {
        return duration.toNanos() / 1_000_000.0;
    }

    /**
     * Shape of this statement with literal values replaced by placeholders.
     */
    public String normalizedPattern() {
        return SqlPatternNormalizer.normalize(sql);
    }

    /**
     * First captured frame whose class does not start with any of {@code ignoredPrefixes}.
     */
    public Optional<CallSiteFrame> applicationCallSite(List<String> ignoredPrefixes) {
        for (CallSiteFrame frame : stackTrace) {
            String className = frame.className();
            if (className == null) {
                continue;
            }
            boolean ignored = ignoredPrefixes.stream().anyMatch(className::startsWith);
            if (!ignored) {
                return Optional.of(frame);
            }
        }
        return Optional.empty();
    }
}
