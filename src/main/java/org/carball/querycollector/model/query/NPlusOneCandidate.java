package org.carball.querycollector.model.query;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A statement shape executed often enough in one window to suggest a per-row query issued in a loop.
 *
 * @param callSite       most frequent application frame among the executions, {@code null} when no frames
 *                       were captured
 * @param sharedCallSite whether every execution came from {@code callSite}
 */
public record NPlusOneCandidate(
        String pattern,
        int executionCount,
        Duration totalDuration,
        List<String> tableNames,
        CallSiteFrame callSite,
        boolean sharedCallSite,
        List<CapturedQuery> queries
) {

    public NPlusOneCandidate {
        tableNames = List.copyOf(tableNames);
        queries = List.copyOf(queries);
    }

    public Optional<CallSiteFrame> dominantCallSite() {
        return Optional.ofNullable(callSite);
    }
}
