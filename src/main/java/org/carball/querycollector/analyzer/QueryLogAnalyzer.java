package org.carball.querycollector.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.querycollector.config.CollectorConfig;
import org.carball.querycollector.model.query.CallSiteFrame;
import org.carball.querycollector.model.query.CapturedQuery;
import org.carball.querycollector.model.query.CollectionSummary;
import org.carball.querycollector.model.query.NPlusOneCandidate;
import org.carball.querycollector.model.query.QueryType;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-only diagnostics over a captured query log.
 *
 * <p>Every operation scans the list it is given and returns new collections; map results iterate in the order
 * their keys were first seen and each group keeps execution order.
 */
@Slf4j
public class QueryLogAnalyzer {

    private QueryLogAnalyzer() {
        // Utility class - prevent instantiation
    }

    public static Duration totalDuration(List<CapturedQuery> queries) {
        return queries.stream()
                .map(CapturedQuery::duration)
                .reduce(Duration.ZERO, Duration::plus);
    }

    public static Map<QueryType, List<CapturedQuery>> groupByType(List<CapturedQuery> queries) {
        return queries.stream()
                .collect(Collectors.groupingBy(
                        CapturedQuery::queryType,
                        LinkedHashMap::new,
                        Collectors.toList()));
    }

    /**
     * Groups statements whose trimmed text is identical, keeping only groups with two or more members.
     * Bound parameter values are not compared.
     */
    public static Map<String, List<CapturedQuery>> findDuplicates(List<CapturedQuery> queries) {
        Map<String, List<CapturedQuery>> bySql = new LinkedHashMap<>();
        for (CapturedQuery query : queries) {
            String key = query.sql() == null ? "" : query.sql().strip();
            bySql.computeIfAbsent(key, k -> new ArrayList<>()).add(query);
        }
        return repeatedOnly(bySql);
    }

    /**
     * Groups statements by normalized shape, keeping only groups with two or more members.
     */
    public static Map<String, List<CapturedQuery>> findSimilar(List<CapturedQuery> queries) {
        return repeatedOnly(groupByPattern(queries));
    }

    public static List<CapturedQuery> findSlow(List<CapturedQuery> queries, Duration threshold) {
        return queries.stream()
                .filter(q -> q.duration().compareTo(threshold) >= 0)
                .collect(Collectors.toList());
    }

    public static List<CapturedQuery> findFailed(List<CapturedQuery> queries) {
        return queries.stream()
                .filter(CapturedQuery::isError)
                .collect(Collectors.toList());
    }

    /**
     * Number of statements touching each table.
     */
    public static Map<String, Long> tableAccessCounts(List<CapturedQuery> queries) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (CapturedQuery query : queries) {
            for (String table : query.tableNames()) {
                counts.merge(table, 1L, Long::sum);
            }
        }
        return counts;
    }

    /**
     * Reports shapes executed at least {@code minRepetitions} times, most executed first.
     *
     * @param ignoredFramePrefixes class-name prefixes skipped when locating each statement's application frame
     */
    public static List<NPlusOneCandidate> findNPlusOneCandidates(List<CapturedQuery> queries,
                                                                 int minRepetitions,
                                                                 List<String> ignoredFramePrefixes) {
        if (minRepetitions < 1) {
            throw new IllegalArgumentException("Minimum repetitions must be positive: " + minRepetitions);
        }
        List<String> prefixes = ignoredFramePrefixes == null ? List.of() : ignoredFramePrefixes;

        List<NPlusOneCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, List<CapturedQuery>> group : groupByPattern(queries).entrySet()) {
            List<CapturedQuery> members = group.getValue();
            if (members.size() < minRepetitions) {
                continue;
            }
            candidates.add(buildCandidate(group.getKey(), members, prefixes));
        }

        // Stable sort keeps first-seen order among equal counts
        candidates.sort(Comparator.comparingInt(NPlusOneCandidate::executionCount).reversed());

        if (!candidates.isEmpty()) {
            log.debug("Found {} N+1 candidate(s) with at least {} repetitions", candidates.size(), minRepetitions);
        }
        return candidates;
    }

    public static CollectionSummary summarize(List<CapturedQuery> queries, CollectorConfig config) {
        CollectionSummary summary = new CollectionSummary();

        summary.setTotalQueries(queries.size());
        summary.setFailedQueries(findFailed(queries).size());
        summary.setTotalDurationMs(totalDuration(queries).toNanos() / 1_000_000.0);

        Map<QueryType, Long> typeBreakdown = queries.stream()
                .collect(Collectors.groupingBy(
                        CapturedQuery::queryType,
                        LinkedHashMap::new,
                        Collectors.counting()));
        summary.setTypeBreakdown(typeBreakdown);

        summary.setDuplicateGroupCount(findDuplicates(queries).size());
        summary.setSimilarGroupCount(findSimilar(queries).size());
        summary.setSlowQueryCount(findSlow(queries, Duration.ofMillis(config.getSlowQueryThresholdMs())).size());
        summary.setNPlusOneCandidates(findNPlusOneCandidates(
                queries, Math.max(1, config.getNPlusOneThreshold()), config.getIgnoredFramePrefixes()));

        return summary;
    }

    private static Map<String, List<CapturedQuery>> groupByPattern(List<CapturedQuery> queries) {
        Map<String, List<CapturedQuery>> byPattern = new LinkedHashMap<>();
        for (CapturedQuery query : queries) {
            byPattern.computeIfAbsent(query.normalizedPattern(), k -> new ArrayList<>()).add(query);
        }
        return byPattern;
    }

    private static Map<String, List<CapturedQuery>> repeatedOnly(Map<String, List<CapturedQuery>> groups) {
        Map<String, List<CapturedQuery>> repeated = new LinkedHashMap<>();
        groups.forEach((key, members) -> {
            if (members.size() > 1) {
                repeated.put(key, members);
            }
        });
        return repeated;
    }

    private static NPlusOneCandidate buildCandidate(String pattern, List<CapturedQuery> members,
                                                    List<String> ignoredFramePrefixes) {
        Set<String> tables = new LinkedHashSet<>();
        Map<CallSiteFrame, Integer> callSiteCounts = new LinkedHashMap<>();
        int withoutCallSite = 0;

        for (CapturedQuery query : members) {
            tables.addAll(query.tableNames());
            Optional<CallSiteFrame> callSite = query.applicationCallSite(ignoredFramePrefixes);
            if (callSite.isPresent()) {
                callSiteCounts.merge(callSite.get(), 1, Integer::sum);
            } else {
                withoutCallSite++;
            }
        }

        // Ties go to the call site seen first
        CallSiteFrame dominant = null;
        int dominantCount = 0;
        for (Map.Entry<CallSiteFrame, Integer> entry : callSiteCounts.entrySet()) {
            if (entry.getValue() > dominantCount) {
                dominant = entry.getKey();
                dominantCount = entry.getValue();
            }
        }
        boolean shared = dominant != null && callSiteCounts.size() == 1 && withoutCallSite == 0;

        return new NPlusOneCandidate(
                pattern,
                members.size(),
                totalDuration(members),
                new ArrayList<>(tables),
                dominant,
                shared,
                members);
    }
}
