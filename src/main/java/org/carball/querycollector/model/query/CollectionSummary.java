package org.carball.querycollector.model.query;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Totals and diagnostics for one collection window.
 */
@Data
public class CollectionSummary {
    private int totalQueries;
    private int failedQueries;
    private double totalDurationMs;
    private Map<QueryType, Long> typeBreakdown;
    private int duplicateGroupCount;
    private int similarGroupCount;
    private int slowQueryCount;
    private List<NPlusOneCandidate> nPlusOneCandidates;

    public boolean hasNPlusOneCandidates() {
        return nPlusOneCandidates != null && !nPlusOneCandidates.isEmpty();
    }
}
