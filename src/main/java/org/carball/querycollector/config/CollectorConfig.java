package org.carball.querycollector.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Data
@Slf4j
public class CollectorConfig {

    public static final List<String> DEFAULT_IGNORED_FRAME_PREFIXES = List.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            "org.carball.querycollector.jdbc.",
            "org.springframework.",
            "org.hibernate.",
            "com.zaxxer."
    );

    // Capture
    @JsonProperty("capture_stack_traces")
    private boolean captureStackTraces = true;

    @JsonProperty("max_stack_depth")
    private int maxStackDepth = 64;

    /**
     * Class-name prefixes of infrastructure layers skipped when looking for the application frame that issued
     * a statement.
     */
    @JsonProperty("ignored_frame_prefixes")
    private List<String> ignoredFramePrefixes = new ArrayList<>(DEFAULT_IGNORED_FRAME_PREFIXES);

    // Diagnostics
    @JsonProperty("n_plus_one_threshold")
    private int nPlusOneThreshold = 3;

    @JsonProperty("slow_query_threshold_ms")
    private long slowQueryThresholdMs = 100;

    public static CollectorConfig defaults() {
        return new CollectorConfig();
    }

    /**
     * Logs warnings for values that are accepted but unlikely to be intended.
     */
    public void validate() {
        if (maxStackDepth < 0) {
            log.warn("Max stack depth ({}) should not be negative, treating as unlimited", maxStackDepth);
        }

        if (nPlusOneThreshold < 2) {
            log.warn("N+1 threshold ({}) should be at least 2, every similar group will be reported",
                    nPlusOneThreshold);
        }

        if (slowQueryThresholdMs < 0) {
            log.warn("Slow query threshold ({} ms) should not be negative", slowQueryThresholdMs);
        }

        if (!captureStackTraces) {
            log.info("Stack trace capture disabled, N+1 candidates will have no call site");
        }

        log.debug("Using collector config - {}", getDescription());
    }

    public String getDescription() {
        return String.format(
            "stackTraces=%s, maxStackDepth=%d, nPlusOneThreshold=%d, slowQueryMs=%d, ignoredPrefixes=%d",
            captureStackTraces,
            maxStackDepth,
            nPlusOneThreshold,
            slowQueryThresholdMs,
            ignoredFramePrefixes == null ? 0 : ignoredFramePrefixes.size()
        );
    }
}
