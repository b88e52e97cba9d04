package org.carball.querycollector.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class CollectorConfigLoaderTest {

    @Test
    void shouldLoadYamlFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("collector.yml");
        Files.writeString(file, """
                capture_stack_traces: false
                max_stack_depth: 10
                n_plus_one_threshold: 5
                slow_query_threshold_ms: 250
                ignored_frame_prefixes:
                  - "java."
                  - "com.acme.dao."
                """);

        CollectorConfig config = new CollectorConfigLoader(Map.of()).loadConfiguration(file.toString(), new String[0]);

        assertThat(config.isCaptureStackTraces()).isFalse();
        assertThat(config.getMaxStackDepth()).isEqualTo(10);
        assertThat(config.getNPlusOneThreshold()).isEqualTo(5);
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(250);
        assertThat(config.getIgnoredFramePrefixes()).containsExactly("java.", "com.acme.dao.");
    }

    @Test
    void shouldFallBackToDefaultsForMissingFile(@TempDir Path tempDir) {
        CollectorConfig config = new CollectorConfigLoader(Map.of())
                .loadFile(tempDir.resolve("missing.yml").toString());

        assertThat(config).isEqualTo(CollectorConfig.defaults());
    }

    @Test
    void shouldFallBackToDefaultsForUnreadableFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "n_plus_one_threshold: [not, a, number");

        CollectorConfig config = new CollectorConfigLoader(Map.of()).loadFile(file.toString());

        assertThat(config).isEqualTo(CollectorConfig.defaults());
    }

    @Test
    void shouldLoadClasspathResourceWhenNoPathGiven() {
        CollectorConfig config = new CollectorConfigLoader(Map.of()).loadConfiguration(null, new String[0]);

        // src/test/resources/query-collector.yml
        assertThat(config.getNPlusOneThreshold()).isEqualTo(4);
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(200);
    }

    @Test
    void shouldApplyEnvironmentOverFileAndOverridesOverEnvironment(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("collector.yml");
        Files.writeString(file, """
                n_plus_one_threshold: 5
                slow_query_threshold_ms: 250
                max_stack_depth: 10
                """);
        Map<String, String> env = Map.of(
                "QUERY_COLLECTOR_N_PLUS_ONE_THRESHOLD", "7",
                "QUERY_COLLECTOR_SLOW_QUERY_THRESHOLD_MS", "300",
                "QUERY_COLLECTOR_IGNORED_FRAME_PREFIXES", "java., org.example.infra.");
        String[] overrides = {"--collector.slow-query-ms", "400", "--collector.stack-traces", "false"};

        CollectorConfig config = new CollectorConfigLoader(env).loadConfiguration(file.toString(), overrides);

        assertThat(config.getMaxStackDepth()).isEqualTo(10);
        assertThat(config.getNPlusOneThreshold()).isEqualTo(7);
        assertThat(config.getSlowQueryThresholdMs()).isEqualTo(400);
        assertThat(config.isCaptureStackTraces()).isFalse();
        assertThat(config.getIgnoredFramePrefixes()).containsExactly("java.", "org.example.infra.");
    }

    @Test
    void shouldIgnoreInvalidNumbers() {
        Map<String, String> env = Map.of("QUERY_COLLECTOR_MAX_STACK_DEPTH", "deep");
        String[] overrides = {"--collector.n-plus-one-threshold", "many"};

        CollectorConfig config = new CollectorConfigLoader(env).loadConfiguration(
                "does-not-exist.yml", overrides);

        assertThat(config.getMaxStackDepth()).isEqualTo(64);
        assertThat(config.getNPlusOneThreshold()).isEqualTo(3);
    }

    @Test
    void shouldDocumentOptions() {
        assertThat(CollectorConfigLoader.getConfigurationHelp())
                .contains("--collector.n-plus-one-threshold")
                .contains("QUERY_COLLECTOR_SLOW_QUERY_THRESHOLD_MS");
    }
}
