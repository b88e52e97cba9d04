package org.carball.querycollector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;
import java.util.stream.Collectors;

@Slf4j
public class CollectorConfigLoader {

    public static final String DEFAULT_RESOURCE = "query-collector.yml";

    private final Map<String, String> environment;
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public CollectorConfigLoader() {
        this(System.getenv());
    }

    CollectorConfigLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: overrides > env vars > YAML file > defaults.
     *
     * @param configPath YAML file to start from; when {@code null} the classpath resource
     *                   {@value #DEFAULT_RESOURCE} is used if present
     * @param overrides  {@code --collector.*} style key/value pairs
     */
    public CollectorConfig loadConfiguration(String configPath, String[] overrides) {
        log.debug("Loading collector configuration");

        CollectorConfig config = configPath == null || configPath.isBlank()
                ? loadClasspathDefaults()
                : loadFile(configPath);

        applyEnvironmentVariables(config);
        applyOverrides(config, overrides);

        config.validate();
        log.info("Collector configuration loaded: {}", config.getDescription());
        return config;
    }

    /**
     * Reads a YAML file, falling back to defaults when it is missing or unreadable.
     */
    public CollectorConfig loadFile(String configPath) {
        File configFile = new File(configPath);
        if (!configFile.exists()) {
            log.warn("Collector config file not found: {}, using defaults", configPath);
            return CollectorConfig.defaults();
        }

        try {
            CollectorConfig config = mapper.readValue(configFile, CollectorConfig.class);
            log.info("Loaded collector configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load collector config from {}: {}, using defaults", configPath, e.getMessage());
            return CollectorConfig.defaults();
        }
    }

    private CollectorConfig loadClasspathDefaults() {
        try (InputStream in = CollectorConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return CollectorConfig.defaults();
            }
            CollectorConfig config = mapper.readValue(in, CollectorConfig.class);
            log.info("Loaded collector configuration from classpath resource {}", DEFAULT_RESOURCE);
            return config;
        } catch (IOException e) {
            log.error("Failed to load classpath resource {}: {}, using defaults", DEFAULT_RESOURCE, e.getMessage());
            return CollectorConfig.defaults();
        }
    }

    private void applyEnvironmentVariables(CollectorConfig config) {
        String value = environment.get("QUERY_COLLECTOR_CAPTURE_STACK_TRACES");
        if (value != null) {
            config.setCaptureStackTraces(Boolean.parseBoolean(value.trim()));
        }

        value = environment.get("QUERY_COLLECTOR_MAX_STACK_DEPTH");
        if (value != null) {
            applyInt("QUERY_COLLECTOR_MAX_STACK_DEPTH", value, config::setMaxStackDepth);
        }

        value = environment.get("QUERY_COLLECTOR_N_PLUS_ONE_THRESHOLD");
        if (value != null) {
            applyInt("QUERY_COLLECTOR_N_PLUS_ONE_THRESHOLD", value, config::setNPlusOneThreshold);
        }

        value = environment.get("QUERY_COLLECTOR_SLOW_QUERY_THRESHOLD_MS");
        if (value != null) {
            try {
                config.setSlowQueryThresholdMs(Long.parseLong(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", "QUERY_COLLECTOR_SLOW_QUERY_THRESHOLD_MS", value);
            }
        }

        value = environment.get("QUERY_COLLECTOR_IGNORED_FRAME_PREFIXES");
        if (value != null) {
            config.setIgnoredFramePrefixes(splitPrefixes(value));
        }
    }

    private void applyOverrides(CollectorConfig config, String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--collector.stack-traces":
                    config.setCaptureStackTraces(Boolean.parseBoolean(value));
                    break;
                case "--collector.max-stack-depth":
                    applyInt(arg, value, config::setMaxStackDepth);
                    break;
                case "--collector.n-plus-one-threshold":
                    applyInt(arg, value, config::setNPlusOneThreshold);
                    break;
                case "--collector.slow-query-ms":
                    try {
                        config.setSlowQueryThresholdMs(Long.parseLong(value));
                    } catch (NumberFormatException e) {
                        log.warn("Invalid numeric value for {}: {}", arg, value);
                    }
                    break;
                case "--collector.ignored-frame-prefixes":
                    config.setIgnoredFramePrefixes(splitPrefixes(value));
                    break;
            }
        }
    }

    private static void applyInt(String key, String value, IntConsumer setter) {
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", key, value);
        }
    }

    private static List<String> splitPrefixes(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(prefix -> !prefix.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Returns help text for collector configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Collector Configuration Options:

            Overrides:
              --collector.stack-traces <true|false>        Capture call-site frames per statement
              --collector.max-stack-depth <num>            Frames kept per statement (0 = unlimited)
              --collector.n-plus-one-threshold <num>       Minimum repetitions reported as N+1
              --collector.slow-query-ms <num>              Slow statement threshold in milliseconds
              --collector.ignored-frame-prefixes <a,b,c>   Packages skipped when locating the call site

            Environment Variables:
              QUERY_COLLECTOR_CAPTURE_STACK_TRACES         Same as --collector.stack-traces
              QUERY_COLLECTOR_MAX_STACK_DEPTH              Same as --collector.max-stack-depth
              QUERY_COLLECTOR_N_PLUS_ONE_THRESHOLD         Same as --collector.n-plus-one-threshold
              QUERY_COLLECTOR_SLOW_QUERY_THRESHOLD_MS      Same as --collector.slow-query-ms
              QUERY_COLLECTOR_IGNORED_FRAME_PREFIXES       Same as --collector.ignored-frame-prefixes

            Priority Order (highest to lowest):
              1. Overrides
              2. Environment variables
              3. YAML file (or classpath query-collector.yml)
              4. Built-in defaults
            """;
    }
}
