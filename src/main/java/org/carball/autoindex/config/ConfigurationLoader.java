package org.carball.autoindex.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
public class ConfigurationLoader {

    public static final String ENV_PREFIX = "AUTOINDEX_";
    public static final String ARG_PREFIX = "--indexer.";

    private static final Pattern SHORT_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

    // option name (kebab-case) -> setter; the same table serves YAML, env vars and CLI args
    private static final Map<String, BiConsumer<IndexerOptions, String>> OPTIONS = new LinkedHashMap<>();

    static {
        OPTIONS.put("advisory-mode", (o, v) -> o.setAdvisoryMode(parseBoolean(v)));
        OPTIONS.put("require-approval", (o, v) -> o.setRequireApproval(parseBoolean(v)));
        OPTIONS.put("min-query-threshold", (o, v) -> o.setMinQueryThreshold(Long.parseLong(v.trim())));
        OPTIONS.put("safety-margin", (o, v) -> o.setSafetyMargin(Double.parseDouble(v.trim())));
        OPTIONS.put("max-indexes-per-table", (o, v) -> o.setMaxIndexesPerTable(Integer.parseInt(v.trim())));
        OPTIONS.put("maintenance-window-start-hour", (o, v) -> o.setMaintenanceWindowStartHour(v.isBlank() ? null : Integer.valueOf(v.trim())));
        OPTIONS.put("maintenance-window-end-hour", (o, v) -> o.setMaintenanceWindowEndHour(Integer.parseInt(v.trim())));
        OPTIONS.put("maintenance-window-max-wait", (o, v) -> o.setMaintenanceWindowMaxWait(parseDuration(v)));
        OPTIONS.put("maintenance-window-zone", (o, v) -> o.setMaintenanceWindowZone(parseZone(v)));
        OPTIONS.put("rate-limit-per-window", (o, v) -> o.setRateLimitPerWindow(Integer.parseInt(v.trim())));
        OPTIONS.put("burst-capacity", (o, v) -> o.setBurstCapacity(Integer.parseInt(v.trim())));
        OPTIONS.put("rate-limit-window", (o, v) -> o.setRateLimitWindow(parseDuration(v)));
        OPTIONS.put("build-timeout", (o, v) -> o.setBuildTimeout(parseDuration(v)));
        OPTIONS.put("retry-backoff", (o, v) -> o.setRetryBackoff(parseDuration(v)));
        OPTIONS.put("max-parallelism", (o, v) -> o.setMaxParallelism(Integer.parseInt(v.trim())));
        OPTIONS.put("window-size", (o, v) -> o.setWindowSize(parseDuration(v)));
        OPTIONS.put("window-slide", (o, v) -> o.setWindowSlide(v.isBlank() ? null : parseDuration(v)));
        OPTIONS.put("allowed-lateness", (o, v) -> o.setAllowedLateness(parseDuration(v)));
        OPTIONS.put("telemetry-batch-size", (o, v) -> o.setTelemetryBatchSize(Integer.parseInt(v.trim())));
        OPTIONS.put("health-check-interval", (o, v) -> o.setHealthCheckInterval(parseDuration(v)));
        OPTIONS.put("schema-name", (o, v) -> o.setSchemaName(v.trim()));
        OPTIONS.put("cost-model.scan-to-seek-ratio", (o, v) -> o.getCostModel().setScanToSeekRatio(Double.parseDouble(v.trim())));
        OPTIONS.put("cost-model.build-cost-per-1000-rows", (o, v) -> o.getCostModel().setBuildCostPer1000Rows(Double.parseDouble(v.trim())));
        OPTIONS.put("cost-model.write-amplification-cost-ms", (o, v) -> o.getCostModel().setWriteAmplificationCostMs(Double.parseDouble(v.trim())));
        OPTIONS.put("cost-model.bloat-penalty-weight", (o, v) -> o.getCostModel().setBloatPenaltyWeight(Double.parseDouble(v.trim())));
        OPTIONS.put("cost-model.rarely-used-threshold", (o, v) -> o.getCostModel().setRarelyUsedThreshold(Long.parseLong(v.trim())));
        OPTIONS.put("cost-model.max-health-penalty", (o, v) -> o.getCostModel().setMaxHealthPenalty(Double.parseDouble(v.trim())));
    }

    private final ObjectMapper yamlMapper;
    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment == null ? Collections.emptyMap() : environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.registerModule(new JavaTimeModule());
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public IndexerOptions loadConfiguration(String[] args) {
        log.debug("Loading configuration");
        return finish(IndexerOptions.defaults(), null, args);
    }

    /**
     * Loads configuration from a specific profile.
     */
    public IndexerOptions loadProfile(String profileName) {
        try {
            IndexerProfile profile = IndexerProfile.fromName(profileName);
            IndexerOptions options = profile.buildOptions();
            log.info("Loaded profile '{}': {}", profileName, options.getConfigurationSummary());
            return options;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with env vars and CLI args.
     */
    public IndexerOptions loadConfigurationWithProfile(String profileName, String[] args) {
        return finish(loadProfile(profileName), null, args);
    }

    /**
     * Loads a YAML configuration file, then overlays env vars and CLI args. A
     * top-level {@code profile} key selects the starting profile.
     */
    public IndexerOptions loadConfiguration(Path configFile, String[] args) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(Files.readString(configFile));
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            log.warn("Configuration file {} is empty, using defaults", configFile);
            return finish(IndexerOptions.defaults(), null, args);
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Configuration file " + configFile + " must contain a mapping at the top level");
        }

        IndexerOptions base = root.has("profile")
                ? loadProfile(root.get("profile").asText())
                : IndexerOptions.defaults();
        return finish(base, root, args);
    }

    private IndexerOptions finish(IndexerOptions base, JsonNode yaml, String[] args) {
        // work on a private copy so profile instances are never mutated
        IndexerOptions options = base.toBuilder()
                .costModel(base.getCostModel() == null ? CostModelConfig.defaults() : base.getCostModel().copy())
                .build();

        if (yaml != null) {
            applyYaml(options, yaml);
        }
        applyEnvironmentVariables(options);
        applyCLIArguments(options, args == null ? new String[0] : args);

        options.validate();

        log.info("Configuration loaded: {}", options.getConfigurationSummary());
        return options;
    }

    private void applyYaml(IndexerOptions options, JsonNode root) {
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (key.equals("profile")) {
                continue;
            }
            if (key.equals("cost_model")) {
                try {
                    yamlMapper.readerForUpdating(options.getCostModel()).readValue(value);
                } catch (IOException e) {
                    throw new IllegalArgumentException("Invalid cost_model section: " + e.getMessage(), e);
                }
                continue;
            }
            apply(options, key.replace('_', '-'), value.isNull() ? "" : value.asText(), "configuration file key '" + key + "'");
        }
    }

    private void applyEnvironmentVariables(IndexerOptions options) {
        for (String option : OPTIONS.keySet()) {
            String variable = toEnvironmentVariable(option);
            String value = environment.get(variable);
            if (value != null) {
                apply(options, option, value, "environment variable " + variable);
            }
        }
    }

    private void applyCLIArguments(IndexerOptions options, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith(ARG_PREFIX)) {
                continue;
            }

            String option = arg.substring(ARG_PREFIX.length());
            String value;
            int eq = option.indexOf('=');
            if (eq >= 0) {
                value = option.substring(eq + 1);
                option = option.substring(0, eq);
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            apply(options, option, value, "argument " + ARG_PREFIX + option);
        }
    }

    private static void apply(IndexerOptions options, String option, String value, String source) {
        BiConsumer<IndexerOptions, String> setter = OPTIONS.get(option);
        if (setter == null) {
            throw new IllegalArgumentException("Unknown option in " + source + ". Known options: " + String.join(", ", OPTIONS.keySet()));
        }
        try {
            setter.accept(options, value);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid value for " + source + ": '" + value + "'", e);
        }
        log.debug("Applied {} = {}", source, value);
    }

    static String toEnvironmentVariable(String option) {
        return ENV_PREFIX + option.replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT);
    }

    static boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return true;
            case "false":
            case "no":
            case "off":
            case "0":
                return false;
            default:
                throw new IllegalArgumentException("Not a boolean: '" + value + "'");
        }
    }

    static ZoneId parseZone(String value) {
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Not a time zone: '" + value + "'", e);
        }
    }

    /**
     * Parses "250ms", "30s", "5m", "1h", "2d" or an ISO-8601 duration such as "PT5M".
     * A bare number is read as seconds.
     */
    public static Duration parseDuration(String value) {
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        if (trimmed.matches("\\d+")) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        Matcher matcher = SHORT_DURATION.matcher(trimmed);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "ms":
                    return Duration.ofMillis(amount);
                case "s":
                    return Duration.ofSeconds(amount);
                case "m":
                    return Duration.ofMinutes(amount);
                case "h":
                    return Duration.ofHours(amount);
                default:
                    return Duration.ofDays(amount);
            }
        }
        return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Returns help text for configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Indexer Configuration Options:

            CLI Arguments (--indexer.<option> <value> or --indexer.<option>=<value>):
              advisory-mode <bool>              Evaluate and log only, never build
              require-approval <bool>           Hold every build for operator approval
              min-query-threshold <num>         Minimum queries per window before a build is considered
              safety-margin <num>               Benefit must exceed build cost times this factor
              max-indexes-per-table <num>       No new index on a table that already has this many
              maintenance-window-start-hour <h> Hour (0-23) builds may start (unset: any time)
              maintenance-window-end-hour <h>   Hour (0-23) the window closes; may wrap past midnight
              maintenance-window-max-wait <duration>
                                                Defer only when the window opens within this wait
              maintenance-window-zone <zone>    Time zone of the window hours (default UTC)
              rate-limit-per-window <num>       Builds allowed per rate-limit window
              burst-capacity <num>              Builds allowed back to back
              rate-limit-window <duration>      Rate-limit refill period
              build-timeout <duration>          Deadline for a single index build
              retry-backoff <duration>          Wait before retrying a transient failure
              max-parallelism <num>             Concurrent evaluations per cycle
              window-size <duration>            Aggregation window length
              window-slide <duration>           Slide for sliding windows (unset: tumbling)
              allowed-lateness <duration>       How late a record may arrive
              telemetry-batch-size <num>        Records read per telemetry poll
              health-check-interval <duration>  Health recorder schedule
              schema-name <name>                Schema that holds the tenant tables
              cost-model.<name> <num>           Cost model calibration

            Durations: 250ms, 30s, 5m, 1h, 2d or ISO-8601 (PT5M). Bare numbers are seconds.

            Environment Variables:
              AUTOINDEX_<OPTION>                e.g. AUTOINDEX_MIN_QUERY_THRESHOLD,
                                                AUTOINDEX_COST_MODEL_SCAN_TO_SEEK_RATIO

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file
              4. Profile defaults or built-in defaults
            """;
    }
}
