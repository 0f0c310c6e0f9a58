package org.carball.autoindex.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class IndexerOptions {

    // Mutation control
    @Builder.Default
    private boolean advisoryMode = false;

    @Builder.Default
    private boolean requireApproval = false;

    // Decision thresholds
    @Builder.Default
    private long minQueryThreshold = 100;

    @Builder.Default
    private double safetyMargin = 1.5;

    // Every extra index taxes writes; tables at the cap get no more
    @Builder.Default
    private int maxIndexesPerTable = 10;

    // Maintenance window in whole hours of the given zone; a null start disables it
    private Integer maintenanceWindowStartHour;

    @Builder.Default
    private int maintenanceWindowEndHour = 6;

    @Builder.Default
    private Duration maintenanceWindowMaxWait = Duration.ofHours(6);

    @Builder.Default
    private ZoneId maintenanceWindowZone = ZoneOffset.UTC;

    // Rate limiting
    @Builder.Default
    private int rateLimitPerWindow = 10;

    @Builder.Default
    private int burstCapacity = 3;

    @Builder.Default
    private Duration rateLimitWindow = Duration.ofHours(1);

    // Execution
    @Builder.Default
    private Duration buildTimeout = Duration.ofMinutes(5);

    @Builder.Default
    private Duration retryBackoff = Duration.ofSeconds(2);

    @Builder.Default
    private int maxParallelism = 4;

    // Aggregation windows; a null slide means tumbling windows
    @Builder.Default
    private Duration windowSize = Duration.ofHours(1);

    private Duration windowSlide;

    @Builder.Default
    private Duration allowedLateness = Duration.ofMinutes(5);

    @Builder.Default
    private int telemetryBatchSize = 10_000;

    // Health monitoring
    @Builder.Default
    private Duration healthCheckInterval = Duration.ofMinutes(5);

    @Builder.Default
    private String schemaName = "public";

    @Builder.Default
    private CostModelConfig costModel = CostModelConfig.defaults();

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced settings";

    /**
     * Creates default options suitable for most deployments.
     */
    public static IndexerOptions defaults() {
        return IndexerOptions.builder()
                .profileName("default")
                .profileDescription("Default balanced settings")
                .build();
    }

    /**
     * Validates the options. Unlike advisory warnings, every violation here is
     * fatal: the engine refuses to start with an inconsistent configuration.
     *
     * @throws IllegalArgumentException listing every violation found
     */
    public void validate() {
        List<String> violations = new ArrayList<>();

        if (minQueryThreshold < 1) {
            violations.add("minQueryThreshold (" + minQueryThreshold + ") must be at least 1");
        }
        if (!(safetyMargin >= 1.0) || Double.isInfinite(safetyMargin)) {
            violations.add("safetyMargin (" + safetyMargin + ") must be a finite value of at least 1.0");
        }
        if (maxIndexesPerTable < 1) {
            violations.add("maxIndexesPerTable (" + maxIndexesPerTable + ") must be at least 1");
        }
        if (maintenanceWindowStartHour != null) {
            if (maintenanceWindowStartHour < 0 || maintenanceWindowStartHour > 23) {
                violations.add("maintenanceWindowStartHour (" + maintenanceWindowStartHour + ") must be between 0 and 23");
            }
            if (maintenanceWindowEndHour < 0 || maintenanceWindowEndHour > 23) {
                violations.add("maintenanceWindowEndHour (" + maintenanceWindowEndHour + ") must be between 0 and 23");
            } else if (maintenanceWindowStartHour == maintenanceWindowEndHour) {
                violations.add("maintenanceWindowStartHour and maintenanceWindowEndHour must differ (" + maintenanceWindowEndHour + ")");
            }
            if (maintenanceWindowMaxWait == null || maintenanceWindowMaxWait.isNegative()) {
                violations.add("maintenanceWindowMaxWait (" + maintenanceWindowMaxWait + ") must not be negative");
            }
            if (maintenanceWindowZone == null) {
                violations.add("maintenanceWindowZone must be set when a maintenance window is configured");
            }
        }
        if (rateLimitPerWindow < 0) {
            violations.add("rateLimitPerWindow (" + rateLimitPerWindow + ") must not be negative");
        }
        if (burstCapacity < 1) {
            violations.add("burstCapacity (" + burstCapacity + ") must be at least 1");
        }
        requirePositive(violations, "rateLimitWindow", rateLimitWindow);
        requirePositive(violations, "buildTimeout", buildTimeout);
        requirePositive(violations, "windowSize", windowSize);
        requirePositive(violations, "healthCheckInterval", healthCheckInterval);
        if (retryBackoff == null || retryBackoff.isNegative()) {
            violations.add("retryBackoff (" + retryBackoff + ") must not be negative");
        }
        if (allowedLateness == null || allowedLateness.isNegative()) {
            violations.add("allowedLateness (" + allowedLateness + ") must not be negative");
        }
        if (windowSlide != null) {
            if (windowSlide.isZero() || windowSlide.isNegative()) {
                violations.add("windowSlide (" + windowSlide + ") must be positive");
            } else if (windowSize != null && windowSlide.compareTo(windowSize) > 0) {
                violations.add("windowSlide (" + windowSlide + ") must not exceed windowSize (" + windowSize + ")");
            }
        }
        if (maxParallelism < 1) {
            violations.add("maxParallelism (" + maxParallelism + ") must be at least 1");
        }
        if (telemetryBatchSize < 1) {
            violations.add("telemetryBatchSize (" + telemetryBatchSize + ") must be at least 1");
        }
        if (schemaName == null || !schemaName.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            violations.add("schemaName (" + schemaName + ") must be a plain SQL identifier");
        }
        if (advisoryMode && requireApproval) {
            violations.add("advisoryMode and requireApproval are contradictory: advisory mode never builds, so nothing can be approved");
        }
        if (costModel == null) {
            violations.add("costModel must be set");
        } else {
            costModel.collectViolations(violations);
        }

        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("Invalid indexer configuration:\n  - " + String.join("\n  - ", violations));
        }

        log.debug("Using options - minQueries: {}, margin: {}, rate: {}/{}, burst: {}, profile: {}",
                minQueryThreshold, safetyMargin, rateLimitPerWindow, rateLimitWindow, burstCapacity, profileName);
    }

    private static void requirePositive(List<String> violations, String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            violations.add(name + " (" + value + ") must be positive");
        }
    }

    public boolean hasMaintenanceWindow() {
        return maintenanceWindowStartHour != null;
    }

    public boolean isTumbling() {
        return windowSlide == null || windowSlide.equals(windowSize);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        String window = hasMaintenanceWindow()
                ? String.format("%02d:00-%02d:00 %s", maintenanceWindowStartHour, maintenanceWindowEndHour, maintenanceWindowZone)
                : "any time";
        return String.format("Profile: %s | Advisory: %s | Min queries: %d | Margin: %.1f | Rate: %d/%s (burst %d) | Approval: %s"
                        + " | Max indexes/table: %d | Window: %s",
                profileName, advisoryMode, minQueryThreshold, safetyMargin,
                rateLimitPerWindow, rateLimitWindow, burstCapacity, requireApproval, maxIndexesPerTable, window);
    }
}
