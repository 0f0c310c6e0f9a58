package org.carball.autoindex.config;

import lombok.Getter;

@Getter
public enum IndexerProfile {

    CONSERVATIVE("conservative", "Conservative approach - only build indexes with a large, well-established benefit",
            2.0, 2.5, 5, 1),

    BALANCED("balanced", "Balanced approach - default settings for most deployments",
            1.0, 1.5, 10, 3),

    AGGRESSIVE("aggressive", "Aggressive approach - build as soon as the benefit clears the cost",
            0.5, 1.1, 20, 5),

    ADVISORY("advisory", "Advisory only - evaluate and record decisions, never touch the schema",
            1.0, 1.5, 10, 3) {
        @Override
        public IndexerOptions buildOptions() {
            IndexerOptions base = super.buildOptions();
            return base.toBuilder()
                    .advisoryMode(true)
                    .build();
        }
    },

    SUPERVISED("supervised", "Every build waits for an operator approval",
            1.0, 1.5, 10, 3) {
        @Override
        public IndexerOptions buildOptions() {
            IndexerOptions base = super.buildOptions();
            return base.toBuilder()
                    .requireApproval(true)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double queryThresholdMultiplier;
    private final double safetyMargin;
    private final int rateLimitPerWindow;
    private final int burstCapacity;

    IndexerProfile(String name, String description, double queryThresholdMultiplier,
                   double safetyMargin, int rateLimitPerWindow, int burstCapacity) {
        this.name = name;
        this.description = description;
        this.queryThresholdMultiplier = queryThresholdMultiplier;
        this.safetyMargin = safetyMargin;
        this.rateLimitPerWindow = rateLimitPerWindow;
        this.burstCapacity = burstCapacity;
    }

    /**
     * Creates IndexerOptions based on this profile's settings.
     */
    public IndexerOptions buildOptions() {
        // Base value that profiles multiply against
        long baseMinQueryThreshold = 100;

        return IndexerOptions.builder()
                .profileName(name)
                .profileDescription(description)
                .minQueryThreshold(Math.max(1, (long) (baseMinQueryThreshold * queryThresholdMultiplier)))
                .safetyMargin(safetyMargin)
                .rateLimitPerWindow(rateLimitPerWindow)
                .burstCapacity(burstCapacity)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static IndexerProfile fromName(String name) {
        for (IndexerProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown indexer profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    /**
     * Returns a comma-separated list of available profile names.
     */
    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (IndexerProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Indexer Profiles:\n\n");
        for (IndexerProfile profile : values()) {
            help.append(String.format("  %-15s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile=<name> to select a profile.\n");
        return help.toString();
    }
}
