package com.koni.homeenergy.infrastructure.resilience;

/**
 * Rate-limit tiers. Each tier has its own limiter configuration and its own
 * counters per client.
 */
public enum AdmissionTier {
    /** High-frequency single-record ingestion. */
    SHORT("short"),
    /** Batch ingestion, queries and statistics. */
    MEDIUM("medium"),
    /** Administrative operations such as the retention sweep. */
    LONG("long");

    private final String configName;

    AdmissionTier(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }
}
