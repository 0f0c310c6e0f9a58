package org.carball.autoindex.model.health;

public enum HealthStatus {
    HEALTHY,
    BLOATED,
    UNDERUTILIZED
}
