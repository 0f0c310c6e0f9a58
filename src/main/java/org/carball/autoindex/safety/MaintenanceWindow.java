package org.carball.autoindex.safety;

import org.carball.autoindex.config.IndexerOptions;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Daily window, in whole hours of a zone, during which builds may start. The
 * start hour is inclusive and the end hour exclusive; a start after the end
 * wraps past midnight (22 to 4 covers 22:00-03:59).
 */
public record MaintenanceWindow(int startHour, int endHour, ZoneId zone) {

    public MaintenanceWindow {
        if (startHour < 0 || startHour > 23 || endHour < 0 || endHour > 23 || startHour == endHour) {
            throw new IllegalArgumentException("Invalid maintenance window " + startHour + "-" + endHour);
        }
        Objects.requireNonNull(zone, "zone");
    }

    /**
     * The configured window, or {@code null} when builds may start at any time.
     */
    public static MaintenanceWindow from(IndexerOptions options) {
        if (!options.hasMaintenanceWindow()) {
            return null;
        }
        return new MaintenanceWindow(options.getMaintenanceWindowStartHour(),
                options.getMaintenanceWindowEndHour(), options.getMaintenanceWindowZone());
    }

    public boolean isOpen(Instant now) {
        int hour = now.atZone(zone).getHour();
        if (startHour < endHour) {
            return hour >= startHour && hour < endHour;
        }
        return hour >= startHour || hour < endHour;
    }

    /**
     * Zero while open, otherwise the time until the next opening.
     */
    public Duration timeUntilOpen(Instant now) {
        if (isOpen(now)) {
            return Duration.ZERO;
        }
        ZonedDateTime local = now.atZone(zone);
        ZonedDateTime opening = local.truncatedTo(ChronoUnit.DAYS).withHour(startHour);
        if (!opening.isAfter(local)) {
            opening = opening.plusDays(1);
        }
        return Duration.between(local, opening);
    }

    @Override
    public String toString() {
        return String.format("%02d:00-%02d:00 %s", startHour, endHour, zone);
    }
}
