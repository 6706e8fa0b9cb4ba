package com.metrics.indexer.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a check on the index store, the cache, or the indexer as a whole.
 * Details keep insertion order so reports list them the way checks add them.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status {
        UP, DEGRADED, DOWN;

        public boolean isWorseThan(Status other) {
            return ordinal() > other.ordinal();
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status");
        message = message != null ? message : status.name();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    /**
     * DEGRADED because {@code error} was thrown. The message carries the error
     * message and the {@code error} detail its simple class name.
     */
    public static HealthStatus degraded(String reason, Throwable error) {
        return degraded(reason + ": " + error.getMessage())
                .withDetail("error", error.getClass().getSimpleName());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    /**
     * DOWN because {@code error} was thrown, formatted like {@link #degraded(String, Throwable)}.
     */
    public static HealthStatus down(String reason, Throwable error) {
        return down(reason + ": " + error.getMessage())
                .withDetail("error", error.getClass().getSimpleName());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(details);
        newDetails.put(key, value);
        return new HealthStatus(status, message, newDetails);
    }

    /**
     * This status as one entry of an aggregate report: status name, message and details.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.name());
        summary.put("message", message);
        summary.put("details", details);
        return Collections.unmodifiableMap(summary);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
