package com.metrics.indexer.api;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Outcome of indexing one {@code (tenantId, string)} pair: either the id it
 * resolved to or the reason it failed.
 *
 * @param tenantId the tenant the string belongs to
 * @param string   the raw string
 * @param id       the resolved id, or null when the key failed
 * @param failure  why the key failed, or null when it resolved
 */
public record KeyResult(long tenantId, String string, Long id, String failure) {

    public KeyResult {
        Objects.requireNonNull(string, "string");
        if ((id == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of id and failure must be set");
        }
    }

    public static KeyResult resolved(long tenantId, String string, long id) {
        return new KeyResult(tenantId, string, id, null);
    }

    public static KeyResult failed(long tenantId, String string, String failure) {
        return new KeyResult(tenantId, string, null, failure != null ? failure : "unknown error");
    }

    public boolean isResolved() {
        return id != null;
    }

    public OptionalLong resolvedId() {
        return id != null ? OptionalLong.of(id) : OptionalLong.empty();
    }

    public Optional<String> failureReason() {
        return Optional.ofNullable(failure);
    }
}
