package com.metrics.indexer.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Aggregate of {@link KeyResult}s keyed by {@code (tenantId, string)}.
 *
 * <p>Built incrementally while a batch is processed; a later result for the
 * same key replaces the earlier one. Failed keys are kept alongside resolved
 * ones so callers can retry just the failures via {@link #getUnmappedKeys}.
 * Not thread-safe.</p>
 */
public class KeyResults {

    private final Map<Long, Map<String, KeyResult>> results = new LinkedHashMap<>();

    public KeyResults addKeyResult(KeyResult result) {
        results.computeIfAbsent(result.tenantId(), k -> new LinkedHashMap<>())
                .put(result.string(), result);
        return this;
    }

    public KeyResults addKeyResults(Collection<KeyResult> keyResults) {
        keyResults.forEach(this::addKeyResult);
        return this;
    }

    /**
     * Returns a new aggregate holding this one's results overlaid with {@code other}'s.
     */
    public KeyResults merge(KeyResults other) {
        KeyResults merged = new KeyResults();
        merged.addKeyResults(all());
        merged.addKeyResults(other.all());
        return merged;
    }

    public Optional<KeyResult> get(long tenantId, String string) {
        Map<String, KeyResult> byString = results.get(tenantId);
        return byString == null ? Optional.empty() : Optional.ofNullable(byString.get(string));
    }

    /**
     * Returns the resolved id for a key, empty if the key failed or is unknown.
     */
    public OptionalLong getId(long tenantId, String string) {
        return get(tenantId, string).map(KeyResult::resolvedId).orElse(OptionalLong.empty());
    }

    /**
     * Returns tenant to string to id for every resolved key.
     */
    public Map<Long, Map<String, Long>> getMappedResults() {
        Map<Long, Map<String, Long>> mapped = new LinkedHashMap<>();
        results.forEach((tenantId, byString) -> byString.values().stream()
                .filter(KeyResult::isResolved)
                .forEach(r -> mapped.computeIfAbsent(tenantId, k -> new LinkedHashMap<>())
                        .put(r.string(), r.id())));
        return mapped;
    }

    /**
     * Returns the keys that were attempted and failed.
     */
    public KeyCollection getFailedKeys() {
        KeyCollection.Builder builder = KeyCollection.builder();
        all().stream().filter(r -> !r.isResolved()).forEach(r -> builder.add(r.tenantId(), r.string()));
        return builder.build();
    }

    /**
     * Returns the subset of {@code requested} that has no resolved id here,
     * whether it failed or was never attempted.
     */
    public KeyCollection getUnmappedKeys(KeyCollection requested) {
        KeyCollection.Builder builder = KeyCollection.builder();
        for (KeyCollection.Key key : requested.asTuples()) {
            if (getId(key.tenantId(), key.string()).isEmpty()) {
                builder.add(key.tenantId(), key.string());
            }
        }
        return builder.build();
    }

    public List<KeyResult> all() {
        List<KeyResult> all = new ArrayList<>();
        results.values().forEach(byString -> all.addAll(byString.values()));
        return Collections.unmodifiableList(all);
    }

    public int size() {
        return results.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public boolean hasFailures() {
        return all().stream().anyMatch(r -> !r.isResolved());
    }

    @Override
    public String toString() {
        long failed = all().stream().filter(r -> !r.isResolved()).count();
        return "KeyResults{size=" + size() + ", failed=" + failed + '}';
    }
}
