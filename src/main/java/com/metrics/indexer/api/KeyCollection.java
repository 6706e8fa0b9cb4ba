package com.metrics.indexer.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of strings to index, grouped by tenant.
 */
public final class KeyCollection {

    private static final KeyCollection EMPTY = new KeyCollection(Map.of());

    private final Map<Long, Set<String>> mapping;
    private final int size;

    public KeyCollection(Map<Long, ? extends Set<String>> mapping) {
        Map<Long, Set<String>> copy = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<Long, ? extends Set<String>> entry : mapping.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            for (String string : entry.getValue()) {
                Objects.requireNonNull(string, "strings must not contain null");
            }
            Set<String> strings = Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue()));
            copy.put(entry.getKey(), strings);
            total += strings.size();
        }
        this.mapping = Collections.unmodifiableMap(copy);
        this.size = total;
    }

    public static KeyCollection empty() {
        return EMPTY;
    }

    public static KeyCollection of(long tenantId, Set<String> strings) {
        return new KeyCollection(Map.of(tenantId, strings));
    }

    /**
     * Returns tenant to strings. Tenants with no strings are omitted.
     */
    public Map<Long, Set<String>> getMapping() {
        return mapping;
    }

    public Set<String> getStrings(long tenantId) {
        return mapping.getOrDefault(tenantId, Set.of());
    }

    public boolean contains(long tenantId, String string) {
        return getStrings(tenantId).contains(string);
    }

    /**
     * Total number of {@code (tenant, string)} pairs.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Flattens to {@code (tenant, string)} pairs.
     */
    public List<Key> asTuples() {
        List<Key> keys = new ArrayList<>(size);
        mapping.forEach((tenantId, strings) -> strings.forEach(s -> keys.add(new Key(tenantId, s))));
        return keys;
    }

    /**
     * Builds a collection incrementally.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyCollection that)) return false;
        return mapping.equals(that.mapping);
    }

    @Override
    public int hashCode() {
        return mapping.hashCode();
    }

    @Override
    public String toString() {
        return "KeyCollection{tenants=" + mapping.size() + ", size=" + size + '}';
    }

    /**
     * A single {@code (tenant, string)} pair.
     */
    public record Key(long tenantId, String string) {}

    public static class Builder {
        private final Map<Long, Set<String>> mapping = new LinkedHashMap<>();

        public Builder add(long tenantId, String string) {
            mapping.computeIfAbsent(tenantId, k -> new LinkedHashSet<>()).add(string);
            return this;
        }

        public Builder addAll(long tenantId, Set<String> strings) {
            mapping.computeIfAbsent(tenantId, k -> new LinkedHashSet<>()).addAll(strings);
            return this;
        }

        public KeyCollection build() {
            return new KeyCollection(mapping);
        }
    }
}
