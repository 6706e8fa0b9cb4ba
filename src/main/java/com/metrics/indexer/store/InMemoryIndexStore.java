package com.metrics.indexer.store;

import com.metrics.indexer.api.UseCaseKey;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory index store backed by concurrent maps.
 * Suitable for tests and single-process deployments; contents are lost on restart.
 */
public class InMemoryIndexStore implements IndexStore {

    private final ConcurrentMap<StringKey, Long> idsByString = new ConcurrentHashMap<>();
    private final ConcurrentMap<IdKey, String> stringsById = new ConcurrentHashMap<>();

    @Override
    public OptionalLong lookup(UseCaseKey useCase, long tenantId, String string) {
        Long id = idsByString.get(new StringKey(useCase, tenantId, string));
        return id != null ? OptionalLong.of(id) : OptionalLong.empty();
    }

    @Override
    public Optional<String> reverseLookup(UseCaseKey useCase, long tenantId, long encodedId) {
        return Optional.ofNullable(stringsById.get(new IdKey(useCase, tenantId, encodedId)));
    }

    @Override
    public long insertIfAbsent(UseCaseKey useCase, long tenantId, String string, long candidateId) {
        Long stored = claim(useCase, tenantId, string, candidateId);
        if (stored == null) {
            throw new IdConflictException(candidateId);
        }
        return stored;
    }

    @Override
    public Map<String, Long> lookupMany(UseCaseKey useCase, long tenantId, Set<String> strings) {
        Map<String, Long> found = new HashMap<>();
        for (String string : strings) {
            Long id = idsByString.get(new StringKey(useCase, tenantId, string));
            if (id != null) {
                found.put(string, id);
            }
        }
        return found;
    }

    @Override
    public Map<String, Long> insertManyIfAbsent(UseCaseKey useCase, long tenantId, Map<String, Long> candidates) {
        Map<String, Long> stored = new HashMap<>(candidates.size());
        candidates.forEach((string, candidateId) -> {
            Long id = claim(useCase, tenantId, string, candidateId);
            if (id != null) {
                stored.put(string, id);
            }
        });
        return stored;
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public String getName() {
        return "in-memory";
    }

    /**
     * Returns the number of stored entries across all tenants and use cases.
     */
    public int size() {
        return idsByString.size();
    }

    /**
     * Removes every entry.
     */
    public void clear() {
        idsByString.clear();
        stringsById.clear();
    }

    /**
     * Claims the id first and the string second. A caller that loses the
     * string race releases its id claim again.
     *
     * @return the id stored for the string, or null if {@code candidateId} belongs to another string
     */
    private Long claim(UseCaseKey useCase, long tenantId, String string, long candidateId) {
        StringKey stringKey = new StringKey(useCase, tenantId, string);
        Long existing = idsByString.get(stringKey);
        if (existing != null) {
            return existing;
        }

        IdKey idKey = new IdKey(useCase, tenantId, candidateId);
        String holder = stringsById.putIfAbsent(idKey, string);
        if (holder != null && !holder.equals(string)) {
            return idsByString.get(stringKey);
        }

        Long winner = idsByString.putIfAbsent(stringKey, candidateId);
        if (winner != null) {
            if (winner != candidateId) {
                stringsById.remove(idKey, string);
            }
            return winner;
        }
        return candidateId;
    }

    private record StringKey(UseCaseKey useCase, long tenantId, String string) {}

    private record IdKey(UseCaseKey useCase, long tenantId, long id) {}
}
