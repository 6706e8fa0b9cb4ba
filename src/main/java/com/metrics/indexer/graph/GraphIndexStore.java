package com.metrics.indexer.graph;

import com.metrics.indexer.api.UseCaseKey;
import com.metrics.indexer.store.IdConflictException;
import com.metrics.indexer.store.IndexStore;
import com.metrics.indexer.store.IndexStoreException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * {@link IndexStore} on a graph database. String uniqueness comes from Cypher MERGE,
 * id uniqueness from a guard in the same query.
 */
public class GraphIndexStore implements IndexStore {

    private final CypherExecutor executor;
    private final boolean ownsConnection;

    public GraphIndexStore(CypherExecutor executor) {
        this(executor, false);
    }

    public GraphIndexStore(GraphConnection connection) {
        this(new CypherExecutor(connection), true);
    }

    private GraphIndexStore(CypherExecutor executor, boolean ownsConnection) {
        this.executor = executor;
        this.ownsConnection = ownsConnection;
    }

    @Override
    public OptionalLong lookup(UseCaseKey useCase, long tenantId, String string) {
        List<Map<String, Object>> rows = executor.findByValue(tenantId, useCase.value(), string);
        if (rows.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(idOf(rows.get(0)));
    }

    @Override
    public Optional<String> reverseLookup(UseCaseKey useCase, long tenantId, long encodedId) {
        List<Map<String, Object>> rows = executor.findById(tenantId, useCase.value(), encodedId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable((String) rows.get(0).get("value"));
    }

    @Override
    public long insertIfAbsent(UseCaseKey useCase, long tenantId, String string, long candidateId) {
        List<Map<String, Object>> rows = executor.mergeEntry(tenantId, useCase.value(), string, candidateId);
        if (rows.isEmpty()) {
            throw new IdConflictException(candidateId);
        }
        return idOf(rows.get(0));
    }

    @Override
    public Map<String, Long> lookupMany(UseCaseKey useCase, long tenantId, Set<String> strings) {
        if (strings.isEmpty()) {
            return Map.of();
        }
        return toIdMap(executor.findByValues(tenantId, useCase.value(), new ArrayList<>(strings)));
    }

    @Override
    public Map<String, Long> insertManyIfAbsent(UseCaseKey useCase, long tenantId, Map<String, Long> candidates) {
        if (candidates.isEmpty()) {
            return Map.of();
        }
        Map<String, Long> stored = toIdMap(executor.mergeEntries(tenantId, useCase.value(), candidates));
        if (!candidates.keySet().containsAll(stored.keySet())) {
            throw new IndexStoreException("MERGE returned rows for values that were not submitted");
        }
        return stored;
    }

    @Override
    public void ping() {
        executor.ping();
    }

    @Override
    public String getName() {
        return "graph:" + executor.getConnection().getGraphName();
    }

    @Override
    public void close() {
        if (ownsConnection) {
            executor.getConnection().close();
        }
    }

    private static Map<String, Long> toIdMap(List<Map<String, Object>> rows) {
        Map<String, Long> ids = new HashMap<>(rows.size());
        for (Map<String, Object> row : rows) {
            ids.put((String) row.get("value"), idOf(row));
        }
        return ids;
    }

    private static long idOf(Map<String, Object> row) {
        Object id = row.get("id");
        if (!(id instanceof Number number)) {
            throw new IndexStoreException("Entry has no numeric id: " + row);
        }
        return number.longValue();
    }
}
