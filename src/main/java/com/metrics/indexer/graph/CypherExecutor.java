package com.metrics.indexer.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Executes the Cypher queries behind the graph index store.
 *
 * <p>Each entry is one {@code :IndexedString} node keyed by
 * {@code (tenantId, useCase, value)} and carrying the encoded {@code id}.</p>
 */
public class CypherExecutor {
    private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

    private final GraphConnection connection;

    public CypherExecutor(GraphConnection connection) {
        this.connection = connection;
    }

    // ========== Forward lookup ==========

    /**
     * Find the entry for a single string.
     */
    public List<Map<String, Object>> findByValue(long tenantId, String useCase, String value) {
        String query = """
                MATCH (s:IndexedString {tenantId: $tenantId, useCase: $useCase, value: $value})
                RETURN s.value as value, s.id as id
                """;
        return connection.query(query, Map.of(
                "tenantId", tenantId,
                "useCase", useCase,
                "value", value
        ));
    }

    /**
     * Find the entries for several strings of one tenant in a single round trip.
     */
    public List<Map<String, Object>> findByValues(long tenantId, String useCase, List<String> values) {
        String query = """
                UNWIND $values AS v
                MATCH (s:IndexedString {tenantId: $tenantId, useCase: $useCase, value: v})
                RETURN s.value as value, s.id as id
                """;
        return connection.query(query, Map.of(
                "tenantId", tenantId,
                "useCase", useCase,
                "values", values
        ));
    }

    // ========== Reverse lookup ==========

    /**
     * Find the entry stored under an encoded id.
     */
    public List<Map<String, Object>> findById(long tenantId, String useCase, long id) {
        String query = """
                MATCH (s:IndexedString {tenantId: $tenantId, useCase: $useCase, id: $id})
                RETURN s.value as value, s.id as id
                """;
        return connection.query(query, Map.of(
                "tenantId", tenantId,
                "useCase", useCase,
                "id", id
        ));
    }

    // ========== Insert-if-absent ==========

    /**
     * Create the entry unless it exists. Writes are serialized per graph, so the
     * returned id is the one that won. Returns no row when the candidate id
     * already belongs to another value.
     */
    public List<Map<String, Object>> mergeEntry(long tenantId, String useCase, String value, long candidateId) {
        String query = """
                OPTIONAL MATCH (taken:IndexedString {tenantId: $tenantId, useCase: $useCase, id: $id})
                WHERE taken.value <> $value
                WITH count(taken) AS conflicts
                WHERE conflicts = 0
                MERGE (s:IndexedString {tenantId: $tenantId, useCase: $useCase, value: $value})
                ON CREATE SET s.id = $id, s.createdAt = timestamp()
                RETURN s.value as value, s.id as id
                """;
        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "tenantId", tenantId,
                "useCase", useCase,
                "value", value,
                "id", candidateId
        ));
        log.debug("Merged entry for tenant {} in {}", tenantId, useCase);
        return rows;
    }

    /**
     * Batched {@link #mergeEntry}. Values whose candidate id is taken get no
     * row. The guard runs before any MERGE, so candidate ids must be distinct.
     *
     * @param candidates value to candidate id
     */
    public List<Map<String, Object>> mergeEntries(long tenantId, String useCase, Map<String, Long> candidates) {
        String query = """
                UNWIND $entries AS e
                OPTIONAL MATCH (taken:IndexedString {tenantId: $tenantId, useCase: $useCase, id: e.id})
                WHERE taken.value <> e.value
                WITH e, count(taken) AS conflicts
                WHERE conflicts = 0
                MERGE (s:IndexedString {tenantId: $tenantId, useCase: $useCase, value: e.value})
                ON CREATE SET s.id = e.id, s.createdAt = timestamp()
                RETURN s.value as value, s.id as id
                """;
        List<Map<String, Object>> entries = new ArrayList<>(candidates.size());
        candidates.forEach((value, id) -> entries.add(Map.of("value", value, "id", id)));

        List<Map<String, Object>> rows = connection.query(query, Map.of(
                "tenantId", tenantId,
                "useCase", useCase,
                "entries", entries
        ));
        log.debug("Merged {} entries for tenant {} in {}", entries.size(), tenantId, useCase);
        return rows;
    }

    // ========== Liveness ==========

    public void ping() {
        connection.query("RETURN 1");
    }

    public GraphConnection getConnection() {
        return connection;
    }
}
