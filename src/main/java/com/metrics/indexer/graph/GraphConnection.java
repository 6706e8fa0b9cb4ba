package com.metrics.indexer.graph;

import java.util.List;
import java.util.Map;

/**
 * Interface for graph database connection management.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query and returns results.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return list of result records as maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    /**
     * Gets the name of the graph being used.
     */
    String getGraphName();

    /**
     * Creates the indexes string lookups rely on, if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
