package com.metrics.indexer.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.metrics.indexer.store.IndexStoreException;
import com.metrics.indexer.store.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.exceptions.JedisConnectionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * FalkorDB-specific implementation using JFalkorDB client.
 *
 * <p>Client failures are translated: Jedis connection errors become
 * {@link TransientStoreException}, everything else {@link IndexStoreException}.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);
    private static final Pattern PARAM = Pattern.compile("\\$(\\w+)");

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {} at {}:{}", graphName, host, port);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = run(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for graph {}", graphName);
        safeExecute("CREATE INDEX FOR (s:IndexedString) ON (s.value)");
        safeExecute("CREATE INDEX FOR (s:IndexedString) ON (s.id)");
        safeExecute("CREATE INDEX FOR (s:IndexedString) ON (s.tenantId)");
        log.info("Index creation complete");
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection closed");
    }

    private ResultSet run(String processedQuery) {
        try {
            return graph.query(processedQuery);
        } catch (JedisConnectionException e) {
            throw new TransientStoreException("FalkorDB connection failed for graph " + graphName, e);
        } catch (RuntimeException e) {
            throw new IndexStoreException("FalkorDB query failed for graph " + graphName, e);
        }
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $param} placeholders with literal values in a single pass,
     * so text inside a substituted value is never treated as a placeholder.
     * Unknown placeholders are left as they are.
     */
    static String processParams(String query, Map<String, Object> params) {
        Matcher matcher = PARAM.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = params.containsKey(name) ? formatValue(params.get(name)) : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> e.getKey() + ": " + formatValue(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
