package com.metrics.indexer.core;

import com.metrics.indexer.api.KeyCollection;
import com.metrics.indexer.api.KeyResult;
import com.metrics.indexer.api.KeyResults;
import com.metrics.indexer.api.StringIndexer;
import com.metrics.indexer.api.UseCaseKey;
import com.metrics.indexer.codec.IdCodec;
import com.metrics.indexer.codec.IdGenerator;
import com.metrics.indexer.logging.LogContext;
import com.metrics.indexer.metrics.MetricsService;
import com.metrics.indexer.metrics.NoOpMetricsService;
import com.metrics.indexer.store.IdConflictException;
import com.metrics.indexer.store.IndexStore;
import com.metrics.indexer.store.OperationNotImplementedException;
import com.metrics.indexer.store.TransientStoreException;
import com.metrics.indexer.tracing.NoOpTracingService;
import com.metrics.indexer.tracing.Span;
import com.metrics.indexer.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link StringIndexer} that persists entries in an {@link IndexStore}.
 *
 * <p>New strings get ids from the {@link IdGenerator}; ids are encoded with the
 * {@link IdCodec} on the way into the store and decoded on the way out, so
 * callers only ever see decoded ids. Uniqueness is left to the store: a string
 * raced by two callers ends up with whichever id the store kept, and a
 * candidate id the store already gave to another string is replaced with a
 * fresh one.</p>
 *
 * <p>{@link #bulkRecord} makes one batched lookup and one batched insert per
 * tenant. Stores without batched calls, and batches that fail as a whole, are
 * retried one string at a time so a single bad key only fails itself. A
 * {@link TransientStoreException} means the store is unreachable and aborts the
 * whole call instead.</p>
 */
public class StoreBackedStringIndexer implements StringIndexer {
    private static final Logger log = LoggerFactory.getLogger(StoreBackedStringIndexer.class);

    /** Fresh ids tried per string before giving up on it. */
    static final int MAX_ID_ATTEMPTS = 5;

    private final IndexStore store;
    private final IdCodec codec;
    private final IdGenerator idGenerator;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public StoreBackedStringIndexer(IndexStore store) {
        this(store, new IdCodec(), new IdGenerator(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public StoreBackedStringIndexer(IndexStore store, IdCodec codec, IdGenerator idGenerator,
                                    MetricsService metricsService, TracingService tracingService) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService");
    }

    /**
     * Runs a trivial query to make sure the store is reachable.
     * A {@link TransientStoreException} is logged and not rethrown; anything else propagates.
     */
    public void validate() {
        try (Span span = tracingService.startSpan("indexer.validate", Map.of("store", store.getName()))) {
            try {
                timed("ping", () -> {
                    store.ping();
                    return null;
                });
                span.setStatus(Span.SpanStatus.OK);
                log.debug("Store {} is reachable", store.getName());
            } catch (TransientStoreException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.warn("Transient connection error while validating store {}: {}",
                        store.getName(), e.getMessage());
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    @Override
    public KeyResults bulkRecord(UseCaseKey useCase, KeyCollection strings) {
        KeyResults results = new KeyResults();
        if (strings.isEmpty()) {
            return results;
        }
        metricsService.recordBatchSize(strings.size());

        try (LogContext ctx = LogContext.forBulkRecord(LogContext.newBatchId(), useCase);
             Span span = tracingService.startSpan("indexer.bulk_record", Map.of("useCase", useCase.value()))) {
            span.setAttribute("size", strings.size());
            span.setAttribute("tenants", strings.getMapping().size());

            try {
                strings.getMapping().forEach((tenantId, tenantStrings) ->
                        results.addKeyResults(recordTenant(useCase, tenantId, tenantStrings)));
            } catch (TransientStoreException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("bulk_record aborted, store {} unreachable: {}", store.getName(), e.getMessage());
                throw e;
            }

            int failed = results.getFailedKeys().size();
            if (failed > 0) {
                metricsService.incrementRecordFailures(useCase, failed);
                log.warn("bulk_record finished with {} of {} keys failed", failed, strings.size());
                span.setAttribute("failed", failed);
            } else {
                log.debug("bulk_record resolved {} keys", strings.size());
            }
            span.setStatus(Span.SpanStatus.OK);
        }
        return results;
    }

    @Override
    public OptionalLong record(UseCaseKey useCase, long tenantId, String string) {
        Objects.requireNonNull(string, "string");
        return bulkRecord(useCase, KeyCollection.of(tenantId, Set.of(string))).getId(tenantId, string);
    }

    @Override
    public OptionalLong resolve(UseCaseKey useCase, long tenantId, String string) {
        if (!StringValidator.isIndexable(string)) {
            return OptionalLong.empty();
        }
        try (LogContext ctx = LogContext.forLookup("resolve", useCase, tenantId)) {
            OptionalLong encoded = timed("lookup", () -> store.lookup(useCase, tenantId, string));
            if (encoded.isEmpty()) {
                log.debug("No entry for string in tenant {}", tenantId);
                return OptionalLong.empty();
            }
            return OptionalLong.of(codec.decode(encoded.getAsLong()));
        }
    }

    @Override
    public Optional<String> reverseResolve(UseCaseKey useCase, long tenantId, long id) {
        if (id < 0) {
            // outside the codec domain, so never written
            return Optional.empty();
        }
        long encoded = codec.encode(id);
        try (LogContext ctx = LogContext.forLookup("reverse_resolve", useCase, tenantId)) {
            return timed("reverseLookup", () -> store.reverseLookup(useCase, tenantId, encoded));
        }
    }

    public IndexStore getStore() {
        return store;
    }

    private List<KeyResult> recordTenant(UseCaseKey useCase, long tenantId, Set<String> strings) {
        List<KeyResult> results = new ArrayList<>(strings.size());
        Set<String> valid = new LinkedHashSet<>();
        for (String string : strings) {
            try {
                StringValidator.validateIndexedString(string);
                valid.add(string);
            } catch (IllegalArgumentException e) {
                results.add(KeyResult.failed(tenantId, string, e.getMessage()));
            }
        }
        if (valid.isEmpty()) {
            return results;
        }

        try {
            results.addAll(recordBatched(useCase, tenantId, valid));
        } catch (OperationNotImplementedException e) {
            log.debug("Store {} lacks {}, recording tenant {} per item",
                    store.getName(), e.getOperation(), tenantId);
            results.addAll(recordEach(useCase, tenantId, valid));
        } catch (TransientStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Batched record failed for tenant {} ({} strings), retrying per item: {}",
                    tenantId, valid.size(), e.getMessage());
            results.addAll(recordEach(useCase, tenantId, valid));
        }
        return results;
    }

    private List<KeyResult> recordBatched(UseCaseKey useCase, long tenantId, Set<String> strings) {
        Map<String, Long> existing = timed("lookupMany", () -> store.lookupMany(useCase, tenantId, strings));

        Map<String, Long> stored = new HashMap<>(existing);
        Set<String> pending = new LinkedHashSet<>(strings);
        pending.removeAll(existing.keySet());
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS && !pending.isEmpty(); attempt++) {
            Map<String, Long> candidates = distinctCandidates(pending);
            Map<String, Long> inserted =
                    timed("insertManyIfAbsent", () -> store.insertManyIfAbsent(useCase, tenantId, candidates));

            int created = 0;
            for (Map.Entry<String, Long> candidate : candidates.entrySet()) {
                Long id = inserted.get(candidate.getKey());
                if (id != null) {
                    stored.put(candidate.getKey(), id);
                    pending.remove(candidate.getKey());
                    if (id.equals(candidate.getValue())) {
                        created++;
                    }
                }
            }
            if (created > 0) {
                metricsService.incrementStringsCreated(useCase, created);
            }
            if (!pending.isEmpty()) {
                log.debug("{} candidate ids already taken in tenant {}, retrying (attempt {})",
                        pending.size(), tenantId, attempt);
            }
        }

        List<KeyResult> results = new ArrayList<>(strings.size());
        for (String string : strings) {
            Long encoded = stored.get(string);
            if (encoded == null) {
                results.add(KeyResult.failed(tenantId, string,
                        "No free id after " + MAX_ID_ATTEMPTS + " attempts"));
            } else {
                results.add(toResult(tenantId, string, encoded));
            }
        }
        return results;
    }

    /**
     * One candidate per string, distinct within the batch. A string whose
     * candidate repeats one already handed out waits for the next attempt.
     */
    private Map<String, Long> distinctCandidates(Set<String> strings) {
        Map<String, Long> candidates = new LinkedHashMap<>();
        Set<Long> used = new HashSet<>();
        for (String string : strings) {
            long candidate = codec.encode(idGenerator.nextId());
            if (used.add(candidate)) {
                candidates.put(string, candidate);
            }
        }
        return candidates;
    }

    private List<KeyResult> recordEach(UseCaseKey useCase, long tenantId, Set<String> strings) {
        List<KeyResult> results = new ArrayList<>(strings.size());
        for (String string : strings) {
            try {
                results.add(toResult(tenantId, string, recordOne(useCase, tenantId, string)));
            } catch (TransientStoreException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Failed to record string for tenant {}: {}", tenantId, e.getMessage());
                results.add(KeyResult.failed(tenantId, string, e.getMessage()));
            }
        }
        return results;
    }

    private long recordOne(UseCaseKey useCase, long tenantId, String string) {
        OptionalLong existing = timed("lookup", () -> store.lookup(useCase, tenantId, string));
        if (existing.isPresent()) {
            return existing.getAsLong();
        }
        IdConflictException conflict = null;
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            long candidate = codec.encode(idGenerator.nextId());
            try {
                long stored = timed("insertIfAbsent",
                        () -> store.insertIfAbsent(useCase, tenantId, string, candidate));
                if (stored == candidate) {
                    metricsService.incrementStringsCreated(useCase, 1);
                }
                return stored;
            } catch (IdConflictException e) {
                log.debug("Candidate id taken in tenant {}, retrying (attempt {})", tenantId, attempt);
                conflict = e;
            }
        }
        throw conflict;
    }

    private KeyResult toResult(long tenantId, String string, long encoded) {
        try {
            return KeyResult.resolved(tenantId, string, codec.decode(encoded));
        } catch (IllegalArgumentException e) {
            return KeyResult.failed(tenantId, string, e.getMessage());
        }
    }

    private <T> T timed(String operation, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            return call.get();
        } finally {
            metricsService.recordStoreDuration(operation, Duration.ofNanos(System.nanoTime() - start));
        }
    }
}
