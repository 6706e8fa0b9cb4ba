package com.metrics.indexer.core;

import com.metrics.indexer.codec.IdGenerator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Well-known strings with reserved ids, shared by every tenant and use case.
 *
 * <p>Reserved ids sit far below {@link IdGenerator#MIN_GENERATED_ID}, so they
 * can never collide with a generated id. Ids here are permanent: append new
 * strings with new ids, never renumber.</p>
 */
public final class SharedStrings {

    private static final Map<String, Long> IDS;
    private static final Map<Long, String> STRINGS;

    static {
        Map<String, Long> ids = new LinkedHashMap<>();
        // session status values
        ids.put("abnormal", 1L);
        ids.put("crashed", 2L);
        ids.put("errored", 3L);
        ids.put("exited", 4L);
        ids.put("healthy", 5L);
        ids.put("init", 6L);
        // common tag keys
        ids.put("environment", 7L);
        ids.put("release", 8L);
        ids.put("session.status", 9L);
        ids.put("transaction", 10L);
        ids.put("transaction.status", 11L);
        ids.put("transaction.op", 12L);
        ids.put("http.method", 13L);
        ids.put("browser.name", 14L);
        ids.put("os.name", 15L);
        ids.put("device.class", 16L);
        // common tag values
        ids.put("production", 17L);
        ids.put("staging", 18L);
        ids.put("ok", 19L);
        ids.put("cancelled", 20L);
        ids.put("unknown", 21L);
        ids.put("internal_error", 22L);
        // metric names
        ids.put("sessions.session", 23L);
        ids.put("sessions.user", 24L);
        ids.put("sessions.session.duration", 25L);
        ids.put("sessions.session.error", 26L);
        ids.put("transactions.transaction.duration", 27L);
        ids.put("transactions.user", 28L);
        ids.put("transactions.measurements.lcp", 29L);
        ids.put("transactions.measurements.fcp", 30L);

        Map<Long, String> strings = new LinkedHashMap<>();
        ids.forEach((string, id) -> {
            if (strings.put(id, string) != null) {
                throw new ExceptionInInitializerError("Duplicate shared string id " + id);
            }
        });
        IDS = Collections.unmodifiableMap(ids);
        STRINGS = Collections.unmodifiableMap(strings);
    }

    private SharedStrings() {
        // utility class
    }

    public static OptionalLong idOf(String string) {
        Long id = IDS.get(string);
        return id != null ? OptionalLong.of(id) : OptionalLong.empty();
    }

    public static Optional<String> stringOf(long id) {
        return Optional.ofNullable(STRINGS.get(id));
    }

    public static boolean contains(String string) {
        return IDS.containsKey(string);
    }

    public static Map<String, Long> all() {
        return IDS;
    }
}
