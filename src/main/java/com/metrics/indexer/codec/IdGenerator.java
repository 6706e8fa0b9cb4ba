package com.metrics.indexer.codec;

import java.time.Clock;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Generates roughly sequential 63-bit ids for new string entries.
 *
 * <p>Layout, most significant bits first:</p>
 * <pre>
 * | version (4) | seconds since indexer epoch (32) | random (28) |
 * </pre>
 *
 * <p>The version is fixed at {@link #VERSION}, which keeps the top bit clear so
 * every generated id lies in {@code [0, 2^63)} and is accepted by {@link IdCodec}.
 * Uniqueness is not guaranteed here; the backing store arbitrates collisions.</p>
 */
public class IdGenerator {

    public static final int VERSION = 2;
    public static final int VERSION_BITS = 4;
    public static final int TIMESTAMP_BITS = 32;
    public static final int RANDOM_BITS = 28;
    public static final int TOTAL_BITS = VERSION_BITS + TIMESTAMP_BITS + RANDOM_BITS;

    /** 2022-04-01T00:00:00Z. */
    public static final Instant INDEXER_EPOCH = Instant.ofEpochSecond(1_648_771_200L);

    /** Smallest id this generator can produce; everything below is free for reserved ids. */
    public static final long MIN_GENERATED_ID = (long) VERSION << (TOTAL_BITS - VERSION_BITS);

    private static final long TIMESTAMP_MASK = (1L << TIMESTAMP_BITS) - 1;
    private static final long RANDOM_MASK = (1L << RANDOM_BITS) - 1;

    private final Clock clock;
    private final Supplier<Random> random;

    public IdGenerator() {
        this(Clock.systemUTC(), ThreadLocalRandom::current);
    }

    public IdGenerator(Clock clock, Supplier<Random> random) {
        this.clock = clock;
        this.random = random;
    }

    /**
     * Returns a new id.
     *
     * @throws IllegalStateException if the clock reads earlier than {@link #INDEXER_EPOCH}
     */
    public long nextId() {
        long secondsSinceEpoch = clock.instant().getEpochSecond() - INDEXER_EPOCH.getEpochSecond();
        if (secondsSinceEpoch < 0) {
            throw new IllegalStateException("Clock is before the indexer epoch: " + clock.instant());
        }
        long randomPart = random.get().nextLong() & RANDOM_MASK;

        long id = (long) VERSION << (TOTAL_BITS - VERSION_BITS);
        id |= (secondsSinceEpoch & TIMESTAMP_MASK) << RANDOM_BITS;
        id |= randomPart;
        return id;
    }
}
