package com.metrics.indexer.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdGenerator Tests")
class IdGeneratorTest {

    private static Clock clockAt(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Ids fit in 63 bits and carry the version")
    void idsCarryVersion() {
        IdGenerator generator = new IdGenerator();
        for (int i = 0; i < 1_000; i++) {
            long id = generator.nextId();
            assertTrue(id >= 0);
            assertEquals(IdGenerator.VERSION, id >>> (IdGenerator.TOTAL_BITS - IdGenerator.VERSION_BITS));
            assertTrue(id >= IdGenerator.MIN_GENERATED_ID);
        }
    }

    @Test
    @DisplayName("At the epoch the timestamp bits are zero")
    void epochHasZeroTimestamp() {
        IdGenerator generator = new IdGenerator(clockAt(IdGenerator.INDEXER_EPOCH), () -> new Random(1));
        long id = generator.nextId();

        long timestamp = (id >>> IdGenerator.RANDOM_BITS) & ((1L << IdGenerator.TIMESTAMP_BITS) - 1);
        assertEquals(0, timestamp);
    }

    @Test
    @DisplayName("Timestamp bits hold seconds since the epoch")
    void timestampBits() {
        Instant now = IdGenerator.INDEXER_EPOCH.plusSeconds(86_400);
        IdGenerator generator = new IdGenerator(clockAt(now), () -> new Random(1));
        long id = generator.nextId();

        long timestamp = (id >>> IdGenerator.RANDOM_BITS) & ((1L << IdGenerator.TIMESTAMP_BITS) - 1);
        assertEquals(86_400, timestamp);
    }

    @Test
    @DisplayName("Later clocks give larger ids")
    void roughlySequential() {
        IdGenerator earlier = new IdGenerator(clockAt(Instant.parse("2024-01-01T00:00:00Z")), Random::new);
        IdGenerator later = new IdGenerator(clockAt(Instant.parse("2024-01-01T00:00:01Z")), Random::new);

        assertTrue(later.nextId() > earlier.nextId());
    }

    @Test
    @DisplayName("Ids within one second differ by their random bits")
    void randomBitsVary() {
        IdGenerator generator = new IdGenerator(clockAt(Instant.parse("2024-06-01T12:00:00Z")), Random::new);
        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            ids.add(generator.nextId());
        }
        assertTrue(ids.size() > 990);
    }

    @Test
    @DisplayName("A clock before the epoch is rejected")
    void clockBeforeEpoch() {
        IdGenerator generator = new IdGenerator(clockAt(Instant.parse("2020-01-01T00:00:00Z")), Random::new);
        assertThrows(IllegalStateException.class, generator::nextId);
    }
}
