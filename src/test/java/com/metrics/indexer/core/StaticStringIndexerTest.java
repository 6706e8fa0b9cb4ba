package com.metrics.indexer.core;

import com.metrics.indexer.api.KeyCollection;
import com.metrics.indexer.api.KeyResult;
import com.metrics.indexer.api.KeyResults;
import com.metrics.indexer.api.StringIndexer;
import com.metrics.indexer.api.UseCaseKey;
import com.metrics.indexer.codec.IdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StaticStringIndexerTest {

    @Mock
    private StringIndexer inner;

    private StaticStringIndexer indexer;

    @BeforeEach
    void setUp() {
        indexer = new StaticStringIndexer(inner);
    }

    @Test
    @DisplayName("Shared strings resolve to their reserved ids without the inner indexer")
    void sharedStringsAnsweredDirectly() {
        assertEquals(SharedStrings.idOf("environment"), indexer.resolve(UseCaseKey.PERFORMANCE, 1L, "environment"));
        assertEquals(SharedStrings.idOf("release"), indexer.record(UseCaseKey.RELEASE_HEALTH, 2L, "release"));
        assertEquals(Optional.of("environment"),
                indexer.reverseResolve(UseCaseKey.PERFORMANCE, 1L, SharedStrings.idOf("environment").getAsLong()));

        verifyNoInteractions(inner);
    }

    @Test
    @DisplayName("Other strings are forwarded")
    void othersForwarded() {
        when(inner.resolve(UseCaseKey.PERFORMANCE, 1L, "/checkout")).thenReturn(OptionalLong.of(99L));
        when(inner.reverseResolve(UseCaseKey.PERFORMANCE, 1L, IdGenerator.MIN_GENERATED_ID))
                .thenReturn(Optional.of("/checkout"));

        assertEquals(99L, indexer.resolve(UseCaseKey.PERFORMANCE, 1L, "/checkout").getAsLong());
        assertEquals("/checkout",
                indexer.reverseResolve(UseCaseKey.PERFORMANCE, 1L, IdGenerator.MIN_GENERATED_ID).orElseThrow());
    }

    @Test
    @DisplayName("bulkRecord forwards only the non-shared strings and merges the results")
    void bulkRecordSplits() {
        when(inner.bulkRecord(eq(UseCaseKey.PERFORMANCE), any())).thenReturn(new KeyResults()
                .addKeyResult(KeyResult.resolved(1L, "/checkout", 1000L)));

        KeyCollection keys = KeyCollection.of(1L, Set.of("transaction", "/checkout"));
        KeyResults results = indexer.bulkRecord(UseCaseKey.PERFORMANCE, keys);

        ArgumentCaptor<KeyCollection> forwarded = ArgumentCaptor.forClass(KeyCollection.class);
        verify(inner).bulkRecord(eq(UseCaseKey.PERFORMANCE), forwarded.capture());
        assertEquals(KeyCollection.of(1L, Set.of("/checkout")), forwarded.getValue());

        assertEquals(SharedStrings.idOf("transaction"), results.getId(1L, "transaction"));
        assertEquals(1000L, results.getId(1L, "/checkout").getAsLong());
    }

    @Test
    @DisplayName("A request of only shared strings never reaches the inner indexer")
    void onlySharedStrings() {
        KeyResults results = indexer.bulkRecord(UseCaseKey.PERFORMANCE,
                KeyCollection.builder().add(1L, "ok").add(2L, "production").build());

        assertEquals(2, results.size());
        verifyNoInteractions(inner);
    }

    @Test
    @DisplayName("Reserved ids are unique and below every generated id")
    void reservedIdsBelowGenerated() {
        Set<Long> ids = new HashSet<>(SharedStrings.all().values());

        assertEquals(SharedStrings.all().size(), ids.size());
        assertTrue(ids.stream().allMatch(id -> id > 0 && id < IdGenerator.MIN_GENERATED_ID));
        SharedStrings.all().forEach((string, id) -> assertEquals(Optional.of(string), SharedStrings.stringOf(id)));
    }
}
