package com.pedromossi.clinicache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pedromossi.clinicache.CacheEntry;
import com.pedromossi.clinicache.CacheStore;
import com.pedromossi.clinicache.local.CaffeineCacheStore;
import com.pedromossi.clinicache.serializer.SerializationException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.ParameterizedTypeReference;

@ExtendWith(MockitoExtension.class)
@DisplayName("DualCacheStore")
class DualCacheStoreTest {

    private static final String KEY = "screening_types:active=true";
    private static final Duration TTL = Duration.ofMinutes(30);
    private static final ParameterizedTypeReference<String> TYPE_REF = new ParameterizedTypeReference<>() {};
    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    @Mock private CacheStore durable;

    private CaffeineCacheStore local;
    private DualCacheStore store;

    @BeforeEach
    void setUp() {
        local = new CaffeineCacheStore("maximumSize=100");
        store = new DualCacheStore(local, Optional.of(durable));
    }

    private static CacheEntry entry(String value) {
        return CacheEntry.of(KEY, value, NOW, TTL, Set.of("screening_types"), 1);
    }

    @Nested
    @DisplayName("Write path")
    class WritePath {

        @Test
        @DisplayName("should write both stores")
        void shouldWriteBothStores() {
            CacheEntry entry = entry("v");

            assertThat(store.put(entry, TTL)).isTrue();

            verify(durable).put(entry, TTL);
            assertThat(local.get(KEY, TYPE_REF)).isSameAs(entry);
        }

        @Test
        @DisplayName("should keep the value in process when the durable store is unreachable")
        void shouldSurviveUnreachableDurable() {
            doThrow(new BackendUnavailableException("down")).when(durable).put(any(), any());

            assertThat(store.put(entry("v"), TTL)).isTrue();
            assertThat(local.get(KEY, TYPE_REF)).isNotNull();
        }

        @Test
        @DisplayName("should keep the value in process when it cannot be encoded")
        void shouldSurviveSerializationFailure() {
            doThrow(new SerializationException("not encodable", new IllegalStateException()))
                    .when(durable).put(any(), any());

            assertThat(store.put(entry("v"), TTL)).isTrue();
            assertThat(local.get(KEY, TYPE_REF)).isNotNull();
        }
    }

    @Nested
    @DisplayName("Read path")
    class ReadPath {

        @Test
        @DisplayName("should prefer the durable copy")
        void shouldPreferDurable() {
            CacheEntry durableEntry = entry("durable");
            local.put(entry("local"), TTL);
            when(durable.get(KEY, TYPE_REF)).thenReturn(durableEntry);

            assertThat(store.get(KEY, TYPE_REF)).isSameAs(durableEntry);
        }

        @Test
        @DisplayName("should fall back to the in-process copy on a durable miss")
        void shouldFallBackOnMiss() {
            CacheEntry localEntry = entry("local");
            local.put(localEntry, TTL);

            assertThat(store.get(KEY, TYPE_REF)).isSameAs(localEntry);
        }

        @Test
        @DisplayName("should fall back to the in-process copy when the durable store fails")
        void shouldFallBackOnFailure() {
            CacheEntry localEntry = entry("local");
            local.put(localEntry, TTL);
            when(durable.get(eq(KEY), any())).thenThrow(new BackendUnavailableException("timeout"));

            assertThat(store.get(KEY, TYPE_REF)).isSameAs(localEntry);
        }

        @Test
        @DisplayName("should return null when neither store holds the key")
        void shouldMissEverywhere() {
            assertThat(store.get(KEY, TYPE_REF)).isNull();
        }
    }

    @Nested
    @DisplayName("Deletes and availability")
    class DeletesAndAvailability {

        @Test
        @DisplayName("evict() should report a removal from either store")
        void shouldEvictFromBoth() {
            local.put(entry("v"), TTL);
            when(durable.evict(KEY)).thenReturn(false);

            assertThat(store.evict(KEY)).isTrue();
            assertThat(store.evict(KEY)).isFalse();
        }

        @Test
        @DisplayName("evict() should still remove the in-process copy when the durable store fails")
        void shouldEvictLocallyOnFailure() {
            local.put(entry("v"), TTL);
            when(durable.evict(anyString())).thenThrow(new BackendUnavailableException("down"));

            assertThat(store.evict(KEY)).isTrue();
            assertThat(local.size()).isZero();
        }

        @Test
        @DisplayName("clear() should report a durable failure but still clear the in-process store")
        void shouldReportClearFailure() {
            local.put(entry("v"), TTL);
            doThrow(new BackendUnavailableException("down")).when(durable).clear();

            assertThat(store.clear()).isFalse();
            assertThat(store.localSize()).isZero();
        }

        @Test
        @DisplayName("should reflect the durable store's reachability")
        void shouldReportAvailability() {
            when(durable.isAvailable()).thenReturn(true, false);

            assertThat(store.hasDurableStore()).isTrue();
            assertThat(store.isDurableAvailable()).isTrue();
            assertThat(store.isDurableAvailable()).isFalse();
        }

        @Test
        @DisplayName("should report no durable store in in-process-only mode")
        void shouldReportInProcessOnly() {
            DualCacheStore localOnly = new DualCacheStore(new CaffeineCacheStore("maximumSize=10"), Optional.empty());

            assertThat(localOnly.hasDurableStore()).isFalse();
            assertThat(localOnly.isDurableAvailable()).isFalse();
            assertThat(localOnly.clear()).isTrue();
        }
    }

    @Nested
    @DisplayName("Outdated durable copies")
    class OutdatedDurableCopies {

        @Test
        @DisplayName("should not read the durable copy of a key whose durable write failed")
        void shouldSkipDurableReadAfterFailedWrite() {
            doThrow(new BackendUnavailableException("down")).when(durable).put(any(), any());
            when(durable.evict(KEY)).thenThrow(new BackendUnavailableException("down"));
            CacheEntry newer = entry("v2");

            store.put(newer, TTL);

            assertThat(store.get(KEY, TYPE_REF)).isSameAs(newer);
            assertThat(store.staleDurableKeyCount()).isEqualTo(1);
            verify(durable, never()).get(anyString(), any());
        }

        @Test
        @DisplayName("should delete the outdated durable copy once the backend answers again")
        void shouldRepairOnceReachable() {
            when(durable.evict(KEY)).thenThrow(new BackendUnavailableException("down")).thenReturn(true);
            local.put(entry("v"), TTL);

            store.evict(KEY);
            assertThat(store.get(KEY, TYPE_REF)).isNull();

            assertThat(store.staleDurableKeyCount()).isZero();
            verify(durable, never()).get(anyString(), any());
        }

        @Test
        @DisplayName("should treat a value that cannot be encoded as leaving an outdated durable copy")
        void shouldMarkUnencodableValue() {
            doThrow(new SerializationException("not encodable", new IllegalStateException()))
                    .when(durable).put(any(), any());

            store.put(entry("v"), TTL);

            assertThat(store.staleDurableKeyCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should suspend durable reads until a failed clear is retried successfully")
        void shouldRetryPendingClear() {
            doThrow(new BackendUnavailableException("down")).doNothing().when(durable).clear();

            assertThat(store.clear()).isFalse();
            assertThat(store.isDurableClearPending()).isTrue();

            assertThat(store.get(KEY, TYPE_REF)).isNull();
            assertThat(store.isDurableClearPending()).isFalse();
            verify(durable).get(KEY, TYPE_REF);
        }
    }
}
