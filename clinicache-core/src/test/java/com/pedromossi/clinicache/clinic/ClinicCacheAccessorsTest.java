package com.pedromossi.clinicache.clinic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pedromossi.clinicache.MutableClock;
import com.pedromossi.clinicache.impl.TaggedCacheManager;
import com.pedromossi.clinicache.local.CaffeineCacheStore;
import com.pedromossi.clinicache.store.DualCacheStore;
import com.pedromossi.clinicache.trigger.TriggerDispatcher;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.ParameterizedTypeReference;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClinicCacheAccessors")
class ClinicCacheAccessorsTest {

    private static final ParameterizedTypeReference<List<String>> ROWS = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<String> TEXT = new ParameterizedTypeReference<>() {};

    @Mock private ClinicDataSource dataSource;

    private MutableClock clock;
    private TaggedCacheManager cache;
    private ClinicCacheAccessors accessors;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T09:00:00Z");
        DualCacheStore store = new DualCacheStore(new CaffeineCacheStore("maximumSize=1000"), Optional.empty());
        cache = new TaggedCacheManager(store, new TriggerDispatcher(), Duration.ofHours(1), clock);
        accessors = new ClinicCacheAccessors(cache, dataSource);
    }

    @Nested
    @DisplayName("Screening types")
    class ScreeningTypes {

        @Test
        @DisplayName("should load once per filter and cache for 30 minutes")
        void shouldCacheScreeningTypes() {
            List<ScreeningTypeSummary> active = List.of(new ScreeningTypeSummary(1L, "A1C", true));
            when(dataSource.findScreeningTypes(true)).thenReturn(active);

            assertThat(accessors.activeScreeningTypes()).isEqualTo(active);
            assertThat(accessors.screeningTypes(true)).isEqualTo(active);
            verify(dataSource, times(1)).findScreeningTypes(true);

            clock.advance(Duration.ofMinutes(31));
            accessors.screeningTypes(true);
            verify(dataSource, times(2)).findScreeningTypes(true);
        }

        @Test
        @DisplayName("should tag the active and full lists differently")
        void shouldTagByFilter() {
            when(dataSource.findScreeningTypes(true)).thenReturn(List.of());
            when(dataSource.findScreeningTypes(false)).thenReturn(List.of());
            accessors.screeningTypes(true);
            accessors.screeningTypes(false);

            assertThat(cache.invalidateByTag(ClinicCacheTags.ALL_SCREENING_TYPES)).isEqualTo(1);
            assertThat(cache.get("screening_types:active=true")).isNotNull();
            assertThat(cache.invalidateByTag(ClinicCacheTags.SCREENING_TYPES)).isEqualTo(1);
        }

        @Test
        @DisplayName("should propagate data source failures and cache nothing")
        void shouldPropagateFailures() {
            when(dataSource.findScreeningTypes(true)).thenThrow(new IllegalStateException("db down"));

            assertThatThrownBy(() -> accessors.screeningTypes(true)).isInstanceOf(IllegalStateException.class);
            assertThat(cache.getStats().getCacheSize()).isZero();
        }
    }

    @Nested
    @DisplayName("Patient demographics")
    class Demographics {

        @Test
        @DisplayName("should cache demographics under the patient tags")
        void shouldCacheDemographics() {
            PatientDemographics demographics = new PatientDemographics(7L, 50, "M", LocalDate.of(1974, 2, 1), List.of());
            when(dataSource.findPatientDemographics(7L)).thenReturn(Optional.of(demographics));

            assertThat(accessors.patientDemographics(7L)).isEqualTo(demographics);
            assertThat(cache.get("patient_demographics:7")).isEqualTo(demographics);
            assertThat(cache.invalidateByTag("patient_7")).isEqualTo(1);
        }

        @Test
        @DisplayName("should not cache a missing patient")
        void shouldNotCacheMissingPatient() {
            when(dataSource.findPatientDemographics(8L)).thenReturn(Optional.empty());

            assertThat(accessors.patientDemographics(8L)).isNull();
            assertThat(accessors.patientDemographics(8L)).isNull();
            verify(dataSource, times(2)).findPatientDemographics(8L);
        }
    }

    @Test
    @DisplayName("document types should be cached for two hours")
    void shouldCacheDocumentTypes() {
        when(dataSource.findDocumentTypes()).thenReturn(List.of("lab"));

        accessors.documentTypes();
        clock.advance(Duration.ofMinutes(119));
        accessors.documentTypes();
        verify(dataSource, times(1)).findDocumentTypes();

        clock.advance(Duration.ofMinutes(2));
        accessors.documentTypes();
        verify(dataSource, times(2)).findDocumentTypes();
    }

    @Test
    @DisplayName("prep sheets should be keyed by patient and document flag")
    void shouldCachePrepSheets() {
        AtomicInteger generated = new AtomicInteger();

        accessors.prepSheet(5L, true, TEXT, () -> "with-docs-" + generated.incrementAndGet());
        accessors.prepSheet(5L, false, TEXT, () -> "without-docs-" + generated.incrementAndGet());
        String cached = accessors.prepSheet(5L, true, TEXT, () -> "again-" + generated.incrementAndGet());

        assertThat(cached).isEqualTo("with-docs-1");
        assertThat(generated.get()).isEqualTo(2);
        assertThat(cache.invalidateByTag(ClinicCacheTags.prepSheet(5L))).isEqualTo(2);
    }

    @Nested
    @DisplayName("Document repository")
    class DocumentRepository {

        @Test
        @DisplayName("should derive the same key regardless of filter order")
        void shouldUseCanonicalKey() {
            Map<String, Object> first = new LinkedHashMap<>();
            first.put("type", "lab");
            first.put("year", 2024);
            Map<String, Object> second = new LinkedHashMap<>();
            second.put("year", 2024);
            second.put("type", "lab");

            String key = ClinicCacheAccessors.documentRepositoryKey(12L, first);

            assertThat(key).isEqualTo(ClinicCacheAccessors.documentRepositoryKey(12L, second));
            assertThat(key).matches("document_repository:[0-9a-f]{32}");
            assertThat(key).isNotEqualTo(ClinicCacheAccessors.documentRepositoryKey(13L, first));
            assertThat(ClinicCacheAccessors.documentRepositoryKey(null, null)).startsWith("document_repository:");
        }

        @Test
        @DisplayName("should tag the listing with every returned document")
        void shouldTagEachDocument() {
            AtomicInteger queries = new AtomicInteger();
            List<String> rows = List.of("doc-1", "doc-2");

            accessors.documentRepository(12L, Map.of("type", "lab"), ROWS, row -> row.substring(4),
                    () -> {
                        queries.incrementAndGet();
                        return rows;
                    });
            List<String> cached = accessors.documentRepository(12L, Map.of("type", "lab"), ROWS, row -> row.substring(4),
                    () -> {
                        queries.incrementAndGet();
                        return rows;
                    });

            assertThat(cached).isEqualTo(rows);
            assertThat(queries.get()).isEqualTo(1);
            assertThat(cache.invalidateByTag(ClinicCacheTags.document("2"))).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("OCR results should be tagged with their document")
    void shouldCacheOcrResults() {
        accessors.ocrResult(99L, TEXT, () -> "scanned text");

        assertThat(cache.get("ocr_result:99")).isEqualTo("scanned text");
        assertThat(cache.invalidateByTag(ClinicCacheTags.document(99L))).isEqualTo(1);
    }
}
