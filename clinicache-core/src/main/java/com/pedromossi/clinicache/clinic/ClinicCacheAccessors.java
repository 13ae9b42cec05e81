package com.pedromossi.clinicache.clinic;

import com.pedromossi.clinicache.CacheService;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.util.DigestUtils;

/**
 * Read-through accessors for the clinic data that pages request most often.
 *
 * <p>Each accessor builds a deterministic key from its parameters, returns the cached value
 * when present and otherwise loads it, caches it under the accessor's tags and TTL, and
 * returns it. Results that are not found are returned as {@code null} and never cached.</p>
 *
 * <table>
 * <caption>Keys, tags and lifetimes</caption>
 * <tr><th>Accessor</th><th>Key</th><th>Tags</th><th>TTL</th></tr>
 * <tr><td>screening types</td><td>{@code screening_types:active={bool}}</td>
 *     <td>{@code screening_types}, {@code active_screening_types} or {@code all_screening_types}</td><td>30 min</td></tr>
 * <tr><td>patient demographics</td><td>{@code patient_demographics:{id}}</td>
 *     <td>{@code patient_demographics}, {@code patient_{id}}</td><td>1 h</td></tr>
 * <tr><td>document types</td><td>{@code document_types}</td><td>{@code document_types}</td><td>2 h</td></tr>
 * <tr><td>prep sheet</td><td>{@code prep_sheet:{id}:docs_{bool}}</td>
 *     <td>{@code patient_{id}}, {@code prep_sheet_{id}}, {@code prep_sheets}</td><td>30 min</td></tr>
 * <tr><td>document repository</td><td>{@code document_repository:{md5}}</td>
 *     <td>{@code document_repository}, {@code patient_{id}}, {@code document_{id}} per row</td><td>1 h</td></tr>
 * <tr><td>OCR result</td><td>{@code ocr_result:{id}}</td>
 *     <td>{@code document_{id}}, {@code ocr_results}</td><td>24 h</td></tr>
 * </table>
 *
 * <p>Accessors never invalidate. Keeping these entries fresh is the job of the
 * invalidation triggers.</p>
 *
 * @since 1.0.0
 * @see ClinicCacheTags
 */
public class ClinicCacheAccessors {

    private static final Logger log = LoggerFactory.getLogger(ClinicCacheAccessors.class);

    public static final Duration SCREENING_TYPES_TTL = Duration.ofMinutes(30);
    public static final Duration PATIENT_DEMOGRAPHICS_TTL = Duration.ofHours(1);
    public static final Duration DOCUMENT_TYPES_TTL = Duration.ofHours(2);
    public static final Duration PREP_SHEET_TTL = Duration.ofMinutes(30);
    public static final Duration DOCUMENT_REPOSITORY_TTL = Duration.ofHours(1);
    public static final Duration OCR_RESULT_TTL = Duration.ofHours(24);

    private static final ParameterizedTypeReference<List<ScreeningTypeSummary>> SCREENING_TYPE_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<PatientDemographics> DEMOGRAPHICS =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<String>> STRING_LIST =
            new ParameterizedTypeReference<>() {};

    private final CacheService cache;

    private final ClinicDataSource dataSource;

    public ClinicCacheAccessors(CacheService cache, ClinicDataSource dataSource) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    /**
     * Returns the screening type definitions.
     *
     * @param activeOnly {@code true} for active types only
     * @return the screening types
     */
    public List<ScreeningTypeSummary> screeningTypes(boolean activeOnly) {
        String key = screeningTypesKey(activeOnly);
        Set<String> tags = Set.of(ClinicCacheTags.SCREENING_TYPES,
                activeOnly ? ClinicCacheTags.ACTIVE_SCREENING_TYPES : ClinicCacheTags.ALL_SCREENING_TYPES);
        return cache.getOrLoad(key, SCREENING_TYPE_LIST, SCREENING_TYPES_TTL, tags,
                () -> dataSource.findScreeningTypes(activeOnly));
    }

    public List<ScreeningTypeSummary> activeScreeningTypes() {
        return screeningTypes(true);
    }

    /**
     * Returns a patient's demographics.
     *
     * @param patientId the patient identifier
     * @return the demographics, or {@code null} if the patient does not exist
     */
    public PatientDemographics patientDemographics(long patientId) {
        Set<String> tags = Set.of(ClinicCacheTags.PATIENT_DEMOGRAPHICS, ClinicCacheTags.patient(patientId));
        return cache.getOrLoad(patientDemographicsKey(patientId), DEMOGRAPHICS, PATIENT_DEMOGRAPHICS_TTL, tags,
                () -> dataSource.findPatientDemographics(patientId).orElse(null));
    }

    /**
     * @return the distinct document types on file
     */
    public List<String> documentTypes() {
        return cache.getOrLoad(DOCUMENT_TYPES_KEY, STRING_LIST, DOCUMENT_TYPES_TTL,
                Set.of(ClinicCacheTags.DOCUMENT_TYPES), dataSource::findDocumentTypes);
    }

    /**
     * Returns a patient's generated prep sheet, generating it on a miss.
     *
     * @param <T> the prep sheet representation
     * @param patientId the patient identifier
     * @param includeDocuments whether the sheet includes document analysis
     * @param type the prep sheet type
     * @param generator produces the prep sheet on a miss
     * @return the prep sheet, or {@code null} if the generator produced none
     */
    public <T> T prepSheet(long patientId, boolean includeDocuments, ParameterizedTypeReference<T> type, Supplier<T> generator) {
        String key = "prep_sheet:" + patientId + ":docs_" + includeDocuments;
        Set<String> tags = Set.of(ClinicCacheTags.patient(patientId), ClinicCacheTags.prepSheet(patientId),
                ClinicCacheTags.PREP_SHEETS);
        return cache.getOrLoad(key, type, PREP_SHEET_TTL, tags, generator);
    }

    /**
     * Returns the result of a document repository query, running it on a miss. Every
     * returned row is tagged with its document id so that a change to any listed document
     * invalidates the listing.
     *
     * @param <D> the row type
     * @param patientId the patient filter, or {@code null} for all patients
     * @param filters further query filters (may be null)
     * @param type the row list type
     * @param documentId extracts a row's document id (may return null)
     * @param query runs the query on a miss
     * @return the rows
     */
    public <D> List<D> documentRepository(Long patientId, Map<String, ?> filters,
                                          ParameterizedTypeReference<List<D>> type,
                                          Function<D, ?> documentId, Supplier<List<D>> query) {
        String key = documentRepositoryKey(patientId, filters);
        List<D> cached = cache.get(key, type);
        if (cached != null) {
            return cached;
        }
        List<D> rows = query.get();
        if (rows == null) {
            return null;
        }
        Set<String> tags = new LinkedHashSet<>();
        tags.add(ClinicCacheTags.DOCUMENT_REPOSITORY);
        if (patientId != null) {
            tags.add(ClinicCacheTags.patient(patientId));
        }
        for (D row : rows) {
            Object id = documentId.apply(row);
            if (id != null) {
                tags.add(ClinicCacheTags.document(id));
            }
        }
        cache.set(key, rows, DOCUMENT_REPOSITORY_TTL, tags);
        log.debug("Cached document repository query {} ({} rows)", key, rows.size());
        return rows;
    }

    /**
     * Returns the OCR output for a document, computing it on a miss.
     *
     * @param <T> the OCR result representation
     * @param documentId the document identifier
     * @param type the result type
     * @param ocr runs OCR on a miss
     * @return the OCR result, or {@code null} if none was produced
     */
    public <T> T ocrResult(long documentId, ParameterizedTypeReference<T> type, Supplier<T> ocr) {
        Set<String> tags = Set.of(ClinicCacheTags.document(documentId), ClinicCacheTags.ocr(documentId), ClinicCacheTags.OCR_RESULTS);
        return cache.getOrLoad("ocr_result:" + documentId, type, OCR_RESULT_TTL, tags, ocr);
    }

    static final String DOCUMENT_TYPES_KEY = "document_types";

    static String screeningTypesKey(boolean activeOnly) {
        return "screening_types:active=" + activeOnly;
    }

    static String patientDemographicsKey(long patientId) {
        return "patient_demographics:" + patientId;
    }

    /**
     * Hashes the query parameters in a canonical order so that equal queries share a key.
     */
    static String documentRepositoryKey(Long patientId, Map<String, ?> filters) {
        Map<String, Object> canonical = new TreeMap<>();
        if (filters != null) {
            canonical.putAll(filters);
        }
        String params = "patient_id=" + patientId + ";filters=" + canonical;
        return "document_repository:" + DigestUtils.md5DigestAsHex(params.getBytes(StandardCharsets.UTF_8));
    }
}
