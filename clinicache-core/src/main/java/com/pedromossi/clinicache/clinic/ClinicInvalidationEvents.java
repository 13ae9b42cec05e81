package com.pedromossi.clinicache.clinic;

import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.trigger.InvalidationContext;
import com.pedromossi.clinicache.trigger.InvalidationTrigger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed entry points for the clinic events that make cached data stale.
 *
 * <p>Services that refresh screenings, upload documents or edit screening types call these
 * methods instead of building trigger names and context maps by hand.</p>
 *
 * @since 1.0.0
 */
public class ClinicInvalidationEvents {

    private static final Logger log = LoggerFactory.getLogger(ClinicInvalidationEvents.class);

    private final CacheService cache;

    public ClinicInvalidationEvents(CacheService cache) {
        this.cache = cache;
    }

    /**
     * Call before a patient's screenings are recomputed.
     */
    public void patientScreeningsRefreshing(long patientId) {
        fire(InvalidationTrigger.PATIENT_DEMOGRAPHIC_CHANGE, InvalidationContext.of(InvalidationContext.PATIENT_ID, patientId));
    }

    /**
     * Call after a patient's screenings were recomputed.
     */
    public void patientScreeningsRefreshed(long patientId) {
        fire(InvalidationTrigger.MEDICAL_DATA_SUBSECTION_UPDATE, InvalidationContext.of(InvalidationContext.PATIENT_ID, patientId));
    }

    public void medicalDataUpdated(long patientId, String dataType) {
        fire(InvalidationTrigger.MEDICAL_DATA_SUBSECTION_UPDATE, InvalidationContext.of(
                InvalidationContext.PATIENT_ID, patientId, InvalidationContext.DATA_TYPE, dataType));
    }

    /**
     * @param patientId the document's patient
     * @param action what happened, e.g. {@code upload} or {@code delete}
     * @param documentId the document, if known
     */
    public void documentChanged(long patientId, String action, Long documentId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(InvalidationContext.PATIENT_ID, patientId);
        context.put(InvalidationContext.DOCUMENT_ID, documentId);
        context.put("action", action);
        fire(InvalidationTrigger.DOCUMENT_TYPE_CHANGE, InvalidationContext.of(context));
    }

    public void screeningTypeStatusChanged(long screeningTypeId, String action) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put(InvalidationContext.SCREENING_TYPE_ID, screeningTypeId);
        context.put("action", action);
        context.put("change_type", "status");
        fire(InvalidationTrigger.SCREENING_TYPE_STATUS_CHANGE, InvalidationContext.of(context));
    }

    public void screeningTypeKeywordsChanged(long screeningTypeId) {
        fire(InvalidationTrigger.SCREENING_TYPE_KEYWORD_CHANGE, InvalidationContext.of(
                InvalidationContext.SCREENING_TYPE_ID, screeningTypeId, "change_type", "keyword"));
    }

    /**
     * Drops everything cached for one patient, prep sheets included.
     *
     * @return the number of entries removed
     */
    public int invalidatePatient(long patientId) {
        int removed = cache.invalidateByTag(ClinicCacheTags.patient(patientId))
                + cache.invalidateByTag(ClinicCacheTags.prepSheet(patientId));
        log.debug("Invalidated {} cache entries for patient {}", removed, patientId);
        return removed;
    }

    /**
     * Drops everything cached for one document, OCR output included.
     *
     * @return the number of entries removed
     */
    public int invalidateDocument(long documentId) {
        int removed = cache.invalidateByTag(ClinicCacheTags.document(documentId))
                + cache.invalidateByTag(ClinicCacheTags.ocr(documentId));
        log.debug("Invalidated {} cache entries for document {}", removed, documentId);
        return removed;
    }

    private void fire(InvalidationTrigger trigger, InvalidationContext context) {
        cache.triggerInvalidation(trigger.triggerName(), context);
    }
}
