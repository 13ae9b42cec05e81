package com.pedromossi.clinicache.clinic;

import com.pedromossi.clinicache.CacheService;
import com.pedromossi.clinicache.trigger.InvalidationContext;
import com.pedromossi.clinicache.trigger.InvalidationTrigger;
import com.pedromossi.clinicache.trigger.TriggerDispatcher;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in handlers mapping clinic domain events to the tags they invalidate.
 *
 * <ul>
 * <li>{@code screening_type_keyword_change}, {@code screening_type_status_change}:
 *     {@code screening_types}, {@code active_screening_types}, {@code all_screening_types},
 *     and {@code screening_type_{id}} when {@code screening_type_id} is given.</li>
 * <li>{@code document_type_change}: {@code document_types}, and {@code patient_{id}} when
 *     {@code patient_id} is given.</li>
 * <li>{@code patient_demographic_change}: {@code patient_{id}} and {@code patient_demographics},
 *     only when {@code patient_id} is given.</li>
 * <li>{@code medical_data_subsection_update}: {@code patient_{id}} when {@code patient_id} is
 *     given, {@code medical_data_{type}} when {@code data_type} is given.</li>
 * <li>{@code batch_operation_start}, {@code batch_operation_end}: open and close the batch window.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ClinicInvalidationHandlers {

    private static final Logger log = LoggerFactory.getLogger(ClinicInvalidationHandlers.class);

    private ClinicInvalidationHandlers() {
    }

    /**
     * Creates a dispatcher with every built-in handler registered.
     *
     * @return the dispatcher
     */
    public static TriggerDispatcher newDispatcher() {
        return registerDefaults(new TriggerDispatcher());
    }

    /**
     * Registers the built-in handlers on a dispatcher.
     *
     * @param dispatcher the dispatcher
     * @return the same dispatcher
     */
    public static TriggerDispatcher registerDefaults(TriggerDispatcher dispatcher) {
        return dispatcher
                .register(InvalidationTrigger.SCREENING_TYPE_KEYWORD_CHANGE, ClinicInvalidationHandlers::screeningTypeChanged)
                .register(InvalidationTrigger.SCREENING_TYPE_STATUS_CHANGE, ClinicInvalidationHandlers::screeningTypeChanged)
                .register(InvalidationTrigger.DOCUMENT_TYPE_CHANGE, ClinicInvalidationHandlers::documentChanged)
                .register(InvalidationTrigger.PATIENT_DEMOGRAPHIC_CHANGE, ClinicInvalidationHandlers::patientChanged)
                .register(InvalidationTrigger.MEDICAL_DATA_SUBSECTION_UPDATE, ClinicInvalidationHandlers::medicalDataChanged)
                .register(InvalidationTrigger.BATCH_OPERATION_START, (context, cache) -> cache.beginBatch())
                .register(InvalidationTrigger.BATCH_OPERATION_END, (context, cache) -> cache.endBatch());
    }

    static void screeningTypeChanged(InvalidationContext context, CacheService cache) {
        Optional<String> screeningTypeId = context.getId(InvalidationContext.SCREENING_TYPE_ID);
        log.info("Invalidating screening type cache - id: {}, change: {}",
                screeningTypeId.orElse(null), context.getString("change_type").orElse("unknown"));
        cache.invalidateByTag(ClinicCacheTags.SCREENING_TYPES);
        cache.invalidateByTag(ClinicCacheTags.ACTIVE_SCREENING_TYPES);
        cache.invalidateByTag(ClinicCacheTags.ALL_SCREENING_TYPES);
        screeningTypeId.ifPresent(id -> cache.invalidateByTag(ClinicCacheTags.screeningType(id)));
    }

    static void documentChanged(InvalidationContext context, CacheService cache) {
        Optional<String> patientId = context.getId(InvalidationContext.PATIENT_ID);
        log.info("Invalidating document cache - document: {}, patient: {}",
                context.getId(InvalidationContext.DOCUMENT_ID).orElse(null), patientId.orElse(null));
        cache.invalidateByTag(ClinicCacheTags.DOCUMENT_TYPES);
        patientId.ifPresent(id -> cache.invalidateByTag(ClinicCacheTags.patient(id)));
    }

    static void patientChanged(InvalidationContext context, CacheService cache) {
        Optional<String> patientId = context.getId(InvalidationContext.PATIENT_ID);
        if (patientId.isEmpty()) {
            log.debug("Patient change without patient_id, nothing to invalidate");
            return;
        }
        log.info("Invalidating patient cache - patient: {}", patientId.get());
        cache.invalidateByTag(ClinicCacheTags.patient(patientId.get()));
        cache.invalidateByTag(ClinicCacheTags.PATIENT_DEMOGRAPHICS);
    }

    static void medicalDataChanged(InvalidationContext context, CacheService cache) {
        Optional<String> patientId = context.getId(InvalidationContext.PATIENT_ID);
        Optional<String> dataType = context.getString(InvalidationContext.DATA_TYPE);
        log.info("Invalidating medical data cache - patient: {}, type: {}", patientId.orElse(null), dataType.orElse(null));
        patientId.ifPresent(id -> cache.invalidateByTag(ClinicCacheTags.patient(id)));
        dataType.ifPresent(type -> cache.invalidateByTag(ClinicCacheTags.medicalData(type)));
    }
}
