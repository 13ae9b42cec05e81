package com.pedromossi.clinicache.clinic;

import java.util.List;
import java.util.Optional;

/**
 * Port to the authoritative clinic data, implemented by the embedding application
 * (typically on top of its repositories).
 *
 * <p>Implementations may throw; the accessors let such failures propagate to the caller
 * and cache nothing.</p>
 *
 * @since 1.0.0
 * @see ClinicCacheAccessors
 */
public interface ClinicDataSource {

    /**
     * @param activeOnly {@code true} to return only active screening types
     * @return the screening types, never null
     */
    List<ScreeningTypeSummary> findScreeningTypes(boolean activeOnly);

    /**
     * @param patientId the patient identifier
     * @return the patient's demographics, or empty if the patient does not exist
     */
    Optional<PatientDemographics> findPatientDemographics(long patientId);

    /**
     * @return the distinct document types on file, never null
     */
    List<String> findDocumentTypes();
}
