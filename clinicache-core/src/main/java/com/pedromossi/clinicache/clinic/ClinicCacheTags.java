package com.pedromossi.clinicache.clinic;

/**
 * Tag names shared by the clinic accessors and the built-in invalidation handlers.
 */
public final class ClinicCacheTags {

    public static final String SCREENING_TYPES = "screening_types";
    public static final String ACTIVE_SCREENING_TYPES = "active_screening_types";
    public static final String ALL_SCREENING_TYPES = "all_screening_types";
    public static final String DOCUMENT_TYPES = "document_types";
    public static final String PATIENT_DEMOGRAPHICS = "patient_demographics";
    public static final String PREP_SHEETS = "prep_sheets";
    public static final String DOCUMENT_REPOSITORY = "document_repository";
    public static final String OCR_RESULTS = "ocr_results";

    private ClinicCacheTags() {
    }

    public static String patient(Object patientId) {
        return "patient_" + patientId;
    }

    public static String screeningType(Object screeningTypeId) {
        return "screening_type_" + screeningTypeId;
    }

    public static String medicalData(String dataType) {
        return "medical_data_" + dataType;
    }

    public static String prepSheet(Object patientId) {
        return "prep_sheet_" + patientId;
    }

    public static String document(Object documentId) {
        return "document_" + documentId;
    }

    public static String ocr(Object documentId) {
        return "ocr_" + documentId;
    }
}
