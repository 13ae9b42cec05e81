package com.pedromossi.clinicache.trigger;

import java.util.Arrays;
import java.util.Optional;

/**
 * Trigger types known to the built-in handlers, by wire name.
 *
 * @since 1.0.0
 */
public enum InvalidationTrigger {

    SCREENING_TYPE_KEYWORD_CHANGE("screening_type_keyword_change"),
    SCREENING_TYPE_STATUS_CHANGE("screening_type_status_change"),
    DOCUMENT_TYPE_CHANGE("document_type_change"),
    PATIENT_DEMOGRAPHIC_CHANGE("patient_demographic_change"),
    MEDICAL_DATA_SUBSECTION_UPDATE("medical_data_subsection_update"),
    BATCH_OPERATION_START("batch_operation_start"),
    BATCH_OPERATION_END("batch_operation_end");

    private final String triggerName;

    InvalidationTrigger(String triggerName) {
        this.triggerName = triggerName;
    }

    /**
     * @return the name used when firing this trigger
     */
    public String triggerName() {
        return triggerName;
    }

    /**
     * Looks up a trigger by its wire name.
     *
     * @param name the trigger name
     * @return the trigger, or empty if the name is not a built-in trigger
     */
    public static Optional<InvalidationTrigger> fromName(String name) {
        return Arrays.stream(values())
                .filter(trigger -> trigger.triggerName.equals(name))
                .findFirst();
    }
}
