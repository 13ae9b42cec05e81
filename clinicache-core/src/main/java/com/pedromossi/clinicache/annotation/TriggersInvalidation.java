package com.pedromossi.clinicache.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Fires an invalidation trigger after the annotated method completes successfully.
 *
 * <p>If the method throws, no trigger fires. Context entries are written as
 * {@code name=expression}, where the expression is SpEL over the method parameters.
 * Entries whose expression evaluates to {@code null} are left out.</p>
 *
 * <pre>{@code
 * @TriggersInvalidation(value = "patient_demographic_change", context = "patient_id=#patient.id")
 * public Patient updatePatient(Patient patient) {
 *     return patientRepository.save(patient);
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see com.pedromossi.clinicache.aspect.CacheAspect
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TriggersInvalidation {

    /**
     * The trigger name, e.g. {@code document_type_change}.
     */
    String value();

    /**
     * Context entries as {@code name=spelExpression}.
     */
    String[] context() default {};
}
