package com.pedromossi.clinicache.trigger;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable payload of an invalidation trigger, e.g. {@code patient_id} or {@code data_type}.
 *
 * <p>Values arrive from request handlers and may be numbers or strings. Identifier lookups
 * through {@link #getId(String)} normalise both to their plain decimal text, so
 * {@code 42}, {@code 42L} and {@code "42"} all yield {@code "42"}.</p>
 *
 * @since 1.0.0
 */
public final class InvalidationContext {

    public static final String PATIENT_ID = "patient_id";
    public static final String SCREENING_TYPE_ID = "screening_type_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String DATA_TYPE = "data_type";

    private static final InvalidationContext EMPTY = new InvalidationContext(Map.of());

    private final Map<String, Object> values;

    private InvalidationContext(Map<String, Object> values) {
        this.values = values;
    }

    public static InvalidationContext empty() {
        return EMPTY;
    }

    /**
     * Creates a context from a map. Null values are dropped.
     *
     * @param values the payload (may be null)
     * @return the context
     */
    public static InvalidationContext of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (name != null && value != null) {
                copy.put(name, value);
            }
        });
        return new InvalidationContext(Collections.unmodifiableMap(copy));
    }

    public static InvalidationContext of(String name, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(name, value);
        return of(map);
    }

    public static InvalidationContext of(String name1, Object value1, String name2, Object value2) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(name1, value1);
        map.put(name2, value2);
        return of(map);
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Returns a value as trimmed text.
     *
     * @param name the entry name
     * @return the text, or empty if absent or blank
     */
    public Optional<String> getString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Returns an identifier in its canonical text form.
     *
     * @param name the entry name
     * @return the identifier, or empty if absent or blank
     */
    public Optional<String> getId(String name) {
        Object value = values.get(name);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return Optional.of(String.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(number.toString()).stripTrailingZeros().toPlainString());
        }
        return getString(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
