package com.fraud.cohortanomaly.model;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One fixed combination of cohort dimension values, e.g. merchant_id=M-17.
 * Dimension order is preserved so the canonical string form is stable.
 *
 * Canonical form: {@code name=value|name=value}. Backslash, {@code |} and
 * {@code =} inside names and values are escaped with a backslash, so distinct
 * keys always have distinct canonical strings.
 */
@EqualsAndHashCode
public final class CohortKey {

    private static final char PAIR_SEPARATOR = '|';
    private static final char VALUE_SEPARATOR = '=';
    private static final char ESCAPE = '\\';

    private final Map<String, String> dimensions;

    private CohortKey(Map<String, String> dimensions) {
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
    }

    public static CohortKey of(Map<String, String> dimensions) {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("A cohort key needs at least one dimension");
        }
        return new CohortKey(dimensions);
    }

    public static CohortKey of(String dimension, String value) {
        Map<String, String> dims = new LinkedHashMap<>();
        dims.put(dimension, value);
        return new CohortKey(dims);
    }

    /**
     * Parses the canonical form produced by {@link #asString()}.
     *
     * @throws IllegalArgumentException if {@code canonical} is not a well-formed key
     */
    public static CohortKey parse(String canonical) {
        if (canonical == null || canonical.isBlank()) {
            throw new IllegalArgumentException("Empty cohort key");
        }
        Map<String, String> dims = new LinkedHashMap<>();
        StringBuilder token = new StringBuilder();
        String name = null;
        for (int i = 0; i < canonical.length(); i++) {
            char c = canonical.charAt(i);
            if (c == ESCAPE) {
                if (++i == canonical.length()) {
                    throw new IllegalArgumentException("Dangling escape in cohort key: " + canonical);
                }
                token.append(canonical.charAt(i));
            } else if (c == VALUE_SEPARATOR && name == null) {
                name = token.toString();
                token.setLength(0);
            } else if (c == PAIR_SEPARATOR) {
                putPair(dims, name, token, canonical);
                name = null;
                token.setLength(0);
            } else {
                token.append(c);
            }
        }
        putPair(dims, name, token, canonical);
        return new CohortKey(dims);
    }

    private static void putPair(Map<String, String> dims, String name, StringBuilder value, String canonical) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Malformed cohort key: " + canonical);
        }
        if (dims.put(name, value.toString()) != null) {
            throw new IllegalArgumentException("Duplicate dimension " + name + " in cohort key: " + canonical);
        }
    }

    public Map<String, String> getDimensions() {
        return dimensions;
    }

    public String get(String dimension) {
        return dimensions.get(dimension);
    }

    public String asString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : dimensions.entrySet()) {
            if (sb.length() > 0) sb.append(PAIR_SEPARATOR);
            escape(sb, e.getKey());
            sb.append(VALUE_SEPARATOR);
            escape(sb, e.getValue());
        }
        return sb.toString();
    }

    private static void escape(StringBuilder sb, String raw) {
        String text = String.valueOf(raw);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE || c == PAIR_SEPARATOR || c == VALUE_SEPARATOR) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
    }

    @Override
    public String toString() {
        return asString();
    }
}
