package com.pkgmeta.core.metadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Uniform field lookup across the access shapes of {@link MetadataSource}.
 *
 * <p>Lookup order for a field name such as {@code Author-email}:
 * <ol>
 *   <li>named field {@code Author_email} (dashes replaced by underscores)</li>
 *   <li>named field {@code author_email} (same, lower-cased)</li>
 *   <li>single accessor with {@code Author-email}, {@code author-email}, {@code author_email}</li>
 *   <li>multi accessor with the same keys (only when multiple values are requested)</li>
 * </ol>
 * Empty strings and empty collections count as absent and the lookup moves on.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String author = AttributeResolver.getString(source, "Author");
 * List<Object> classifiers = AttributeResolver.getAttributes(source, "Classifier");
 * }</pre>
 */
public final class AttributeResolver {

    private AttributeResolver() {
        // Utility class
    }

    /**
     * Returns the scalar value of a field, or null.
     *
     * @param source metadata source
     * @param fieldName logical field name
     * @return first non-empty value found, or null
     */
    public static Object getAttribute(MetadataSource source, String fieldName) {
        Object value = fromNamedFields(source, fieldName);
        if (isPresent(value)) {
            return value;
        }
        if (source.hasSingleGetter()) {
            for (String key : accessorKeys(fieldName)) {
                value = source.get(key);
                if (isPresent(value)) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * Returns every value of a multi-valued field; never null.
     *
     * <p>A scalar found through the named-field or single-value paths is
     * returned as a one-element list.
     *
     * @param source metadata source
     * @param fieldName logical field name
     * @return values, possibly empty
     */
    public static List<Object> getAttributes(MetadataSource source, String fieldName) {
        Object value = fromNamedFields(source, fieldName);
        if (isPresent(value)) {
            return asList(value);
        }
        if (source.hasMultiGetter()) {
            for (String key : accessorKeys(fieldName)) {
                List<String> values = source.getAll(key);
                if (values != null && !values.isEmpty()) {
                    return new ArrayList<>(values);
                }
            }
        }
        if (source.hasSingleGetter()) {
            for (String key : accessorKeys(fieldName)) {
                value = source.get(key);
                if (isPresent(value)) {
                    return asList(value);
                }
            }
        }
        return List.of();
    }

    /**
     * Returns a field as trimmed text, or null when absent or not textual.
     *
     * @param source metadata source
     * @param fieldName logical field name
     * @return trimmed text or null
     */
    public static String getString(MetadataSource source, String fieldName) {
        Object value = getAttribute(source, fieldName);
        if (value instanceof String text) {
            String trimmed = text.trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        return null;
    }

    /**
     * Returns the first of several alternative fields that is present.
     *
     * @param source metadata source
     * @param fieldNames alternative field names in priority order
     * @return trimmed text or null
     */
    public static String getFirstString(MetadataSource source, String... fieldNames) {
        for (String fieldName : fieldNames) {
            String value = getString(source, fieldName);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Object fromNamedFields(MetadataSource source, String fieldName) {
        if (!source.hasNamedFields()) {
            return null;
        }
        String attributeName = fieldName.replace('-', '_');
        Object value = source.namedField(attributeName);
        if (isPresent(value)) {
            return value;
        }
        return source.namedField(attributeName.toLowerCase(Locale.ROOT));
    }

    private static Set<String> accessorKeys(String fieldName) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(fieldName);
        keys.add(fieldName.toLowerCase(Locale.ROOT));
        keys.add(fieldName.replace('-', '_').toLowerCase(Locale.ROOT));
        return keys;
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }
}
