package com.pkgmeta.core.metadata;

import java.util.List;
import java.util.Optional;

/**
 * A descriptor's metadata as seen by the normalization engine.
 *
 * <p>Descriptor formats expose the same logical field through different access
 * protocols. A source declares which of the three protocols it supports and
 * {@link AttributeResolver} tries them in a fixed order:
 * <ol>
 *   <li>named fields ({@link #hasNamedFields()}, {@link #namedField(String)})</li>
 *   <li>single-value accessor ({@link #hasSingleGetter()}, {@link #get(String)})</li>
 *   <li>multi-value accessor ({@link #hasMultiGetter()}, {@link #getAll(String)})</li>
 * </ol>
 *
 * <p>Values are {@code String}, {@code List} or {@code Map}; a missing key yields
 * {@code null} (or an empty list for {@link #getAll(String)}).
 *
 * @see AttributeResolver
 */
public interface MetadataSource {

    /**
     * @return true if {@link #namedField(String)} is supported
     */
    default boolean hasNamedFields() {
        return false;
    }

    /**
     * @return true if {@link #get(String)} is supported
     */
    default boolean hasSingleGetter() {
        return false;
    }

    /**
     * @return true if {@link #getAll(String)} is supported
     */
    default boolean hasMultiGetter() {
        return false;
    }

    /**
     * Reads a named property.
     *
     * @param name property name, matched exactly
     * @return value or null
     */
    default Object namedField(String name) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no named fields");
    }

    /**
     * Reads the first value stored under a key.
     *
     * @param key key, matched exactly
     * @return value or null
     */
    default Object get(String key) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no single-value accessor");
    }

    /**
     * Reads every value stored under a key.
     *
     * @param key key, matched exactly
     * @return values, empty if none
     */
    default List<String> getAll(String key) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no multi-value accessor");
    }

    /**
     * Returns the free-form body that follows a header block, if the format has one.
     *
     * @return body text
     */
    default Optional<String> payload() {
        return Optional.empty();
    }
}
