package com.pkgmeta.core.metadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * RFC 822 style metadata ({@code PKG-INFO}, {@code METADATA}): repeated,
 * case-insensitive headers followed by an optional body.
 *
 * <p>Supports the single and multi-value accessors but no named fields.
 */
public final class HeaderMetadata implements MetadataSource {

    private final Map<String, List<String>> headers;
    private final String payload;

    private HeaderMetadata(Map<String, List<String>> headers, String payload) {
        this.headers = headers;
        this.payload = payload;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean hasSingleGetter() {
        return true;
    }

    @Override
    public boolean hasMultiGetter() {
        return true;
    }

    @Override
    public Object get(String key) {
        List<String> values = headers.get(key);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    @Override
    public List<String> getAll(String key) {
        return headers.getOrDefault(key, List.of());
    }

    @Override
    public Optional<String> payload() {
        return Optional.ofNullable(payload);
    }

    public boolean containsHeader(String key) {
        return headers.containsKey(key);
    }

    public int headerCount() {
        return headers.size();
    }

    /**
     * Accumulates headers in declaration order.
     */
    public static final class Builder {
        private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String payload;

        private Builder() {
        }

        public Builder header(String key, String value) {
            headers.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public HeaderMetadata build() {
            Map<String, List<String>> frozen = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            headers.forEach((key, values) -> frozen.put(key, List.copyOf(values)));
            return new HeaderMetadata(Collections.unmodifiableMap(frozen), payload);
        }
    }
}
