package com.pkgmeta.core.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Plain key-value metadata, such as literal {@code setup()} keyword arguments
 * or a {@code setup.cfg} section. Supports only the single-value accessor.
 */
public final class MappingMetadata implements MetadataSource {

    private final Map<String, Object> values;

    public MappingMetadata(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public boolean hasSingleGetter() {
        return true;
    }

    @Override
    public Object get(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "MappingMetadata" + values.keySet();
    }
}
