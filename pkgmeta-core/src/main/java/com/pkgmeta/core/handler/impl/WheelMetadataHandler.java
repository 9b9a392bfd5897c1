package com.pkgmeta.core.handler.impl;

import java.util.Set;

/**
 * Handler for the {@code METADATA} file of an installed wheel ({@code *.dist-info}).
 */
public class WheelMetadataHandler extends AbstractCoreMetadataHandler {

    private static final String HANDLER_ID = "pypi_wheel_metadata";
    private static final String HANDLER_DISPLAY_NAME = "PyPI installed wheel METADATA";

    private static final String PATTERN_METADATA = "{**/,}*.dist-info/METADATA";

    @Override
    public String getId() {
        return HANDLER_ID;
    }

    @Override
    public String getDisplayName() {
        return HANDLER_DISPLAY_NAME;
    }

    @Override
    public Set<String> getFilePatterns() {
        return Set.of(PATTERN_METADATA);
    }
}
