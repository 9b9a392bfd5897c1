package com.pkgmeta.core.handler;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals a descriptor that cannot be turned into a record at all.
 */
public class DescriptorParseException extends IOException {

    private final transient Path file;

    public DescriptorParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public DescriptorParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
