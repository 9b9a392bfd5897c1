package com.pkgmeta.core.handler.impl.util;

import com.pkgmeta.core.handler.DescriptorParseException;
import com.pkgmeta.core.metadata.HeaderMetadata;

import java.nio.file.Path;
import java.util.List;

/**
 * Parser for RFC 822 style core metadata ({@code PKG-INFO}, {@code METADATA}).
 *
 * <p>Headers run up to the first blank line; everything after it is the payload.
 * A line starting with whitespace continues the previous header and is kept
 * with its indentation, so legacy padded descriptions survive for later cleanup.
 */
public final class HeaderParser {

    static final String NAME = "Name";
    static final String METADATA_VERSION = "Metadata-Version";

    private HeaderParser() {
        // Utility class
    }

    /**
     * Parses a metadata file.
     *
     * @param file file the content came from, for error messages
     * @param content file content
     * @return parsed headers and payload
     * @throws DescriptorParseException if the content does not start with a
     *     header block naming the package or its metadata version
     */
    public static HeaderMetadata parse(Path file, String content) throws DescriptorParseException {
        List<String> lines = content.lines().toList();
        if (lines.isEmpty() || !isHeaderLine(lines.get(0))) {
            throw new DescriptorParseException(file, "no metadata header block");
        }

        HeaderMetadata.Builder builder = HeaderMetadata.builder();
        String key = null;
        StringBuilder value = new StringBuilder();
        int index = 0;
        for (; index < lines.size(); index++) {
            String line = lines.get(index);
            if (line.isBlank()) {
                index++;
                break;
            }
            if (isContinuation(line) && key != null) {
                value.append('\n').append(line.stripTrailing());
                continue;
            }
            if (!isHeaderLine(line)) {
                // a stray line ends the header block, as in the email parser
                break;
            }
            if (key != null) {
                builder.header(key, value.toString());
            }
            int colon = line.indexOf(':');
            key = line.substring(0, colon).strip();
            value.setLength(0);
            value.append(line.substring(colon + 1).strip());
        }
        if (key != null) {
            builder.header(key, value.toString());
        }

        String payload = String.join("\n", lines.subList(Math.min(index, lines.size()), lines.size()));
        HeaderMetadata metadata = builder.payload(payload.isBlank() ? null : payload).build();
        if (!metadata.containsHeader(NAME) && !metadata.containsHeader(METADATA_VERSION)) {
            throw new DescriptorParseException(file, "missing " + NAME + " and " + METADATA_VERSION + " headers");
        }
        return metadata;
    }

    private static boolean isContinuation(String line) {
        return line.startsWith(" ") || line.startsWith("\t");
    }

    private static boolean isHeaderLine(String line) {
        if (line.isEmpty() || isContinuation(line)) {
            return false;
        }
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return false;
        }
        for (int i = 0; i < colon; i++) {
            char c = line.charAt(i);
            if (c <= ' ' || c > '~') {
                return false;
            }
        }
        return true;
    }
}
