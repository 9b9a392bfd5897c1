package com.pkgmeta.core.handler.impl.util;

import com.pkgmeta.core.handler.DescriptorParseException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reader for INI style {@code setup.cfg} files.
 *
 * <p>Follows the usual config-parser rules: {@code key = value} or
 * {@code key: value} (whichever delimiter comes first), lower-cased keys,
 * whole-line {@code #} and {@code ;} comments, and indented continuation lines
 * appended to the previous value with a newline.
 */
public final class SetupCfgReader {

    private SetupCfgReader() {
        // Utility class
    }

    /**
     * Reads all sections.
     *
     * @param file file the content came from, for error messages
     * @param content file content
     * @return section name to (key to value), in file order
     * @throws DescriptorParseException on an option outside a section, a
     *     malformed section header or a line that is neither
     */
    public static Map<String, Map<String, String>> read(Path file, String content) throws DescriptorParseException {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> section = null;
        String key = null;
        int lineNumber = 0;
        for (String line : content.lines().toList()) {
            lineNumber++;
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("#") || stripped.startsWith(";")) {
                continue;
            }
            boolean indented = Character.isWhitespace(line.charAt(0));
            if (indented && key != null) {
                String previous = section.get(key);
                // continuation lines keep their line break, an empty first line included
                section.put(key, previous + "\n" + stripped);
                continue;
            }
            if (stripped.startsWith("[")) {
                if (!stripped.endsWith("]")) {
                    throw new DescriptorParseException(file, "malformed section header at line " + lineNumber);
                }
                String name = stripped.substring(1, stripped.length() - 1).strip();
                section = sections.computeIfAbsent(name, n -> new LinkedHashMap<>());
                key = null;
                continue;
            }
            int delimiter = delimiterIndex(stripped);
            if (delimiter <= 0) {
                throw new DescriptorParseException(file, "unparseable line " + lineNumber + ": " + stripped);
            }
            if (section == null) {
                throw new DescriptorParseException(file, "option before any section at line " + lineNumber);
            }
            key = stripped.substring(0, delimiter).strip().toLowerCase(Locale.ROOT);
            section.put(key, stripped.substring(delimiter + 1).strip());
        }
        Map<String, Map<String, String>> frozen = new LinkedHashMap<>();
        sections.forEach((name, values) -> frozen.put(name, Collections.unmodifiableMap(values)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Splits a list-valued option the way setuptools does: a multi-line value
     * has one item per line, a single-line value is split on the separator.
     *
     * <p>Requirement lists use {@code ";"} as separator, so a marker such as
     * {@code pytest; extra == "testing"} survives only on its own line.
     *
     * @param value option value, may be null
     * @param separator separator for single-line values ({@code ","} or {@code ";"}), or null
     * @return non-blank items
     */
    public static List<String> listValue(String value, String separator) {
        List<String> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        List<String> parts = value.indexOf('\n') >= 0 || separator == null
            ? value.lines().toList()
            : List.of(value.split(separator));
        for (String part : parts) {
            String item = part.strip();
            if (!item.isEmpty() && !item.startsWith("#")) {
                items.add(item);
            }
        }
        return items;
    }

    /**
     * Reads a dict-valued option with one {@code key = value} pair per line.
     *
     * @param value option value, may be null
     * @return entries in order
     */
    public static Map<String, String> dictValue(String value) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (String line : listValue(value, null)) {
            int delimiter = line.indexOf('=');
            if (delimiter > 0) {
                entries.put(line.substring(0, delimiter).strip(), line.substring(delimiter + 1).strip());
            }
        }
        return entries;
    }

    private static int delimiterIndex(String line) {
        int equals = line.indexOf('=');
        int colon = line.indexOf(':');
        if (equals < 0) {
            return colon;
        }
        if (colon < 0) {
            return equals;
        }
        return Math.min(equals, colon);
    }
}
