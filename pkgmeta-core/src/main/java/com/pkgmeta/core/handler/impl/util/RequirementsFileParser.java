package com.pkgmeta.core.handler.impl.util;

import com.pkgmeta.core.model.DependentPackage;
import com.pkgmeta.core.requirement.RequirementExpression;
import com.pkgmeta.core.requirement.RequirementResolver;
import com.pkgmeta.core.requirement.RequirementSyntaxException;
import com.pkgmeta.core.requirement.ResolutionOptions;
import com.pkgmeta.core.requirement.SpecifierSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for pip requirements files and egg-info {@code requires.txt}.
 *
 * <p>Handles backslash continuations, {@code #} comments, option lines
 * (skipped), editable requirements ({@code -e}/{@code --editable}), URL and
 * path requirements with an optional {@code #egg=} name, per-line options such
 * as {@code --hash}, and {@code [extra]} / {@code [extra:marker]} sections.
 */
public final class RequirementsFileParser {

    private static final Logger log = LoggerFactory.getLogger(RequirementsFileParser.class);

    private static final Pattern COMMENT = Pattern.compile("(^|\\s+)#.*$");
    private static final Pattern TRAILING_OPTIONS = Pattern.compile("\\s+--?[A-Za-z].*$");
    private static final Pattern EDITABLE = Pattern.compile("^(?:-e|--editable)(?:\\s+|=)(.+)$");
    private static final Pattern EGG_FRAGMENT = Pattern.compile("[#&]egg=([A-Za-z0-9][A-Za-z0-9._-]*)");
    private static final Pattern URL_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*://.*");
    private static final String EDITABLE_PREFIX = "-e ";

    /**
     * One requirement entry.
     *
     * @param lineNumber 1-based line number of the first physical line
     * @param text requirement text without comments and per-line options
     * @param editable true for {@code -e} entries
     * @param location URL or path of editable, URL and path entries, otherwise null
     * @param eggName name from an {@code #egg=} fragment, or null
     * @param extra extra named by the enclosing {@code [section]}, or null
     */
    public record Entry(int lineNumber, String text, boolean editable, String location, String eggName, String extra) {

        public boolean isDirectReference() {
            return location != null;
        }
    }

    private RequirementsFileParser() {
        // Utility class
    }

    /**
     * Parses the lines of a requirements file.
     *
     * @param lines file lines
     * @return requirement entries in file order
     */
    public static List<Entry> parse(List<String> lines) {
        List<Entry> entries = new ArrayList<>();
        String extra = null;
        for (LogicalLine logical : joinContinuations(lines)) {
            int startLine = logical.number();
            String text = COMMENT.matcher(logical.text()).replaceFirst("").strip();
            if (text.isEmpty()) {
                continue;
            }
            if (text.startsWith("[") && text.endsWith("]")) {
                extra = sectionExtra(text);
                continue;
            }
            Matcher editable = EDITABLE.matcher(text);
            if (editable.matches()) {
                String location = editable.group(1).strip();
                entries.add(new Entry(startLine, EDITABLE_PREFIX + location, true, location, eggName(location), extra));
                continue;
            }
            if (text.startsWith("-")) {
                log.debug("Skipping option line {}: {}", startLine, text);
                continue;
            }
            text = TRAILING_OPTIONS.matcher(text).replaceFirst("").strip();
            if (isDirectReference(text)) {
                entries.add(new Entry(startLine, text, false, text, eggName(text), extra));
            } else {
                entries.add(new Entry(startLine, text, false, null, null, extra));
            }
        }
        return entries;
    }

    private record LogicalLine(int number, String text) {
    }

    /**
     * Joins backslash continuations; each logical line keeps the number of its first physical line.
     */
    private static List<LogicalLine> joinContinuations(List<String> lines) {
        List<LogicalLine> logicalLines = new ArrayList<>();
        StringBuilder logical = new StringBuilder();
        int startLine = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (logical.length() == 0) {
                startLine = i + 1;
            }
            if (line.endsWith("\\")) {
                logical.append(line, 0, line.length() - 1).append(' ');
                continue;
            }
            logical.append(line);
            logicalLines.add(new LogicalLine(startLine, logical.toString()));
            logical.setLength(0);
        }
        if (logical.length() > 0) {
            // continuation on the last line ends at end of file
            logicalLines.add(new LogicalLine(startLine, logical.toString()));
        }
        return logicalLines;
    }

    /**
     * Resolves entries into dependencies; malformed entries are skipped with a warning.
     *
     * @param entries parsed entries
     * @param options scope and flag defaults; a section extra overrides the scope
     * @return dependencies in file order
     */
    public static List<DependentPackage> toDependencies(List<Entry> entries, ResolutionOptions options) {
        List<DependentPackage> dependencies = new ArrayList<>();
        for (Entry entry : entries) {
            ResolutionOptions entryOptions = entry.extra() != null ? options.withScope(entry.extra()) : options;
            try {
                dependencies.add(toDependency(entry, entryOptions));
            } catch (RequirementSyntaxException e) {
                log.warn("Skipping malformed requirement at line {}: {}", entry.lineNumber(), e.getMessage());
            }
        }
        return dependencies;
    }

    private static DependentPackage toDependency(Entry entry, ResolutionOptions options) {
        if (!entry.isDirectReference()) {
            return RequirementResolver.resolve(entry.text(), options);
        }
        if (entry.eggName() == null) {
            return RequirementResolver.unnamed(entry.text(), options);
        }
        RequirementExpression named = new RequirementExpression(
            entry.eggName(), List.of(), SpecifierSet.empty(), entry.location(), null, entry.text());
        return RequirementResolver.resolve(named, options);
    }

    private static String sectionExtra(String header) {
        String body = header.substring(1, header.length() - 1).strip();
        int colon = body.indexOf(':');
        String extra = colon >= 0 ? body.substring(0, colon).strip() : body;
        return extra.isEmpty() ? null : extra;
    }

    private static boolean isDirectReference(String text) {
        if (text.contains(" @ ")) {
            return false;
        }
        return URL_SCHEME.matcher(text).matches()
            || text.startsWith(".")
            || text.startsWith("/")
            || text.startsWith("file:")
            || text.endsWith(".whl")
            || text.endsWith(".zip")
            || text.endsWith(".tar.gz");
    }

    private static String eggName(String location) {
        Matcher matcher = EGG_FRAGMENT.matcher(location);
        return matcher.find() ? matcher.group(1) : null;
    }
}
