package com.pkgmeta.core.version;

import com.pkgmeta.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a package version that is computed in code rather than declared
 * as a literal, e.g. {@code setup(version=mypkg.__version__)}.
 *
 * <p>Candidate module files are built from the dotted reference (the
 * conventional module names under the referenced package, then
 * {@code <last>.py}, each also under {@code src/} when that directory exists),
 * followed by every conventional module file found by a level-ordered walk of
 * at most {@code maxDepth} levels below the descriptor's directory. The
 * candidates are searched with {@link VersionDetector#DUNDER} first and only
 * then, in the same order, with {@link VersionDetector#PLAIN}.
 *
 * <p>Instances are immutable and hold no state between calls.
 */
public final class VersionRecoverer {

    private static final Logger log = LoggerFactory.getLogger(VersionRecoverer.class);

    /** Default number of directory levels visited by the walk. */
    public static final int DEFAULT_MAX_DEPTH = 4;

    static final List<String> MODULE_FILE_NAMES = List.of(
        "__init__.py",
        "__main__.py",
        "__version__.py",
        "__about__.py",
        "__version.py",
        "_version.py",
        "version.py",
        "VERSION.py",
        "package_data.py"
    );

    private static final Set<String> MODULE_FILE_NAME_SET = Set.copyOf(MODULE_FILE_NAMES);

    private static final Pattern VERSION_ARGUMENT = Pattern.compile(
        "^\\s*version\\s*=\\s*(.*__version__)", Pattern.MULTILINE);

    private static final String DUNDER_VERSION = "__version__";
    private static final String SRC_DIR = "src";
    private static final String PY_SUFFIX = ".py";

    private final int maxDepth;

    public VersionRecoverer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public VersionRecoverer(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Recovers the version of a code-form descriptor such as {@code setup.py}.
     *
     * <p>When the descriptor passes {@code version=__version__} and defines
     * {@code __version__} itself, that value is returned directly.
     *
     * @param descriptor descriptor file
     * @return recovered version, or empty when no candidate yields one
     * @throws IOException if the descriptor cannot be read
     */
    public Optional<String> recover(Path descriptor) throws IOException {
        String content = Files.readString(descriptor);
        String reference = versionArgument(content).orElse(null);
        Optional<String> ownDunder = VersionDetector.DUNDER.detect(content);
        if (DUNDER_VERSION.equals(reference) && ownDunder.isPresent()) {
            log.debug("Version {} defined in {}", ownDunder.get(), descriptor);
            return ownDunder;
        }
        return search(directoryOf(descriptor), referenceSegments(reference));
    }

    /**
     * Recovers a version from a dotted attribute reference such as
     * {@code mypkg.__version__}, as used by {@code attr:} directives.
     *
     * @param baseDirectory directory the reference is relative to
     * @param reference dotted reference, may be null
     * @return recovered version, or empty when no candidate yields one
     */
    public Optional<String> recoverFromReference(Path baseDirectory, String reference) {
        return search(baseDirectory.toAbsolutePath(), referenceSegments(reference));
    }

    /**
     * Builds the ordered candidate list without reading any file.
     *
     * @param baseDirectory directory the reference is relative to
     * @param segments package segments of the reference, without the attribute name
     * @return candidate files, deduplicated, in search order
     */
    List<Path> candidates(Path baseDirectory, List<String> segments) {
        Set<Path> candidates = new LinkedHashSet<>();
        Path srcDirectory = baseDirectory.resolve(SRC_DIR);
        boolean hasSrc = Files.exists(srcDirectory);

        if (!segments.isEmpty()) {
            Path packageDirectory = resolve(baseDirectory, segments);
            for (String name : MODULE_FILE_NAMES) {
                candidates.add(packageDirectory.resolve(name));
            }
            if (hasSrc) {
                Path srcPackageDirectory = resolve(srcDirectory, segments);
                for (String name : MODULE_FILE_NAMES) {
                    candidates.add(srcPackageDirectory.resolve(name));
                }
            }

            List<String> heads = segments.subList(0, segments.size() - 1);
            String moduleFile = segments.get(segments.size() - 1) + PY_SUFFIX;
            candidates.add(resolve(baseDirectory, heads).resolve(moduleFile));
            if (hasSrc) {
                candidates.add(resolve(srcDirectory, heads).resolve(moduleFile));
            }
        }

        try {
            candidates.addAll(FileUtils.walkLevels(baseDirectory, maxDepth, MODULE_FILE_NAME_SET));
        } catch (IOException e) {
            log.warn("Failed to walk {} for version modules: {}", baseDirectory, e.getMessage());
        }
        return new ArrayList<>(candidates);
    }

    private Optional<String> search(Path baseDirectory, List<String> segments) {
        List<Path> candidates = candidates(baseDirectory, segments);
        log.debug("Searching {} version candidates under {}", candidates.size(), baseDirectory);

        Optional<String> version = detectIn(candidates, VersionDetector.DUNDER);
        if (version.isPresent()) {
            return version;
        }
        return detectIn(candidates, VersionDetector.PLAIN);
    }

    private static Optional<String> detectIn(List<Path> candidates, VersionDetector detector) {
        for (Path candidate : candidates) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try {
                Optional<String> version = detector.detect(Files.readString(candidate));
                if (version.isPresent()) {
                    log.debug("Found {} version {} in {}", detector, version.get(), candidate);
                    return version;
                }
            } catch (IOException e) {
                log.warn("Failed to read version candidate {}: {}", candidate, e.getMessage());
            }
        }
        return Optional.empty();
    }

    static Optional<String> versionArgument(String content) {
        Matcher matcher = VERSION_ARGUMENT.matcher(content);
        return matcher.find() ? Optional.of(matcher.group(1).strip()) : Optional.empty();
    }

    static List<String> referenceSegments(String reference) {
        if (reference == null || !reference.contains(".")) {
            return List.of();
        }
        List<String> segments = Arrays.stream(reference.strip().split("\\."))
            .map(String::strip)
            .toList();
        List<String> packageSegments = segments.subList(0, segments.size() - 1);
        return packageSegments.stream().anyMatch(String::isEmpty) ? List.of() : packageSegments;
    }

    private static Path resolve(Path base, List<String> segments) {
        Path path = base;
        for (String segment : segments) {
            path = path.resolve(segment);
        }
        return path;
    }

    private static Path directoryOf(Path descriptor) {
        Path parent = descriptor.toAbsolutePath().getParent();
        return parent != null ? parent : descriptor.toAbsolutePath();
    }
}
