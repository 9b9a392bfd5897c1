package com.pkgmeta.core.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against the path relative to the root; Java's
     * {@code **} does not match zero directories, so patterns that must also hit
     * top-level files start with an optional-prefix group. Results are sorted by path.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath);
                })
                .sorted()
                .toList();
        } catch (UncheckedIOException e) {
            // raised lazily by the walk, e.g. for an unreadable subdirectory
            throw e.getCause();
        }
    }

    /**
     * Lists files with one of the given names, level by level, at most
     * {@code maxDepth} levels below the root (root files are level 1).
     *
     * <p>Files of a shallower level come first; files of one level are sorted by path.
     *
     * @param rootPath directory to walk
     * @param maxDepth number of levels to visit
     * @param fileNames file names of interest
     * @return matching files in level order
     * @throws IOException if directory traversal fails
     */
    public static List<Path> walkLevels(Path rootPath, int maxDepth, Set<String> fileNames) throws IOException {
        if (maxDepth <= 0 || !Files.isDirectory(rootPath)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(rootPath, maxDepth)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> fileNames.contains(path.getFileName().toString()))
                .sorted(Comparator.comparingInt((Path path) -> rootPath.relativize(path).getNameCount())
                    .thenComparing(Comparator.naturalOrder()))
                .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    /**
     * Gets the file name of a path as a string.
     *
     * @param path file path
     * @return file name, or empty string for a root path
     */
    public static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : "";
    }
}
