/*
 * PhotonStack — Two-Photon Imaging Pipeline
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.photonstack.core.io;

import ai.evacortex.photonstack.core.exceptions.ContainerIOException;
import ai.evacortex.photonstack.core.metadata.TypedIniParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers input files for batch commands.
 */
public final class PathCollector {

    public static final String PATTERN_SEPARATOR = ";";

    private PathCollector() {}

    /**
     * Files under {@code root} whose extension is one of {@code extensions} (with or without the
     * leading dot, case-insensitive). In strict mode only the final suffix is compared; otherwise
     * any suffix of a multi-suffix name (e.g. {@code .notes} of {@code a.notes.txt}) matches.
     * If {@code root} is itself a file it is tested alone.
     */
    public static List<Path> collectPathsFromExtensions(Path root, Collection<String> extensions,
                                                        boolean recursive, boolean strict) {
        List<String> wanted = extensions.stream()
                .map(e -> (e.startsWith(".") ? e : "." + e).toLowerCase(Locale.ROOT))
                .toList();
        Predicate<Path> matches = p -> {
            List<String> suffixes = suffixes(p);
            if (strict) {
                return !suffixes.isEmpty() && wanted.contains(suffixes.get(suffixes.size() - 1));
            }
            return suffixes.stream().anyMatch(wanted::contains);
        };

        if (Files.isRegularFile(root)) {
            return matches.test(root) ? List.of(root) : List.of();
        }
        try (Stream<Path> walk = recursive ? Files.walk(root) : Files.list(root)) {
            return walk.filter(Files::isRegularFile).filter(matches).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new ContainerIOException("Failed to list " + root, e);
        }
    }

    /**
     * Keeps paths whose string form matches at least one include pattern (when any are given)
     * and no exclude pattern. Patterns are regular expressions separated by {@code ;}, searched
     * anywhere in the path.
     */
    public static List<Path> filterPaths(List<Path> paths, String include, String exclude) {
        List<Pattern> includes = compile(include);
        List<Pattern> excludes = compile(exclude);
        return paths.stream()
                .filter(p -> includes.isEmpty() || includes.stream().anyMatch(r -> r.matcher(p.toString()).find()))
                .filter(p -> excludes.stream().noneMatch(r -> r.matcher(p.toString()).find()))
                .collect(Collectors.toList());
    }

    /** {@link #collectPathsFromExtensions} followed by {@link #filterPaths}. */
    public static List<Path> findPaths(Path root, Collection<String> extensions, boolean recursive,
                                       boolean strict, String include, String exclude) {
        return filterPaths(collectPathsFromExtensions(root, extensions, recursive, strict), include, exclude);
    }

    private static List<Pattern> compile(String patterns) {
        if (patterns == null || patterns.isEmpty()) return List.of();
        return TypedIniParser.splitString(patterns, PATTERN_SEPARATOR).stream()
                .map(Pattern::compile)
                .toList();
    }

    static List<String> suffixes(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int first = name.indexOf('.', 1);
        if (first < 0) return List.of();
        return Stream.of(name.substring(first + 1).split("\\."))
                .filter(s -> !s.isEmpty())
                .map(s -> "." + s)
                .toList();
    }
}
