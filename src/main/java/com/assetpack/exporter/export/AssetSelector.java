package com.assetpack.exporter.export;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects files under a root directory by include and exclude glob patterns.
 * <p>
 * Patterns use {@link FileSystem#getPathMatcher(String) glob} syntax and are matched against
 * the path relative to the root. A leading {@code **}{@code /} also matches files directly in the
 * root, and an exclude pattern that matches a directory excludes everything below it.
 */
public class AssetSelector {
    private static final Logger log = LoggerFactory.getLogger(AssetSelector.class);

    private final List<PathMatcher> includes;
    private final List<PathMatcher> excludes;
    private final Set<Path> excludedFiles = new HashSet<>();

    /**
     * @throws java.util.regex.PatternSyntaxException if a pattern is not a valid glob
     */
    public AssetSelector(Collection<String> includePatterns, Collection<String> excludePatterns) {
        this.includes = compile(includePatterns);
        this.excludes = compile(excludePatterns);
    }

    /**
     * Excludes one specific file, e.g. the package being written.
     */
    public AssetSelector excludeFile(Path file) {
        excludedFiles.add(file.toAbsolutePath().normalize());
        return this;
    }

    /**
     * Absolute paths of the matching regular files, sorted. A missing root selects nothing.
     */
    public List<Path> select(Path root) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(base)) {
            log.debug("Nothing to select, {} is not a directory", base);
            return List.of();
        }

        try (Stream<Path> stream = Files.walk(base)) {
            List<Path> selected = stream.filter(Files::isRegularFile)
                    .filter(file -> !excludedFiles.contains(file))
                    .filter(file -> matches(base.relativize(file)))
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("Selected {} files under {}", selected.size(), base);
            return selected;
        }
    }

    boolean matches(Path relativePath) {
        return matchesAny(includes, relativePath) && !isExcluded(relativePath);
    }

    private boolean isExcluded(Path relativePath) {
        // the file itself or any directory above it
        for (int i = relativePath.getNameCount(); i > 0; i--) {
            if (matchesAny(excludes, relativePath.subpath(0, i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(path)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> compile(Collection<String> patterns) {
        FileSystem fs = FileSystems.getDefault();
        List<PathMatcher> matchers = new ArrayList<>();
        for (String pattern : patterns) {
            String glob = pattern.replace('\\', '/');
            matchers.add(fs.getPathMatcher("glob:" + glob));
            if (glob.startsWith("**/")) {
                matchers.add(fs.getPathMatcher("glob:" + glob.substring(3)));
            }
        }
        return matchers;
    }
}
