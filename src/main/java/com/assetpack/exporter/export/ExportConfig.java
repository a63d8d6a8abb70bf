package com.assetpack.exporter.export;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration for one export run.
 */
@Value
@Builder(toBuilder = true)
public class ExportConfig {

    public static final List<String> DEFAULT_ASSET_PATTERNS = List.of("**");
    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of("Library/**", "**/.*");
    public static final String DEFAULT_ASSET_ROOT = "Assets";

    /** Project root. Pathnames in the package are relative to it. */
    @NonNull
    Path source;

    /** Package file to write. */
    @NonNull
    Path output;

    @Singular
    List<String> assetPatterns;

    @Singular
    List<String> excludePatterns;

    boolean skipDependencyCheck;

    /** Directory under {@link #source} scanned for dependency candidates. */
    @Builder.Default
    String assetRoot = DEFAULT_ASSET_ROOT;

    /** Folder prepended to every pathname. */
    @Builder.Default
    String subFolder = "";

    /** Worker threads, 0 for one per available processor. */
    int parallelism;

    public Path getAssetRootPath() {
        return source.resolve(assetRoot);
    }

    public List<String> getEffectiveAssetPatterns() {
        return assetPatterns.isEmpty() ? DEFAULT_ASSET_PATTERNS : assetPatterns;
    }
}
