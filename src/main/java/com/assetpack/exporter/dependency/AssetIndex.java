package com.assetpack.exporter.dependency;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.model.ExportDiagnostics;
import com.assetpack.exporter.util.ParallelRunner;

/**
 * Maps asset guids to files for one project and answers direct-reference queries.
 * <p>
 * Lifecycle has two phases. During indexing ({@link #indexFile(Path)} /
 * {@link #indexFiles(Collection)}) many workers insert concurrently. Once indexing has
 * completed the tables are only read, which is what lets {@link #directReferencesOf(Path)}
 * run from any number of resolver threads without further locking. Interleaving the two
 * phases is not supported.
 */
public class AssetIndex implements ReferenceSource {
    private static final Logger log = LoggerFactory.getLogger(AssetIndex.class);

    /** Asset id -> asset file (without the .meta suffix). */
    private final Map<AssetId, Path> fileIndex = new ConcurrentHashMap<>();

    /** Guid -> asset id. */
    private final Map<String, AssetId> guidIndex = new ConcurrentHashMap<>();

    private final ParallelRunner runner;
    private final ExportDiagnostics diagnostics;

    public AssetIndex(ParallelRunner runner, ExportDiagnostics diagnostics) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Indexes one asset. {@code file} may be either the asset or its meta file.
     * A missing meta file indexes the asset under {@link AssetId#EMPTY}.
     */
    public void indexFile(Path file) throws IOException {
        log.trace("Indexing file {}", file);

        Path metaFile = AssetParser.metaPathOf(file.toAbsolutePath().normalize());
        AssetId assetId = AssetParser.readAssetId(metaFile);

        fileIndex.put(assetId, AssetParser.assetPathOf(metaFile));
        if (assetId.hasGuid()) {
            guidIndex.put(assetId.getGuid(), assetId);
        }
    }

    @Override
    public void indexFiles(Collection<Path> files) {
        List<ParallelRunner.ItemFailure<Path>> failures = runner.forEach(files, this::indexFile);
        for (ParallelRunner.ItemFailure<Path> failure : failures) {
            String msg = "Failed to index " + failure.getItem() + " (" + failure.getCause().getMessage() + ")";
            diagnostics.addError(msg);
            log.error("Failed to index {}", failure.getItem(), failure.getCause());
        }
        log.info("Indexed {} assets ({} with guid, {} failed)", files.size(), guidIndex.size(), failures.size());
    }

    /**
     * Files referenced by {@code file}. References whose guid is not indexed are dropped.
     *
     * @throws UncheckedIOException if {@code file} exists but cannot be read
     */
    @Override
    public Set<Path> directReferencesOf(Path file) {
        List<AssetId> references;
        try {
            references = AssetParser.readReferences(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read references from " + file, e);
        }

        Set<Path> files = new LinkedHashSet<>();
        for (AssetId reference : references) {
            fileForGuid(reference.getGuid()).ifPresent(files::add);
        }
        return files;
    }

    /**
     * Resolves a guid to its indexed asset file.
     */
    public Optional<Path> fileForGuid(String guid) {
        if (guid == null || guid.isBlank()) {
            return Optional.empty();
        }
        AssetId assetId = guidIndex.get(guid);
        if (assetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(fileIndex.get(assetId));
    }

    public int size() {
        return fileIndex.size();
    }
}
