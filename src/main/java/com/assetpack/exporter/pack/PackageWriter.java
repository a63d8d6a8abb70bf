package com.assetpack.exporter.pack;

import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.dependency.AssetId;
import com.assetpack.exporter.dependency.AssetParser;
import com.assetpack.exporter.model.ExportDiagnostics;
import com.assetpack.exporter.util.ParallelRunner;

/**
 * Writes assets into a gzip-compressed tar package laid out by guid.
 * <p>
 * Every asset becomes three consecutive entries:
 * <pre>
 *   &lt;guid&gt;/asset       raw asset bytes
 *   &lt;guid&gt;/asset.meta  raw meta file
 *   &lt;guid&gt;/pathname    project path, e.g. Assets/Prefabs/Player.prefab
 * </pre>
 * {@link #addAsset(Path)} may be called from many threads. Reading the meta file happens
 * outside the lock; only the three entry writes are serialized, so entries of different
 * assets are never interleaved.
 */
public class PackageWriter implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(PackageWriter.class);

    private static final String TAR_NAME = "archtemp.tar";

    private final Path projectPath;
    private final ParallelRunner runner;
    private final ExportDiagnostics diagnostics;
    private final OutputStream outStream;
    private final GzipCompressorOutputStream gzStream;
    private final TarArchiveOutputStream tarStream;

    /** Guards every write to {@link #tarStream}. */
    private final ReentrantLock streamLock = new ReentrantLock();

    /** Absolute paths of assets already accepted. */
    private final Set<Path> files = ConcurrentHashMap.newKeySet();

    private volatile String subFolder = "";

    public PackageWriter(Path projectPath, OutputStream out, ParallelRunner runner, ExportDiagnostics diagnostics)
            throws IOException {
        this.projectPath = Objects.requireNonNull(projectPath, "projectPath").toAbsolutePath().normalize();
        this.runner = Objects.requireNonNull(runner, "runner");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.outStream = Objects.requireNonNull(out, "out");

        GzipParameters parameters = new GzipParameters();
        parameters.setFilename(TAR_NAME);
        this.gzStream = new GzipCompressorOutputStream(outStream, parameters);
        this.tarStream = new TarArchiveOutputStream(gzStream, StandardCharsets.UTF_8.name());
        this.tarStream.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        this.tarStream.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
    }

    /**
     * Opens a writer on {@code output}, replacing any existing file.
     */
    public static PackageWriter create(Path projectPath, Path output, ParallelRunner runner,
                                       ExportDiagnostics diagnostics) throws IOException {
        return new PackageWriter(projectPath, Files.newOutputStream(output), runner, diagnostics);
    }

    public void setSubFolder(String subFolder) {
        this.subFolder = subFolder == null ? "" : subFolder;
    }

    public String getSubFolder() {
        return subFolder;
    }

    /**
     * Absolute paths of every asset accepted so far.
     */
    public Set<Path> getFiles() {
        return Collections.unmodifiableSet(files);
    }

    /**
     * Adds an asset. A meta file path adds the asset it belongs to.
     *
     * @return {@code true} if the asset was written, {@code false} if it was a directory or already added
     * @throws FileNotFoundException if the asset does not exist
     */
    public boolean addAsset(Path path) throws IOException {
        Path file = AssetParser.assetPathOf(path.toAbsolutePath().normalize());
        if (!Files.isRegularFile(file)) {
            if (Files.isDirectory(file)) {
                log.warn("Attempted to add folder {} as a file. This is not supported.", file);
                diagnostics.addWarning("Skipped folder " + file);
                return false;
            }
            throw new FileNotFoundException("Could not find the file " + file);
        }
        return writeAsset(file);
    }

    /**
     * Writes an asset that passed the existence check. Returns {@code false} if it was already
     * added, or if it vanished before its entries were started; a vanished asset is forgotten
     * again and recorded as an error.
     */
    boolean writeAsset(Path file) throws IOException {
        if (!files.add(file)) {
            return false;
        }

        // Prepare everything outside the lock
        Path relativePath = projectPath.relativize(file);
        Path metaFile = AssetParser.metaPathOf(file);
        String guid;
        byte[] metaContents;

        if (!Files.isRegularFile(metaFile)) {
            log.warn("Missing .meta for {}", relativePath);
            diagnostics.addWarning("Missing .meta for " + relativePath);
            guid = newGuid();
            metaContents = ("guid: " + guid + "\n").getBytes(StandardCharsets.UTF_8);
        } else {
            metaContents = Files.readAllBytes(metaFile);
            AssetId assetId = AssetParser.parseAssetId(new String(metaContents, StandardCharsets.ISO_8859_1));
            if (assetId.hasGuid()) {
                guid = assetId.getGuid();
            } else {
                guid = newGuid();
                log.warn("No guid in {}, using generated guid {}", metaFile, guid);
                diagnostics.addWarning("No guid in " + metaFile);
                metaContents = prependGuid(guid, metaContents);
            }
        }

        String pathname = PackagePaths.pathnameOf(subFolder, relativePath);

        streamLock.lock();
        try {
            log.info("Writing File {} ( {} )", relativePath, guid);
            TarStreamUtil.writeFile(tarStream, file, PackagePaths.entryName(guid, PackagePaths.ASSET_FILE));
            TarStreamUtil.writeBytes(tarStream, PackagePaths.entryName(guid, PackagePaths.META_FILE), metaContents);
            TarStreamUtil.writeText(tarStream, PackagePaths.entryName(guid, PackagePaths.PATHNAME_FILE), pathname);
        } catch (FileNotFoundException | NoSuchFileException e) {
            // deleted after the existence check, before any entry was started
            files.remove(file);
            diagnostics.addError("Asset disappeared before it could be written: " + relativePath);
            log.error("Failed to write {}: {}", relativePath, e.getMessage());
            return false;
        } finally {
            streamLock.unlock();
        }

        return true;
    }

    /**
     * Adds assets in parallel and attempts every one of them.
     * <p>
     * Assets that do not exist are logged and recorded in the diagnostics. Any other failure
     * is thrown once all assets have been attempted: the first one, with the rest suppressed.
     *
     * @return number of assets written
     */
    public int addAssets(Collection<Path> assets) throws IOException {
        AtomicInteger written = new AtomicInteger();
        List<ParallelRunner.ItemFailure<Path>> failures = runner.forEach(assets, asset -> {
            if (addAsset(asset)) {
                written.incrementAndGet();
            }
        });

        Throwable fatal = null;
        for (ParallelRunner.ItemFailure<Path> failure : failures) {
            Throwable cause = failure.getCause();
            if (cause instanceof FileNotFoundException) {
                diagnostics.addError(cause.getMessage());
                log.error("Skipping {}: {}", failure.getItem(), cause.getMessage());
                continue;
            }

            log.error("Failed to add asset {}", failure.getItem(), cause);
            if (fatal == null) {
                fatal = cause;
            } else {
                fatal.addSuppressed(cause);
            }
        }

        if (fatal instanceof IOException io) {
            throw io;
        }
        if (fatal instanceof RuntimeException re) {
            throw re;
        }
        if (fatal != null) {
            throw new PackageWriteException("Failed to write package", fatal);
        }
        return written.get();
    }

    public void flush() throws IOException {
        streamLock.lock();
        try {
            tarStream.flush();
        } finally {
            streamLock.unlock();
        }
    }

    /**
     * Finishes the tar and gzip streams and closes the underlying output.
     */
    @Override
    public void close() throws IOException {
        streamLock.lock();
        try {
            tarStream.close();
        } finally {
            streamLock.unlock();
        }
    }

    /**
     * Random guid in the 32 lowercase hex digit form used by meta files.
     */
    static String newGuid() {
        // version 4 uuids always carry a non-zero version nibble
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static byte[] prependGuid(String guid, byte[] metaContents) {
        byte[] guidLine = ("guid: " + guid + "\n").getBytes(StandardCharsets.UTF_8);
        byte[] result = new byte[guidLine.length + metaContents.length];
        System.arraycopy(guidLine, 0, result, 0, guidLine.length);
        System.arraycopy(metaContents, 0, result, guidLine.length, metaContents.length);
        return result;
    }
}
