package com.assetpack.exporter.dependency;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented extraction of guid definitions and references from asset and meta files.
 *
 * Files are streamed one line at a time so very large scene files never need to be
 * buffered. A missing file is not an error: it yields no references / {@link AssetId#EMPTY}.
 */
public final class AssetParser {

    public static final String META_EXTENSION = ".meta";

    // fileID: <id>, guid: <guid>
    private static final Pattern REFERENCE_PATTERN = Pattern.compile(
            "fileID: ([\\-0-9]+), guid: ([a-z0-9]{32})"
    );

    // guid: <guid>
    private static final Pattern GUID_PATTERN = Pattern.compile(
            "guid: ([a-z0-9]{32})"
    );

    private AssetParser() {
        // Utility class
    }

    /**
     * Reads every {@code fileID/guid} reference in the file, in file order, duplicates included.
     */
    public static List<AssetId> readReferences(Path file) throws IOException {
        List<AssetId> results = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return results;
        }

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                results.addAll(parseReferences(line));
            }
        }
        return results;
    }

    /**
     * Reads the asset's own id from its meta file. Stops at the first {@code guid:} line.
     */
    public static AssetId readAssetId(Path metaFile) throws IOException {
        if (!Files.isRegularFile(metaFile)) {
            return AssetId.EMPTY;
        }

        try (BufferedReader reader = Files.newBufferedReader(metaFile, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                AssetId id = parseAssetId(line);
                if (id.hasGuid()) {
                    return id;
                }
            }
        }
        return AssetId.EMPTY;
    }

    static List<AssetId> parseReferences(String line) {
        List<AssetId> ids = new ArrayList<>();
        Matcher matcher = REFERENCE_PATTERN.matcher(line);
        while (matcher.find()) {
            long fileId;
            try {
                fileId = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                // "-" or an id that overflows long; the guid is what matters
                fileId = 0L;
            }
            ids.add(new AssetId(fileId, matcher.group(2)));
        }
        return ids;
    }

    /**
     * First {@code guid:} definition in {@code text}, which may span several lines.
     */
    public static AssetId parseAssetId(CharSequence text) {
        Matcher matcher = GUID_PATTERN.matcher(text);
        return matcher.find() ? AssetId.ofGuid(matcher.group(1)) : AssetId.EMPTY;
    }

    /**
     * Meta file path for an asset. A path that already is a meta file is returned as is.
     */
    public static Path metaPathOf(Path path) {
        return isMetaFile(path) ? path : path.resolveSibling(path.getFileName() + META_EXTENSION);
    }

    /**
     * Asset path for a meta file. A path that is not a meta file is returned as is.
     */
    public static Path assetPathOf(Path path) {
        if (!isMetaFile(path)) {
            return path;
        }
        String name = path.getFileName().toString();
        return path.resolveSibling(name.substring(0, name.length() - META_EXTENSION.length()));
    }

    public static boolean isMetaFile(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().endsWith(META_EXTENSION);
    }
}
