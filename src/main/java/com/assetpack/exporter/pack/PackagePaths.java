package com.assetpack.exporter.pack;

import java.nio.file.Path;
import java.util.StringJoiner;

/**
 * Naming conventions of the package layout.
 */
public final class PackagePaths {

    /** Every pathname stored in a package starts with this folder. */
    public static final String ROOT_FOLDER = "Assets";

    public static final String ASSET_FILE = "asset";
    public static final String META_FILE = "asset.meta";
    public static final String PATHNAME_FILE = "pathname";

    private PackagePaths() {
        // Utility class
    }

    /**
     * Pathname stored for an asset: forward slashes, optional sub folder, always rooted at {@link #ROOT_FOLDER}.
     */
    public static String pathnameOf(String subFolder, Path relativePath) {
        StringJoiner joiner = new StringJoiner("/");
        String folder = subFolder == null ? "" : trimSlashes(subFolder.replace('\\', '/'));
        if (!folder.isEmpty()) {
            joiner.add(folder);
        }
        for (Path part : relativePath) {
            joiner.add(part.toString());
        }

        String pathname = joiner.toString().replace('\\', '/');
        if (!pathname.startsWith(ROOT_FOLDER + "/")) {
            pathname = ROOT_FOLDER + "/" + pathname;
        }
        return pathname;
    }

    /**
     * Archive entry name for one of an asset's files.
     */
    public static String entryName(String guid, String file) {
        return guid + "/" + file;
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
