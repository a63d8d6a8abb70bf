package com.assetpack.exporter.pack;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One asset decoded from a package: the files found under a single guid folder.
 *
 * Any field may be missing when the package is partial or corrupt.
 */
@Data
@NoArgsConstructor
public class PackageEntry {

    /** Name of the folder the entries were stored under, normally the asset guid. */
    private String folderName;

    /** Project-relative path, e.g. {@code Assets/Prefabs/Player.prefab}. */
    private String relativePath;

    /** Contents of the .meta file. */
    private byte[] metadata;

    /** Contents of the asset file. */
    private byte[] content;

    public PackageEntry(String folderName) {
        this.folderName = folderName;
    }

    public boolean isComplete() {
        return relativePath != null && metadata != null && content != null;
    }
}
