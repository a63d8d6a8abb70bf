package com.assetpack.exporter.dependency;

import lombok.Value;

/**
 * Reference to an asset: the local object id inside a file plus the asset's global id.
 *
 * Two ids name the same asset when their guids are equal. The fileID is carried along
 * but never used for lookups.
 */
@Value
public class AssetId {

    /** Id with neither a local object id nor a guid. */
    public static final AssetId EMPTY = new AssetId(0L, null);

    long fileId;

    /** Lowercase hex guid, or {@code null} for built-in references. */
    String guid;

    public static AssetId ofGuid(String guid) {
        return new AssetId(0L, guid);
    }

    public boolean hasGuid() {
        return guid != null && !guid.isBlank();
    }
}
