package com.assetpack.exporter.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.dependency.AssetParser;
import com.assetpack.exporter.pack.PackageEntry;
import com.assetpack.exporter.pack.PackageReader;

/**
 * Extracts a package into a directory, restoring each asset at its pathname next to its meta file.
 */
public class UnpackService {
    private static final Logger log = LoggerFactory.getLogger(UnpackService.class);

    private final PackageReader reader;

    public UnpackService() {
        this(new PackageReader());
    }

    public UnpackService(PackageReader reader) {
        this.reader = reader;
    }

    /**
     * @return number of assets restored
     */
    public int unpack(Path packageFile, Path outputDir) throws IOException {
        Path base = outputDir.toAbsolutePath().normalize();
        log.info("Unpacking {} into {}", packageFile, base);

        List<PackageEntry> entries = reader.decode(packageFile);
        int restored = 0;
        for (PackageEntry entry : entries) {
            if (entry.getRelativePath() == null) {
                log.warn("Skipping {} because it has no pathname", entry.getFolderName());
                continue;
            }

            Path target = base.resolve(entry.getRelativePath()).normalize();
            if (!target.startsWith(base) || target.equals(base)) {
                log.warn("Skipping {} because its pathname {} points outside {}",
                        entry.getFolderName(), entry.getRelativePath(), base);
                continue;
            }

            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (entry.getContent() != null) {
                Files.write(target, entry.getContent());
                restored++;
            } else {
                log.warn("Package has no asset data for {}", entry.getRelativePath());
            }
            if (entry.getMetadata() != null) {
                Files.write(AssetParser.metaPathOf(target), entry.getMetadata());
            }
        }

        log.info("Restored {} of {} assets", restored, entries.size());
        return restored;
    }
}
