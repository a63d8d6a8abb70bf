package com.assetpack.exporter.pack;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a package back into one {@link PackageEntry} per guid folder.
 * <p>
 * Entry contents go through {@link TarStreamUtil#readEntry}, so text entries come back
 * with CRLF line endings. Unknown file kinds are logged and skipped; a partial package
 * yields partial entries.
 */
public class PackageReader {
    private static final Logger log = LoggerFactory.getLogger(PackageReader.class);

    public List<PackageEntry> decode(Path packageFile) throws IOException {
        try (InputStream in = Files.newInputStream(packageFile)) {
            return decode(in);
        }
    }

    /**
     * Reads every entry of the package. The stream is consumed but not closed.
     */
    public List<PackageEntry> decode(InputStream packageStream) throws IOException {
        Map<String, PackageEntry> entries = new LinkedHashMap<>();

        GzipCompressorInputStream gzStream = new GzipCompressorInputStream(packageStream);
        TarArchiveInputStream tarStream = new TarArchiveInputStream(gzStream, StandardCharsets.UTF_8.name());

        TarArchiveEntry tarEntry;
        while ((tarEntry = tarStream.getNextEntry()) != null) {
            if (tarEntry.isDirectory()) {
                continue;
            }

            String name = stripCurrentDir(tarEntry.getName());
            int slash = name.indexOf('/');
            if (slash <= 0) {
                log.warn("Skipping {} because it is not inside an asset folder", tarEntry.getName());
                continue;
            }
            String folderName = name.substring(0, slash);
            String file = name.substring(slash + 1);

            ByteArrayOutputStream mem = new ByteArrayOutputStream();
            TarStreamUtil.readEntry(tarStream, mem);
            byte[] data = mem.toByteArray();

            PackageEntry entry = entries.computeIfAbsent(folderName, PackageEntry::new);
            switch (file) {
                case PackagePaths.ASSET_FILE:
                    entry.setContent(data);
                    break;
                case PackagePaths.META_FILE:
                    entry.setMetadata(data);
                    break;
                case PackagePaths.PATHNAME_FILE:
                    entry.setRelativePath(new String(data, StandardCharsets.UTF_8));
                    break;
                default:
                    log.warn("Skipping {} because it is an unknown file", tarEntry.getName());
                    break;
            }
        }

        log.debug("Decoded {} package entries", entries.size());
        return new ArrayList<>(entries.values());
    }

    private static String stripCurrentDir(String name) {
        return name.startsWith("./") ? name.substring(2) : name;
    }
}
