package com.assetpack.exporter.pack;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;

/**
 * Reading and writing single tar entries.
 */
public final class TarStreamUtil {

    private static final int BUFFER_SIZE = 4096;

    /** Number of leading bytes inspected to decide whether an entry is text. */
    static final int TEXT_PROBE_LENGTH = 200;

    private static final byte CR = 13;
    private static final byte LF = 10;

    private TarStreamUtil() {
        // Utility class
    }

    /**
     * Copies a file from disk into a new entry. The entry size is taken from the file.
     */
    public static void writeFile(TarArchiveOutputStream tar, Path source, String name) throws IOException {
        try (InputStream in = Files.newInputStream(source)) {
            TarArchiveEntry entry = new TarArchiveEntry(name);
            entry.setSize(Files.size(source));
            tar.putArchiveEntry(entry);
            in.transferTo(tar);
            tar.closeArchiveEntry();
        }
    }

    public static void writeBytes(TarArchiveOutputStream tar, String name, byte[] content) throws IOException {
        TarArchiveEntry entry = new TarArchiveEntry(name);
        entry.setSize(content.length);
        tar.putArchiveEntry(entry);
        tar.write(content);
        tar.closeArchiveEntry();
    }

    public static void writeText(TarArchiveOutputStream tar, String name, String content) throws IOException {
        writeBytes(tar, name, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Copies the current entry of {@code in} to {@code out}, converting line endings of text entries.
     * <p>
     * An entry is text when none of its first {@value #TEXT_PROBE_LENGTH} bytes is a control
     * character other than backspace, tab, LF, VT, FF or CR, and none is 0xFF. In text entries
     * every LF not preceded by CR becomes CRLF. Binary entries are copied unchanged.
     *
     * @return number of bytes read from the entry
     */
    public static long readEntry(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        int numRead = in.readNBytes(buffer, 0, buffer.length);
        long totalRead = numRead;

        boolean text = isText(buffer, Math.min(TEXT_PROBE_LENGTH, numRead));
        // carried across buffer refills, a CRLF pair may straddle two reads
        boolean cr = false;

        while (numRead > 0) {
            if (text) {
                for (int i = 0; i < numRead; i++) {
                    byte b = buffer[i];
                    if (b == LF && !cr) {
                        out.write(CR);
                    }
                    cr = b == CR;
                    out.write(b);
                }
            } else {
                out.write(buffer, 0, numRead);
            }

            numRead = in.read(buffer, 0, buffer.length);
            if (numRead > 0) {
                totalRead += numRead;
            }
        }
        return totalRead;
    }

    static boolean isText(byte[] buffer, int length) {
        for (int i = 0; i < length; i++) {
            int b = buffer[i] & 0xFF;
            if (b < 8 || (b > 13 && b < 32) || b == 255) {
                return false;
            }
        }
        return true;
    }
}
