package com.assetpack.exporter.dependency;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Recognizes script source files by extension.
 */
public final class ScriptFiles {

    public static final String SCRIPT_EXTENSION = ".cs";

    /** Glob used to collect script files for the script reference source. */
    public static final String SCRIPT_PATTERN = "**/*" + SCRIPT_EXTENSION;

    private ScriptFiles() {
        // Utility class
    }

    public static boolean isScript(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(SCRIPT_EXTENSION);
    }
}
