package com.assetpack.exporter;

import com.assetpack.exporter.cli.ExportCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Asset Package Exporter.
 * Packs project assets, together with every asset they reference, into a guid-keyed package.
 */
public class ExporterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExportCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
