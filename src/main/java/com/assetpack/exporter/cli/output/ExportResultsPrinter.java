package com.assetpack.exporter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.cli.exception.OptionsValidationException;
import com.assetpack.exporter.cli.model.ExportOptions;
import com.assetpack.exporter.cli.model.ValidatedExportOptions;
import com.assetpack.exporter.export.ExportResult;

/**
 * Responsible only for printing CLI output for the "export" command.
 * No validation, no execution.
 */
public class ExportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ExportResultsPrinter.class);

    public void printBanner(ExportOptions o, ValidatedExportOptions v) {
        log.info("=================================================");
        log.info("Asset Package Exporter");
        log.info("=================================================");
        log.info("Project Directory: {}", v.getSource());
        log.info("Output Package: {}", v.getOutput());
        log.info("Assets: {}", v.getAssetPatterns());
        log.info("Excludes: {}", v.getExcludePatterns());
        log.info("Sub Folder: {}", o.getSubFolder().isEmpty() ? "None" : o.getSubFolder());

        if (o.isSkipDependencyCheck()) {
            log.info("Dependency Check: skipped");
        } else {
            log.info("Dependency Check: enabled (asset root {})", o.getAssetRoot());
            if (!v.isAssetRootPresent()) {
                log.warn("Asset root {} does not exist, no dependencies will be resolved", o.getAssetRoot());
            }
        }

        log.info("=================================================");
    }

    public void printSuccess(ExportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("EXPORT SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Files Matched: {}", result.getFilesMatched());
        log.info("Dependencies Found: {}", result.getDependenciesFound());
        log.info("Assets Written: {}", result.getAssetsWritten());
        log.info("Elapsed: {} ms", result.getElapsedMillis());

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings: {}", result.getWarnings().size());
            result.getWarnings().forEach(w -> log.info("  {}", w));
        }
        if (!result.getErrors().isEmpty()) {
            log.info("");
            log.info("Skipped with errors: {}", result.getErrors().size());
            result.getErrors().forEach(e -> log.info("  {}", e));
        }

        log.info("=================================================");
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options for {}:", e.getCommand());
        for (String error : e.getErrors()) {
            log.error("  {}", error);
        }
    }
}
