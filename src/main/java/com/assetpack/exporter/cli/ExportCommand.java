package com.assetpack.exporter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.cli.exception.OptionsValidationException;
import com.assetpack.exporter.cli.model.ExportOptions;
import com.assetpack.exporter.cli.model.ValidatedExportOptions;
import com.assetpack.exporter.cli.output.ExportResultsPrinter;
import com.assetpack.exporter.cli.validation.ExportOptionsValidator;
import com.assetpack.exporter.export.ExportConfig;
import com.assetpack.exporter.export.ExportResult;
import com.assetpack.exporter.export.ExportService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that packs a project directory into a package file.
 */
@Command(
        name = "export",
        mixinStandardHelpOptions = true,
        version = "asset-package-exporter 1.0.0",
        description = "Packs the assets of a project, and every asset they reference, into a package.",
        subcommands = { UnpackCommand.class }
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Mixin
    private ExportOptions options = new ExportOptions();

    private final ExportOptionsValidator validator = new ExportOptionsValidator();
    private final ExportResultsPrinter printer = new ExportResultsPrinter();

    @Override
    public Integer call() {
        LoggingConfigurer.apply(options.getVerbose());

        ValidatedExportOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        }

        printer.printBanner(options, validated);

        ExportConfig config = ExportConfig.builder()
                .source(validated.getSource())
                .output(validated.getOutput())
                .assetPatterns(validated.getAssetPatterns())
                .excludePatterns(validated.getExcludePatterns())
                .skipDependencyCheck(options.isSkipDependencyCheck())
                .assetRoot(options.getAssetRoot())
                .subFolder(options.getSubFolder())
                .parallelism(options.getThreads())
                .build();

        try {
            ExportResult result = new ExportService(config).export();
            printer.printSuccess(result);
            return 0;
        } catch (Exception e) {
            log.error("Export failed: {}", e.getMessage());
            return 1;
        }
    }
}
