package com.assetpack.exporter.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.cli.exception.OptionsValidationException;
import com.assetpack.exporter.cli.model.LogLevel;
import com.assetpack.exporter.export.UnpackService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command that extracts a package into a directory.
 */
@Command(
        name = "unpack",
        mixinStandardHelpOptions = true,
        description = "Extracts the assets of a package into a directory, restoring their paths and .meta files."
)
public class UnpackCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UnpackCommand.class);

    @Parameters(index = "0", description = "Package file to read")
    private Path packageFile;

    @Parameters(index = "1", description = "Directory to extract into")
    private Path outputDir;

    @Option(names = { "--force", "-f" }, description = "Extract into a directory that is not empty")
    private boolean force;

    @Option(names = { "--verbose", "--log-level", "-v" }, defaultValue = "INFO",
            description = "Log level: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private LogLevel verbose;

    @Override
    public Integer call() {
        LoggingConfigurer.apply(verbose);

        try {
            validate();
        } catch (OptionsValidationException e) {
            log.error("Invalid options for {}:", e.getCommand());
            e.getErrors().forEach(error -> log.error("  {}", error));
            return 1;
        }

        try {
            int restored = new UnpackService().unpack(packageFile, outputDir);
            log.info("Unpacked {} assets into {}", restored, outputDir.toAbsolutePath());
            return 0;
        } catch (Exception e) {
            log.error("Unpack failed", e);
            return 1;
        }
    }

    private void validate() {
        List<String> errors = new ArrayList<>();
        if (!Files.isRegularFile(packageFile)) {
            errors.add("Package file does not exist: " + packageFile);
        }
        if (Files.exists(outputDir)) {
            if (!Files.isDirectory(outputDir)) {
                errors.add("Output path is not a directory: " + outputDir);
            } else if (!force) {
                try {
                    if (!isEmptyDirectory(outputDir)) {
                        errors.add("Output directory is not empty: " + outputDir + ". Use --force to extract anyway.");
                    }
                } catch (IOException e) {
                    errors.add("Cannot read output directory " + outputDir + " (" + e.getMessage() + ")");
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException("unpack", errors);
        }
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return children.findAny().isEmpty();
        }
    }
}
