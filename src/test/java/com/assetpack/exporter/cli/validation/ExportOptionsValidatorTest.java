package com.assetpack.exporter.cli.validation;

import com.assetpack.exporter.cli.exception.OptionsValidationException;
import com.assetpack.exporter.cli.model.ExportOptions;
import com.assetpack.exporter.cli.model.ValidatedExportOptions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ExportOptionsValidator.
 */
class ExportOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ExportOptionsValidator validator = new ExportOptionsValidator();

    @Test
    void testValidOptionsWithDefaults() throws IOException {
        Files.createDirectories(tempDir.resolve("Assets"));

        ValidatedExportOptions validated = validator.validate(parse(tempDir.toString(), tempDir.resolve("out.unitypackage").toString()));

        assertThat(validated.getSource()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(validated.isAssetRootPresent()).isTrue();
        assertThat(validated.getAssetPatterns()).containsExactly("**");
        assertThat(validated.getExcludePatterns()).containsExactly("Library/**", "**/.*");
    }

    @Test
    void testRepeatedAssetOptions() {
        ValidatedExportOptions validated = validator.validate(parse(
                "-a", "Assets/Prefabs/**", "--assets", " Assets/Scripts/** ", "-e", "**/*.tmp",
                tempDir.toString(), tempDir.resolve("out.unitypackage").toString()));

        assertThat(validated.getAssetPatterns()).containsExactly("Assets/Prefabs/**", "Assets/Scripts/**");
        assertThat(validated.getExcludePatterns()).containsExactly("**/*.tmp");
        assertThat(validated.isAssetRootPresent()).isFalse();
    }

    @Test
    void testCollectsEveryError() {
        ExportOptions options = parse("-t", "-1", "-r", " ", tempDir.resolve("missing").toString(), tempDir.toString());

        OptionsValidationException e = catchThrowableOfType(() -> validator.validate(options), OptionsValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getCommand()).isEqualTo("export");
        assertThat(e.getErrors()).hasSize(4);
    }

    @Test
    void testMissingPositionals() {
        OptionsValidationException e = catchThrowableOfType(() -> validator.validate(parse()), OptionsValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrors()).contains("Project directory is required.", "Output package file is required.");
    }

    @Test
    void testBraceGlobIsKeptWhole() {
        ValidatedExportOptions validated = validator.validate(parse(
                "-e", "**/*.{tmp,bak}", tempDir.toString(), tempDir.resolve("out.unitypackage").toString()));

        assertThat(validated.getExcludePatterns()).containsExactly("**/*.{tmp,bak}");
    }

    @Test
    void testInvalidGlobIsReported() {
        ExportOptions options = parse("-e", "**/*.{tmp", tempDir.toString(), tempDir.resolve("out.unitypackage").toString());

        OptionsValidationException e = catchThrowableOfType(() -> validator.validate(options), OptionsValidationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getErrors()).hasSize(1);
        assertThat(e.getErrors().get(0)).startsWith("Invalid glob for --exclude: **/*.{tmp");
    }

    private static ExportOptions parse(String... args) {
        ExportOptions options = new ExportOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
