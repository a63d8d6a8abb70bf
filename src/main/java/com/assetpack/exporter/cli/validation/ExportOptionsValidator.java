package com.assetpack.exporter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.assetpack.exporter.cli.exception.OptionsValidationException;
import com.assetpack.exporter.cli.model.ExportOptions;
import com.assetpack.exporter.cli.model.ValidatedExportOptions;
import com.assetpack.exporter.export.AssetSelector;
import com.assetpack.exporter.export.ExportConfig;

public class ExportOptionsValidator {

	public ValidatedExportOptions validate(ExportOptions o) {
		List<String> errors = new ArrayList<>();

		Path source = null;
		if (o.getSource() == null) {
			errors.add("Project directory is required.");
		} else {
			source = o.getSource().toAbsolutePath().normalize();
			if (!existsDirectory(source)) {
				errors.add("Project directory does not exist or is not a directory: " + o.getSource());
			}
		}

		Path output = null;
		if (o.getOutput() == null) {
			errors.add("Output package file is required.");
		} else {
			output = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(output)) {
				errors.add("Output path is a directory, expected a file: " + o.getOutput());
			}
		}

		List<String> assetPatterns = cleanPatterns(o.getAssets());
		if (assetPatterns.isEmpty()) {
			errors.add("At least one asset pattern is required (--assets / -a).");
		}
		List<String> excludePatterns = cleanPatterns(o.getExcludes());
		if (excludePatterns.isEmpty()) {
			excludePatterns = ExportConfig.DEFAULT_EXCLUDE_PATTERNS;
		}
		checkGlobs("--assets", assetPatterns, errors);
		checkGlobs("--exclude", excludePatterns, errors);

		if (isBlank(o.getAssetRoot())) {
			errors.add("Asset root must not be blank (--asset-root / -r).");
		}

		if (o.getThreads() < 0) {
			errors.add("Thread count must be >= 0. Got: " + o.getThreads());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("export", errors);
		}

		boolean assetRootPresent = existsDirectory(source.resolve(o.getAssetRoot()));
		return new ValidatedExportOptions(source, output, assetRootPresent, assetPatterns, excludePatterns);
	}

	private static void checkGlobs(String option, List<String> patterns, List<String> errors) {
		for (String pattern : patterns) {
			try {
				new AssetSelector(List.of(pattern), List.of());
			} catch (IllegalArgumentException e) {
				errors.add("Invalid glob for " + option + ": " + pattern + " (" + e.getMessage().lines().findFirst().orElse("") + ")");
			}
		}
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static List<String> cleanPatterns(List<String> raw) {
		if (raw == null) {
			return List.of();
		}
		return raw.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
	}
}
