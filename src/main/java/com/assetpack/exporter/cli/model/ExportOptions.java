package com.assetpack.exporter.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "export" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ExportOptions {

	@Parameters(index = "0", arity = "0..1", description = "Project directory")
	private Path source;

	@Parameters(index = "1", arity = "0..1", description = "Output package file")
	private Path output;

	@Option(names = { "--assets", "-a" }, defaultValue = "**",
			description = "Adds assets to the pack. Supports glob matching (default: ${DEFAULT-VALUE})")
	private List<String> assets = new ArrayList<>();

	@Option(names = { "--exclude", "-e" },
			description = "Excludes assets from the pack. Repeatable, supports glob matching (default: Library/** and **/.*)")
	private List<String> excludes = new ArrayList<>();

	@Option(names = { "--skip-dependency-check" },
			description = "Skips dependency analysis. Disabling it may leave referenced assets out of the package")
	private boolean skipDependencyCheck;

	@Option(names = { "--asset-root", "-r" }, defaultValue = "Assets",
			description = "Directory scanned for assets that dependencies can resolve to (default: ${DEFAULT-VALUE})")
	private String assetRoot;

	@Option(names = { "--sub-folder", "-s" }, defaultValue = "",
			description = "Folder every packed asset is placed under")
	private String subFolder;

	@Option(names = { "--threads", "-t" }, defaultValue = "0",
			description = "Worker threads, 0 for one per processor (default: ${DEFAULT-VALUE})")
	private int threads;

	@Option(names = { "--verbose", "--log-level", "-v" }, defaultValue = "INFO",
			description = "Log level: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private LogLevel verbose;

}
