package com.assetpack.exporter.export;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.dependency.AssetIndex;
import com.assetpack.exporter.dependency.DependencyResolver;
import com.assetpack.exporter.dependency.NoOpScriptReferenceSource;
import com.assetpack.exporter.dependency.ReferenceSource;
import com.assetpack.exporter.dependency.ScriptFiles;
import com.assetpack.exporter.model.ExportDiagnostics;
import com.assetpack.exporter.pack.PackageWriter;
import com.assetpack.exporter.util.ParallelRunner;

/**
 * Runs an export: select files, resolve their dependencies, write the package.
 */
public class ExportService {
    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    private static final List<String> META_PATTERNS = List.of("**/*.meta");

    private final ExportConfig config;
    private final ReferenceSource scriptSource;

    public ExportService(ExportConfig config) {
        this(config, new NoOpScriptReferenceSource());
    }

    public ExportService(ExportConfig config, ReferenceSource scriptSource) {
        this.config = Objects.requireNonNull(config, "config");
        this.scriptSource = Objects.requireNonNull(scriptSource, "scriptSource");
    }

    /**
     * Writes the package described by the configuration.
     *
     * @throws IOException if reading the project or writing the package fails
     */
    public ExportResult export() throws IOException {
        Path source = config.getSource().toAbsolutePath().normalize();
        Path output = config.getOutput().toAbsolutePath().normalize();
        ExportDiagnostics diagnostics = new ExportDiagnostics();

        try {
            log.info("Packing {}", source);
            long start = System.nanoTime();

            Path outputDir = output.getParent();
            if (outputDir != null) {
                Files.createDirectories(outputDir);
            }

            int parallelism = config.getParallelism() > 0
                    ? config.getParallelism()
                    : Runtime.getRuntime().availableProcessors();

            int filesMatched = 0;
            int dependenciesFound = 0;
            int written = 0;

            try (ParallelRunner runner = new ParallelRunner(parallelism)) {
                DependencyResolver resolver = config.isSkipDependencyCheck()
                        ? null
                        : createResolver(runner, diagnostics);

                try (PackageWriter packer = PackageWriter.create(source, output, runner, diagnostics)) {
                    packer.setSubFolder(config.getSubFolder());

                    List<Path> matchedAssets = new AssetSelector(config.getEffectiveAssetPatterns(), config.getExcludePatterns())
                            .excludeFile(output)
                            .select(source);
                    filesMatched = matchedAssets.size();
                    written += packer.addAssets(matchedAssets);

                    if (resolver != null) {
                        Set<Path> results = resolver.resolve(matchedAssets);
                        dependenciesFound = results.size();
                        written += packer.addAssets(results);
                    }
                }
            }

            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.info("Finished Packing in {}ms", elapsed);

            return ExportResult.builder()
                    .outputPath(output)
                    .filesMatched(filesMatched)
                    .dependenciesFound(dependenciesFound)
                    .assetsWritten(written)
                    .elapsedMillis(elapsed)
                    .errors(List.copyOf(diagnostics.getErrors()))
                    .warnings(List.copyOf(diagnostics.getWarnings()))
                    .build();

        } catch (IOException | RuntimeException e) {
            log.error("An error occurred during export", e);
            throw e;
        }
    }

    /**
     * Indexes the asset root and returns a resolver over it. Indexing completes before this returns.
     */
    private DependencyResolver createResolver(ParallelRunner runner, ExportDiagnostics diagnostics) throws IOException {
        Path assetRoot = config.getAssetRootPath().toAbsolutePath().normalize();
        log.info("Indexing {}", assetRoot);

        List<Path> metaFiles = new AssetSelector(META_PATTERNS, config.getExcludePatterns()).select(assetRoot);
        List<Path> scriptFiles = new AssetSelector(List.of(ScriptFiles.SCRIPT_PATTERN), config.getExcludePatterns())
                .select(assetRoot);

        AssetIndex assetIndex = new AssetIndex(runner, diagnostics);
        assetIndex.indexFiles(metaFiles);
        scriptSource.indexFiles(scriptFiles);

        return new DependencyResolver(assetIndex, scriptSource, runner, diagnostics);
    }
}
