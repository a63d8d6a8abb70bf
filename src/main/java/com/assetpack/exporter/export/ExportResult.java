package com.assetpack.exporter.export;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Result of an export run.
 */
@Value
@Builder
public class ExportResult {
    Path outputPath;

    int filesMatched;
    int dependenciesFound;
    int assetsWritten;

    long elapsedMillis;

    List<String> errors;
    List<String> warnings;
}
