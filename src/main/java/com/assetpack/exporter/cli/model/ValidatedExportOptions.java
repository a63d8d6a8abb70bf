package com.assetpack.exporter.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Export inputs after validation: absolute paths and trimmed pattern lists.
 */
@Data
@AllArgsConstructor
public class ValidatedExportOptions {
    Path source;
    Path output;
    boolean assetRootPresent;
    List<String> assetPatterns;
    List<String> excludePatterns;
}
