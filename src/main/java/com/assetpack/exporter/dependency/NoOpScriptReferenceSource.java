package com.assetpack.exporter.dependency;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Script reference source that resolves nothing.
 *
 * Used when no script analyzer is plugged in: script files are still packed when the
 * asset graph reaches them, but the code they reference is not followed.
 */
public class NoOpScriptReferenceSource implements ReferenceSource {
    private static final Logger log = LoggerFactory.getLogger(NoOpScriptReferenceSource.class);

    @Override
    public void indexFiles(Collection<Path> files) {
        log.debug("No script analyzer configured, ignoring {} script files", files.size());
    }

    @Override
    public Set<Path> directReferencesOf(Path file) {
        return Set.of();
    }
}
