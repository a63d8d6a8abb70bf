package com.assetpack.exporter.dependency;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;

/**
 * Something that can tell which project files a given file references.
 *
 * Implementations are indexed once through {@link #indexFiles(Collection)} and only
 * queried afterwards; {@link #directReferencesOf(Path)} must be safe to call from many
 * threads once indexing has completed.
 */
public interface ReferenceSource {

    /**
     * Indexes the candidate files that references may resolve to. Blocks until every file has been attempted.
     */
    void indexFiles(Collection<Path> files);

    /**
     * Absolute paths of the indexed files that {@code file} references directly. Never null.
     */
    Set<Path> directReferencesOf(Path file);
}
