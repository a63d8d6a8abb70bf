package com.assetpack.exporter.dependency;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetpack.exporter.model.ExportDiagnostics;
import com.assetpack.exporter.util.ParallelRunner;

/**
 * Computes every file reachable from a seed set.
 * <p>
 * Two passes:
 * <ol>
 *   <li>Asset closure: breadth-first over {@code assetSource}, in batches of {@link #BATCH_SIZE}.
 *       Members of a batch are processed in parallel; the next batch starts only once the
 *       current one has finished. A path enters the queue only the first time it is added to
 *       the visited set.</li>
 *   <li>Script pass: every script file in the closure is handed once to {@code scriptSource}
 *       and its results are added. Script results are not expanded further.</li>
 * </ol>
 * Discovery order is not deterministic; only the resulting set is.
 * Both sources must have finished indexing before {@link #resolve(Collection)} is called.
 */
public class DependencyResolver {
    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public static final int BATCH_SIZE = 32;

    private final ReferenceSource assetSource;
    private final ReferenceSource scriptSource;
    private final ParallelRunner runner;
    private final ExportDiagnostics diagnostics;

    public DependencyResolver(ReferenceSource assetSource,
                              ReferenceSource scriptSource,
                              ParallelRunner runner,
                              ExportDiagnostics diagnostics) {
        this.assetSource = Objects.requireNonNull(assetSource, "assetSource");
        this.scriptSource = Objects.requireNonNull(scriptSource, "scriptSource");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Seed files plus everything they transitively reference.
     */
    public Set<Path> resolve(Collection<Path> seeds) {
        log.info("Finding dependencies of {} files", seeds.size());

        Set<Path> assets = findAssetClosure(seeds);
        Set<Path> scripts = findScriptReferences(assets);

        Set<Path> results = new LinkedHashSet<>(assets);
        results.addAll(scripts);

        log.info("Found {} files ({} from assets, {} from scripts)", results.size(), assets.size(), scripts.size());
        return results;
    }

    Set<Path> findAssetClosure(Collection<Path> seeds) {
        Set<Path> visited = ConcurrentHashMap.newKeySet();
        Queue<Path> queue = new ConcurrentLinkedQueue<>();

        for (Path seed : seeds) {
            Path file = normalize(seed);
            if (visited.add(file)) {
                queue.add(file);
            }
        }

        while (!queue.isEmpty()) {
            List<Path> batch = new ArrayList<>(BATCH_SIZE);
            Path next;
            while (batch.size() < BATCH_SIZE && (next = queue.poll()) != null) {
                batch.add(next);
            }
            if (batch.isEmpty()) {
                break;
            }

            List<ParallelRunner.ItemFailure<Path>> failures = runner.forEach(batch, current -> {
                log.trace("Searching {}", current);
                for (Path dependency : assetSource.directReferencesOf(current)) {
                    Path file = normalize(dependency);
                    if (visited.add(file)) {
                        log.trace(" - Found {}", file);
                        queue.add(file);
                    }
                }
            });
            reportFailures("search", failures);
        }

        return visited;
    }

    Set<Path> findScriptReferences(Set<Path> closure) {
        List<Path> scripts = closure.stream()
                .filter(ScriptFiles::isScript)
                .collect(Collectors.toList());
        if (scripts.isEmpty()) {
            return Set.of();
        }

        Set<Path> found = ConcurrentHashMap.newKeySet();
        List<ParallelRunner.ItemFailure<Path>> failures = runner.forEach(scripts, script -> {
            for (Path dependency : scriptSource.directReferencesOf(script)) {
                found.add(normalize(dependency));
            }
        });
        reportFailures("analyze script", failures);
        return found;
    }

    private void reportFailures(String action, List<ParallelRunner.ItemFailure<Path>> failures) {
        for (ParallelRunner.ItemFailure<Path> failure : failures) {
            diagnostics.addError("Failed to " + action + " " + failure.getItem()
                    + " (" + failure.getCause().getMessage() + ")");
            log.error("Failed to {} {}", action, failure.getItem(), failure.getCause());
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
