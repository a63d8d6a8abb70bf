package com.assetpack.exporter.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ParallelRunner.
 */
class ParallelRunnerTest {

    @Test
    void testRunsEveryItem() {
        List<Integer> items = IntStream.range(0, 500).boxed().collect(Collectors.toList());
        Set<Integer> seen = ConcurrentHashMap.newKeySet();

        try (ParallelRunner runner = new ParallelRunner(4)) {
            List<ParallelRunner.ItemFailure<Integer>> failures = runner.forEach(items, seen::add);

            assertThat(failures).isEmpty();
        }
        assertThat(seen).hasSize(500);
    }

    @Test
    void testFailuresAreIsolatedPerItem() {
        Set<String> done = ConcurrentHashMap.newKeySet();

        List<ParallelRunner.ItemFailure<String>> failures;
        try (ParallelRunner runner = new ParallelRunner(2)) {
            failures = runner.forEach(List.of("a", "bad", "c", "worse"), item -> {
                if (item.length() > 1) {
                    throw new IOException("cannot process " + item);
                }
                done.add(item);
            });
        }

        assertThat(done).containsExactlyInAnyOrder("a", "c");
        assertThat(failures).extracting(ParallelRunner.ItemFailure::getItem).containsExactly("bad", "worse");
        assertThat(failures.get(0).getCause()).isInstanceOf(IOException.class).hasMessage("cannot process bad");
    }

    @Test
    void testWorkersAreNamedDaemonThreads() {
        Set<String> names = ConcurrentHashMap.newKeySet();
        Set<Boolean> daemon = ConcurrentHashMap.newKeySet();

        try (ParallelRunner runner = new ParallelRunner(3)) {
            assertThat(runner.getParallelism()).isEqualTo(3);
            runner.forEach(List.of(1, 2, 3, 4, 5, 6), item -> {
                names.add(Thread.currentThread().getName());
                daemon.add(Thread.currentThread().isDaemon());
            });
        }

        assertThat(names).allMatch(name -> name.startsWith("export-worker-"));
        assertThat(daemon).containsExactly(true);
    }

    @Test
    void testEmptyCollection() {
        try (ParallelRunner runner = new ParallelRunner(1)) {
            assertThat(runner.forEach(List.<String>of(), item -> fail("not expected"))).isEmpty();
        }
    }

    @Test
    void testInvalidParallelism() {
        assertThatThrownBy(() -> new ParallelRunner(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0");
    }
}
