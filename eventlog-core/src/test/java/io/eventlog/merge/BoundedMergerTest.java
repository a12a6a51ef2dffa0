package io.eventlog.merge;

import com.codahale.metrics.MetricRegistry;
import io.eventlog.error.MergeIOException;
import io.eventlog.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedMergerTest {

    private static BoundedMerger<String> merger(int budget, MetricRegistry registry) {
        return new BoundedMerger<>(LineFiles.BY_KEY, LineFiles.LineSource::new, LineFiles.LineSink::new,
                budget, new Metrics(registry));
    }

    private static List<Path> randomInputs(Path dir, int count, long seed) throws Exception {
        Random rnd = new Random(seed);
        List<Path> inputs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            List<String> lines = new ArrayList<>();
            long key = rnd.nextInt(5);
            int n = rnd.nextInt(30);
            for (int j = 0; j < n; j++) {
                key += rnd.nextInt(3); // duplicates within and across inputs
                lines.add(key + ",src" + i + "#" + j);
            }
            inputs.add(LineFiles.write(dir, "in" + i + ".txt", lines));
        }
        return inputs;
    }

    private static List<Path> copies(List<Path> inputs, Path dir) throws Exception {
        Files.createDirectories(dir);
        List<Path> out = new ArrayList<>();
        for (Path p : inputs) out.add(Files.copy(p, dir.resolve(p.getFileName())));
        return out;
    }

    @Test
    void merges_sorted_inputs_without_loss() throws Exception {
        Path dir = Files.createTempDirectory("merge-basic");
        List<Path> inputs = List.of(
                LineFiles.write(dir, "a.txt", List.of("1,a", "3,a")),
                LineFiles.write(dir, "b.txt", List.of("2,b", "4,b")),
                LineFiles.write(dir, "c.txt", List.of("0,c")));
        Path out = dir.resolve("out.txt");

        MergeStats stats = merger(8, new MetricRegistry()).mergeFiles(inputs, out, dir.resolve("scratch"));

        assertEquals(List.of("0,c", "1,a", "2,b", "3,a", "4,b"), Files.readAllLines(out));
        assertEquals(1, stats.rounds());
        assertEquals(5, stats.recordsMerged());
    }

    @Test
    void equal_keys_follow_input_order() throws Exception {
        Path dir = Files.createTempDirectory("merge-ties");
        List<Path> inputs = List.of(
                LineFiles.write(dir, "a.txt", List.of("5,first", "5,first-again")),
                LineFiles.write(dir, "b.txt", List.of("5,second")),
                LineFiles.write(dir, "c.txt", List.of("5,third")));
        Path out = dir.resolve("out.txt");

        merger(2, new MetricRegistry()).mergeFiles(inputs, out, dir.resolve("scratch"));

        assertEquals(List.of("5,first", "5,first-again", "5,second", "5,third"), Files.readAllLines(out));
    }

    @Test
    void multi_round_output_is_identical_for_every_budget() throws Exception {
        Path dir = Files.createTempDirectory("merge-rounds");
        List<Path> inputs = randomInputs(Files.createDirectories(dir.resolve("src")), 23, 42L);

        Path reference = dir.resolve("reference.txt");
        merger(64, new MetricRegistry()).mergeFiles(copies(inputs, dir.resolve("ref-in")), reference, dir.resolve("ref-scratch"));
        byte[] expected = Files.readAllBytes(reference);
        long expectedLines = 0;
        for (Path p : inputs) expectedLines += Files.readAllLines(p).size();
        assertEquals(expectedLines, Files.readAllLines(reference).size());

        for (int budget = 2; budget <= 24; budget++) {
            Path out = dir.resolve("out-" + budget + ".txt");
            MergeStats stats = merger(budget, new MetricRegistry())
                    .mergeFiles(copies(inputs, dir.resolve("in-" + budget)), out, dir.resolve("scratch-" + budget));
            assertArrayEquals(expected, Files.readAllBytes(out), "budget " + budget);
            assertTrue(stats.peakOpenInputs() <= budget, "peak " + stats.peakOpenInputs() + " > " + budget);
        }
    }

    @Test
    void output_is_ordered_by_key() throws Exception {
        Path dir = Files.createDirectories(Files.createTempDirectory("merge-order").resolve("src"));
        List<Path> inputs = randomInputs(dir, 11, 7L);
        Path out = dir.getParent().resolve("out.txt");

        merger(3, new MetricRegistry()).mergeFiles(inputs, out, dir.getParent().resolve("scratch"));

        List<String> lines = Files.readAllLines(out);
        for (int i = 1; i < lines.size(); i++) {
            assertTrue(LineFiles.key(lines.get(i - 1)) <= LineFiles.key(lines.get(i)), "at line " + i);
        }
    }

    @Test
    void single_input_is_moved_without_merging() throws Exception {
        Path dir = Files.createTempDirectory("merge-single");
        Path only = LineFiles.write(dir, "only.txt", List.of("1,x", "2,x"));
        Path out = dir.resolve("nested/out.txt");
        MetricRegistry registry = new MetricRegistry();

        MergeStats stats = merger(4, registry).mergeFiles(List.of(only), out, dir.resolve("scratch"));

        assertEquals(MergeStats.moved(), stats);
        assertFalse(Files.exists(only));
        assertEquals("1,x\n2,x\n", Files.readString(out, StandardCharsets.UTF_8));
        assertEquals(0, registry.counter("merge.batches").getCount());
    }

    @Test
    void rounds_shrink_by_budget_and_clean_temporaries() throws Exception {
        Path dir = Files.createDirectories(Files.createTempDirectory("merge-reduce").resolve("src"));
        List<Path> inputs = randomInputs(dir, 9, 3L);
        Path scratch = dir.getParent().resolve("scratch");
        MetricRegistry registry = new MetricRegistry();

        MergeStats stats = merger(3, registry).mergeFiles(inputs, dir.getParent().resolve("out.txt"), scratch);

        // 9 -> 3 -> 1
        assertEquals(2, stats.rounds());
        assertEquals(4, stats.batchMerges());
        assertEquals(3, stats.peakOpenInputs());
        assertEquals(2, registry.counter("merge.rounds").getCount());
        try (var left = Files.list(scratch)) {
            assertEquals(0, left.count(), "round temporaries are removed after use");
        }
    }

    @Test
    void failing_input_aborts_and_leaves_no_output() throws Exception {
        Path dir = Files.createTempDirectory("merge-fail");
        List<Path> inputs = List.of(
                LineFiles.write(dir, "a.txt", List.of("1,a", "2,a")),
                LineFiles.write(dir, "b.txt", List.of("1,b", "boom")),
                LineFiles.write(dir, "c.txt", List.of("3,c")));
        Path out = dir.resolve("out.txt");

        MergeIOException e = assertThrows(MergeIOException.class,
                () -> merger(2, new MetricRegistry()).mergeFiles(inputs, out, dir.resolve("scratch")));

        assertTrue(e.getMessage().contains("b.txt"), e.getMessage());
        assertFalse(Files.exists(out));
    }

    @Test
    void rejects_empty_input_list() throws Exception {
        Path dir = Files.createTempDirectory("merge-empty");
        assertThrows(IllegalArgumentException.class,
                () -> merger(2, new MetricRegistry()).mergeFiles(List.of(), dir.resolve("out.txt"), dir));
    }

    @Test
    void batches_are_consecutive_and_bounded() {
        List<List<Integer>> b = BoundedMerger.batches(List.of(1, 2, 3, 4, 5, 6, 7), 3);
        assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5, 6), List.of(7)), b);
    }

    @Test
    void budget_below_minimum_is_raised() {
        assertEquals(2, merger(0, new MetricRegistry()).handleBudget());
    }
}
