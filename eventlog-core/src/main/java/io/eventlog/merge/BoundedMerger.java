package io.eventlog.merge;

import com.codahale.metrics.Timer;
import io.eventlog.budget.HandleBudget;
import io.eventlog.core.Record;
import io.eventlog.core.Sink;
import io.eventlog.core.SinkFactory;
import io.eventlog.core.Source;
import io.eventlog.core.SourceFactory;
import io.eventlog.error.MergeIOException;
import io.eventlog.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Merges individually sorted files into one sorted file while keeping at most {@code handleBudget}
 * inputs open. Inputs beyond the budget are reduced in rounds: consecutive batches are merged into
 * temporaries, which become the next round's inputs, until one file remains.
 *
 * <p>Ties under the comparator resolve by input position. Batches are consecutive and keep their
 * relative order in the next round, so the final order for equal keys is the order the inputs were
 * supplied in, whatever the number of rounds.
 */
public class BoundedMerger<T> {
    private static final Logger log = LoggerFactory.getLogger(BoundedMerger.class);

    private final Comparator<? super T> order;
    private final SourceFactory<T> sources;
    private final SinkFactory<T> sinks;
    private final int handleBudget;
    private final Metrics metrics;

    public BoundedMerger(Comparator<? super T> order,
                         SourceFactory<T> sources,
                         SinkFactory<T> sinks,
                         int handleBudget,
                         Metrics metrics) {
        this.order = Objects.requireNonNull(order);
        this.sources = Objects.requireNonNull(sources);
        this.sinks = Objects.requireNonNull(sinks);
        this.handleBudget = Math.max(HandleBudget.MIN_HANDLES, handleBudget);
        this.metrics = Objects.requireNonNull(metrics);
    }

    public int handleBudget() { return handleBudget; }

    /**
     * Merges {@code inputs} into {@code output}. Temporaries go to {@code scratchDir}; those created by a
     * round are deleted once the following round has read them. The output only appears after the last
     * round succeeded. A single input is moved to the output unread.
     */
    public MergeStats mergeFiles(List<Path> inputs, Path output, Path scratchDir) {
        if (inputs.isEmpty()) throw new IllegalArgumentException("nothing to merge into " + output);
        if (inputs.size() == 1) {
            moveIntoPlace(inputs.get(0), output);
            return MergeStats.moved();
        }
        HandleBudget budget = new HandleBudget(handleBudget);
        List<Path> current = List.copyOf(inputs);
        Set<Path> temporaries = new HashSet<>();
        int round = 0;
        int batchMerges = 0;
        long recordsMerged = 0;
        try {
            Files.createDirectories(scratchDir);
        } catch (IOException e) {
            throw new MergeIOException("cannot create scratch directory " + scratchDir, e);
        }
        while (current.size() > 1) {
            List<List<Path>> batches = batches(current, handleBudget);
            List<Path> next = new ArrayList<>(batches.size());
            for (int b = 0; b < batches.size(); b++) {
                List<Path> batch = batches.get(b);
                if (batch.size() == 1) {
                    next.add(batch.get(0));
                    continue;
                }
                Path merged = scratchDir.resolve("merge_" + round + "_" + b + ".tmp");
                recordsMerged += mergeBatch(batch, merged, budget);
                batchMerges++;
                for (Path consumed : batch) {
                    if (temporaries.remove(consumed)) delete(consumed);
                }
                temporaries.add(merged);
                next.add(merged);
            }
            log.debug("round {} reduced {} inputs to {}", round, current.size(), next.size());
            metrics.counter("merge.rounds").inc();
            current = next;
            round++;
        }
        moveIntoPlace(current.get(0), output);
        return new MergeStats(round, batchMerges, recordsMerged, budget.peak());
    }

    /**
     * Base merge over already open inputs: repeatedly emits the smallest head and advances its input.
     * Returns the number of records written.
     */
    public long merge(List<? extends Source<T>> inputs, Sink<T> sink) throws IOException {
        PriorityQueue<MergeCursor<T>> heap = new PriorityQueue<>(Math.max(1, inputs.size()));
        for (int i = 0; i < inputs.size(); i++) {
            MergeCursor<T> cursor = new MergeCursor<>(i, inputs.get(i), order);
            if (cursor.advance()) heap.add(cursor);
        }
        long emitted = 0;
        while (!heap.isEmpty()) {
            MergeCursor<T> smallest = heap.poll();
            sink.accept(Record.of(emitted++, smallest.head()));
            if (smallest.advance()) heap.add(smallest);
        }
        return emitted;
    }

    private long mergeBatch(List<Path> batch, Path out, HandleBudget budget) {
        List<Source<T>> opened = new ArrayList<>(batch.size());
        long written;
        try (Timer.Context ignored = metrics.timer("merge.batch.time").time()) {
            for (Path p : batch) {
                budget.acquire();
                opened.add(open(p, budget));
            }
            try (Sink<T> sink = sinks.create(out)) {
                written = merge(opened, sink);
            }
        } catch (IOException e) {
            MergeIOException failure = new MergeIOException(
                    "merge of " + batch.size() + " inputs into " + out + " failed: " + e.getMessage(), e);
            IOException closeFailure = closeAll(opened, budget);
            if (closeFailure != null) failure.addSuppressed(closeFailure);
            throw failure;
        } catch (RuntimeException e) {
            IOException closeFailure = closeAll(opened, budget);
            if (closeFailure != null) e.addSuppressed(closeFailure);
            throw e;
        }
        IOException closeFailure = closeAll(opened, budget);
        if (closeFailure != null) {
            throw new MergeIOException("failed to close inputs merged into " + out, closeFailure);
        }
        metrics.counter("merge.batches").inc();
        metrics.counter("merge.records").inc(written);
        log.debug("merged {} inputs into {} ({} records)", batch.size(), out.getFileName(), written);
        return written;
    }

    private Source<T> open(Path p, HandleBudget budget) throws IOException {
        try {
            return sources.open(p);
        } catch (IOException | RuntimeException e) {
            budget.release();
            throw e;
        }
    }

    /** Closes every input and returns their permits; the first close failure carries the rest as suppressed. */
    private static <T> IOException closeAll(List<Source<T>> opened, HandleBudget budget) {
        IOException first = null;
        for (Source<T> s : opened) {
            try {
                s.close();
            } catch (IOException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            } finally {
                budget.release();
            }
        }
        opened.clear();
        return first;
    }

    private void moveIntoPlace(Path from, Path to) {
        try {
            Path parent = to.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new MergeIOException("cannot move " + from + " to " + to, e);
        }
    }

    private static void delete(Path temporary) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException e) {
            throw new MergeIOException("cannot delete merge temporary " + temporary, e);
        }
    }

    /** Splits {@code items} into consecutive batches of at most {@code size}, preserving order. */
    static <E> List<List<E>> batches(List<E> items, int size) {
        List<List<E>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return out;
    }
}
