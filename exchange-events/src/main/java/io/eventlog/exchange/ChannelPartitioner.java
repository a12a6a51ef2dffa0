package io.eventlog.exchange;

import io.eventlog.error.EventLogException;
import io.eventlog.merge.BoundedMerger;
import io.eventlog.merge.MergeStats;
import io.eventlog.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Decides merge groups and runs the merger for each. Combined output merges every source at once and relies on
 * channel being the leading sort key. Per-channel output groups sources by resolved channel and merges groups
 * independently on a worker pool; a failed group does not stop the others.
 */
public class ChannelPartitioner {
    private static final Logger log = LoggerFactory.getLogger(ChannelPartitioner.class);

    private final BoundedMerger<Event> merger;
    private final int workers;
    private final Metrics metrics;

    public ChannelPartitioner(BoundedMerger<Event> merger, int workers, Metrics metrics) {
        this.merger = Objects.requireNonNull(merger);
        this.workers = Math.max(1, workers);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Merges the event files of {@code sources} into {@code target}. Sources without events are skipped.
     * Input order is kept within every group so equal keys resolve by source order.
     */
    public List<MergeArtifact> partition(List<NormalizedSource> sources, OutputTarget target, Path workDir) {
        List<NormalizedSource> contributing = sources.stream().filter(NormalizedSource::hasEvents).toList();
        if (contributing.isEmpty()) return List.of();
        if (target.mode() == OutputTarget.Mode.COMBINED) {
            MergeArtifact artifact = mergeGroup(OptionalInt.empty(), contributing, target.path(), workDir.resolve("merge_all"));
            return List.of(artifact);
        }
        return mergePerChannel(groupByChannel(contributing), target, workDir);
    }

    static Map<Integer, List<NormalizedSource>> groupByChannel(List<NormalizedSource> sources) {
        Map<Integer, List<NormalizedSource>> groups = new TreeMap<>();
        for (NormalizedSource s : sources) {
            groups.computeIfAbsent(s.channel().getAsInt(), k -> new ArrayList<>()).add(s);
        }
        return groups;
    }

    private List<MergeArtifact> mergePerChannel(Map<Integer, List<NormalizedSource>> groups, OutputTarget target, Path workDir) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, groups.size()));
        try {
            Map<Integer, Future<MergeArtifact>> futures = new TreeMap<>();
            for (Map.Entry<Integer, List<NormalizedSource>> g : groups.entrySet()) {
                int channel = g.getKey();
                futures.put(channel, pool.submit(() -> mergeGroup(OptionalInt.of(channel), g.getValue(),
                        target.fileFor(channel), workDir.resolve("merge_channel_" + channel))));
            }
            List<MergeArtifact> done = new ArrayList<>(futures.size());
            EventLogException failure = null;
            for (Map.Entry<Integer, Future<MergeArtifact>> f : futures.entrySet()) {
                try {
                    done.add(f.getValue().get());
                } catch (ExecutionException e) {
                    metrics.counter("merge.groups.failed").inc();
                    MergeGroupException groupFailure = new MergeGroupException(f.getKey(), e.getCause());
                    log.error("{}", groupFailure.getMessage());
                    if (failure == null) failure = groupFailure; else failure.addSuppressed(groupFailure);
                }
            }
            if (failure != null) throw failure;
            return done;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventLogException("interrupted while merging channel groups", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private MergeArtifact mergeGroup(OptionalInt channel, List<NormalizedSource> group, Path output, Path scratch) {
        List<Path> files = group.stream().map(NormalizedSource::file).toList();
        long events = group.stream().mapToLong(NormalizedSource::events).sum();
        MergeStats stats = merger.mergeFiles(files, output, scratch);
        metrics.counter("merge.groups").inc();
        metrics.counter("merge.events.out").inc(events);
        log.info("wrote {} events from {} sources to {} ({} rounds)", events, group.size(), output, stats.rounds());
        return new MergeArtifact(channel, output, group.size(), events, stats);
    }
}
