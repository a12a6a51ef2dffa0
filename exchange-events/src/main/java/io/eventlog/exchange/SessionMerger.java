package io.eventlog.exchange;

import io.eventlog.error.EventLogException;
import io.eventlog.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Builds the session's event log: normalizes every order entry, then every tick entry, into intermediate files
 * under the work directory, then hands them to the {@link ChannelPartitioner} in that order.
 */
public class SessionMerger {
    private static final Logger log = LoggerFactory.getLogger(SessionMerger.class);

    private final MergeConfig config;
    private final ArchiveAccess orderArchive;
    private final ArchiveAccess tickArchive;
    private final SourceNormalizer normalizer;
    private final ChannelPartitioner partitioner;
    private final Metrics metrics;

    public SessionMerger(MergeConfig config,
                         ArchiveAccess orderArchive,
                         ArchiveAccess tickArchive,
                         SourceNormalizer normalizer,
                         ChannelPartitioner partitioner,
                         Metrics metrics) {
        this.config = config;
        this.orderArchive = orderArchive;
        this.tickArchive = tickArchive;
        this.normalizer = normalizer;
        this.partitioner = partitioner;
        this.metrics = metrics;
    }

    public SessionResult run() {
        config.validate();
        Path work = prepareWorkDir();
        try {
            List<NormalizedSource> sources = new ArrayList<>();
            sources.addAll(buildEventFiles(orderArchive, SourceFamily.ORDER_STREAM, work.resolve("order_events")));
            sources.addAll(buildEventFiles(tickArchive, SourceFamily.TICK_STREAM, work.resolve("tick_events")));
            if (sources.stream().noneMatch(NormalizedSource::hasEvents)) {
                throw new EventLogException("No event files produced; check filters or input archives.");
            }
            OutputTarget target = config.outputTarget();
            log.info("merging {} sources into {} with handle budget {}", sources.size(), target, config.handleBudget());
            List<MergeArtifact> artifacts = partitioner.partition(sources, target, work);
            return new SessionResult(List.copyOf(sources), artifacts);
        } finally {
            if (config.cleanupWorkDir()) deleteRecursively(work);
        }
    }

    /**
     * Normalizes the matching CSV entries of one archive. With a file limit, discovery stops after that many
     * entries produced events.
     */
    List<NormalizedSource> buildEventFiles(ArchiveAccess archive, SourceFamily family, Path dir) {
        Optional<Pattern> symbols = config.symbolPattern();
        List<String> entries = archive.listEntries(ArchiveAccess.CSV_ENTRIES);
        log.info("{} archive {}: {} csv entries", family.label(), archive.location(), entries.size());
        List<NormalizedSource> out = new ArrayList<>();
        int produced = 0;
        for (int i = 0; i < entries.size(); i++) {
            String entry = entries.get(i);
            String symbol = RecordNormalizer.symbolOf(entry);
            if (symbols.isPresent() && !symbols.get().matcher(symbol).find()) continue;
            // entries in different folders may share a symbol
            Path file = dir.resolve(family.label() + "_" + i + "_" + symbol + ".events.csv");
            NormalizedSource source = normalizer.normalize(archive, entry, family, file);
            if (!source.hasEvents()) continue;
            out.add(source);
            produced++;
            if (config.limitFiles() != null && produced >= config.limitFiles()) break;
        }
        metrics.counter("session." + family.label() + ".sources").inc(out.size());
        return out;
    }

    private Path prepareWorkDir() {
        try {
            if (config.workDir() == null) return Files.createTempDirectory("event_merge_");
            return Files.createDirectories(config.workDir());
        } catch (IOException e) {
            throw new EventLogException("cannot prepare work directory: " + e.getMessage(), e);
        }
    }

    private static void deleteRecursively(Path root) {
        if (!Files.exists(root)) return;
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("could not remove work directory {}: {}", root, e.toString());
        } catch (UncheckedIOException e) {
            log.warn("could not remove work directory {}: {}", root, e.getCause().toString());
        }
    }
}
