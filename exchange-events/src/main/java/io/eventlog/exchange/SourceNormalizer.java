package io.eventlog.exchange;

import com.codahale.metrics.Timer;
import io.eventlog.core.Record;
import io.eventlog.core.Source;
import io.eventlog.error.SourceAccessException;
import io.eventlog.metrics.Metrics;
import io.eventlog.transform.TransformChain;
import io.eventlog.transform.TransformingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Drains one archive entry through normalize-then-validate into an intermediate event file.
 * Validation happens per event while the entry streams; nothing is buffered beyond one row.
 */
public class SourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceNormalizer.class);

    private final Metrics metrics;
    private final OptionalInt onlyChannel;
    private final long maxRowsPerSource;

    public SourceNormalizer(Metrics metrics, OptionalInt onlyChannel, long maxRowsPerSource) {
        this.metrics = Objects.requireNonNull(metrics);
        this.onlyChannel = Objects.requireNonNull(onlyChannel);
        this.maxRowsPerSource = Math.max(0, maxRowsPerSource);
    }

    /**
     * Writes the events of {@code entry} to {@code out}. If the entry yields no events (no rows, or all rows
     * filtered out) the file is removed and the result has no channel.
     */
    public NormalizedSource normalize(ArchiveAccess archive, String entry, SourceFamily family, Path out) {
        String symbol = RecordNormalizer.symbolOf(entry);
        StreamValidator validator = new StreamValidator(entry);
        TransformChain<RawRow, Event> chain = new TransformChain<>(
                new RecordNormalizer(family, symbol, onlyChannel, metrics.registry()),
                validator);
        try (Timer.Context ignored = metrics.timer("normalize." + family.label() + ".time").time();
             InputStream in = archive.open(entry);
             Source<Event> events = new TransformingSource<>(new RawCsvSource(entry, in, maxRowsPerSource), chain);
             EventFileSink sink = new EventFileSink(out)) {
            Optional<Record<Event>> next;
            while ((next = events.poll()).isPresent()) {
                sink.accept(next.get());
            }
        } catch (IOException e) {
            throw new SourceAccessException(entry, "failed while normalizing into " + out + ": " + e.getMessage(), e);
        }

        if (validator.events() == 0) {
            try {
                Files.deleteIfExists(out);
            } catch (IOException e) {
                throw new SourceAccessException(entry, "cannot remove empty event file " + out, e);
            }
            log.debug("{} produced no events", entry);
            return NormalizedSource.empty(entry, symbol, family);
        }
        metrics.counter("normalize." + family.label() + ".events").inc(validator.events());
        metrics.counter("normalize." + family.label() + ".sources").inc();
        return new NormalizedSource(entry, symbol, family, out, validator.resolvedChannel(), validator.events());
    }
}
