package io.eventlog.exchange;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Outcome of normalizing one archive entry. A source without events has no channel and no file.
 */
public record NormalizedSource(String entry, String symbol, SourceFamily family, Path file, OptionalInt channel, long events) {

    static NormalizedSource empty(String entry, String symbol, SourceFamily family) {
        return new NormalizedSource(entry, symbol, family, null, OptionalInt.empty(), 0);
    }

    public boolean hasEvents() {
        return channel.isPresent();
    }
}
