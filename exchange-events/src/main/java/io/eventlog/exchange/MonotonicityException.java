package io.eventlog.exchange;

import io.eventlog.error.EventLogException;

/** A source's sequence numbers went backwards. */
public class MonotonicityException extends EventLogException {
    private final String source;
    private final long previous;
    private final long current;

    public MonotonicityException(String source, long previous, long current) {
        super("Stream not monotonic: " + source + " seq " + current + " < " + previous);
        this.source = source;
        this.previous = previous;
        this.current = current;
    }

    public String source() { return source; }
    public long previous() { return previous; }
    public long current() { return current; }
}
