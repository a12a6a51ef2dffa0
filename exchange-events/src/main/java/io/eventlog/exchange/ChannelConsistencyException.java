package io.eventlog.exchange;

import io.eventlog.error.EventLogException;

/** A source produced events on more than one channel. */
public class ChannelConsistencyException extends EventLogException {
    private final String source;
    private final int expected;
    private final int actual;

    public ChannelConsistencyException(String source, int expected, int actual) {
        super("Multiple ChannelNo values in " + source + ": " + expected + " vs " + actual);
        this.source = source;
        this.expected = expected;
        this.actual = actual;
    }

    public String source() { return source; }
    public int expected() { return expected; }
    public int actual() { return actual; }
}
