package io.eventlog.exchange;

import io.eventlog.core.Record;
import io.eventlog.core.Transform;

import java.util.List;
import java.util.OptionalInt;

/**
 * Pass-through stage that checks each event of one source as it flows by: every event must carry the channel of
 * the first one, and sequence numbers must never decrease (repeats are allowed).
 * One instance per source; not thread safe.
 */
public class StreamValidator implements Transform<Event, Event> {
    private final String source;
    private boolean seen = false;
    private int seenChannel;
    private long lastSequence;
    private long events = 0;

    public StreamValidator(String source) {
        this.source = source;
    }

    @Override
    public List<Record<Event>> apply(Record<Event> input) {
        Event e = input.payload();
        if (!seen) {
            seen = true;
            seenChannel = e.channel();
        } else {
            if (e.channel() != seenChannel) {
                throw new ChannelConsistencyException(source, seenChannel, e.channel());
            }
            if (e.sequence() < lastSequence) {
                throw new MonotonicityException(source, lastSequence, e.sequence());
            }
        }
        lastSequence = e.sequence();
        events++;
        return List.of(input);
    }

    /** Channel shared by all events of the source, or empty if it produced none. */
    public OptionalInt resolvedChannel() {
        return seen ? OptionalInt.of(seenChannel) : OptionalInt.empty();
    }

    public long events() { return events; }
}
