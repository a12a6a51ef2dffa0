package io.eventlog.exchange;

import com.codahale.metrics.MetricRegistry;
import io.eventlog.core.Record;
import io.eventlog.core.Transform;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Maps raw rows of one source into canonical events, one row at a time and in input order.
 * Rows on a channel other than the optional channel filter are dropped here, before validation.
 */
public class RecordNormalizer implements Transform<RawRow, Event> {
    static final String CHANNEL = "ChannelNo";
    static final String SEQUENCE = "ApplSeqNum";

    private final SourceFamily family;
    private final String symbol;
    private final OptionalInt onlyChannel;
    private final MetricRegistry registry; // optional

    public RecordNormalizer(SourceFamily family, String symbol, OptionalInt onlyChannel) {
        this(family, symbol, onlyChannel, null);
    }

    public RecordNormalizer(SourceFamily family, String symbol, OptionalInt onlyChannel, MetricRegistry registry) {
        this.family = Objects.requireNonNull(family);
        this.symbol = Objects.requireNonNull(symbol);
        this.onlyChannel = Objects.requireNonNull(onlyChannel);
        this.registry = registry;
    }

    @Override
    public List<Record<Event>> apply(Record<RawRow> input) {
        RawRow row = input.payload();
        if (registry != null) registry.counter("normalize." + family.label() + ".rows").inc();
        int channel = row.requiredInt(CHANNEL);
        if (onlyChannel.isPresent() && onlyChannel.getAsInt() != channel) {
            if (registry != null) registry.counter("normalize." + family.label() + ".filtered").inc();
            return List.of();
        }
        long sequence = row.requiredLong(SEQUENCE);
        Event event = family == SourceFamily.ORDER_STREAM
                ? orderEvent(row, channel, sequence)
                : tickEvent(row, channel, sequence);
        return List.of(input.withPayload(0, event));
    }

    private Event orderEvent(RawRow row, int channel, long sequence) {
        return Event.order(channel, sequence, symbol,
                row.text("Side"),
                row.requiredDecimal("Price"),
                row.requiredLong("OrderQty"),
                row.text("OrdType"),
                row.requiredLong("TransactTime"),
                row.requiredLong("SendingTime"));
    }

    private Event tickEvent(RawRow row, int channel, long sequence) {
        return Event.tick(channel, sequence, symbol,
                row.requiredLong("BidApplSeqNum"),
                row.requiredLong("OfferApplSeqNum"),
                row.requiredDecimal("Price"),
                row.requiredLong("Qty"),
                row.requiredDecimal("Amt"),
                row.text("ExecType"),
                row.requiredLong("TransactTime"),
                row.requiredLong("SendingTime"));
    }

    /** Instrument identifier of an entry: its file name without directories or extension. */
    public static String symbolOf(String entry) {
        String name = entry.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
