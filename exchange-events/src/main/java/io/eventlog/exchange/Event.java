package io.eventlog.exchange;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Objects;

/**
 * Canonical event shared by both stream families. Optional fields are null when the family does not carry them:
 * order events have orderId, side and orderType; tick events have bid/offer order ids, amount and execType.
 */
public record Event(
        int channel,
        long sequence,
        EventKind kind,
        String symbol,
        Long orderId,
        Long bidOrderId,
        Long offerOrderId,
        String side,
        BigDecimal price,
        long quantity,
        BigDecimal amount,
        String orderType,
        String execType,
        long transactTime,
        long sendingTime,
        SourceFamily sourceFamily
) {
    /** Merge order: channel, then sequence. */
    public static final Comparator<Event> BY_CHANNEL_AND_SEQUENCE =
            Comparator.comparingInt(Event::channel).thenComparingLong(Event::sequence);

    public Event {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(sourceFamily, "sourceFamily");
    }

    public static Event order(int channel, long sequence, String symbol, String side, BigDecimal price,
                              long quantity, String orderType, long transactTime, long sendingTime) {
        return new Event(channel, sequence, EventKind.ORDER, symbol, sequence, null, null, side, price, quantity,
                null, orderType, null, transactTime, sendingTime, SourceFamily.ORDER_STREAM);
    }

    public static Event tick(int channel, long sequence, String symbol, long bidOrderId, long offerOrderId,
                             BigDecimal price, long quantity, BigDecimal amount, String execType,
                             long transactTime, long sendingTime) {
        return new Event(channel, sequence, EventKind.fromExecType(execType), symbol, null, bidOrderId, offerOrderId,
                null, price, quantity, amount, null, execType, transactTime, sendingTime, SourceFamily.TICK_STREAM);
    }
}
