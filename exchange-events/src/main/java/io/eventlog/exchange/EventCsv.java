package io.eventlog.exchange;

import io.eventlog.error.RecordParseException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Text form of {@link Event}: a fixed 16-column header, comma separated, unset fields as empty strings.
 * Decimal fields keep the scale they were read with.
 */
public final class EventCsv {
    public static final List<String> HEADER = List.of(
            "ChannelNo",
            "ApplSeqNum",
            "Event",
            "Symbol",
            "OrderID",
            "BidOrderID",
            "OfferOrderID",
            "Side",
            "Price",
            "Qty",
            "Amt",
            "OrdType",
            "ExecType",
            "TransactTime",
            "SendingTime",
            "Source");
    public static final String HEADER_LINE = String.join(",", HEADER);

    private EventCsv() {}

    public static String format(Event e) {
        List<String> f = new ArrayList<>(HEADER.size());
        f.add(Integer.toString(e.channel()));
        f.add(Long.toString(e.sequence()));
        f.add(e.kind().name());
        f.add(e.symbol());
        f.add(text(e.orderId()));
        f.add(text(e.bidOrderId()));
        f.add(text(e.offerOrderId()));
        f.add(text(e.side()));
        f.add(e.price().toPlainString());
        f.add(Long.toString(e.quantity()));
        f.add(e.amount() == null ? "" : e.amount().toPlainString());
        f.add(text(e.orderType()));
        f.add(text(e.execType()));
        f.add(Long.toString(e.transactTime()));
        f.add(Long.toString(e.sendingTime()));
        f.add(e.sourceFamily().label());
        return CsvLine.join(f);
    }

    /**
     * Parses one data line of an event file. {@code where} names the file and line for diagnostics.
     */
    public static Event parse(String line, String where) {
        List<String> f = CsvLine.split(line);
        if (f.size() != HEADER.size()) {
            throw new RecordParseException(where, line, "expected " + HEADER.size() + " fields but found " + f.size());
        }
        EventKind kind;
        SourceFamily family;
        try {
            kind = EventKind.valueOf(f.get(2));
            family = SourceFamily.fromLabel(f.get(15));
        } catch (IllegalArgumentException e) {
            throw new RecordParseException(where, f.get(2) + "/" + f.get(15), "unknown event kind or source", e);
        }
        return new Event(
                channel(f.get(0), where),
                number(f.get(1), "ApplSeqNum", where),
                kind,
                f.get(3),
                optionalNumber(f.get(4), "OrderID", where),
                optionalNumber(f.get(5), "BidOrderID", where),
                optionalNumber(f.get(6), "OfferOrderID", where),
                emptyToNull(f.get(7)),
                decimal(f.get(8), "Price", where),
                number(f.get(9), "Qty", where),
                f.get(10).isEmpty() ? null : decimal(f.get(10), "Amt", where),
                emptyToNull(f.get(11)),
                emptyToNull(f.get(12)),
                number(f.get(13), "TransactTime", where),
                number(f.get(14), "SendingTime", where),
                family);
    }

    private static String text(Object v) {
        return v == null ? "" : v.toString();
    }

    private static String emptyToNull(String v) {
        return v.isEmpty() ? null : v;
    }

    private static int channel(String v, String where) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where, v, "malformed ChannelNo", e);
        }
    }

    private static long number(String v, String column, String where) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where, v, "malformed " + column, e);
        }
    }

    private static Long optionalNumber(String v, String column, String where) {
        return v.isEmpty() ? null : number(v, column, where);
    }

    private static BigDecimal decimal(String v, String column, String where) {
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where, v, "malformed " + column, e);
        }
    }
}
