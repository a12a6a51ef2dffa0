package io.eventlog.exchange;

import com.codahale.metrics.MetricRegistry;
import io.eventlog.core.Record;
import io.eventlog.error.RecordParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {

    private static Record<RawRow> row(String header, String line) throws Exception {
        String text = header + "\n" + line + "\n";
        RawCsvSource src = new RawCsvSource("000001.csv", new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), 0);
        return src.poll().orElseThrow();
    }

    @Test
    void orderRowBecomesOrderEvent() throws Exception {
        RecordNormalizer n = new RecordNormalizer(SourceFamily.ORDER_STREAM, "000001", OptionalInt.empty());
        List<Record<Event>> out = n.apply(row(Fixtures.ORDER_HEADER, Fixtures.orderRow(2011, 57)));

        assertEquals(1, out.size());
        Event e = out.get(0).payload();
        assertEquals(EventKind.ORDER, e.kind());
        assertEquals(2011, e.channel());
        assertEquals(57, e.sequence());
        assertEquals(57L, e.orderId());
        assertEquals("1", e.side());
        assertEquals(new BigDecimal("10.500"), e.price());
        assertEquals(100, e.quantity());
        assertEquals("2", e.orderType());
        assertNull(e.bidOrderId());
        assertNull(e.offerOrderId());
        assertNull(e.amount());
        assertNull(e.execType());
        assertEquals("000001", e.symbol());
        assertEquals(SourceFamily.ORDER_STREAM, e.sourceFamily());
    }

    @Test
    void tickRowKindFollowsExecType() throws Exception {
        RecordNormalizer n = new RecordNormalizer(SourceFamily.TICK_STREAM, "000001", OptionalInt.empty());

        Event trade = n.apply(row(Fixtures.TICK_HEADER, Fixtures.tickRow(1, 5, "F"))).get(0).payload();
        Event cancel = n.apply(row(Fixtures.TICK_HEADER, Fixtures.tickRow(1, 6, "4"))).get(0).payload();
        Event other = n.apply(row(Fixtures.TICK_HEADER, Fixtures.tickRow(1, 7, "0"))).get(0).payload();

        assertEquals(EventKind.TRADE, trade.kind());
        assertEquals(EventKind.CANCEL, cancel.kind());
        assertEquals(EventKind.TICK, other.kind());
        assertEquals(11L, trade.bidOrderId());
        assertEquals(12L, trade.offerOrderId());
        assertEquals(new BigDecimal("1050.000"), trade.amount());
        assertEquals("F", trade.execType());
        assertNull(trade.orderId());
        assertNull(trade.side());
        assertNull(trade.orderType());
        assertEquals(SourceFamily.TICK_STREAM, trade.sourceFamily());
    }

    @Test
    void rowsOfOtherChannelsAreDropped() throws Exception {
        MetricRegistry registry = new MetricRegistry();
        RecordNormalizer n = new RecordNormalizer(SourceFamily.ORDER_STREAM, "000001", OptionalInt.of(3), registry);

        assertTrue(n.apply(row(Fixtures.ORDER_HEADER, Fixtures.orderRow(4, 1))).isEmpty());
        assertEquals(1, n.apply(row(Fixtures.ORDER_HEADER, Fixtures.orderRow(3, 2))).size());
        assertEquals(2, registry.counter("normalize.order.rows").getCount());
        assertEquals(1, registry.counter("normalize.order.filtered").getCount());
    }

    @Test
    void malformedNumberNamesSourceAndValue() throws Exception {
        RecordNormalizer n = new RecordNormalizer(SourceFamily.ORDER_STREAM, "000001", OptionalInt.empty());
        Record<RawRow> bad = row(Fixtures.ORDER_HEADER, "12,1,1,ten,100,2,1,1,0");

        RecordParseException e = assertThrows(RecordParseException.class, () -> n.apply(bad));
        assertEquals("ten", e.value());
        assertTrue(e.getMessage().contains("000001.csv"), e.getMessage());
        assertTrue(e.getMessage().contains("Price"), e.getMessage());
    }

    @Test
    void missingColumnIsAParseError() throws Exception {
        RecordNormalizer n = new RecordNormalizer(SourceFamily.TICK_STREAM, "000001", OptionalInt.empty());
        Record<RawRow> orderShaped = row(Fixtures.ORDER_HEADER, Fixtures.orderRow(1, 1));

        RecordParseException e = assertThrows(RecordParseException.class, () -> n.apply(orderShaped));
        assertEquals("BidApplSeqNum", e.value());
    }

    @Test
    void symbolComesFromEntryName() {
        assertEquals("000001", RecordNormalizer.symbolOf("order_new_STK_SZ_20240102/000001.csv"));
        assertEquals("300750", RecordNormalizer.symbolOf("300750.csv"));
        assertEquals("noext", RecordNormalizer.symbolOf("a\\b\\noext"));
    }
}
