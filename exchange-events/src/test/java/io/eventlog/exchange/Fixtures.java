package io.eventlog.exchange;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Writes per-symbol exchange CSVs in the raw column layouts. */
final class Fixtures {
    static final String ORDER_HEADER = "ApplSeqNum,ChannelNo,Side,Price,OrderQty,OrdType,TransactTime,SendingTime,ExpirationDays";
    static final String TICK_HEADER = "ApplSeqNum,BidApplSeqNum,SendingTime,Price,ChannelNo,Qty,OfferApplSeqNum,Amt,ExecType,TransactTime";

    private Fixtures() {}

    static String orderRow(int channel, long seq) {
        return seq + "," + channel + ",1,10.500,100,2,20240102093000000,20240102093000010,0";
    }

    static String tickRow(int channel, long seq, String execType) {
        return seq + ",11,20240102093001010,10.500," + channel + ",100,12,1050.000," + execType + ",20240102093001000";
    }

    /** Writes an order file whose rows carry the given (channel, sequence) pairs. */
    static Path orders(Path dir, String symbol, int[]... pairs) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add(ORDER_HEADER);
        for (int[] p : pairs) lines.add(orderRow(p[0], p[1]));
        return write(dir, symbol + ".csv", lines);
    }

    static Path ticks(Path dir, String symbol, int[]... pairs) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add(TICK_HEADER);
        for (int[] p : pairs) lines.add(tickRow(p[0], p[1], "F"));
        return write(dir, symbol + ".csv", lines);
    }

    static Path write(Path dir, String name, List<String> lines) throws IOException {
        Files.createDirectories(dir);
        Path p = dir.resolve(name);
        Files.write(p, lines, StandardCharsets.UTF_8);
        return p;
    }

    static int[] at(int channel, int seq) {
        return new int[]{channel, seq};
    }

    /** (channel, sequence) of every data line of an event file. */
    static List<long[]> keys(Path eventFile) throws IOException {
        List<String> lines = Files.readAllLines(eventFile, StandardCharsets.UTF_8);
        List<long[]> out = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            String[] f = line.split(",", 3);
            out.add(new long[]{Long.parseLong(f[0]), Long.parseLong(f[1])});
        }
        return out;
    }

    static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) return;
        try (var s = Files.walk(root)) {
            for (Path p : s.sorted(java.util.Comparator.reverseOrder()).toList()) Files.deleteIfExists(p);
        }
    }
}
