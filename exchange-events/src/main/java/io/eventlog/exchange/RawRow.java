package io.eventlog.exchange;

import io.eventlog.error.RecordParseException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * One data row of a per-symbol exchange CSV, addressed by column name. Values are trimmed on access.
 */
public final class RawRow {
    private final String source;
    private final long lineNo;
    private final Map<String, Integer> columns;
    private final List<String> values;

    RawRow(String source, long lineNo, Map<String, Integer> columns, List<String> values) {
        this.source = source;
        this.lineNo = lineNo;
        this.columns = columns;
        this.values = values;
    }

    public String source() { return source; }
    public long lineNo() { return lineNo; }

    public String text(String column) {
        Integer idx = columns.get(column);
        if (idx == null) {
            throw new RecordParseException(source, column, "missing column");
        }
        if (idx >= values.size()) {
            throw new RecordParseException(where(), String.join(",", values), "row has no value for " + column);
        }
        return values.get(idx).trim();
    }

    public int requiredInt(String column) {
        String v = text(column);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where(), v, "malformed " + column, e);
        }
    }

    public long requiredLong(String column) {
        String v = text(column);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where(), v, "malformed " + column, e);
        }
    }

    public BigDecimal requiredDecimal(String column) {
        String v = text(column);
        try {
            return new BigDecimal(v);
        } catch (NumberFormatException e) {
            throw new RecordParseException(where(), v, "malformed " + column, e);
        }
    }

    private String where() {
        return source + ":" + lineNo;
    }
}
