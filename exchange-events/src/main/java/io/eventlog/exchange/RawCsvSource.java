package io.eventlog.exchange;

import io.eventlog.core.Record;
import io.eventlog.core.Source;
import io.eventlog.error.RecordParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Streams the rows of one per-symbol CSV, one line at a time. The first line is the header.
 * A positive {@code maxRows} stops the source after that many data rows.
 */
public class RawCsvSource implements Source<RawRow> {
    private static final char BOM = '\uFEFF';

    private final String name;
    private final BufferedReader reader;
    private final long maxRows;
    private Map<String, Integer> columns;
    private long lineNo = 0;
    private long rows = 0;
    private boolean finished = false;

    public RawCsvSource(String name, InputStream in, long maxRows) {
        this.name = name;
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.maxRows = maxRows;
    }

    @Override
    public Optional<Record<RawRow>> poll() throws IOException {
        if (finished) return Optional.empty();
        if (columns == null && !readHeader()) return Optional.empty();
        if (maxRows > 0 && rows >= maxRows) {
            finished = true;
            return Optional.empty();
        }
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) continue;
            RawRow row = new RawRow(name, lineNo, columns, CsvLine.split(line));
            return Optional.of(Record.of(rows++, row));
        }
        finished = true;
        return Optional.empty();
    }

    private boolean readHeader() throws IOException {
        String header = reader.readLine();
        if (header == null) {
            finished = true;
            return false;
        }
        lineNo++;
        if (!header.isEmpty() && header.charAt(0) == BOM) header = header.substring(1);
        List<String> names = CsvLine.split(header);
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            if (idx.putIfAbsent(names.get(i).trim(), i) != null) {
                throw new RecordParseException(name, names.get(i), "duplicate column in header");
            }
        }
        columns = idx;
        return true;
    }

    @Override
    public boolean isFinished() { return finished; }

    @Override
    public String name() { return name; }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
