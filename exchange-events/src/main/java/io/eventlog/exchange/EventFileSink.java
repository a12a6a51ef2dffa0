package io.eventlog.exchange;

import io.eventlog.core.Record;
import io.eventlog.core.Sink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes events in canonical CSV form, header first. Truncates an existing file.
 */
public class EventFileSink implements Sink<Event> {
    private final BufferedWriter writer;

    public EventFileSink(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        writer.write(EventCsv.HEADER_LINE);
        writer.write('\n');
    }

    @Override
    public void accept(Record<Event> record) throws IOException {
        writer.write(EventCsv.format(record.payload()));
        writer.write('\n');
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
