package io.eventlog.exchange;

import io.eventlog.core.Record;
import io.eventlog.core.Source;
import io.eventlog.error.RecordParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads back a file written by {@link EventFileSink}. Opening fails if the header is not the canonical
 * one; a line that does not parse fails the read with an {@link IOException}.
 */
public class EventFileSource implements Source<Event> {
    private final Path path;
    private final BufferedReader reader;
    private long lineNo = 1;
    private long seq = 0;
    private boolean finished = false;

    public EventFileSource(Path path) throws IOException {
        this.path = path;
        this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        String header = reader.readLine();
        if (!EventCsv.HEADER_LINE.equals(header)) {
            reader.close();
            throw new IOException("Header mismatch in " + path + ": " + header);
        }
    }

    @Override
    public Optional<Record<Event>> poll() throws IOException {
        if (finished) return Optional.empty();
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isEmpty()) continue;
            try {
                return Optional.of(Record.of(seq++, EventCsv.parse(line, path + ":" + lineNo)));
            } catch (RecordParseException e) {
                throw new IOException("Corrupt event file: " + e.getMessage(), e);
            }
        }
        finished = true;
        return Optional.empty();
    }

    @Override
    public boolean isFinished() { return finished; }

    @Override
    public String name() { return path.toString(); }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
