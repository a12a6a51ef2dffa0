package io.eventlog.exchange;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * Read access to a container of per-symbol CSV entries. Failures surface as
 * {@link io.eventlog.error.SourceAccessException}.
 */
public interface ArchiveAccess {
    Predicate<String> CSV_ENTRIES = entry -> entry.endsWith(".csv");

    /** Human-readable location, for logs. */
    String location();

    /** Entry names accepted by {@code filter}, in the container's own order. */
    List<String> listEntries(Predicate<String> filter);

    /** Opens one entry for streaming. The caller closes the stream. */
    InputStream open(String entry);

    /** A directory is read as already extracted; anything else is handed to 7-Zip. */
    static ArchiveAccess forPath(Path path) {
        return Files.isDirectory(path) ? new DirectoryArchiveAccess(path) : new SevenZipArchiveAccess(path);
    }
}
