package io.eventlog.exchange;

import io.eventlog.error.SourceAccessException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Entries of an already extracted archive: regular files below a root directory, named by their
 * '/'-separated relative path and listed in path order.
 */
public class DirectoryArchiveAccess implements ArchiveAccess {
    private final Path root;

    public DirectoryArchiveAccess(Path root) {
        this.root = root;
    }

    @Override
    public String location() { return root.toString(); }

    @Override
    public List<String> listEntries(Predicate<String> filter) {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .filter(filter)
                    .sorted(Comparator.naturalOrder())
                    .toList();
        } catch (IOException e) {
            throw new SourceAccessException(root.toString(), "cannot list entries", e);
        } catch (UncheckedIOException e) {
            throw new SourceAccessException(root.toString(), "cannot list entries", e.getCause());
        }
    }

    @Override
    public InputStream open(String entry) {
        try {
            return Files.newInputStream(root.resolve(entry));
        } catch (IOException e) {
            throw new SourceAccessException(entry, "cannot open entry in " + root, e);
        }
    }
}
