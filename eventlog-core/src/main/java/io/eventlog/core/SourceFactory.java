package io.eventlog.core;

import java.io.IOException;
import java.nio.file.Path;

/** Opens a file previously written by the matching {@link SinkFactory}. */
@FunctionalInterface
public interface SourceFactory<T> {
    Source<T> open(Path path) throws IOException;
}
