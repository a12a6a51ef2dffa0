package io.eventlog.core;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface SinkFactory<T> {
    Sink<T> create(Path path) throws IOException;
}
