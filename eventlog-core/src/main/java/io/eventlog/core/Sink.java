package io.eventlog.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Sink consumes records in the order they are handed over.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws IOException;

    @Override
    default void close() throws IOException {}
}
