package io.eventlog.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A finite, ordered producer of records. Reads block; an empty poll means the source is exhausted.
 */
public interface Source<T> extends Closeable {
    /**
     * Fetch the next record, or empty once the source has no more records.
     */
    Optional<Record<T>> poll() throws IOException;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    /** Identity used in diagnostics. */
    default String name() { return getClass().getSimpleName(); }

    @Override
    default void close() throws IOException {}
}
