package io.eventlog.transform;

import io.eventlog.core.Record;
import io.eventlog.core.Source;
import io.eventlog.core.Transform;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Lazily applies a transform to each record pulled from an upstream source.
 * Holds at most the outputs of one upstream record.
 */
public class TransformingSource<I, O> implements Source<O> {
    private final Source<I> upstream;
    private final Transform<I, O> transform;
    private final Deque<Record<O>> pending = new ArrayDeque<>();

    public TransformingSource(Source<I> upstream, Transform<I, O> transform) {
        this.upstream = Objects.requireNonNull(upstream);
        this.transform = Objects.requireNonNull(transform);
    }

    @Override
    public Optional<Record<O>> poll() throws IOException {
        while (pending.isEmpty()) {
            Optional<Record<I>> next = upstream.poll();
            if (next.isEmpty()) return Optional.empty();
            pending.addAll(transform.apply(next.get()));
        }
        return Optional.of(pending.removeFirst());
    }

    @Override
    public boolean isFinished() {
        return pending.isEmpty() && upstream.isFinished();
    }

    @Override
    public String name() { return upstream.name(); }

    @Override
    public void close() throws IOException {
        upstream.close();
    }
}
