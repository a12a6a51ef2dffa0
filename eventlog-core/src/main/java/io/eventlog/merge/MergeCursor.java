package io.eventlog.merge;

import io.eventlog.core.Record;
import io.eventlog.core.Source;

import java.io.IOException;
import java.util.Comparator;
import java.util.Optional;

/**
 * One open input of a k-way merge with its peeked head. Owned by a single merge loop.
 * Ordering is the payload order, then the input's position in the merge list.
 */
final class MergeCursor<T> implements Comparable<MergeCursor<T>> {
    private final int index;
    private final Source<T> source;
    private final Comparator<? super T> order;
    private T head;

    MergeCursor(int index, Source<T> source, Comparator<? super T> order) {
        this.index = index;
        this.source = source;
        this.order = order;
    }

    /** Moves to the next record; false once the input is exhausted. */
    boolean advance() throws IOException {
        Optional<Record<T>> next = source.poll();
        head = next.map(Record::payload).orElse(null);
        return next.isPresent();
    }

    T head() { return head; }

    @Override
    public int compareTo(MergeCursor<T> other) {
        int c = order.compare(head, other.head);
        if (c != 0) return c;
        return Integer.compare(index, other.index);
    }
}
