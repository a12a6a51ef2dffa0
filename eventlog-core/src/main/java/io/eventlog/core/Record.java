package io.eventlog.core;

import java.util.Objects;

/**
 * A payload tagged with its position in the stream that produced it.
 */
public final class Record<T> {
    private final long seq; // ordinal within the producing source
    private final int subSeq; // fan-out index within a transform
    private final T payload;

    public Record(long seq, int subSeq, T payload) {
        this.seq = seq;
        this.subSeq = subSeq;
        this.payload = payload;
    }

    public static <T> Record<T> of(long seq, T payload) {
        return new Record<>(seq, 0, payload);
    }

    public long seq() { return seq; }
    public int subSeq() { return subSeq; }
    public T payload() { return payload; }

    public <R> Record<R> withPayload(int subSeq, R newPayload) {
        return new Record<>(seq, subSeq, newPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && subSeq == that.subSeq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, subSeq, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", subSeq=" + subSeq +
                ", payload=" + payload +
                '}';
    }
}
