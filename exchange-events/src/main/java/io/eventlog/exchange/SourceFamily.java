package io.eventlog.exchange;

/** Provenance of an event: the order-submission stream or the execution/tick stream. */
public enum SourceFamily {
    ORDER_STREAM("order"),
    TICK_STREAM("tick");

    private final String label;

    SourceFamily(String label) {
        this.label = label;
    }

    /** Value written to the Source column and used in intermediate file names. */
    public String label() { return label; }

    public static SourceFamily fromLabel(String label) {
        for (SourceFamily f : values()) {
            if (f.label.equals(label)) return f;
        }
        throw new IllegalArgumentException("unknown source family: " + label);
    }
}
