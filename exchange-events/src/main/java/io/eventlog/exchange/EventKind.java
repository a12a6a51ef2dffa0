package io.eventlog.exchange;

/**
 * What a canonical event represents. Order-stream rows are always {@link #ORDER}; tick-stream rows are
 * classified by their execution-type code.
 */
public enum EventKind {
    ORDER,
    TRADE,
    CANCEL,
    TICK;

    static final String EXEC_TYPE_TRADE = "F";
    static final String EXEC_TYPE_CANCEL = "4";

    public static EventKind fromExecType(String execType) {
        if (EXEC_TYPE_TRADE.equals(execType)) return TRADE;
        if (EXEC_TYPE_CANCEL.equals(execType)) return CANCEL;
        return TICK;
    }
}
