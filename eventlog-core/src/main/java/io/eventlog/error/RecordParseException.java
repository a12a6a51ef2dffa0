package io.eventlog.error;

/**
 * A field of an input row could not be parsed. Carries the source identity and the offending text.
 */
public class RecordParseException extends EventLogException {
    private final String source;
    private final String value;

    public RecordParseException(String source, String value, String message) {
        super(source + ": " + message + " (value='" + value + "')");
        this.source = source;
        this.value = value;
    }

    public RecordParseException(String source, String value, String message, Throwable cause) {
        super(source + ": " + message + " (value='" + value + "')", cause);
        this.source = source;
        this.value = value;
    }

    public String source() { return source; }
    public String value() { return value; }
}
