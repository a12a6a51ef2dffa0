package io.eventlog.error;

/** An input source could not be listed, opened or read. */
public class SourceAccessException extends EventLogException {
    private final String source;

    public SourceAccessException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public SourceAccessException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String source() { return source; }
}
