package io.eventlog.error;

/**
 * Root of every failure raised while building an event log. None of them are retried.
 */
public class EventLogException extends RuntimeException {
    public EventLogException(String message) {
        super(message);
    }

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
