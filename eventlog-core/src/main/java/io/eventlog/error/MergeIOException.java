package io.eventlog.error;

/** Reading or writing failed during a k-way merge round; the whole merge group is void. */
public class MergeIOException extends EventLogException {
    public MergeIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
