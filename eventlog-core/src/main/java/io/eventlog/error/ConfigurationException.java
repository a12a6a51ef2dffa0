package io.eventlog.error;

/** Invalid or contradictory settings, detected before any input is read. */
public class ConfigurationException extends EventLogException {
    public ConfigurationException(String message) {
        super(message);
    }
}
