package io.eventlog.exchange;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where merged events land: one combined file, or one {@code channel_<n>.csv} per channel in a directory.
 */
public final class OutputTarget {
    public enum Mode { COMBINED, PER_CHANNEL }

    private final Mode mode;
    private final Path path;

    private OutputTarget(Mode mode, Path path) {
        this.mode = mode;
        this.path = Objects.requireNonNull(path);
    }

    public static OutputTarget combined(Path file) {
        return new OutputTarget(Mode.COMBINED, file);
    }

    public static OutputTarget perChannel(Path dir) {
        return new OutputTarget(Mode.PER_CHANNEL, dir);
    }

    public Mode mode() { return mode; }
    public Path path() { return path; }

    public Path fileFor(int channel) {
        if (mode != Mode.PER_CHANNEL) throw new IllegalStateException("combined output has no per-channel files");
        return path.resolve("channel_" + channel + ".csv");
    }

    @Override
    public String toString() {
        return mode + ":" + path;
    }
}
