package io.eventlog.exchange;

import io.eventlog.error.EventLogException;

/** One per-channel merge group failed. Other groups' outputs are left in place. */
public class MergeGroupException extends EventLogException {
    private final int channel;

    public MergeGroupException(int channel, Throwable cause) {
        super("channel " + channel + " merge failed: " + cause.getMessage(), cause);
        this.channel = channel;
    }

    public int channel() { return channel; }
}
