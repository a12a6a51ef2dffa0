package io.eventlog.exchange;

import io.eventlog.merge.MergeStats;

import java.nio.file.Path;
import java.util.OptionalInt;

/** A finished output file. {@code channel} is empty for the combined file. */
public record MergeArtifact(OptionalInt channel, Path path, int sources, long events, MergeStats stats) {}
