package io.eventlog.exchange;

import io.eventlog.budget.HandleBudget;
import io.eventlog.error.ConfigurationException;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Settings for one session merge. Exactly one of {@code out} and {@code outDir} must be set.
 * Nullable fields mean "not requested"; {@code maxRowsPerSource} of 0 means unlimited.
 */
public record MergeConfig(
        Path orderArchive,
        Path tickArchive,
        Path out,
        Path outDir,
        Path workDir,
        boolean keepTemp,
        int maxOpen,
        Integer limitFiles,
        long maxRowsPerSource,
        String symbolRegex,
        Integer channel,
        int workers
) {
    public static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    }

    /** Fails with {@link ConfigurationException} on contradictory or missing settings. */
    public MergeConfig validate() {
        if (out != null && outDir != null) {
            throw new ConfigurationException("Use either --out or --out-dir, not both.");
        }
        if (out == null && outDir == null) {
            throw new ConfigurationException("Specify --out (single file) or --out-dir (per-channel).");
        }
        if (orderArchive == null || tickArchive == null) {
            throw new ConfigurationException("Both --order-archive and --tick-archive are required.");
        }
        if (limitFiles != null && limitFiles < 1) {
            throw new ConfigurationException("--limit-files must be positive: " + limitFiles);
        }
        if (maxRowsPerSource < 0) {
            throw new ConfigurationException("--limit-rows must not be negative: " + maxRowsPerSource);
        }
        symbolPattern();
        return this;
    }

    public OutputTarget outputTarget() {
        return outDir != null ? OutputTarget.perChannel(outDir) : OutputTarget.combined(out);
    }

    /** Handle budget with the floor of {@link HandleBudget#MIN_HANDLES} applied. */
    public int handleBudget() {
        return Math.max(HandleBudget.MIN_HANDLES, maxOpen);
    }

    public OptionalInt channelFilter() {
        return channel == null ? OptionalInt.empty() : OptionalInt.of(channel);
    }

    public Optional<Pattern> symbolPattern() {
        if (symbolRegex == null) return Optional.empty();
        try {
            return Optional.of(Pattern.compile(symbolRegex));
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid --symbol-regex: " + e.getMessage());
        }
    }

    /** Temporary work directories are removed at the end of a run unless asked to keep them. */
    public boolean cleanupWorkDir() {
        return workDir == null && !keepTemp;
    }
}
