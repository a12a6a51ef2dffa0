package io.eventlog.exchange;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.eventlog.budget.HandleBudget;
import io.eventlog.error.ConfigurationException;
import io.eventlog.error.EventLogException;
import io.eventlog.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI that k-way merges per-symbol order and tick CSV streams into a channel-ordered event log.
 */
@CommandLine.Command(name = "event-merge", mixinStandardHelpOptions = true,
        description = "K-way merge order and tick CSV streams into a channel-ordered event log")
public final class SessionMergeMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SessionMergeMain.class);

    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFIG = 2;

    @CommandLine.Option(names = "--order-archive", required = true, description = "Order archive (.7z) or extracted directory")
    Path orderArchive;

    @CommandLine.Option(names = "--tick-archive", required = true, description = "Tick archive (.7z) or extracted directory")
    Path tickArchive;

    @CommandLine.Option(names = "--out", description = "Output CSV path for merged events")
    Path out;

    @CommandLine.Option(names = "--out-dir", description = "Output directory for per-channel files")
    Path outDir;

    @CommandLine.Option(names = "--work-dir", description = "Working directory for temp files")
    Path workDir;

    @CommandLine.Option(names = "--keep-temp", description = "Keep temp files after merge")
    boolean keepTemp;

    @CommandLine.Option(names = "--max-open", description = "Max files to merge per pass (min 2)", defaultValue = "" + HandleBudget.DEFAULT_HANDLES)
    int maxOpen;

    @CommandLine.Option(names = "--limit-files", description = "Limit files per archive (for testing)")
    Integer limitFiles;

    @CommandLine.Option(names = "--limit-rows", description = "Limit rows read per file (for sampling)", defaultValue = "0")
    long limitRows;

    @CommandLine.Option(names = "--symbol-regex", description = "Regex to filter symbol filenames")
    String symbolRegex;

    @CommandLine.Option(names = "--channel", description = "Only include a specific ChannelNo")
    Integer channel;

    @CommandLine.Option(names = "--workers", description = "Concurrent per-channel merges")
    Integer workers;

    public static void main(String[] args) {
        int code = new CommandLine(new SessionMergeMain()).execute(args);
        System.exit(code);
    }

    MergeConfig config() {
        return new MergeConfig(orderArchive, tickArchive, out, outDir, workDir, keepTemp, maxOpen, limitFiles,
                limitRows, symbolRegex, channel, workers == null ? MergeConfig.defaultWorkers() : workers);
    }

    @Override
    public Integer call() {
        MergeConfig cfg;
        try {
            cfg = config().validate();
        } catch (ConfigurationException e) {
            System.err.println("error: " + e.getMessage());
            return EXIT_CONFIG;
        }
        Injector injector = Guice.createInjector(new SessionMergeModule(cfg));
        try {
            SessionResult result = injector.getInstance(SessionMerger.class).run();
            printSummary(result, injector.getInstance(Metrics.class));
            return 0;
        } catch (EventLogException e) {
            log.debug("session merge failed", e);
            System.err.println("error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void printSummary(SessionResult result, Metrics metrics) {
        System.out.println("Merged " + result.totalEvents() + " events from " + result.contributingSources() + " sources:");
        for (MergeArtifact a : result.artifacts()) {
            String label = a.channel().isPresent() ? "channel " + a.channel().getAsInt() : "all channels";
            System.out.println("  " + label + ": events=" + a.events() + " sources=" + a.sources()
                    + " rounds=" + a.stats().rounds() + " -> " + a.path());
        }
        StringBuilder counts = new StringBuilder("metrics:");
        for (Map.Entry<String, Long> c : metrics.counts().entrySet()) {
            counts.append(' ').append(c.getKey()).append('=').append(c.getValue());
        }
        System.out.println(counts);
    }
}
