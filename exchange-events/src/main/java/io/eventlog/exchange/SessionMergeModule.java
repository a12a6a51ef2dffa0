package io.eventlog.exchange;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.eventlog.merge.BoundedMerger;
import io.eventlog.metrics.Metrics;

public class SessionMergeModule extends AbstractModule {
    private final MergeConfig config;

    public SessionMergeModule(MergeConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(MergeConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton @Named("order") ArchiveAccess orderArchive() { return ArchiveAccess.forPath(config.orderArchive()); }

    @Provides @Singleton @Named("tick") ArchiveAccess tickArchive() { return ArchiveAccess.forPath(config.tickArchive()); }

    @Provides @Singleton BoundedMerger<Event> merger(Metrics metrics) {
        return new BoundedMerger<>(Event.BY_CHANNEL_AND_SEQUENCE, EventFileSource::new, EventFileSink::new,
                config.handleBudget(), metrics);
    }

    @Provides @Singleton SourceNormalizer normalizer(Metrics metrics) {
        return new SourceNormalizer(metrics, config.channelFilter(), config.maxRowsPerSource());
    }

    @Provides @Singleton ChannelPartitioner partitioner(BoundedMerger<Event> merger, Metrics metrics) {
        return new ChannelPartitioner(merger, config.workers(), metrics);
    }

    @Provides @Singleton SessionMerger sessionMerger(@Named("order") ArchiveAccess order,
                                                     @Named("tick") ArchiveAccess tick,
                                                     SourceNormalizer normalizer,
                                                     ChannelPartitioner partitioner,
                                                     Metrics metrics) {
        return new SessionMerger(config, order, tick, normalizer, partitioner, metrics);
    }
}
