package io.eventlog.exchange;

import java.util.List;

/** What a session merge read and wrote. */
public record SessionResult(List<NormalizedSource> sources, List<MergeArtifact> artifacts) {
    public long totalEvents() {
        return artifacts.stream().mapToLong(MergeArtifact::events).sum();
    }

    public long contributingSources() {
        return sources.stream().filter(NormalizedSource::hasEvents).count();
    }
}
