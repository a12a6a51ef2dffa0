package io.eventlog.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.Map;
import java.util.TreeMap;

public class Metrics {
    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    /** Counter values by name, sorted, for end-of-run summaries. */
    public Map<String, Long> counts() {
        Map<String, Long> out = new TreeMap<>();
        registry.getCounters().forEach((name, c) -> out.put(name, c.getCount()));
        return out;
    }
}
