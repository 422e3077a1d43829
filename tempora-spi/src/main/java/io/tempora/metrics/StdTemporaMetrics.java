package io.tempora.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import com.google.inject.Inject;
import io.tempora.spi.metrics.TemporaMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TemporaMetrics on a single Micrometer registry. Metric names are prefixed
 * with the category except for DEFAULT.
 */
public class StdTemporaMetrics implements TemporaMetrics
{
    private final MeterRegistry registry;
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Inject
    public StdTemporaMetrics(MeterRegistry registry)
    {
        this.registry = registry;
    }

    @Override
    public MeterRegistry getRegistry()
    {
        return registry;
    }

    @Override
    public String mkMetricsName(Category category, String metricsName)
    {
        if (category == Category.DEFAULT) {
            return metricsName;
        }
        else {
            return category.getString() + "_" + metricsName;
        }
    }

    @Override
    public void increment(Category category, String metricName, Tags tags)
    {
        registry.counter(mkMetricsName(category, metricName), tags).increment();
    }

    @Override
    public void gauge(Category category, String metricName, Tags tags, double value)
    {
        // MeterRegistry.gauge keeps only a weak reference to its state object
        String name = mkMetricsName(category, metricName);
        AtomicDouble holder = gauges.computeIfAbsent(name + tags,
                (key) -> registry.gauge(name, tags, new AtomicDouble()));
        holder.set(value);
    }

    @Override
    public void summary(Category category, String metricName, Tags tags, double value)
    {
        registry.summary(mkMetricsName(category, metricName), tags).record(value);
    }

    public static StdTemporaMetrics empty()
    {
        return new StdTemporaMetrics(new SimpleMeterRegistry());
    }
}
