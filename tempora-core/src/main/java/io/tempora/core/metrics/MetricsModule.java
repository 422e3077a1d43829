package io.tempora.core.metrics;

import com.google.inject.AbstractModule;
import com.google.inject.Scopes;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.tempora.metrics.StdTemporaMetrics;
import io.tempora.spi.metrics.TemporaMetrics;

/**
 * Binds {@link TemporaMetrics} on a {@link MeterRegistry}.
 *
 * The default registry keeps the meters in memory. Embedders replace it
 * with {@code overrideModulesWith(binder -> binder.bind(MeterRegistry.class).toInstance(...))}
 * or add registries by overriding {@link #createMeterRegistry()}.
 */
public class MetricsModule
        extends AbstractModule
{
    @Override
    protected void configure()
    {
        binder().bind(MeterRegistry.class).toInstance(createMeterRegistry());
        binder().bind(StdTemporaMetrics.class).in(Scopes.SINGLETON);
        binder().bind(TemporaMetrics.class).to(StdTemporaMetrics.class);
    }

    protected MeterRegistry createMeterRegistry()
    {
        CompositeMeterRegistry registry = new CompositeMeterRegistry();
        registry.add(new SimpleMeterRegistry());
        return registry;
    }
}
