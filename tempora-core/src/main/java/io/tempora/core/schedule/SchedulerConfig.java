package io.tempora.core.schedule;

import java.time.Duration;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigException;
import io.tempora.util.DurationParam;
import org.immutables.value.Value;

@Value.Immutable
public interface SchedulerConfig
{
    boolean getEnabled();

    Duration getMaxSleepInterval();

    Duration getReconcileInterval();

    /**
     * How far ahead a crontab search goes before giving up.
     */
    Duration getSearchHorizon();

    Duration getDispatchRetryInterval();

    Duration getNoOccurrenceBackoff();

    int getStoreRetryLimit();

    Duration getStoreRetryInitialWait();

    static ImmutableSchedulerConfig.Builder defaultBuilder()
    {
        return ImmutableSchedulerConfig.builder()
            .enabled(true)
            .maxSleepInterval(Duration.ofSeconds(5))
            .reconcileInterval(Duration.ofMinutes(5))
            .searchHorizon(Duration.ofDays(1826))
            .dispatchRetryInterval(Duration.ofSeconds(10))
            .noOccurrenceBackoff(Duration.ofDays(1))
            .storeRetryLimit(3)
            .storeRetryInitialWait(Duration.ofSeconds(1));
    }

    static SchedulerConfig convertFrom(Config config)
    {
        SchedulerConfig defaults = defaultBuilder().build();
        return defaultBuilder()
            .enabled(config.get("scheduler.enabled", boolean.class, true))
            .maxSleepInterval(duration(config, "scheduler.max_sleep_interval", defaults.getMaxSleepInterval()))
            .reconcileInterval(duration(config, "scheduler.reconcile_interval", defaults.getReconcileInterval()))
            .searchHorizon(duration(config, "scheduler.search_horizon", defaults.getSearchHorizon()))
            .dispatchRetryInterval(duration(config, "scheduler.dispatch_retry_interval", defaults.getDispatchRetryInterval()))
            .noOccurrenceBackoff(duration(config, "scheduler.no_occurrence_backoff", defaults.getNoOccurrenceBackoff()))
            .storeRetryLimit(config.get("scheduler.store_retry_limit", int.class, defaults.getStoreRetryLimit()))
            .storeRetryInitialWait(duration(config, "scheduler.store_retry_initial_wait", defaults.getStoreRetryInitialWait()))
            .build();
    }

    static Duration duration(Config config, String key, Duration defaultValue)
    {
        return config.get(key, DurationParam.class, DurationParam.of(defaultValue)).getDuration();
    }

    @Value.Check
    default void check()
    {
        if (getMaxSleepInterval().isZero() || getMaxSleepInterval().isNegative()) {
            throw new ConfigException("scheduler.max_sleep_interval must be positive: " + getMaxSleepInterval());
        }
        if (getReconcileInterval().isZero() || getReconcileInterval().isNegative()) {
            throw new ConfigException("scheduler.reconcile_interval must be positive: " + getReconcileInterval());
        }
        if (getSearchHorizon().isZero() || getSearchHorizon().isNegative()) {
            throw new ConfigException("scheduler.search_horizon must be positive: " + getSearchHorizon());
        }
        if (getStoreRetryLimit() < 0) {
            throw new ConfigException("scheduler.store_retry_limit must not be negative: " + getStoreRetryLimit());
        }
    }
}
