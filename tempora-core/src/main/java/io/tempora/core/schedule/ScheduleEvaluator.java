package io.tempora.core.schedule;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.ScheduleUnsatisfiableException;
import io.tempora.spi.schedule.ScheduleVariant;
import io.tempora.standards.scheduler.ClockedCalculator;
import io.tempora.standards.scheduler.CrontabCalculator;
import io.tempora.standards.scheduler.IntervalCalculator;
import io.tempora.standards.scheduler.SolarCalculator;

/**
 * Answers whether an entry is due, applying entry-level rules before the
 * calculator of its schedule kind.
 */
public class ScheduleEvaluator
{
    private final IntervalCalculator interval;
    private final CrontabCalculator crontab;
    private final SolarCalculator solar;
    private final ClockedCalculator clocked;

    @Inject
    public ScheduleEvaluator(SchedulerConfig config)
    {
        this.interval = new IntervalCalculator();
        this.crontab = new CrontabCalculator(config.getSearchHorizon());
        this.solar = new SolarCalculator(config.getNoOccurrenceBackoff());
        this.clocked = new ClockedCalculator();
    }

    public DueCheck isDue(StoredScheduleEntry entry, Instant now)
        throws ScheduleUnsatisfiableException
    {
        Optional<Instant> startTime = entry.getStartTime();
        if (startTime.isPresent() && now.isBefore(startTime.get())) {
            return DueCheck.notDue(Duration.between(now, startTime.get()));
        }

        Optional<Instant> lastRunAt = entry.getLastRunAt();
        // crontab and solar count from the creation time until the first run
        Optional<Instant> reference = Optional.of(lastRunAt.or(entry.getCreatedAt()));

        ScheduleVariant schedule = entry.getSchedule();
        switch (schedule.getKind()) {
        case INTERVAL:
            return interval.isDue(schedule.getInterval().get(), lastRunAt, now);
        case CRONTAB:
            return crontab.isDue(schedule.getCrontab().get(), reference, now);
        case SOLAR:
            return solar.isDue(schedule.getSolar().get(), reference, now);
        case CLOCKED:
            return clocked.isDue(schedule.getClocked().get(), lastRunAt, now);
        default:
            throw new AssertionError("Unknown schedule kind: " + schedule.getKind());
        }
    }
}
