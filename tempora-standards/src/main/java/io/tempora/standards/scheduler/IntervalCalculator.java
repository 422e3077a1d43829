package io.tempora.standards.scheduler;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.IntervalSchedule;
import io.tempora.spi.schedule.ScheduleCalculator;

/**
 * Fixed-interval schedules. An entry that never ran is due immediately.
 */
public class IntervalCalculator
        implements ScheduleCalculator<IntervalSchedule>
{
    @Override
    public DueCheck isDue(IntervalSchedule schedule, Optional<Instant> lastRunAt, Instant now)
    {
        Duration every = schedule.toDuration();
        if (!lastRunAt.isPresent()) {
            return DueCheck.due(every);
        }

        Duration elapsed = Duration.between(lastRunAt.get(), now);
        if (elapsed.compareTo(every) >= 0) {
            return DueCheck.due(every);
        }
        return DueCheck.notDue(every.minus(elapsed));
    }
}
