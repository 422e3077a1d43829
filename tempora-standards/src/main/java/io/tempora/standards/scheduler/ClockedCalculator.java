package io.tempora.standards.scheduler;

import java.time.Duration;
import java.time.Instant;
import com.google.common.base.Optional;
import io.tempora.spi.schedule.ClockedSchedule;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.ScheduleCalculator;

/**
 * One-shot schedules. Due once at or after the clocked time, never again
 * after a run.
 */
public class ClockedCalculator
        implements ScheduleCalculator<ClockedSchedule>
{
    @Override
    public DueCheck isDue(ClockedSchedule schedule, Optional<Instant> lastRunAt, Instant now)
    {
        if (lastRunAt.isPresent()) {
            return DueCheck.never();
        }
        Instant clockedTime = schedule.getClockedTime();
        if (!now.isBefore(clockedTime)) {
            return DueCheck.dueOnce();
        }
        return DueCheck.notDue(Duration.between(now, clockedTime));
    }
}
