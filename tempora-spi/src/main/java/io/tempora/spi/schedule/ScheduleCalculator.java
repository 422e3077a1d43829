package io.tempora.spi.schedule;

import java.time.Instant;
import com.google.common.base.Optional;

/**
 * Decides whether a schedule of type {@code S} is due.
 */
public interface ScheduleCalculator<S>
{
    /**
     * @param lastRunAt the last time the schedule ran. Calculators that count
     *        from a reference time use {@code now} when absent.
     * @param now the current time aligned to seconds
     */
    DueCheck isDue(S schedule, Optional<Instant> lastRunAt, Instant now)
        throws ScheduleUnsatisfiableException;
}
