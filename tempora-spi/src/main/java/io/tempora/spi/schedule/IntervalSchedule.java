package io.tempora.spi.schedule;

import java.time.Duration;
import org.immutables.value.Value;

@Value.Immutable
public abstract class IntervalSchedule
{
    public abstract long getEvery();

    public abstract IntervalPeriod getPeriod();

    public Duration toDuration()
    {
        return getPeriod().toDuration(getEvery());
    }

    public static IntervalSchedule of(long every, IntervalPeriod period)
    {
        return ImmutableIntervalSchedule.builder()
            .every(every)
            .period(period)
            .build();
    }

    @Value.Check
    protected void check()
    {
        ScheduleValidator.builder()
            .check("every", getEvery(), getEvery() > 0, "must be a positive number")
            .validate("interval schedule", this);
    }

    @Override
    public String toString()
    {
        return "every " + getEvery() + " " + getPeriod().getName();
    }
}
