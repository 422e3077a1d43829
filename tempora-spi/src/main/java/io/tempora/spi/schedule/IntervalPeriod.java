package io.tempora.spi.schedule;

import java.time.Duration;

import static java.util.Locale.ENGLISH;

public enum IntervalPeriod
{
    DAYS,
    HOURS,
    MINUTES,
    SECONDS;

    public Duration toDuration(long every)
    {
        switch (this) {
        case DAYS:
            return Duration.ofDays(every);
        case HOURS:
            return Duration.ofHours(every);
        case MINUTES:
            return Duration.ofMinutes(every);
        case SECONDS:
            return Duration.ofSeconds(every);
        default:
            throw new AssertionError("Unknown interval period: " + this);
        }
    }

    public String getName()
    {
        return name().toLowerCase(ENGLISH);
    }

    public static IntervalPeriod fromName(String name)
    {
        try {
            return valueOf(name.toUpperCase(ENGLISH));
        }
        catch (IllegalArgumentException ex) {
            throw new InvalidScheduleException("Unknown interval period: " + name);
        }
    }
}
