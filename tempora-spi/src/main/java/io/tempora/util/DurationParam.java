package io.tempora.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;

/**
 * A duration written as {@code 1d 2h 30m 10s} in configuration files.
 */
public class DurationParam
{
    private final Duration duration;

    private DurationParam(Duration duration)
    {
        this.duration = duration;
    }

    public Duration getDuration()
    {
        return duration;
    }

    @JsonCreator
    public static DurationParam parse(String expr)
    {
        return new DurationParam(Durations.parseDuration(expr));
    }

    public static DurationParam of(Duration duration)
    {
        return new DurationParam(duration);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return duration.equals(((DurationParam) o).duration);
    }

    @Override
    public int hashCode()
    {
        return duration.hashCode();
    }

    @Override
    @JsonValue
    public String toString()
    {
        return Durations.formatDuration(duration);
    }
}
