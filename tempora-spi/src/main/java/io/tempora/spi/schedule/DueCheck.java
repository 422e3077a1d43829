package io.tempora.spi.schedule;

import java.time.Duration;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Answer of a due check: whether to run now, and how long to wait before
 * checking again. An absent delay means the schedule will never be due
 * again.
 */
@Value.Immutable
public abstract class DueCheck
{
    public abstract boolean isDue();

    public abstract Optional<Duration> getNextCheckDelay();

    public static DueCheck due(Duration nextCheckDelay)
    {
        return ImmutableDueCheck.builder()
            .isDue(true)
            .nextCheckDelay(nextCheckDelay)
            .build();
    }

    public static DueCheck notDue(Duration nextCheckDelay)
    {
        return ImmutableDueCheck.builder()
            .isDue(false)
            .nextCheckDelay(nextCheckDelay)
            .build();
    }

    public static DueCheck dueOnce()
    {
        return ImmutableDueCheck.builder()
            .isDue(true)
            .build();
    }

    public static DueCheck never()
    {
        return ImmutableDueCheck.builder()
            .isDue(false)
            .build();
    }

    @Value.Check
    protected void check()
    {
        if (getNextCheckDelay().isPresent() && getNextCheckDelay().get().isNegative()) {
            throw new IllegalStateException("nextCheckDelay must not be negative: " + getNextCheckDelay().get());
        }
    }
}
