package io.tempora.spi.schedule;

import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
public abstract class ClockedSchedule
{
    public abstract Instant getClockedTime();

    public static ClockedSchedule of(Instant clockedTime)
    {
        return ImmutableClockedSchedule.builder()
            .clockedTime(clockedTime)
            .build();
    }

    @Override
    public String toString()
    {
        return "at " + getClockedTime();
    }
}
