package io.tempora.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Bookkeeping written back to the store after a tick.
 */
@Value.Immutable
public interface RunState
{
    long getEntryId();

    Optional<Instant> getLastRunAt();

    long getTotalRunCount();

    boolean getDisable();

    static RunState ran(StoredScheduleEntry entry, boolean disable)
    {
        return ImmutableRunState.builder()
            .entryId(entry.getId())
            .lastRunAt(entry.getLastRunAt())
            .totalRunCount(entry.getTotalRunCount())
            .disable(disable)
            .build();
    }

    static RunState disable(StoredScheduleEntry entry)
    {
        return ImmutableRunState.builder()
            .entryId(entry.getId())
            .totalRunCount(entry.getTotalRunCount())
            .disable(true)
            .build();
    }
}
