package io.tempora.core.schedule;

import java.time.Instant;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * A schedule entry as persisted, with its id, run bookkeeping and
 * timestamps. {@code updatedAt} changes only when the definition changes.
 */
@Value.Immutable
@Value.Style(builder = "new")
public abstract class StoredScheduleEntry
        extends ScheduleEntry
{
    public abstract long getId();

    public abstract Optional<Instant> getLastRunAt();

    public abstract long getTotalRunCount();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();

    public StoredScheduleEntry withRun(Instant runAt)
    {
        return new ImmutableStoredScheduleEntry.Builder()
            .from(this)
            .lastRunAt(runAt)
            .totalRunCount(getTotalRunCount() + 1)
            .build();
    }
}
