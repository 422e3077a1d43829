package io.tempora.core.schedule;

import java.time.Instant;
import java.util.List;
import io.tempora.core.repository.ResourceConflictException;
import io.tempora.core.repository.ResourceNotFoundException;

/**
 * Persistent storage of schedule entries.
 *
 * Every method throws {@link StoreException} when the store cannot be reached.
 */
public interface EntryStore
{
    /**
     * All entries including disabled ones. Rows that fail validation are
     * logged and left out.
     */
    List<StoredScheduleEntry> loadAll();

    /**
     * Entries whose definition was updated at or after the given time.
     */
    List<StoredScheduleEntry> changedSince(Instant since);

    /**
     * Counter bumped on every change that the scheduler must pick up.
     */
    long getChangeRevision();

    /**
     * Writes the bookkeeping of one tick in a single transaction.
     * Run counts never decrease.
     */
    void saveRunStates(List<RunState> states);

    void saveRunState(long entryId, Instant lastRunAt, long totalRunCount, boolean oneOffDisabled);

    StoredScheduleEntry createEntry(ScheduleEntry entry)
        throws ResourceConflictException;

    StoredScheduleEntry updateEntry(long id, ScheduleEntry entry)
        throws ResourceNotFoundException, ResourceConflictException;

    /**
     * Disabling an entry also clears its last run time.
     */
    StoredScheduleEntry setEnabled(long id, boolean enabled)
        throws ResourceNotFoundException;

    void deleteEntry(long id)
        throws ResourceNotFoundException;

    StoredScheduleEntry getEntryById(long id)
        throws ResourceNotFoundException;

    StoredScheduleEntry getEntryByName(String name)
        throws ResourceNotFoundException;
}
