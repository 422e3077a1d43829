package io.tempora.core.schedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;

/**
 * In-memory working set of the scheduler: entries keyed by id plus an
 * index ordered by next due time.
 *
 * An entry may be held without a due time when it will never be due again
 * or while it is being evaluated. Entries whose evaluation failed are kept
 * aside as problematic, keyed by the {@code updatedAt} they failed at.
 *
 * Not thread-safe. Only the scheduler thread touches it.
 */
public class EntrySet
{
    private static class Slot
    {
        private final StoredScheduleEntry entry;
        private final Optional<Instant> nextDueAt;

        Slot(StoredScheduleEntry entry, Optional<Instant> nextDueAt)
        {
            this.entry = entry;
            this.nextDueAt = nextDueAt;
        }
    }

    private static class DueKey
    {
        private final Instant dueAt;
        private final long id;

        DueKey(Instant dueAt, long id)
        {
            this.dueAt = dueAt;
            this.id = id;
        }
    }

    private static final Comparator<DueKey> DUE_ORDER =
        Comparator.<DueKey, Instant>comparing(key -> key.dueAt).thenComparingLong(key -> key.id);

    private final Map<Long, Slot> slots = new HashMap<>();
    private final TreeSet<DueKey> dueIndex = new TreeSet<>(DUE_ORDER);
    private final Map<Long, Instant> problems = new HashMap<>();

    public void put(StoredScheduleEntry entry, Optional<Instant> nextDueAt)
    {
        removeSlot(entry.getId());
        slots.put(entry.getId(), new Slot(entry, nextDueAt));
        if (nextDueAt.isPresent()) {
            dueIndex.add(new DueKey(nextDueAt.get(), entry.getId()));
        }
        problems.remove(entry.getId());
    }

    /**
     * @return true if the entry was in the set
     */
    public boolean remove(long id)
    {
        return removeSlot(id);
    }

    private boolean removeSlot(long id)
    {
        Slot slot = slots.remove(id);
        if (slot == null) {
            return false;
        }
        if (slot.nextDueAt.isPresent()) {
            dueIndex.remove(new DueKey(slot.nextDueAt.get(), id));
        }
        return true;
    }

    public Optional<StoredScheduleEntry> get(long id)
    {
        Slot slot = slots.get(id);
        return slot == null ? Optional.absent() : Optional.of(slot.entry);
    }

    public Optional<Instant> getNextDueAt(long id)
    {
        Slot slot = slots.get(id);
        return slot == null ? Optional.absent() : slot.nextDueAt;
    }

    public Set<Long> ids()
    {
        return ImmutableSet.copyOf(slots.keySet());
    }

    public int size()
    {
        return slots.size();
    }

    public Optional<Instant> peekNextDueAt()
    {
        if (dueIndex.isEmpty()) {
            return Optional.absent();
        }
        return Optional.of(dueIndex.first().dueAt);
    }

    /**
     * Takes every entry due at or before {@code now} off the index, earliest
     * first. The entries stay in the set without a due time until put back.
     */
    public List<StoredScheduleEntry> pollDue(Instant now)
    {
        List<StoredScheduleEntry> due = new ArrayList<>();
        while (!dueIndex.isEmpty() && !dueIndex.first().dueAt.isAfter(now)) {
            DueKey key = dueIndex.pollFirst();
            Slot slot = slots.get(key.id);
            slots.put(key.id, new Slot(slot.entry, Optional.absent()));
            due.add(slot.entry);
        }
        return due;
    }

    /**
     * Removes the entry and remembers that its definition at
     * {@code updatedAt} cannot be scheduled.
     */
    public void markProblematic(long id, Instant updatedAt)
    {
        removeSlot(id);
        problems.put(id, updatedAt);
    }

    public boolean isProblematic(long id, Instant updatedAt)
    {
        return updatedAt.equals(problems.get(id));
    }

    public boolean isProblematic(long id)
    {
        return problems.containsKey(id);
    }

    public void clearProblem(long id)
    {
        problems.remove(id);
    }

    public void retainProblems(Set<Long> ids)
    {
        problems.keySet().retainAll(ids);
    }
}
