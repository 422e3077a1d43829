package io.tempora.spi.schedule;

import java.util.ArrayList;
import java.util.List;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Exactly one of interval, crontab, solar or clocked schedule, tagged with
 * its {@link ScheduleKind}. Callers switch on {@link #getKind()} and read
 * the matching payload.
 */
@Value.Immutable
public abstract class ScheduleVariant
{
    public abstract ScheduleKind getKind();

    public abstract Optional<IntervalSchedule> getInterval();

    public abstract Optional<CrontabSchedule> getCrontab();

    public abstract Optional<SolarSchedule> getSolar();

    public abstract Optional<ClockedSchedule> getClocked();

    public static ScheduleVariant of(IntervalSchedule interval)
    {
        return ImmutableScheduleVariant.builder()
            .kind(ScheduleKind.INTERVAL)
            .interval(interval)
            .build();
    }

    public static ScheduleVariant of(CrontabSchedule crontab)
    {
        return ImmutableScheduleVariant.builder()
            .kind(ScheduleKind.CRONTAB)
            .crontab(crontab)
            .build();
    }

    public static ScheduleVariant of(SolarSchedule solar)
    {
        return ImmutableScheduleVariant.builder()
            .kind(ScheduleKind.SOLAR)
            .solar(solar)
            .build();
    }

    public static ScheduleVariant of(ClockedSchedule clocked)
    {
        return ImmutableScheduleVariant.builder()
            .kind(ScheduleKind.CLOCKED)
            .clocked(clocked)
            .build();
    }

    /**
     * Builds a variant from nullable payloads, as found on a stored row.
     *
     * @throws InvalidScheduleException unless exactly one payload is given
     */
    public static ScheduleVariant fromPayloads(IntervalSchedule interval, CrontabSchedule crontab,
            SolarSchedule solar, ClockedSchedule clocked)
    {
        List<ScheduleVariant> set = new ArrayList<>();
        if (interval != null) {
            set.add(of(interval));
        }
        if (crontab != null) {
            set.add(of(crontab));
        }
        if (solar != null) {
            set.add(of(solar));
        }
        if (clocked != null) {
            set.add(of(clocked));
        }
        if (set.isEmpty()) {
            throw new InvalidScheduleException("One of clocked, interval, crontab, or solar must be set");
        }
        if (set.size() > 1) {
            throw new InvalidScheduleException("Only one of clocked, interval, crontab, or solar must be set");
        }
        return set.get(0);
    }

    @Value.Check
    protected void check()
    {
        int count = (getInterval().isPresent() ? 1 : 0)
            + (getCrontab().isPresent() ? 1 : 0)
            + (getSolar().isPresent() ? 1 : 0)
            + (getClocked().isPresent() ? 1 : 0);
        ScheduleValidator.builder()
            .check("schedule", this, count == 1, "only one of clocked, interval, crontab, or solar must be set")
            .check("kind", getKind(), count != 1 || payload().isPresent(), "does not match the schedule set")
            .validate("schedule", this);
    }

    private Optional<?> payload()
    {
        switch (getKind()) {
        case INTERVAL:
            return getInterval();
        case CRONTAB:
            return getCrontab();
        case SOLAR:
            return getSolar();
        case CLOCKED:
            return getClocked();
        default:
            throw new AssertionError("Unknown schedule kind: " + getKind());
        }
    }

    @Override
    public String toString()
    {
        return payload().transform(Object::toString).or("(none)");
    }
}
