package io.tempora.standards.scheduler;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import com.google.common.base.Optional;
import io.tempora.spi.schedule.CrontabField;
import io.tempora.spi.schedule.CrontabSchedule;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.ScheduleCalculator;
import io.tempora.spi.schedule.ScheduleUnsatisfiableException;

import static io.tempora.util.Durations.formatDuration;

/**
 * Crontab schedules evaluated in the schedule's time zone.
 *
 * When both day-of-month and day-of-week are restricted a day matches if
 * either matches. Otherwise both must match.
 */
public class CrontabCalculator
        implements ScheduleCalculator<CrontabSchedule>
{
    private final Duration searchHorizon;

    public CrontabCalculator(Duration searchHorizon)
    {
        this.searchHorizon = searchHorizon;
    }

    @Override
    public DueCheck isDue(CrontabSchedule schedule, Optional<Instant> lastRunAt, Instant now)
        throws ScheduleUnsatisfiableException
    {
        Instant next = nextRunTime(schedule, lastRunAt.or(now));
        if (next.isAfter(now)) {
            return DueCheck.notDue(Duration.between(now, next));
        }
        // missed runs collapse into one
        Instant following;
        try {
            following = nextRunTime(schedule, now);
        }
        catch (ScheduleUnsatisfiableException ex) {
            return DueCheck.dueOnce();
        }
        return DueCheck.due(Duration.between(now, following));
    }

    /**
     * Earliest instant strictly after {@code after} that matches every field.
     *
     * @throws ScheduleUnsatisfiableException if nothing matches within the search horizon
     */
    public Instant nextRunTime(CrontabSchedule schedule, Instant after)
        throws ScheduleUnsatisfiableException
    {
        ZoneId zone = schedule.getTimezone();
        CrontabField minute = schedule.minuteField();
        CrontabField hour = schedule.hourField();
        CrontabField dayOfMonth = schedule.dayOfMonthField();
        CrontabField month = schedule.monthOfYearField();
        CrontabField dayOfWeek = schedule.dayOfWeekField();

        LocalDateTime limit = after.plus(searchHorizon).atZone(zone).toLocalDateTime();
        LocalDateTime t = after.atZone(zone).toLocalDateTime()
            .truncatedTo(ChronoUnit.MINUTES)
            .plusMinutes(1);

        while (!t.isAfter(limit)) {
            if (!month.contains(t.getMonthValue())) {
                int next = month.nextValue(t.getMonthValue() + 1);
                if (next < 0) {
                    t = LocalDateTime.of(t.getYear() + 1, month.firstValue(), 1, 0, 0);
                }
                else {
                    t = LocalDateTime.of(t.getYear(), next, 1, 0, 0);
                }
                continue;
            }
            if (!dayMatches(dayOfMonth, dayOfWeek, t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hour.contains(t.getHour())) {
                int next = hour.nextValue(t.getHour() + 1);
                if (next < 0) {
                    t = t.toLocalDate().plusDays(1).atStartOfDay();
                }
                else {
                    t = t.toLocalDate().atTime(next, 0);
                }
                continue;
            }
            if (!minute.contains(t.getMinute())) {
                int next = minute.nextValue(t.getMinute() + 1);
                if (next < 0) {
                    t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                }
                else {
                    t = t.withMinute(next);
                }
                continue;
            }

            // local times in a DST gap shift forward, in an overlap the earlier offset wins
            Instant candidate = ZonedDateTime.ofLocal(t, zone, null).toInstant();
            if (candidate.isAfter(after)) {
                return candidate;
            }
            t = t.plusMinutes(1);
        }

        throw new ScheduleUnsatisfiableException(
                "No time matches crontab " + schedule + " within " + formatDuration(searchHorizon) + " after " + after);
    }

    private static boolean dayMatches(CrontabField dayOfMonth, CrontabField dayOfWeek, LocalDate date)
    {
        boolean dom = dayOfMonth.contains(date.getDayOfMonth());
        boolean dow = dayOfWeek.contains(cronDayOfWeek(date.getDayOfWeek()));
        if (dayOfMonth.isRestricted() && dayOfWeek.isRestricted()) {
            return dom || dow;
        }
        return dom && dow;
    }

    // cron counts Sunday as 0
    private static int cronDayOfWeek(DayOfWeek dayOfWeek)
    {
        return dayOfWeek.getValue() % 7;
    }
}
