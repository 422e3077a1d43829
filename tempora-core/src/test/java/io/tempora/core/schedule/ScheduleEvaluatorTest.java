package io.tempora.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import com.google.common.base.Optional;
import io.tempora.spi.schedule.ClockedSchedule;
import io.tempora.spi.schedule.CrontabSchedule;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.IntervalPeriod;
import io.tempora.spi.schedule.IntervalSchedule;
import io.tempora.spi.schedule.ScheduleUnsatisfiableException;
import io.tempora.spi.schedule.ScheduleVariant;
import org.junit.Test;

import static io.tempora.core.schedule.ScheduleTestingUtils.CREATED_AT;
import static io.tempora.core.schedule.ScheduleTestingUtils.storedEntryBuilder;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ScheduleEvaluatorTest
{
    private final ScheduleEvaluator evaluator = new ScheduleEvaluator(
            SchedulerConfig.defaultBuilder().searchHorizon(Duration.ofDays(400)).build());

    private static ScheduleVariant daily(String expr)
    {
        return ScheduleVariant.of(CrontabSchedule.parse(expr, ZoneId.of("UTC")));
    }

    @Test
    public void notDueBeforeStartTime()
        throws Exception
    {
        Instant now = Instant.parse("2024-06-01T00:00:00Z");
        StoredScheduleEntry entry = storedEntryBuilder(1, "a",
                    ScheduleVariant.of(IntervalSchedule.of(1, IntervalPeriod.MINUTES)), CREATED_AT)
            .startTime(now.plusSeconds(90))
            .build();

        assertThat(evaluator.isDue(entry, now), is(DueCheck.notDue(Duration.ofSeconds(90))));
        assertThat(evaluator.isDue(entry, now.plusSeconds(90)).isDue(), is(true));
    }

    @Test
    public void crontabCountsFromCreationUntilFirstRun()
        throws Exception
    {
        // created 2024-01-01 00:00, daily at 09:00: the first run was missed
        StoredScheduleEntry entry = storedEntryBuilder(1, "a", daily("0 9 * * *"), CREATED_AT).build();
        DueCheck check = evaluator.isDue(entry, Instant.parse("2024-06-01T08:00:00Z"));
        assertThat(check.isDue(), is(true));
        assertThat(check.getNextCheckDelay(), is(Optional.of(Duration.ofHours(1))));

        StoredScheduleEntry ran = storedEntryBuilder(1, "a", daily("0 9 * * *"), CREATED_AT)
            .lastRunAt(Instant.parse("2024-06-01T09:00:00Z"))
            .build();
        check = evaluator.isDue(ran, Instant.parse("2024-06-01T10:00:00Z"));
        assertThat(check, is(DueCheck.notDue(Duration.ofHours(23))));
    }

    @Test
    public void intervalWithoutRunIsDue()
        throws Exception
    {
        StoredScheduleEntry entry = storedEntryBuilder(1, "a",
                    ScheduleVariant.of(IntervalSchedule.of(10, IntervalPeriod.SECONDS)), CREATED_AT)
            .build();
        assertThat(evaluator.isDue(entry, Instant.parse("2024-06-01T00:00:00Z")), is(DueCheck.due(Duration.ofSeconds(10))));
    }

    @Test
    public void clockedRunsOnce()
        throws Exception
    {
        Instant at = Instant.parse("2024-06-01T12:00:00Z");
        StoredScheduleEntry entry = storedEntryBuilder(1, "a", ScheduleVariant.of(ClockedSchedule.of(at)), CREATED_AT)
            .oneOff(true)
            .build();
        assertThat(evaluator.isDue(entry, at), is(DueCheck.dueOnce()));
        assertThat(evaluator.isDue(entry.withRun(at), at.plusSeconds(1)), is(DueCheck.never()));
    }

    @Test(expected = ScheduleUnsatisfiableException.class)
    public void impossibleCrontabIsUnsatisfiable()
        throws Exception
    {
        StoredScheduleEntry entry = storedEntryBuilder(1, "a", daily("0 0 30 2 *"), CREATED_AT).build();
        evaluator.isDue(entry, Instant.parse("2024-06-01T00:00:00Z"));
    }
}
