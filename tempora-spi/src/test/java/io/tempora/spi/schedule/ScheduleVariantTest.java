package io.tempora.spi.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ScheduleVariantTest
{
    @Test
    public void tagMatchesPayload()
    {
        ScheduleVariant variant = ScheduleVariant.of(IntervalSchedule.of(10, IntervalPeriod.MINUTES));
        assertThat(variant.getKind(), is(ScheduleKind.INTERVAL));
        assertThat(variant.getInterval().get().toDuration(), is(Duration.ofMinutes(10)));
        assertThat(variant.getCrontab().isPresent(), is(false));
    }

    @Test
    public void fromPayloadsRequiresExactlyOne()
    {
        ClockedSchedule clocked = ClockedSchedule.of(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(ScheduleVariant.fromPayloads(null, null, null, clocked).getKind(), is(ScheduleKind.CLOCKED));

        try {
            ScheduleVariant.fromPayloads(null, null, null, null);
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getMessage(), containsString("One of clocked, interval, crontab, or solar must be set"));
        }

        try {
            ScheduleVariant.fromPayloads(IntervalSchedule.of(1, IntervalPeriod.SECONDS), null, null, clocked);
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getMessage(), containsString("Only one of"));
        }
    }

    @Test
    public void kindMismatchIsRejected()
    {
        try {
            ImmutableScheduleVariant.builder()
                .kind(ScheduleKind.SOLAR)
                .interval(IntervalSchedule.of(1, IntervalPeriod.SECONDS))
                .build();
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getFailures().get(0).getFieldName(), is("kind"));
        }
    }

    @Test
    public void intervalMustBePositive()
    {
        try {
            IntervalSchedule.of(0, IntervalPeriod.SECONDS);
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getFailures().get(0).getFieldName(), is("every"));
        }
    }

    @Test
    public void solarCoordinatesAreRanged()
    {
        SolarSchedule.of(SolarEvent.SUNRISE, 90, -180);
        try {
            SolarSchedule.of(SolarEvent.SUNRISE, 91, 0);
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getMessage(), containsString("latitude must be between -90 and 90"));
        }
        try {
            SolarSchedule.of(SolarEvent.SUNSET, 0, 180.5);
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getMessage(), containsString("longitude must be between -180 and 180"));
        }
    }

    @Test
    public void crontabFieldsAreValidatedOnBuild()
    {
        CrontabSchedule crontab = CrontabSchedule.parse("0 4 * * mon", ZoneId.of("Asia/Tokyo"));
        assertThat(crontab.getDayOfWeek(), is("mon"));
        assertThat(crontab.toString(), is("0 4 * * mon (m/h/dM/MY/d) Asia/Tokyo"));

        try {
            CrontabSchedule.builder().minute("61").hour("25").build();
            fail();
        }
        catch (InvalidScheduleException ex) {
            assertThat(ex.getFailures().size(), is(2));
        }
    }

    @Test
    public void namesRoundTrip()
    {
        assertThat(SolarEvent.fromName("dawn_civil"), is(SolarEvent.DAWN_CIVIL));
        assertThat(SolarEvent.SOLAR_NOON.getName(), is("solar_noon"));
        assertThat(IntervalPeriod.fromName("hours"), is(IntervalPeriod.HOURS));
    }
}
