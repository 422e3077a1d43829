package io.tempora.standards.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import com.google.common.base.Optional;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.ScheduleCalculator;
import io.tempora.spi.schedule.SolarEvent;
import io.tempora.spi.schedule.SolarSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solar schedules computed with the sunrise equation.
 *
 * Accuracy is about one minute, which is below the scheduler's
 * resolution for these events. When the event does not happen near the
 * last run nor near the current day (polar day or night), the schedule is
 * not due and is checked again after {@code noOccurrenceBackoff}.
 */
public class SolarCalculator
        implements ScheduleCalculator<SolarSchedule>
{
    private static final Logger logger = LoggerFactory.getLogger(SolarCalculator.class);

    private static final double JULIAN_UNIX_EPOCH = 2440587.5;
    private static final double J2000 = 2451545.0;
    private static final long J2000_EPOCH_DAY = 10957;
    private static final double EARTH_OBLIQUITY = 23.4397;

    private static final double HORIZON_SUN = -0.833;
    private static final double HORIZON_CIVIL = -6.0;
    private static final double HORIZON_NAUTICAL = -12.0;
    private static final double HORIZON_ASTRONOMICAL = -18.0;

    private final Duration noOccurrenceBackoff;

    public SolarCalculator(Duration noOccurrenceBackoff)
    {
        this.noOccurrenceBackoff = noOccurrenceBackoff;
    }

    @Override
    public DueCheck isDue(SolarSchedule schedule, Optional<Instant> lastRunAt, Instant now)
    {
        Instant reference = lastRunAt.or(now);
        Optional<Instant> next = nextOccurrence(schedule, reference);
        if (!next.isPresent()) {
            // the reference fell in a polar period. look again around today
            Instant recent = now.minus(Duration.ofDays(1));
            if (recent.isAfter(reference)) {
                next = nextOccurrence(schedule, recent);
            }
        }
        if (!next.isPresent()) {
            logger.debug("Solar event {} does not occur near {}", schedule, now);
            return DueCheck.notDue(noOccurrenceBackoff);
        }
        if (next.get().isAfter(now)) {
            return DueCheck.notDue(Duration.between(now, next.get()));
        }
        Optional<Instant> following = nextOccurrence(schedule, now);
        if (following.isPresent()) {
            return DueCheck.due(Duration.between(now, following.get()));
        }
        return DueCheck.due(noOccurrenceBackoff);
    }

    /**
     * First occurrence of the event strictly after {@code after}, looking at
     * the UTC days around it.
     */
    public Optional<Instant> nextOccurrence(SolarSchedule schedule, Instant after)
    {
        LocalDate day = after.atZone(ZoneOffset.UTC).toLocalDate();
        for (int offset = -1; offset <= 2; offset++) {
            Optional<Instant> time = eventTime(schedule, day.plusDays(offset));
            if (time.isPresent() && time.get().isAfter(after)) {
                return time;
            }
        }
        return Optional.absent();
    }

    /**
     * Time of the event on the given day, or absent if the sun does not
     * cross the event's horizon on that day.
     */
    public Optional<Instant> eventTime(SolarSchedule schedule, LocalDate day)
    {
        double n = day.toEpochDay() - J2000_EPOCH_DAY;
        double meanSolarTime = n - schedule.getLongitude() / 360.0;

        double m = normalizeDegrees(357.5291 + 0.98560028 * meanSolarTime);
        double mRad = Math.toRadians(m);
        double center = 1.9148 * Math.sin(mRad) + 0.0200 * Math.sin(2 * mRad) + 0.0003 * Math.sin(3 * mRad);
        double eclipticLongitude = normalizeDegrees(m + center + 180.0 + 102.9372);
        double lambda = Math.toRadians(eclipticLongitude);

        double transit = J2000 + meanSolarTime + 0.0053 * Math.sin(mRad) - 0.0069 * Math.sin(2 * lambda);

        SolarEvent event = schedule.getEvent();
        switch (event) {
        case SOLAR_NOON:
            return Optional.of(julianToInstant(transit));
        case SUNRISE:
            return crossing(schedule, lambda, transit, HORIZON_SUN, true);
        case SUNSET:
            return crossing(schedule, lambda, transit, HORIZON_SUN, false);
        case DAWN_CIVIL:
            return crossing(schedule, lambda, transit, HORIZON_CIVIL, true);
        case DUSK_CIVIL:
            return crossing(schedule, lambda, transit, HORIZON_CIVIL, false);
        case DAWN_NAUTICAL:
            return crossing(schedule, lambda, transit, HORIZON_NAUTICAL, true);
        case DUSK_NAUTICAL:
            return crossing(schedule, lambda, transit, HORIZON_NAUTICAL, false);
        case DAWN_ASTRONOMICAL:
            return crossing(schedule, lambda, transit, HORIZON_ASTRONOMICAL, true);
        case DUSK_ASTRONOMICAL:
            return crossing(schedule, lambda, transit, HORIZON_ASTRONOMICAL, false);
        default:
            throw new AssertionError("Unknown solar event: " + event);
        }
    }

    private static Optional<Instant> crossing(SolarSchedule schedule, double lambda, double transit,
            double horizon, boolean rising)
    {
        double sinDeclination = Math.sin(lambda) * Math.sin(Math.toRadians(EARTH_OBLIQUITY));
        double cosDeclination = Math.cos(Math.asin(sinDeclination));
        double phi = Math.toRadians(schedule.getLatitude());

        double cosHourAngle = (Math.sin(Math.toRadians(horizon)) - Math.sin(phi) * sinDeclination)
            / (Math.cos(phi) * cosDeclination);
        if (Double.isNaN(cosHourAngle) || cosHourAngle < -1.0 || cosHourAngle > 1.0) {
            return Optional.absent();
        }

        double hourAngle = Math.toDegrees(Math.acos(cosHourAngle));
        double julian = rising ? transit - hourAngle / 360.0 : transit + hourAngle / 360.0;
        return Optional.of(julianToInstant(julian));
    }

    private static Instant julianToInstant(double julian)
    {
        return Instant.ofEpochSecond(Math.round((julian - JULIAN_UNIX_EPOCH) * 86400.0));
    }

    private static double normalizeDegrees(double degrees)
    {
        double v = degrees % 360.0;
        return v < 0 ? v + 360.0 : v;
    }
}
