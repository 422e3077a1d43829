package io.tempora.spi.schedule;

import java.time.ZoneId;
import java.time.ZoneOffset;
import org.immutables.value.Value;

/**
 * A timezone-aware crontab definition. Fields are kept as written and
 * parsed with {@link CrontabField}.
 */
@Value.Immutable
public abstract class CrontabSchedule
{
    @Value.Default
    public String getMinute()
    {
        return "*";
    }

    @Value.Default
    public String getHour()
    {
        return "*";
    }

    @Value.Default
    public String getDayOfMonth()
    {
        return "*";
    }

    @Value.Default
    public String getMonthOfYear()
    {
        return "*";
    }

    @Value.Default
    public String getDayOfWeek()
    {
        return "*";
    }

    @Value.Default
    public ZoneId getTimezone()
    {
        return ZoneOffset.UTC;
    }

    public static ImmutableCrontabSchedule.Builder builder()
    {
        return ImmutableCrontabSchedule.builder();
    }

    /**
     * Builds from a standard five-field expression: minute, hour,
     * day-of-month, month and day-of-week.
     */
    public static CrontabSchedule parse(String expression, ZoneId timezone)
    {
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidScheduleException("Crontab expression must have 5 fields: " + expression);
        }
        return builder()
            .minute(fields[0])
            .hour(fields[1])
            .dayOfMonth(fields[2])
            .monthOfYear(fields[3])
            .dayOfWeek(fields[4])
            .timezone(timezone)
            .build();
    }

    public CrontabField minuteField()
    {
        return CrontabField.parse(getMinute(), CrontabField.Type.MINUTE);
    }

    public CrontabField hourField()
    {
        return CrontabField.parse(getHour(), CrontabField.Type.HOUR);
    }

    public CrontabField dayOfMonthField()
    {
        return CrontabField.parse(getDayOfMonth(), CrontabField.Type.DAY_OF_MONTH);
    }

    public CrontabField monthOfYearField()
    {
        return CrontabField.parse(getMonthOfYear(), CrontabField.Type.MONTH_OF_YEAR);
    }

    public CrontabField dayOfWeekField()
    {
        return CrontabField.parse(getDayOfWeek(), CrontabField.Type.DAY_OF_WEEK);
    }

    @Value.Check
    protected void check()
    {
        ScheduleValidator validator = ScheduleValidator.builder();
        checkField(validator, getMinute(), CrontabField.Type.MINUTE);
        checkField(validator, getHour(), CrontabField.Type.HOUR);
        checkField(validator, getDayOfMonth(), CrontabField.Type.DAY_OF_MONTH);
        checkField(validator, getMonthOfYear(), CrontabField.Type.MONTH_OF_YEAR);
        checkField(validator, getDayOfWeek(), CrontabField.Type.DAY_OF_WEEK);
        validator.validate("crontab schedule", this);
    }

    private static void checkField(ScheduleValidator validator, String expression, CrontabField.Type type)
    {
        try {
            CrontabField.parse(expression, type);
        }
        catch (InvalidScheduleException ex) {
            validator.error(type.getFieldName(), expression, ex.getMessage());
        }
    }

    @Override
    public String toString()
    {
        return String.join(" ", getMinute(), getHour(), getDayOfMonth(), getMonthOfYear(), getDayOfWeek())
            + " (m/h/dM/MY/d) " + getTimezone();
    }
}
