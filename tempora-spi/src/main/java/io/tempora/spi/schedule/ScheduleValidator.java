package io.tempora.spi.schedule;

import java.util.ArrayList;
import java.util.List;

import static java.util.Locale.ENGLISH;

/**
 * Collects field failures of a model object and throws them together.
 */
public class ScheduleValidator
{
    public static ScheduleValidator builder()
    {
        return new ScheduleValidator();
    }

    private final List<InvalidScheduleException.Failure> failures = new ArrayList<>();

    private ScheduleValidator()
    { }

    public ScheduleValidator error(String fieldName, Object object, String errorMessage)
    {
        failures.add(new InvalidScheduleException.Failure(fieldName, object, errorMessage));
        return this;
    }

    public ScheduleValidator check(String fieldName, Object object, boolean expression, String errorMessage)
    {
        if (!expression) {
            error(fieldName, object, errorMessage);
        }
        return this;
    }

    public ScheduleValidator check(String fieldName, Object object, boolean expression, String errorMessageFormat, Object... args)
    {
        if (!expression) {
            error(fieldName, object, String.format(ENGLISH, errorMessageFormat, args));
        }
        return this;
    }

    public ScheduleValidator checkNotEmpty(String fieldName, String value)
    {
        return check(fieldName, value, !value.trim().isEmpty(), "must not be blank");
    }

    public ScheduleValidator checkMaxLength(String fieldName, String value, int max)
    {
        return check(fieldName, value, value.length() <= max, "must not be longer than " + max + " characters");
    }

    public ScheduleValidator checkRange(String fieldName, double value, double min, double max)
    {
        return check(fieldName, value, min <= value && value <= max, "must be between %s and %s", format(min), format(max));
    }

    private static String format(double v)
    {
        if (v == Math.rint(v)) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    public void validate(String modelType, Object modelObject)
    {
        if (!failures.isEmpty()) {
            throw new InvalidScheduleException("Validating " + modelType + " failed", failures);
        }
    }
}
