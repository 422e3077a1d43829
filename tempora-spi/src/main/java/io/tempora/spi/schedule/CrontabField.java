package io.tempora.spi.schedule;

import java.util.BitSet;
import java.util.List;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import static java.util.Locale.ENGLISH;

/**
 * The set of values accepted by one field of a crontab expression.
 *
 * Syntax: {@code *}, {@code N}, {@code A-B}, a {@code /S} step suffix on
 * {@code *} or on a range, {@code A/S} (A to the maximum by S), and comma
 * separated lists of them. Month and day-of-week fields also accept English
 * three-letter names. Day-of-week 7 is Sunday, same as 0.
 */
public final class CrontabField
{
    public enum Type
    {
        MINUTE("minute", 0, 59, ImmutableList.of()),
        HOUR("hour", 0, 23, ImmutableList.of()),
        DAY_OF_MONTH("day_of_month", 1, 31, ImmutableList.of()),
        MONTH_OF_YEAR("month_of_year", 1, 12, ImmutableList.of(
                    "jan", "feb", "mar", "apr", "may", "jun",
                    "jul", "aug", "sep", "oct", "nov", "dec")),
        DAY_OF_WEEK("day_of_week", 0, 7, ImmutableList.of(
                    "sun", "mon", "tue", "wed", "thu", "fri", "sat"));

        private final String fieldName;
        private final int min;
        private final int max;
        private final List<String> names;

        Type(String fieldName, int min, int max, List<String> names)
        {
            this.fieldName = fieldName;
            this.min = min;
            this.max = max;
            this.names = names;
        }

        public String getFieldName()
        {
            return fieldName;
        }

        int getMin()
        {
            return min;
        }

        // day_of_week accepts 7 in expressions but stores it as 0
        int getStoredMax()
        {
            return this == DAY_OF_WEEK ? 6 : max;
        }
    }

    private final Type type;
    private final String expression;
    private final BitSet values;

    private CrontabField(Type type, String expression, BitSet values)
    {
        this.type = type;
        this.expression = expression;
        this.values = values;
    }

    public static CrontabField parse(String expression, Type type)
    {
        String expr = expression.trim().toLowerCase(ENGLISH);
        if (expr.isEmpty()) {
            throw invalid(type, expression, "must not be blank");
        }
        BitSet values = new BitSet(type.max + 1);
        for (String item : Splitter.on(',').trimResults().split(expr)) {
            parseItem(type, expression, item, values);
        }
        if (type == Type.DAY_OF_WEEK && values.get(7)) {
            values.clear(7);
            values.set(0);
        }
        return new CrontabField(type, expression, values);
    }

    private static void parseItem(Type type, String expression, String item, BitSet values)
    {
        int step = 1;
        String range = item;
        int slash = item.indexOf('/');
        if (slash >= 0) {
            range = item.substring(0, slash);
            step = parseNumber(type, expression, item.substring(slash + 1));
            if (step <= 0) {
                throw invalid(type, expression, "step must be positive");
            }
        }

        int from;
        int to;
        if (range.equals("*")) {
            from = type.min;
            to = type.getStoredMax();
        }
        else {
            int dash = range.indexOf('-');
            if (dash >= 0) {
                from = parseValue(type, expression, range.substring(0, dash));
                to = parseValue(type, expression, range.substring(dash + 1));
                if (from > to) {
                    throw invalid(type, expression, "range " + range + " is reversed");
                }
            }
            else {
                from = parseValue(type, expression, range);
                // "5/15" means 5 to the maximum by 15
                to = slash >= 0 ? type.getStoredMax() : from;
            }
        }

        for (int v = from; v <= to; v += step) {
            values.set(v);
        }
    }

    private static int parseValue(Type type, String expression, String text)
    {
        int index = type.names.indexOf(text);
        int value;
        if (index >= 0) {
            value = type == Type.MONTH_OF_YEAR ? index + 1 : index;
        }
        else {
            value = parseNumber(type, expression, text);
        }
        if (value < type.min || value > type.max) {
            throw invalid(type, expression, "value " + text + " is out of range " + type.min + "-" + type.max);
        }
        return value;
    }

    private static int parseNumber(Type type, String expression, String text)
    {
        try {
            return Integer.parseInt(text);
        }
        catch (NumberFormatException ex) {
            throw invalid(type, expression, "'" + text + "' is not a number");
        }
    }

    private static InvalidScheduleException invalid(Type type, String expression, String message)
    {
        return new InvalidScheduleException("Invalid crontab field " + type.fieldName + " '" + expression + "': " + message);
    }

    public Type getType()
    {
        return type;
    }

    public String getExpression()
    {
        return expression;
    }

    public boolean contains(int value)
    {
        return values.get(value);
    }

    /**
     * Smallest accepted value that is greater than or equal to the given one,
     * or -1 if none.
     */
    public int nextValue(int from)
    {
        if (from < 0) {
            from = 0;
        }
        return values.nextSetBit(from);
    }

    public int firstValue()
    {
        return values.nextSetBit(0);
    }

    /**
     * True unless every value of the field's range is accepted.
     */
    public boolean isRestricted()
    {
        return values.cardinality() < type.getStoredMax() - type.min + 1;
    }

    @Override
    public String toString()
    {
        return expression;
    }
}
