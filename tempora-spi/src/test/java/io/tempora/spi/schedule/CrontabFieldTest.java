package io.tempora.spi.schedule;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class CrontabFieldTest
{
    @Test
    public void wildcard()
    {
        CrontabField field = CrontabField.parse("*", CrontabField.Type.MINUTE);
        assertThat(field.contains(0), is(true));
        assertThat(field.contains(59), is(true));
        assertThat(field.isRestricted(), is(false));
    }

    @Test
    public void listsRangesAndSteps()
    {
        CrontabField field = CrontabField.parse("1,10-12,*/20,50/5", CrontabField.Type.MINUTE);
        assertThat(field.contains(0), is(true));   // */20
        assertThat(field.contains(1), is(true));
        assertThat(field.contains(2), is(false));
        assertThat(field.contains(11), is(true));
        assertThat(field.contains(13), is(false));
        assertThat(field.contains(40), is(true));
        assertThat(field.contains(55), is(true));  // 50/5
        assertThat(field.contains(56), is(false));
        assertThat(field.isRestricted(), is(true));
    }

    @Test
    public void rangeWithStep()
    {
        CrontabField field = CrontabField.parse("9-17/4", CrontabField.Type.HOUR);
        assertThat(field.firstValue(), is(9));
        assertThat(field.nextValue(10), is(13));
        assertThat(field.nextValue(14), is(17));
        assertThat(field.nextValue(18), is(-1));
    }

    @Test
    public void namesAreCaseInsensitive()
    {
        CrontabField months = CrontabField.parse("Jan,mar-MAY", CrontabField.Type.MONTH_OF_YEAR);
        assertThat(months.contains(1), is(true));
        assertThat(months.contains(2), is(false));
        assertThat(months.contains(4), is(true));

        CrontabField days = CrontabField.parse("mon-fri", CrontabField.Type.DAY_OF_WEEK);
        assertThat(days.contains(0), is(false));
        assertThat(days.contains(1), is(true));
        assertThat(days.contains(5), is(true));
        assertThat(days.contains(6), is(false));
    }

    @Test
    public void sundayIsZeroOrSeven()
    {
        assertThat(CrontabField.parse("7", CrontabField.Type.DAY_OF_WEEK).contains(0), is(true));
        assertThat(CrontabField.parse("5-7", CrontabField.Type.DAY_OF_WEEK).contains(0), is(true));
        assertThat(CrontabField.parse("0-7", CrontabField.Type.DAY_OF_WEEK).isRestricted(), is(false));
    }

    @Test
    public void fullRangeIsNotRestricted()
    {
        assertThat(CrontabField.parse("1-31", CrontabField.Type.DAY_OF_MONTH).isRestricted(), is(false));
        assertThat(CrontabField.parse("*/1", CrontabField.Type.DAY_OF_MONTH).isRestricted(), is(false));
        assertThat(CrontabField.parse("*/2", CrontabField.Type.DAY_OF_MONTH).isRestricted(), is(true));
    }

    @Test
    public void rejectInvalidExpressions()
    {
        assertInvalid("60", CrontabField.Type.MINUTE);
        assertInvalid("0", CrontabField.Type.DAY_OF_MONTH);
        assertInvalid("13", CrontabField.Type.MONTH_OF_YEAR);
        assertInvalid("10-5", CrontabField.Type.HOUR);
        assertInvalid("*/0", CrontabField.Type.HOUR);
        assertInvalid("abc", CrontabField.Type.DAY_OF_WEEK);
        assertInvalid("", CrontabField.Type.MINUTE);
        assertInvalid("1,,2", CrontabField.Type.MINUTE);
    }

    private static void assertInvalid(String expression, CrontabField.Type type)
    {
        try {
            CrontabField.parse(expression, type);
            fail("expected InvalidScheduleException for '" + expression + "'");
        }
        catch (InvalidScheduleException ex) {
            // expected
        }
    }
}
