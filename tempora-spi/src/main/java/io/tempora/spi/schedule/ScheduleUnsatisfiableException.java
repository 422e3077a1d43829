package io.tempora.spi.schedule;

/**
 * Thrown when no time within the search horizon satisfies a schedule.
 *
 * This exception is deterministic. The same definition fails the same way
 * until it is edited.
 */
public class ScheduleUnsatisfiableException
        extends Exception
{
    public ScheduleUnsatisfiableException(String message)
    {
        super(message);
    }
}
