package io.tempora.spi.schedule;

import java.util.List;
import com.google.common.collect.ImmutableList;
import io.tempora.spi.config.ConfigException;

public class InvalidScheduleException
        extends ConfigException
{
    public static class Failure
    {
        private final String fieldName;
        private final Object object;
        private final String message;

        public Failure(String fieldName, Object object, String message)
        {
            this.fieldName = fieldName;
            this.object = object;
            this.message = message;
        }

        public String getFieldName()
        {
            return fieldName;
        }

        public Object getObject()
        {
            return object;
        }

        public String getMessage()
        {
            return message;
        }

        @Override
        public String toString()
        {
            return fieldName + " " + message + " (" + object + ")";
        }
    }

    private final List<Failure> failures;

    public InvalidScheduleException(String message)
    {
        super(message);
        this.failures = ImmutableList.of();
    }

    public InvalidScheduleException(String message, List<Failure> failures)
    {
        super(message + ": " + failures);
        this.failures = ImmutableList.copyOf(failures);
    }

    public List<Failure> getFailures()
    {
        return failures;
    }
}
