package io.tempora.core.repository;

/**
 * An exception thrown when unique identifier of a new resource already exists.
 *
 * This exception is deterministic.
 */
public class ResourceConflictException extends Exception
{
    public ResourceConflictException(String message)
    {
        super(message);
    }

    public ResourceConflictException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
