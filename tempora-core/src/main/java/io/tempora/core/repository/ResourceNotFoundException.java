package io.tempora.core.repository;

/**
 * An exception thrown when a resource looked up by id or name does not exist.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }
}
