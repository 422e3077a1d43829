package io.tempora.core.schedule;

/**
 * A failure of the backing store, usually transient.
 */
public class StoreException
        extends RuntimeException
{
    public StoreException(String message)
    {
        super(message);
    }

    public StoreException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
