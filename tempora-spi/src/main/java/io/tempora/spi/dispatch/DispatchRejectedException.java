package io.tempora.spi.dispatch;

/**
 * Thrown by a {@link TaskDispatcher} when the runtime refused a request.
 */
public class DispatchRejectedException
        extends Exception
{
    public DispatchRejectedException(String reason)
    {
        super(reason);
    }

    public DispatchRejectedException(String reason, Throwable cause)
    {
        super(reason, cause);
    }
}
