package io.tempora.spi.dispatch;

/**
 * Hands dispatch requests to the external task-queue runtime.
 *
 * Implementations return as soon as the runtime accepted the request and
 * never wait for the task to finish. Any RuntimeException is treated as
 * "runtime unreachable".
 */
public interface TaskDispatcher
{
    void dispatch(DispatchRequest request)
        throws DispatchRejectedException;
}
