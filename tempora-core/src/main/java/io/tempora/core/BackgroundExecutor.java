package io.tempora.core;

public interface BackgroundExecutor
{
    /**
     * Stops background threads before the data source is closed.
     */
    void eagerShutdown() throws Exception;
}
