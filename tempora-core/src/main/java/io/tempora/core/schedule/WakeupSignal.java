package io.tempora.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lets other threads wake the sleeping scheduler loop.
 *
 * Notices coalesce: any number of {@link #notice()} calls during one sleep
 * wake the loop once.
 */
public class WakeupSignal
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition condition = lock.newCondition();
    private boolean noticed = false;
    private volatile boolean stopped = false;

    public void notice()
    {
        lock.lock();
        try {
            noticed = true;
            condition.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    public void stop()
    {
        lock.lock();
        try {
            stopped = true;
            condition.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    public boolean isStopped()
    {
        return stopped;
    }

    /**
     * Sleeps until the deadline, a notice or stop.
     *
     * @return true if woken by a notice. The notice is consumed.
     */
    public boolean awaitUntil(Instant deadline, Clock clock)
        throws InterruptedException
    {
        lock.lock();
        try {
            while (!noticed && !stopped) {
                long nanos = Duration.between(clock.instant(), deadline).toNanos();
                if (nanos <= 0) {
                    break;
                }
                condition.awaitNanos(nanos);
            }
            boolean result = noticed;
            noticed = false;
            return result;
        }
        finally {
            lock.unlock();
        }
    }
}
