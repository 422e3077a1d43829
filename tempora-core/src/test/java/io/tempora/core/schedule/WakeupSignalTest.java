package io.tempora.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

public class WakeupSignalTest
{
    private final Clock clock = Clock.systemUTC();
    private final WakeupSignal signal = new WakeupSignal();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @After
    public void shutdown()
    {
        executor.shutdownNow();
    }

    @Test
    public void noticeBeforeAwaitIsConsumedOnce()
        throws Exception
    {
        signal.notice();
        signal.notice();
        assertThat(signal.awaitUntil(clock.instant().plusSeconds(10), clock), is(true));
        assertThat(signal.awaitUntil(clock.instant().plusMillis(10), clock), is(false));
    }

    @Test
    public void returnsAtDeadline()
        throws Exception
    {
        Instant start = clock.instant();
        assertThat(signal.awaitUntil(start.plusMillis(50), clock), is(false));
        assertThat(clock.instant().isBefore(start.plusMillis(50)), is(false));
    }

    @Test
    public void pastDeadlineReturnsImmediately()
        throws Exception
    {
        assertThat(signal.awaitUntil(clock.instant().minusSeconds(1), clock), is(false));
    }

    @Test
    public void noticeWakesWaitingThread()
        throws Exception
    {
        Instant start = clock.instant();
        Future<Boolean> woken = executor.submit(() -> signal.awaitUntil(start.plusSeconds(30), clock));
        Thread.sleep(50);
        signal.notice();

        assertThat(woken.get(10, TimeUnit.SECONDS), is(true));
        assertThat(Duration.between(start, clock.instant()), lessThan(Duration.ofSeconds(30)));
    }

    @Test
    public void stopWakesWaitingThread()
        throws Exception
    {
        Instant start = clock.instant();
        Future<Boolean> woken = executor.submit(() -> signal.awaitUntil(start.plusSeconds(30), clock));
        Thread.sleep(50);
        signal.stop();

        assertThat(woken.get(10, TimeUnit.SECONDS), is(false));
        assertThat(signal.isStopped(), is(true));
        assertThat(signal.awaitUntil(clock.instant().plusSeconds(30), clock), is(false));
    }
}
