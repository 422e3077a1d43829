package io.tempora.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Test;

import static io.tempora.util.RetryExecutor.retryExecutor;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class RetryExecutorTest
{
    @Test
    public void retryUntilSuccess()
            throws Exception
    {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger retries = new AtomicInteger();
        String result = retryExecutor()
            .withRetryLimit(3)
            .withInitialRetryWait(Duration.ofMillis(1))
            .retryIf(ex -> ex instanceof IllegalStateException)
            .onRetry((ex, count, limit, wait) -> retries.incrementAndGet())
            .run(() -> {
                if (calls.incrementAndGet() < 3) {
                    throw new IllegalStateException("transient");
                }
                return "ok";
            });
        assertThat(result, is("ok"));
        assertThat(calls.get(), is(3));
        assertThat(retries.get(), is(2));
    }

    @Test
    public void giveUpAfterLimit()
    {
        AtomicInteger calls = new AtomicInteger();
        List<Duration> waits = new ArrayList<>();
        try {
            retryExecutor()
                .withRetryLimit(2)
                .withInitialRetryWait(Duration.ofMillis(2))
                .withMaxRetryWait(Duration.ofMillis(3))
                .retryIf(ex -> true)
                .onRetry((ex, count, limit, wait) -> waits.add(wait))
                .run(() -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("down " + calls.get());
                });
            fail();
        }
        catch (RetryExecutor.RetryGiveupException ex) {
            assertThat(ex.getCause(), instanceOf(IllegalStateException.class));
            assertThat(ex.getCause().getMessage(), is("down 3"));
        }
        assertThat(calls.get(), is(3));
        assertThat(waits, contains(Duration.ofMillis(2), Duration.ofMillis(3)));
    }

    @Test
    public void noRetryWhenPredicateRejects()
    {
        AtomicInteger calls = new AtomicInteger();
        try {
            retryExecutor()
                .withInitialRetryWait(Duration.ofMillis(1))
                .retryIf(ex -> ex instanceof IllegalStateException)
                .run(() -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("bad");
                });
            fail();
        }
        catch (RetryExecutor.RetryGiveupException ex) {
            assertThat(calls.get(), is(1));
        }
    }
}
