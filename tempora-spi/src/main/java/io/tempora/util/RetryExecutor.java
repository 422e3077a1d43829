package io.tempora.util;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Runs an operation again with exponential back-off until it succeeds,
 * fails with an exception that is not retryable, or the retry limit is
 * reached. Instances are immutable.
 */
public class RetryExecutor
{
    public static RetryExecutor retryExecutor()
    {
        return new RetryExecutor();
    }

    public static class RetryGiveupException
            extends ExecutionException
    {
        public RetryGiveupException(Exception cause)
        {
            super(cause);
        }

        @Override
        public Exception getCause()
        {
            return (Exception) super.getCause();
        }
    }

    public interface RetryAction
    {
        void onRetry(Exception exception, int retryCount, int retryLimit, Duration retryWait);
    }

    private int retryLimit = 3;
    private Duration initialRetryWait = Duration.ofSeconds(1);
    private Duration maxRetryWait = Duration.ofMinutes(1);
    private Predicate<Exception> retryPredicate = ex -> false;
    private RetryAction retryAction = (ex, count, limit, wait) -> { };

    private RetryExecutor()
    { }

    private RetryExecutor copy()
    {
        RetryExecutor copy = new RetryExecutor();
        copy.retryLimit = retryLimit;
        copy.initialRetryWait = initialRetryWait;
        copy.maxRetryWait = maxRetryWait;
        copy.retryPredicate = retryPredicate;
        copy.retryAction = retryAction;
        return copy;
    }

    public RetryExecutor withRetryLimit(int count)
    {
        RetryExecutor copy = copy();
        copy.retryLimit = count;
        return copy;
    }

    public RetryExecutor withInitialRetryWait(Duration wait)
    {
        RetryExecutor copy = copy();
        copy.initialRetryWait = wait;
        return copy;
    }

    public RetryExecutor withMaxRetryWait(Duration wait)
    {
        RetryExecutor copy = copy();
        copy.maxRetryWait = wait;
        return copy;
    }

    public RetryExecutor retryIf(Predicate<Exception> predicate)
    {
        RetryExecutor copy = copy();
        copy.retryPredicate = predicate;
        return copy;
    }

    public RetryExecutor onRetry(RetryAction action)
    {
        RetryExecutor copy = copy();
        copy.retryAction = action;
        return copy;
    }

    public void run(Runnable op)
            throws RetryGiveupException
    {
        run(() -> {
            op.run();
            return null;
        });
    }

    /**
     * Calls {@code op} up to {@code retryLimit + 1} times. An interrupt during
     * a back-off wait ends the retries and is kept on the thread.
     *
     * @throws RetryGiveupException with the last failure as its cause
     */
    public <T> T run(Callable<T> op)
            throws RetryGiveupException
    {
        Duration wait = initialRetryWait;
        for (int retryCount = 0; ; retryCount++) {
            try {
                return op.call();
            }
            catch (Exception ex) {
                if (retryCount >= retryLimit || !retryPredicate.test(ex)) {
                    throw new RetryGiveupException(ex);
                }
                retryAction.onRetry(ex, retryCount + 1, retryLimit, wait);
                try {
                    Thread.sleep(wait.toMillis());
                }
                catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new RetryGiveupException(ex);
                }
                wait = wait.multipliedBy(2);
                if (wait.compareTo(maxRetryWait) > 0) {
                    wait = maxRetryWait;
                }
            }
        }
    }
}
