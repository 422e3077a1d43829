package io.tempora.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.tempora.core.BackgroundExecutor;
import io.tempora.core.ErrorReporter;
import io.tempora.spi.config.Config;
import io.tempora.spi.dispatch.DispatchRejectedException;
import io.tempora.spi.dispatch.DispatchRequest;
import io.tempora.spi.dispatch.TaskDispatcher;
import io.tempora.spi.metrics.TemporaMetrics;
import io.tempora.spi.schedule.DueCheck;
import io.tempora.spi.schedule.ScheduleUnsatisfiableException;
import io.tempora.util.RetryExecutor;
import io.tempora.util.RetryExecutor.RetryGiveupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.tempora.spi.metrics.TemporaMetrics.Category;
import static io.tempora.util.RetryExecutor.retryExecutor;
import static java.util.Locale.ENGLISH;

/**
 * The scheduler loop.
 *
 * A single thread owns the {@link EntrySet}. It sleeps until the earliest
 * due entry, the next reconcile or the max sleep interval, dispatches
 * every due entry and writes the run bookkeeping back to the store in one
 * batch. Other threads interact only through
 * {@link #noticeScheduleChanged()} and {@link #shutdown()}.
 */
public class ScheduleExecutor
        implements BackgroundExecutor
{
    private static final Logger logger = LoggerFactory.getLogger(ScheduleExecutor.class);

    private static final Duration MIN_RESCHEDULE_DELAY = Duration.ofSeconds(1);
    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);

    public enum State
    {
        IDLE,
        SLEEPING,
        EVALUATING,
        DISPATCHING,
        PERSISTING,
        STOPPED;
    }

    private enum Change
    {
        ADDED,
        UPDATED,
        REMOVED,
        UNCHANGED,
        PROBLEMATIC;
    }

    private final EntryStore store;
    private final TaskDispatcher dispatcher;
    private final ScheduleEvaluator evaluator;
    private final SchedulerConfig config;
    private final TemporaMetrics metrics;
    private final Clock clock;

    private final EntrySet entries = new EntrySet();
    private final WakeupSignal signal = new WakeupSignal();
    private ExecutorService executor;

    private volatile State state = State.IDLE;
    private Optional<Long> lastRevision = Optional.absent();
    private Optional<Instant> lastSyncedAt = Optional.absent();
    private Instant nextReconcileAt = Instant.MIN;

    @Inject(optional = true)
    private ErrorReporter errorReporter = ErrorReporter.empty();

    @Inject
    public ScheduleExecutor(
            EntryStore store,
            TaskDispatcher dispatcher,
            ScheduleEvaluator evaluator,
            SchedulerConfig config,
            TemporaMetrics metrics,
            Clock clock)
    {
        this.store = store;
        this.dispatcher = dispatcher;
        this.evaluator = evaluator;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    @VisibleForTesting
    boolean isStarted()
    {
        return executor != null;
    }

    public State getState()
    {
        return state;
    }

    public synchronized void start()
    {
        if (!config.getEnabled()) {
            logger.debug("Scheduler is disabled.");
            return;
        }
        if (executor == null) {
            executor = Executors.newSingleThreadExecutor(
                    new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scheduler-%d")
                    .build()
                    );
            executor.submit(this::run);
        }
    }

    public synchronized void shutdown()
    {
        signal.stop();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Override
    public synchronized void eagerShutdown()
        throws Exception
    {
        shutdown();
        if (executor != null) {
            if (!executor.awaitTermination(config.getMaxSleepInterval().toMillis() * 2, TimeUnit.MILLISECONDS)) {
                logger.warn("Scheduler thread did not stop in time");
            }
            executor = null;
        }
    }

    /**
     * Wakes the loop to pick up entries changed through the store. Many
     * calls before the loop wakes up count as one.
     */
    public void noticeScheduleChanged()
    {
        signal.notice();
    }

    private Instant now()
    {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private void run()
    {
        logger.info("Scheduler started");
        try {
            while (!signal.isStopped()) {
                boolean failed = false;
                try {
                    runOnce();
                }
                catch (InterruptedException ex) {
                    break;
                }
                catch (Throwable t) {
                    logger.error("An uncaught exception is ignored. Scheduling will be retried.", t);
                    errorReporter.reportUncaughtError(t);
                    metrics.increment(Category.DEFAULT, "uncaughtErrors");
                    failed = true;
                }
                if (failed) {
                    try {
                        signal.awaitUntil(clock.instant().plus(ERROR_BACKOFF), clock);
                    }
                    catch (InterruptedException ex) {
                        break;
                    }
                }
            }
        }
        finally {
            state = State.STOPPED;
            logger.info("Scheduler stopped");
        }
    }

    private void runOnce()
        throws InterruptedException
    {
        Instant now = now();
        if (!now.isBefore(nextReconcileAt)) {
            reconcile(now);
        }
        tick(now);

        state = State.SLEEPING;
        boolean noticed = signal.awaitUntil(nextWakeTime(now()), clock);
        state = State.IDLE;
        if (noticed) {
            sync(now());
        }
    }

    @VisibleForTesting
    EntrySet getEntrySet()
    {
        return entries;
    }

    @VisibleForTesting
    Instant nextWakeTime(Instant now)
    {
        Instant wake = now.plus(config.getMaxSleepInterval());
        Optional<Instant> due = entries.peekNextDueAt();
        if (due.isPresent() && due.get().isBefore(wake)) {
            wake = due.get();
        }
        if (nextReconcileAt.isBefore(wake)) {
            wake = nextReconcileAt;
        }
        return wake.isBefore(now) ? now : wake;
    }

    /**
     * Dispatches every entry due at {@code now}.
     *
     * @return number of accepted dispatches
     */
    @VisibleForTesting
    int tick(Instant now)
    {
        state = State.EVALUATING;
        List<RunState> runStates = new ArrayList<>();
        int dispatched = 0;

        for (StoredScheduleEntry entry : entries.pollDue(now)) {
            if (entry.getExpires().isPresent() && entry.getExpires().get().isBefore(now)) {
                logger.info("Disabling expired entry {} (expired at {})", entry.getName(), entry.getExpires().get());
                entries.remove(entry.getId());
                runStates.add(RunState.disable(entry));
                continue;
            }

            DueCheck check;
            try {
                check = evaluator.isDue(entry, now);
            }
            catch (ScheduleUnsatisfiableException | RuntimeException ex) {
                markProblematic(entry, ex);
                continue;
            }

            if (!check.isDue()) {
                entries.put(entry, dueAt(now, check.getNextCheckDelay()));
                continue;
            }

            state = State.DISPATCHING;
            boolean accepted = dispatch(entry, now);
            state = State.EVALUATING;
            if (!accepted) {
                entries.put(entry, Optional.of(now.plus(dispatchRetryInterval())));
                continue;
            }
            dispatched++;

            StoredScheduleEntry ran = entry.withRun(now);
            if (entry.getOneOff()) {
                logger.info("One-off entry {} ran and is disabled", entry.getName());
                entries.remove(entry.getId());
                runStates.add(RunState.ran(ran, true));
            }
            else {
                runStates.add(RunState.ran(ran, false));
                Optional<Duration> delay = check.getNextCheckDelay();
                if (delay.isPresent() && delay.get().compareTo(MIN_RESCHEDULE_DELAY) < 0) {
                    delay = Optional.of(MIN_RESCHEDULE_DELAY);
                }
                entries.put(ran, dueAt(now, delay));
            }
        }

        if (!runStates.isEmpty()) {
            state = State.PERSISTING;
            saveRunStates(runStates);
        }

        metrics.gauge(Category.SCHEDULER, "entries", entries.size());
        state = State.IDLE;
        return dispatched;
    }

    /**
     * Due time after {@code delay}, rounded up to a whole second because the
     * loop compares due times against a clock truncated to seconds.
     */
    @VisibleForTesting
    static Optional<Instant> dueAt(Instant now, Optional<Duration> delay)
    {
        if (!delay.isPresent()) {
            return Optional.absent();
        }
        Instant due = now.plus(delay.get());
        Instant seconds = due.truncatedTo(ChronoUnit.SECONDS);
        return Optional.of(seconds.equals(due) ? due : seconds.plusSeconds(1));
    }

    private Duration dispatchRetryInterval()
    {
        Duration retry = config.getDispatchRetryInterval();
        Duration max = config.getMaxSleepInterval();
        return retry.compareTo(max) > 0 ? max : retry;
    }

    private boolean dispatch(StoredScheduleEntry entry, Instant now)
    {
        DispatchRequest request = buildRequest(entry, now);
        try {
            dispatcher.dispatch(request);
            logger.info("Dispatched task {} of entry {}", entry.getTask(), entry.getName());
            metrics.increment(Category.SCHEDULER, "dispatched");
            return true;
        }
        catch (DispatchRejectedException ex) {
            logger.warn("Dispatch of entry {} was rejected: {}. Retrying in {}",
                    entry.getName(), ex.getMessage(), dispatchRetryInterval());
            metrics.increment(Category.SCHEDULER, "dispatchRejected");
            return false;
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to dispatch entry {}. Retrying in {}",
                    entry.getName(), dispatchRetryInterval(), ex);
            metrics.increment(Category.SCHEDULER, "dispatchFailed");
            return false;
        }
    }

    @VisibleForTesting
    static DispatchRequest buildRequest(StoredScheduleEntry entry, Instant now)
    {
        Config headers = entry.getHeaders().deepCopy()
            .set("periodic_task_name", entry.getName());

        Optional<Instant> expires = entry.getExpires();
        if (!expires.isPresent() && entry.getExpireSeconds().isPresent()) {
            expires = Optional.of(now.plusSeconds(entry.getExpireSeconds().get()));
        }

        return DispatchRequest.builder()
            .entryName(entry.getName())
            .task(entry.getTask())
            .args(entry.getArgs().deepCopy())
            .kwargs(entry.getKwargs().deepCopy())
            .queue(entry.getQueue())
            .exchange(entry.getExchange())
            .routingKey(entry.getRoutingKey())
            .priority(entry.getPriority())
            .headers(headers)
            .expires(expires)
            .scheduledAt(now)
            .build();
    }

    private void saveRunStates(List<RunState> runStates)
    {
        try {
            storeRetry().run(() -> store.saveRunStates(runStates));
        }
        catch (RetryGiveupException ex) {
            logger.error("Failed to save run state of {} entries. They may run again after restart.",
                    runStates.size(), ex.getCause());
        }
    }

    private RetryExecutor storeRetry()
    {
        return retryExecutor()
            .withRetryLimit(Math.max(1, config.getStoreRetryLimit()))
            .withInitialRetryWait(config.getStoreRetryInitialWait())
            .withMaxRetryWait(config.getMaxSleepInterval())
            .retryIf(ex -> ex instanceof StoreException)
            .onRetry((ex, retryCount, retryLimit, retryWait) -> {
                logger.warn("Store access failed. Retrying {}/{} after {}: {}",
                        retryCount, retryLimit, retryWait, ex.toString());
                metrics.increment(Category.DB, "storeErrors");
            });
    }

    private <T> Optional<T> readStore(Callable<T> op, String what)
    {
        try {
            return Optional.of(storeRetry().run(op));
        }
        catch (RetryGiveupException ex) {
            logger.warn("Failed to {}. Keeping {} cached entries.", what, entries.size(), ex.getCause());
            metrics.increment(Category.DB, "storeErrors");
            return Optional.absent();
        }
    }

    /**
     * Brings the entry set in line with the store. Reads only the change
     * revision when nothing changed since the last reconcile.
     */
    @VisibleForTesting
    void reconcile(Instant now)
    {
        Optional<Long> revision = readStore(store::getChangeRevision, "read change revision");
        if (!revision.isPresent()) {
            nextReconcileAt = now.plus(config.getMaxSleepInterval());
            return;
        }
        if (revision.equals(lastRevision)) {
            nextReconcileAt = now.plus(config.getReconcileInterval());
            return;
        }

        Optional<List<StoredScheduleEntry>> loaded = readStore(store::loadAll, "load entries");
        if (!loaded.isPresent()) {
            nextReconcileAt = now.plus(config.getMaxSleepInterval());
            return;
        }

        int added = 0;
        int updated = 0;
        int removed = 0;
        Set<Long> enabledIds = new HashSet<>();
        for (StoredScheduleEntry entry : loaded.get()) {
            if (entry.getEnabled()) {
                enabledIds.add(entry.getId());
            }
            switch (apply(entry, now)) {
            case ADDED:
                added++;
                break;
            case UPDATED:
                updated++;
                break;
            case REMOVED:
                removed++;
                break;
            default:
                break;
            }
            advanceSyncedAt(entry.getUpdatedAt());
        }

        for (long id : entries.ids()) {
            if (!enabledIds.contains(id)) {
                entries.remove(id);
                removed++;
            }
        }
        entries.retainProblems(enabledIds);

        lastRevision = revision;
        nextReconcileAt = now.plus(config.getReconcileInterval());
        metrics.increment(Category.SCHEDULER, "reconciled");
        if (added > 0 || updated > 0 || removed > 0) {
            logger.info("Reconciled schedule entries at revision {}: {} added, {} updated, {} removed, {} active",
                    revision.get(), added, updated, removed, entries.size());
        }
        else {
            logger.debug("Reconciled schedule entries at revision {}: no changes", revision.get());
        }
    }

    /**
     * Applies entries changed since the last sync. Deleted entries are left
     * to the next reconcile.
     */
    @VisibleForTesting
    void sync(Instant now)
    {
        if (!lastSyncedAt.isPresent()) {
            nextReconcileAt = now;
            return;
        }
        List<StoredScheduleEntry> changed;
        try {
            changed = store.changedSince(lastSyncedAt.get());
        }
        catch (StoreException ex) {
            logger.warn("Failed to read changed entries. Falling back to reconcile.", ex);
            metrics.increment(Category.DB, "storeErrors");
            nextReconcileAt = now;
            return;
        }
        for (StoredScheduleEntry entry : changed) {
            Change change = apply(entry, now);
            if (change != Change.UNCHANGED) {
                logger.info("Entry {} {}", entry.getName(), change.name().toLowerCase(ENGLISH));
            }
            advanceSyncedAt(entry.getUpdatedAt());
        }
    }

    private void advanceSyncedAt(Instant updatedAt)
    {
        if (!lastSyncedAt.isPresent() || updatedAt.isAfter(lastSyncedAt.get())) {
            lastSyncedAt = Optional.of(updatedAt);
        }
    }

    private Change apply(StoredScheduleEntry entry, Instant now)
    {
        long id = entry.getId();
        if (!entry.getEnabled()) {
            entries.clearProblem(id);
            return entries.remove(id) ? Change.REMOVED : Change.UNCHANGED;
        }

        Optional<StoredScheduleEntry> current = entries.get(id);
        if (current.isPresent() && current.get().getUpdatedAt().equals(entry.getUpdatedAt())) {
            return Change.UNCHANGED;
        }
        if (entries.isProblematic(id, entry.getUpdatedAt())) {
            return Change.UNCHANGED;
        }

        if (!place(entry, now)) {
            return Change.PROBLEMATIC;
        }
        return current.isPresent() ? Change.UPDATED : Change.ADDED;
    }

    private boolean place(StoredScheduleEntry entry, Instant now)
    {
        DueCheck check;
        try {
            check = evaluator.isDue(entry, now);
        }
        catch (ScheduleUnsatisfiableException | RuntimeException ex) {
            markProblematic(entry, ex);
            return false;
        }
        if (check.isDue()) {
            entries.put(entry, Optional.of(now));
        }
        else {
            entries.put(entry, dueAt(now, check.getNextCheckDelay()));
        }
        return true;
    }

    private void markProblematic(StoredScheduleEntry entry, Exception ex)
    {
        logger.warn("Skipping entry {} until it is updated: {}", entry.getName(), ex.getMessage());
        metrics.increment(Category.SCHEDULER, "unsatisfiable");
        entries.markProblematic(entry.getId(), entry.getUpdatedAt());
    }
}
