package io.tempora.core.schedule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.tempora.metrics.StdTemporaMetrics;
import io.tempora.spi.dispatch.DispatchRejectedException;
import io.tempora.spi.dispatch.DispatchRequest;
import io.tempora.spi.dispatch.TaskDispatcher;
import io.tempora.spi.schedule.ClockedSchedule;
import io.tempora.spi.schedule.CrontabSchedule;
import io.tempora.spi.schedule.IntervalPeriod;
import io.tempora.spi.schedule.IntervalSchedule;
import io.tempora.spi.schedule.ScheduleVariant;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import static io.tempora.core.schedule.ScheduleTestingUtils.newConfig;
import static io.tempora.core.schedule.ScheduleTestingUtils.storedEntry;
import static io.tempora.core.schedule.ScheduleTestingUtils.storedEntryBuilder;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(MockitoJUnitRunner.Silent.class)
public class ScheduleExecutorTest
{
    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");
    private static final ScheduleVariant EVERY_MINUTE = ScheduleVariant.of(IntervalSchedule.of(60, IntervalPeriod.SECONDS));

    @Mock EntryStore store;
    @Mock TaskDispatcher dispatcher;
    @Captor ArgumentCaptor<List<RunState>> runStates;
    @Captor ArgumentCaptor<DispatchRequest> requests;

    private SchedulerConfig config;
    private ScheduleExecutor executor;

    @Before
    public void setUp()
    {
        config = SchedulerConfig.defaultBuilder()
            .searchHorizon(Duration.ofDays(400))
            .storeRetryInitialWait(Duration.ofMillis(1))
            .build();
        executor = newExecutor(config, Clock.systemUTC());
    }

    @After
    public void tearDown()
        throws Exception
    {
        executor.eagerShutdown();
    }

    private ScheduleExecutor newExecutor(SchedulerConfig config, Clock clock)
    {
        return new ScheduleExecutor(store, dispatcher, new ScheduleEvaluator(config), config,
                StdTemporaMetrics.empty(), clock);
    }

    private void storeHas(long revision, StoredScheduleEntry... entries)
    {
        when(store.getChangeRevision()).thenReturn(revision);
        when(store.loadAll()).thenReturn(ImmutableList.copyOf(entries));
    }

    @Test
    public void intervalEntryRunsEveryPeriod()
        throws Exception
    {
        storeHas(1, storedEntry(1, "add", EVERY_MINUTE, T0));
        executor.reconcile(T0);

        assertThat(executor.tick(T0), is(1));
        assertThat(executor.tick(T0.plusSeconds(30)), is(0));
        assertThat(executor.tick(T0.plusSeconds(60)), is(1));

        verify(dispatcher, times(2)).dispatch(requests.capture());
        assertThat(requests.getAllValues().get(0).getScheduledAt(), is(T0));
        assertThat(requests.getAllValues().get(1).getScheduledAt(), is(T0.plusSeconds(60)));

        verify(store, times(2)).saveRunStates(runStates.capture());
        RunState last = runStates.getValue().get(0);
        assertThat(last.getEntryId(), is(1L));
        assertThat(last.getLastRunAt(), is(Optional.of(T0.plusSeconds(60))));
        assertThat(last.getTotalRunCount(), is(2L));
        assertThat(last.getDisable(), is(false));
    }

    @Test
    public void rejectedDispatchIsRetriedWithoutPersisting()
        throws Exception
    {
        storeHas(1, storedEntry(1, "add", EVERY_MINUTE, T0));
        doThrow(new DispatchRejectedException("queue is full"))
            .doNothing()
            .when(dispatcher).dispatch(any());
        executor.reconcile(T0);

        assertThat(executor.tick(T0), is(0));
        verify(store, never()).saveRunStates(anyList());
        // dispatch retry interval is capped by the max sleep interval
        assertThat(executor.getEntrySet().getNextDueAt(1), is(Optional.of(T0.plusSeconds(5))));

        assertThat(executor.tick(T0.plusSeconds(5)), is(1));
        verify(store).saveRunStates(runStates.capture());
        assertThat(runStates.getValue().get(0).getTotalRunCount(), is(1L));
    }

    @Test
    public void unreachableRuntimeIsRetried()
        throws Exception
    {
        storeHas(1, storedEntry(1, "add", EVERY_MINUTE, T0));
        doThrow(new IllegalStateException("connection refused")).when(dispatcher).dispatch(any());
        executor.reconcile(T0);

        assertThat(executor.tick(T0), is(0));
        assertThat(executor.getEntrySet().getNextDueAt(1), is(Optional.of(T0.plusSeconds(5))));
        verify(store, never()).saveRunStates(anyList());
    }

    @Test
    public void clockedEntryRunsOnceAndIsDisabled()
        throws Exception
    {
        StoredScheduleEntry once = storedEntryBuilder(1, "once",
                    ScheduleVariant.of(ClockedSchedule.of(T0.plusSeconds(30))), T0)
            .oneOff(true)
            .build();
        storeHas(1, once);
        executor.reconcile(T0);

        assertThat(executor.getEntrySet().getNextDueAt(1), is(Optional.of(T0.plusSeconds(30))));
        assertThat(executor.tick(T0), is(0));
        assertThat(executor.tick(T0.plusSeconds(30)), is(1));
        assertThat(executor.tick(T0.plusSeconds(60)), is(0));
        assertThat(executor.getEntrySet().ids(), is(empty()));

        verify(store).saveRunStates(runStates.capture());
        RunState state = runStates.getValue().get(0);
        assertThat(state.getDisable(), is(true));
        assertThat(state.getLastRunAt(), is(Optional.of(T0.plusSeconds(30))));
    }

    @Test
    public void subSecondDueTimeIsRoundedUp()
        throws Exception
    {
        StoredScheduleEntry once = storedEntryBuilder(1, "once",
                    ScheduleVariant.of(ClockedSchedule.of(T0.plusMillis(10500))), T0)
            .oneOff(true)
            .build();
        storeHas(1, once);
        executor.reconcile(T0);

        assertThat(executor.getEntrySet().getNextDueAt(1), is(Optional.of(T0.plusSeconds(11))));
        assertThat(executor.nextWakeTime(T0.plusSeconds(10)), is(T0.plusSeconds(11)));
        assertThat(executor.tick(T0.plusSeconds(10)), is(0));
        assertThat(executor.tick(T0.plusSeconds(11)), is(1));

        assertThat(ScheduleExecutor.dueAt(T0, Optional.of(Duration.ofSeconds(3))), is(Optional.of(T0.plusSeconds(3))));
        assertThat(ScheduleExecutor.dueAt(T0, Optional.of(Duration.ofMillis(1))), is(Optional.of(T0.plusSeconds(1))));
        assertThat(ScheduleExecutor.dueAt(T0, Optional.absent()), is(Optional.absent()));
    }

    @Test
    public void unchangedRevisionSkipsLoading()
    {
        storeHas(1, storedEntry(1, "add", EVERY_MINUTE, T0));
        executor.reconcile(T0);
        executor.reconcile(T0.plusSeconds(300));
        executor.reconcile(T0.plusSeconds(600));

        verify(store, times(3)).getChangeRevision();
        verify(store, times(1)).loadAll();
        assertThat(executor.getEntrySet().size(), is(1));
    }

    @Test
    public void reconcileDropsDeletedAndDisabledEntries()
    {
        storeHas(1, storedEntry(1, "a", EVERY_MINUTE, T0), storedEntry(2, "b", EVERY_MINUTE, T0));
        executor.reconcile(T0);
        assertThat(executor.getEntrySet().size(), is(2));

        StoredScheduleEntry disabled = storedEntryBuilder(2, "b", EVERY_MINUTE, T0.plusSeconds(1))
            .enabled(false)
            .build();
        storeHas(2, disabled);
        executor.reconcile(T0.plusSeconds(10));

        assertThat(executor.getEntrySet().ids(), is(empty()));
    }

    @Test
    public void restartRunsOverdueEntriesOnly()
        throws Exception
    {
        StoredScheduleEntry overdue = storedEntryBuilder(1, "overdue", EVERY_MINUTE, T0.minusSeconds(3600))
            .lastRunAt(T0.minusSeconds(120))
            .totalRunCount(10)
            .build();
        StoredScheduleEntry recent = storedEntryBuilder(2, "recent", EVERY_MINUTE, T0.minusSeconds(3600))
            .lastRunAt(T0.minusSeconds(30))
            .totalRunCount(10)
            .build();
        storeHas(5, overdue, recent);
        executor.reconcile(T0);

        assertThat(executor.tick(T0), is(1));
        verify(dispatcher).dispatch(requests.capture());
        assertThat(requests.getValue().getEntryName(), is("overdue"));
        assertThat(executor.getEntrySet().getNextDueAt(2), is(Optional.of(T0.plusSeconds(30))));

        verify(store).saveRunStates(runStates.capture());
        assertThat(runStates.getValue().get(0).getTotalRunCount(), is(11L));
    }

    @Test
    public void unsatisfiableEntryIsSkippedUntilUpdated()
        throws Exception
    {
        StoredScheduleEntry impossible = storedEntry(1, "feb30",
                ScheduleVariant.of(CrontabSchedule.parse("0 0 30 2 *", ZoneId.of("UTC"))), T0);
        StoredScheduleEntry fine = storedEntry(2, "fine", EVERY_MINUTE, T0);
        storeHas(1, impossible, fine);
        executor.reconcile(T0);

        assertThat(executor.getEntrySet().isProblematic(1), is(true));
        assertThat(executor.tick(T0), is(1));

        // another change elsewhere does not re-evaluate the broken definition
        storeHas(2, impossible, fine);
        executor.reconcile(T0.plusSeconds(10));
        assertThat(executor.getEntrySet().get(1), is(Optional.absent()));

        StoredScheduleEntry fixed = storedEntry(1, "feb30",
                ScheduleVariant.of(CrontabSchedule.parse("0 0 28 2 *", ZoneId.of("UTC"))), T0.plusSeconds(20));
        storeHas(3, fixed, fine);
        executor.reconcile(T0.plusSeconds(30));
        assertThat(executor.getEntrySet().isProblematic(1), is(false));
        assertThat(executor.getEntrySet().get(1), is(Optional.of(fixed)));
    }

    @Test
    public void expiredEntryIsDisabledInsteadOfRun()
        throws Exception
    {
        StoredScheduleEntry expired = storedEntryBuilder(1, "expired", EVERY_MINUTE, T0.minusSeconds(60))
            .expires(T0.minusSeconds(1))
            .build();
        storeHas(1, expired);
        executor.reconcile(T0);

        assertThat(executor.tick(T0), is(0));
        verify(dispatcher, never()).dispatch(any());
        verify(store).saveRunStates(runStates.capture());
        assertThat(runStates.getValue().get(0).getDisable(), is(true));
        assertThat(runStates.getValue().get(0).getLastRunAt(), is(Optional.absent()));
        assertThat(executor.getEntrySet().ids(), is(empty()));
    }

    @Test
    public void syncAppliesChangedEntries()
    {
        storeHas(1, storedEntry(1, "a", EVERY_MINUTE, T0));
        executor.reconcile(T0);

        StoredScheduleEntry disabled = storedEntryBuilder(1, "a", EVERY_MINUTE, T0.plusSeconds(10))
            .enabled(false)
            .build();
        StoredScheduleEntry added = storedEntry(2, "b", EVERY_MINUTE, T0.plusSeconds(10));
        when(store.changedSince(T0)).thenReturn(ImmutableList.of(disabled, added));
        executor.sync(T0.plusSeconds(10));

        assertThat(executor.getEntrySet().ids(), contains(2L));
        assertThat(executor.getEntrySet().getNextDueAt(2), is(Optional.of(T0.plusSeconds(10))));
    }

    @Test
    public void syncFailureFallsBackToReconcile()
    {
        storeHas(1, storedEntryBuilder(1, "a", EVERY_MINUTE, T0).lastRunAt(T0).build());
        executor.reconcile(T0);
        assertThat(executor.nextWakeTime(T0.plusSeconds(1)), is(T0.plusSeconds(6)));

        when(store.changedSince(any())).thenThrow(new StoreException("connection lost"));
        executor.sync(T0.plusSeconds(1));
        assertThat(executor.nextWakeTime(T0.plusSeconds(1)), is(T0.plusSeconds(1)));
    }

    @Test
    public void unreachableStoreKeepsCachedEntries()
    {
        storeHas(1, storedEntry(1, "a", EVERY_MINUTE, T0));
        executor.reconcile(T0);

        when(store.getChangeRevision()).thenThrow(new StoreException("connection lost"));
        executor.reconcile(T0.plusSeconds(300));

        assertThat(executor.getEntrySet().size(), is(1));
        // first read plus three retries of the second
        verify(store, times(5)).getChangeRevision();
    }

    @Test
    public void runStateFailureDoesNotStopScheduling()
        throws Exception
    {
        storeHas(1, storedEntry(1, "a", EVERY_MINUTE, T0));
        doThrow(new StoreException("connection lost")).when(store).saveRunStates(anyList());
        executor.reconcile(T0);

        assertThat(executor.tick(T0), is(1));
        assertThat(executor.getEntrySet().getNextDueAt(1), is(Optional.of(T0.plusSeconds(60))));
    }

    @Test
    public void wakeTimeIsEarliestOfDueReconcileAndMaxSleep()
    {
        storeHas(1, storedEntry(1, "a", EVERY_MINUTE, T0));
        // never reconciled
        assertThat(executor.nextWakeTime(T0), is(T0));

        executor.reconcile(T0);
        executor.getEntrySet().put(storedEntry(1, "a", EVERY_MINUTE, T0), Optional.of(T0.plusSeconds(2)));
        assertThat(executor.nextWakeTime(T0), is(T0.plusSeconds(2)));

        executor.getEntrySet().put(storedEntry(1, "a", EVERY_MINUTE, T0), Optional.of(T0.plusSeconds(600)));
        assertThat(executor.nextWakeTime(T0), is(T0.plusSeconds(5)));
        assertThat(executor.nextWakeTime(T0.plusSeconds(299)), is(T0.plusSeconds(300)));
    }

    @Test
    public void requestCarriesRoutingAndHeaders()
    {
        StoredScheduleEntry entry = storedEntryBuilder(1, "report", EVERY_MINUTE, T0)
            .headers(newConfig().set("trace", "on"))
            .queue("reports")
            .routingKey("reports.daily")
            .priority(3)
            .expireSeconds(30L)
            .build();

        DispatchRequest request = ScheduleExecutor.buildRequest(entry, T0);
        assertThat(request.getTask(), is("proj.tasks.report"));
        assertThat(request.getQueue(), is(Optional.of("reports")));
        assertThat(request.getRoutingKey(), is(Optional.of("reports.daily")));
        assertThat(request.getPriority(), is(Optional.of(3)));
        assertThat(request.getExpires(), is(Optional.of(T0.plusSeconds(30))));
        assertThat(request.getHeaders().get("periodic_task_name", String.class), is("report"));
        assertThat(request.getHeaders().get("trace", String.class), is("on"));
        assertThat(entry.getHeaders().has("periodic_task_name"), is(false));
    }

    @Test
    public void absoluteExpiryIsPassedThrough()
    {
        StoredScheduleEntry entry = storedEntryBuilder(1, "report", EVERY_MINUTE, T0)
            .expires(T0.plusSeconds(3600))
            .build();
        assertThat(ScheduleExecutor.buildRequest(entry, T0).getExpires(), is(Optional.of(T0.plusSeconds(3600))));
    }

    @Test
    public void backgroundThreadDispatches()
        throws Exception
    {
        storeHas(1, storedEntry(1, "a", EVERY_MINUTE, T0));
        doNothing().when(dispatcher).dispatch(any());

        executor.start();
        assertThat(executor.isStarted(), is(true));
        verify(dispatcher, timeout(5000)).dispatch(any());

        executor.eagerShutdown();
        assertThat(executor.getState(), is(ScheduleExecutor.State.STOPPED));
    }

    @Test
    public void disabledSchedulerDoesNotStart()
    {
        ScheduleExecutor disabled = newExecutor(SchedulerConfig.defaultBuilder().enabled(false).build(), Clock.systemUTC());
        disabled.start();
        assertThat(disabled.isStarted(), is(false));
    }
}
