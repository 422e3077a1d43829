package io.tempora.core.database;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.tempora.core.database.DatabaseModule.AutoMigrator;
import io.tempora.core.repository.ResourceConflictException;
import io.tempora.core.repository.ResourceNotFoundException;
import io.tempora.core.schedule.EntryStore;
import io.tempora.core.schedule.ImmutableRunState;
import io.tempora.core.schedule.ImmutableStoredScheduleEntry;
import io.tempora.core.schedule.RunState;
import io.tempora.core.schedule.ScheduleEntry;
import io.tempora.core.schedule.StoreException;
import io.tempora.core.schedule.StoredScheduleEntry;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigException;
import io.tempora.spi.schedule.ClockedSchedule;
import io.tempora.spi.schedule.CrontabSchedule;
import io.tempora.spi.schedule.IntervalPeriod;
import io.tempora.spi.schedule.IntervalSchedule;
import io.tempora.spi.schedule.ScheduleVariant;
import io.tempora.spi.schedule.SolarEvent;
import io.tempora.spi.schedule.SolarSchedule;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DatabaseEntryStore
        extends BasicDatabaseStoreManager<DatabaseEntryStore.Dao>
        implements EntryStore
{
    private static final String SELECT_ENTRIES =
        "select pt.*," +
        " i.every_amount, i.period_unit," +
        " c.minute_expr, c.hour_expr, c.day_of_month, c.month_of_year, c.day_of_week, c.timezone," +
        " s.solar_event, s.latitude, s.longitude," +
        " k.clocked_time" +
        " from periodic_tasks pt" +
        " left join interval_schedules i on i.id = pt.interval_id" +
        " left join crontab_schedules c on c.id = pt.crontab_id" +
        " left join solar_schedules s on s.id = pt.solar_id" +
        " left join clocked_schedules k on k.id = pt.clocked_id";

    private final ConfigMapper configMapper;
    private final Clock clock;

    @Inject
    public DatabaseEntryStore(TransactionManager tm, ConfigMapper configMapper, AutoMigrator migrator, Clock clock)
    {
        super(Dao.class, tm);
        this.configMapper = configMapper;
        this.clock = clock;
    }

    private Instant storeNow()
    {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static StoreException storeFailure(JdbiException ex)
    {
        return new StoreException("Failed to access schedule store: " + ex.getMessage(), ex);
    }

    @Override
    public List<StoredScheduleEntry> loadAll()
    {
        try {
            return autoCommit((handle, dao) ->
                    collect(handle.createQuery(SELECT_ENTRIES + " order by pt.id")));
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public List<StoredScheduleEntry> changedSince(Instant since)
    {
        try {
            return autoCommit((handle, dao) ->
                    collect(handle.createQuery(SELECT_ENTRIES + " where pt.updated_at >= :since order by pt.id")
                        .bind("since", since)));
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public long getChangeRevision()
    {
        try {
            return autoCommit((handle, dao) -> dao.getRevision());
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public void saveRunStates(List<RunState> states)
    {
        if (states.isEmpty()) {
            return;
        }
        try {
            transaction((handle, dao) -> {
                boolean disabled = false;
                for (RunState state : states) {
                    dao.updateRunState(state.getEntryId(),
                            state.getLastRunAt().orNull(),
                            state.getTotalRunCount(),
                            state.getDisable());
                    disabled |= state.getDisable();
                }
                if (disabled) {
                    // other schedulers must drop disabled one-off entries too
                    dao.bumpRevision(storeNow());
                }
                return null;
            });
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public void saveRunState(long entryId, Instant lastRunAt, long totalRunCount, boolean oneOffDisabled)
    {
        saveRunStates(ImmutableList.<RunState>of(
                    ImmutableRunState.builder()
                    .entryId(entryId)
                    .lastRunAt(lastRunAt)
                    .totalRunCount(totalRunCount)
                    .disable(oneOffDisabled)
                    .build()));
    }

    @Override
    public StoredScheduleEntry createEntry(ScheduleEntry entry)
        throws ResourceConflictException
    {
        try {
            return transaction((handle, dao) -> catchConflict(() -> {
                Instant now = storeNow();
                ScheduleRefs refs = insertSchedule(dao, entry.getSchedule());
                long id = dao.insertTask(
                        entry.getName(), entry.getTask(),
                        refs.intervalId, refs.crontabId, refs.solarId, refs.clockedId,
                        configMapper.toText(entry.getArgs()), entry.getKwargs(),
                        entry.getQueue().orNull(), entry.getExchange().orNull(), entry.getRoutingKey().orNull(),
                        entry.getPriority().orNull(), entry.getHeaders(),
                        entry.getExpires().orNull(), entry.getExpireSeconds().orNull(),
                        entry.getOneOff(), entry.getStartTime().orNull(), entry.getEnabled(),
                        entry.getDescription().orNull(), now);
                dao.bumpRevision(now);
                return selectById(handle, id);
            }, "schedule entry name=%s", entry.getName()), ResourceConflictException.class);
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public StoredScheduleEntry updateEntry(long id, ScheduleEntry entry)
        throws ResourceNotFoundException, ResourceConflictException
    {
        try {
            return this.<StoredScheduleEntry, ResourceNotFoundException, ResourceConflictException>transaction((handle, dao) -> {
                ScheduleRefs oldRefs = requiredResource(selectRefs(handle, id), "schedule entry id=%d", id);
                return catchConflict(() -> {
                    Instant now = storeNow();
                    ScheduleRefs refs = insertSchedule(dao, entry.getSchedule());
                    dao.updateTask(id,
                            entry.getName(), entry.getTask(),
                            refs.intervalId, refs.crontabId, refs.solarId, refs.clockedId,
                            configMapper.toText(entry.getArgs()), entry.getKwargs(),
                            entry.getQueue().orNull(), entry.getExchange().orNull(), entry.getRoutingKey().orNull(),
                            entry.getPriority().orNull(), entry.getHeaders(),
                            entry.getExpires().orNull(), entry.getExpireSeconds().orNull(),
                            entry.getOneOff(), entry.getStartTime().orNull(), entry.getEnabled(),
                            entry.getDescription().orNull(), now);
                    deleteSchedule(dao, oldRefs);
                    dao.bumpRevision(now);
                    return selectById(handle, id);
                }, "schedule entry name=%s", entry.getName());
            }, ResourceNotFoundException.class, ResourceConflictException.class);
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public StoredScheduleEntry setEnabled(long id, boolean enabled)
        throws ResourceNotFoundException
    {
        try {
            return transaction((handle, dao) -> {
                Instant now = storeNow();
                if (dao.updateEnabled(id, enabled, now) == 0) {
                    throw new ResourceNotFoundException("Resource does not exist: schedule entry id=" + id);
                }
                dao.bumpRevision(now);
                return selectById(handle, id);
            }, ResourceNotFoundException.class);
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public void deleteEntry(long id)
        throws ResourceNotFoundException
    {
        try {
            transaction((handle, dao) -> {
                ScheduleRefs refs = requiredResource(selectRefs(handle, id), "schedule entry id=%d", id);
                dao.deleteTask(id);
                deleteSchedule(dao, refs);
                dao.bumpRevision(storeNow());
                return null;
            }, ResourceNotFoundException.class);
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public StoredScheduleEntry getEntryById(long id)
        throws ResourceNotFoundException
    {
        try {
            return requiredResource(
                    autoCommit((handle, dao) -> findOne(handle.createQuery(SELECT_ENTRIES + " where pt.id = :id")
                            .bind("id", id))),
                    "schedule entry id=%d", id);
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    @Override
    public StoredScheduleEntry getEntryByName(String name)
        throws ResourceNotFoundException
    {
        try {
            return requiredResource(
                    autoCommit((handle, dao) -> findOne(handle.createQuery(SELECT_ENTRIES + " where pt.name = :name")
                            .bind("name", name))),
                    "schedule entry name=%s", name);
        }
        catch (JdbiException ex) {
            throw storeFailure(ex);
        }
    }

    private StoredScheduleEntry selectById(Handle handle, long id)
    {
        StoredScheduleEntry stored = findOne(handle.createQuery(SELECT_ENTRIES + " where pt.id = :id")
                .bind("id", id));
        if (stored == null) {
            throw new IllegalStateException("Schedule entry id=" + id + " can't be read back");
        }
        return stored;
    }

    private static List<StoredScheduleEntry> collect(Query query)
    {
        try (Stream<StoredScheduleEntry> stream = query.mapTo(StoredScheduleEntry.class).stream()) {
            return stream.filter(Objects::nonNull).collect(Collectors.toList());
        }
    }

    private static StoredScheduleEntry findOne(Query query)
    {
        List<StoredScheduleEntry> list = collect(query);
        return list.isEmpty() ? null : list.get(0);
    }

    private static ScheduleRefs selectRefs(Handle handle, long id)
    {
        return handle.createQuery("select interval_id, crontab_id, solar_id, clocked_id from periodic_tasks where id = :id")
            .bind("id", id)
            .map((r, ctx) -> new ScheduleRefs(
                        getOptionalLong(r, "interval_id").orNull(),
                        getOptionalLong(r, "crontab_id").orNull(),
                        getOptionalLong(r, "solar_id").orNull(),
                        getOptionalLong(r, "clocked_id").orNull()))
            .findOne()
            .orElse(null);
    }

    private static ScheduleRefs insertSchedule(Dao dao, ScheduleVariant schedule)
    {
        switch (schedule.getKind()) {
        case INTERVAL:
            {
                IntervalSchedule interval = schedule.getInterval().get();
                return ScheduleRefs.interval(
                        dao.insertInterval(interval.getEvery(), interval.getPeriod().getName()));
            }
        case CRONTAB:
            {
                CrontabSchedule crontab = schedule.getCrontab().get();
                return ScheduleRefs.crontab(
                        dao.insertCrontab(crontab.getMinute(), crontab.getHour(),
                            crontab.getDayOfMonth(), crontab.getMonthOfYear(), crontab.getDayOfWeek(),
                            crontab.getTimezone().getId()));
            }
        case SOLAR:
            {
                SolarSchedule solar = schedule.getSolar().get();
                return ScheduleRefs.solar(
                        dao.insertSolar(solar.getEvent().getName(), solar.getLatitude(), solar.getLongitude()));
            }
        case CLOCKED:
            return ScheduleRefs.clocked(
                    dao.insertClocked(schedule.getClocked().get().getClockedTime()));
        default:
            throw new AssertionError("Unknown schedule kind: " + schedule.getKind());
        }
    }

    private static void deleteSchedule(Dao dao, ScheduleRefs refs)
    {
        if (refs.intervalId != null) {
            dao.deleteInterval(refs.intervalId);
        }
        if (refs.crontabId != null) {
            dao.deleteCrontab(refs.crontabId);
        }
        if (refs.solarId != null) {
            dao.deleteSolar(refs.solarId);
        }
        if (refs.clockedId != null) {
            dao.deleteClocked(refs.clockedId);
        }
    }

    private static class ScheduleRefs
    {
        private final Long intervalId;
        private final Long crontabId;
        private final Long solarId;
        private final Long clockedId;

        ScheduleRefs(Long intervalId, Long crontabId, Long solarId, Long clockedId)
        {
            this.intervalId = intervalId;
            this.crontabId = crontabId;
            this.solarId = solarId;
            this.clockedId = clockedId;
        }

        static ScheduleRefs interval(long id)
        {
            return new ScheduleRefs(id, null, null, null);
        }

        static ScheduleRefs crontab(long id)
        {
            return new ScheduleRefs(null, id, null, null);
        }

        static ScheduleRefs solar(long id)
        {
            return new ScheduleRefs(null, null, id, null);
        }

        static ScheduleRefs clocked(long id)
        {
            return new ScheduleRefs(null, null, null, id);
        }
    }

    public interface Dao
    {
        @SqlQuery("select revision from periodic_tasks_changed where id = 1")
        long getRevision();

        @SqlUpdate("update periodic_tasks_changed" +
                " set revision = revision + 1, last_update = :now" +
                " where id = 1")
        int bumpRevision(@Bind("now") Instant now);

        @SqlUpdate("insert into interval_schedules (every_amount, period_unit) values (:every, :period)")
        @GetGeneratedKeys("id")
        long insertInterval(@Bind("every") long every, @Bind("period") String period);

        @SqlUpdate("insert into crontab_schedules" +
                " (minute_expr, hour_expr, day_of_month, month_of_year, day_of_week, timezone)" +
                " values (:minute, :hour, :dayOfMonth, :monthOfYear, :dayOfWeek, :timezone)")
        @GetGeneratedKeys("id")
        long insertCrontab(@Bind("minute") String minute, @Bind("hour") String hour,
                @Bind("dayOfMonth") String dayOfMonth, @Bind("monthOfYear") String monthOfYear,
                @Bind("dayOfWeek") String dayOfWeek, @Bind("timezone") String timezone);

        @SqlUpdate("insert into solar_schedules (solar_event, latitude, longitude) values (:event, :latitude, :longitude)")
        @GetGeneratedKeys("id")
        long insertSolar(@Bind("event") String event, @Bind("latitude") double latitude, @Bind("longitude") double longitude);

        @SqlUpdate("insert into clocked_schedules (clocked_time) values (:clockedTime)")
        @GetGeneratedKeys("id")
        long insertClocked(@Bind("clockedTime") Instant clockedTime);

        @SqlUpdate("delete from interval_schedules where id = :id")
        int deleteInterval(@Bind("id") long id);

        @SqlUpdate("delete from crontab_schedules where id = :id")
        int deleteCrontab(@Bind("id") long id);

        @SqlUpdate("delete from solar_schedules where id = :id")
        int deleteSolar(@Bind("id") long id);

        @SqlUpdate("delete from clocked_schedules where id = :id")
        int deleteClocked(@Bind("id") long id);

        @SqlUpdate("insert into periodic_tasks" +
                " (name, task, interval_id, crontab_id, solar_id, clocked_id, args, kwargs," +
                " queue, exchange, routing_key, priority, headers, expires, expire_seconds," +
                " one_off, start_time, enabled, total_run_count, description, created_at, updated_at)" +
                " values (:name, :task, :intervalId, :crontabId, :solarId, :clockedId, :args, :kwargs," +
                " :queue, :exchange, :routingKey, :priority, :headers, :expires, :expireSeconds," +
                " :oneOff, :startTime, :enabled, 0, :description, :now, :now)")
        @GetGeneratedKeys("id")
        long insertTask(@Bind("name") String name, @Bind("task") String task,
                @Bind("intervalId") Long intervalId, @Bind("crontabId") Long crontabId,
                @Bind("solarId") Long solarId, @Bind("clockedId") Long clockedId,
                @Bind("args") String args, @Bind("kwargs") Config kwargs,
                @Bind("queue") String queue, @Bind("exchange") String exchange, @Bind("routingKey") String routingKey,
                @Bind("priority") Integer priority, @Bind("headers") Config headers,
                @Bind("expires") Instant expires, @Bind("expireSeconds") Long expireSeconds,
                @Bind("oneOff") boolean oneOff, @Bind("startTime") Instant startTime, @Bind("enabled") boolean enabled,
                @Bind("description") String description, @Bind("now") Instant now);

        // last_run_at is cleared when the entry gets disabled
        @SqlUpdate("update periodic_tasks" +
                " set name = :name, task = :task," +
                " interval_id = :intervalId, crontab_id = :crontabId, solar_id = :solarId, clocked_id = :clockedId," +
                " args = :args, kwargs = :kwargs, queue = :queue, exchange = :exchange, routing_key = :routingKey," +
                " priority = :priority, headers = :headers, expires = :expires, expire_seconds = :expireSeconds," +
                " one_off = :oneOff, start_time = :startTime, enabled = :enabled," +
                " last_run_at = case when :enabled then last_run_at else null end," +
                " description = :description, updated_at = :now" +
                " where id = :id")
        int updateTask(@Bind("id") long id,
                @Bind("name") String name, @Bind("task") String task,
                @Bind("intervalId") Long intervalId, @Bind("crontabId") Long crontabId,
                @Bind("solarId") Long solarId, @Bind("clockedId") Long clockedId,
                @Bind("args") String args, @Bind("kwargs") Config kwargs,
                @Bind("queue") String queue, @Bind("exchange") String exchange, @Bind("routingKey") String routingKey,
                @Bind("priority") Integer priority, @Bind("headers") Config headers,
                @Bind("expires") Instant expires, @Bind("expireSeconds") Long expireSeconds,
                @Bind("oneOff") boolean oneOff, @Bind("startTime") Instant startTime, @Bind("enabled") boolean enabled,
                @Bind("description") String description, @Bind("now") Instant now);

        @SqlUpdate("update periodic_tasks" +
                " set enabled = :enabled," +
                " last_run_at = case when :enabled then last_run_at else null end," +
                " updated_at = :now" +
                " where id = :id")
        int updateEnabled(@Bind("id") long id, @Bind("enabled") boolean enabled, @Bind("now") Instant now);

        // updated_at stays. run bookkeeping is not a definition change.
        @SqlUpdate("update periodic_tasks" +
                " set last_run_at = coalesce(:lastRunAt, last_run_at)," +
                " total_run_count = greatest(total_run_count, :totalRunCount)," +
                " enabled = case when :disable then false else enabled end" +
                " where id = :id")
        int updateRunState(@Bind("id") long id, @Bind("lastRunAt") Instant lastRunAt,
                @Bind("totalRunCount") long totalRunCount, @Bind("disable") boolean disable);

        @SqlUpdate("delete from periodic_tasks where id = :id")
        int deleteTask(@Bind("id") long id);
    }

    static class StoredScheduleEntryMapper
            implements RowMapper<StoredScheduleEntry>
    {
        private static final Logger logger = LoggerFactory.getLogger(DatabaseEntryStore.class);

        private final ConfigMapper cfm;

        StoredScheduleEntryMapper(ConfigMapper cfm)
        {
            this.cfm = cfm;
        }

        /**
         * @return null if the row does not form a valid entry
         */
        @Override
        public StoredScheduleEntry map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            long id = r.getLong("id");
            String name = r.getString("name");
            try {
                return new ImmutableStoredScheduleEntry.Builder()
                    .id(id)
                    .name(name)
                    .task(r.getString("task"))
                    .schedule(ScheduleVariant.fromPayloads(interval(r), crontab(r), solar(r), clocked(r)))
                    .args(cfm.arrayFromResultSetOrEmpty(r, "args"))
                    .kwargs(cfm.fromResultSetOrEmpty(r, "kwargs"))
                    .queue(getOptionalString(r, "queue"))
                    .exchange(getOptionalString(r, "exchange"))
                    .routingKey(getOptionalString(r, "routing_key"))
                    .priority(getOptionalInt(r, "priority"))
                    .headers(cfm.fromResultSetOrEmpty(r, "headers"))
                    .expires(getOptionalTimestampInstant(r, "expires"))
                    .expireSeconds(getOptionalLong(r, "expire_seconds"))
                    .oneOff(r.getBoolean("one_off"))
                    .startTime(getOptionalTimestampInstant(r, "start_time"))
                    .enabled(r.getBoolean("enabled"))
                    .lastRunAt(getOptionalTimestampInstant(r, "last_run_at"))
                    .totalRunCount(r.getLong("total_run_count"))
                    .description(getOptionalString(r, "description"))
                    .createdAt(getTimestampInstant(r, "created_at"))
                    .updatedAt(getTimestampInstant(r, "updated_at"))
                    .build();
            }
            catch (ConfigException | DateTimeException ex) {
                logger.warn("Skipping invalid schedule entry id={} name={}: {}", id, name, ex.getMessage());
                return null;
            }
        }

        private static IntervalSchedule interval(ResultSet r)
                throws SQLException
        {
            Optional<Long> every = getOptionalLong(r, "every_amount");
            if (!every.isPresent()) {
                return null;
            }
            return IntervalSchedule.of(every.get(), IntervalPeriod.fromName(r.getString("period_unit")));
        }

        private static CrontabSchedule crontab(ResultSet r)
                throws SQLException
        {
            Optional<String> minute = getOptionalString(r, "minute_expr");
            if (!minute.isPresent()) {
                return null;
            }
            return CrontabSchedule.builder()
                .minute(minute.get())
                .hour(r.getString("hour_expr"))
                .dayOfMonth(r.getString("day_of_month"))
                .monthOfYear(r.getString("month_of_year"))
                .dayOfWeek(r.getString("day_of_week"))
                .timezone(ZoneId.of(r.getString("timezone")))
                .build();
        }

        private static SolarSchedule solar(ResultSet r)
                throws SQLException
        {
            Optional<String> event = getOptionalString(r, "solar_event");
            if (!event.isPresent()) {
                return null;
            }
            return SolarSchedule.of(SolarEvent.fromName(event.get()),
                    r.getDouble("latitude"), r.getDouble("longitude"));
        }

        private static ClockedSchedule clocked(ResultSet r)
                throws SQLException
        {
            Optional<Instant> clockedTime = getOptionalTimestampInstant(r, "clocked_time");
            if (!clockedTime.isPresent()) {
                return null;
            }
            return ClockedSchedule.of(clockedTime.get());
        }
    }
}
