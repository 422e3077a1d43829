package io.tempora.core.database.migrate;

import io.tempora.core.database.DatabaseType;
import org.jdbi.v3.core.Handle;

import static io.tempora.core.database.migrate.CreateTableBuilder.createTable;

public class Migration_20240601000000_CreateScheduleTables
        implements Migration
{
    @Override
    public void migrate(Handle handle, DatabaseType type)
    {
        handle.execute(
                createTable(type, "interval_schedules")
                .addLongId("id")
                .addLong("every_amount", "not null")
                .addString("period_unit", "not null")
                .build());

        handle.execute(
                createTable(type, "crontab_schedules")
                .addLongId("id")
                .addString("minute_expr", "not null")
                .addString("hour_expr", "not null")
                .addString("day_of_month", "not null")
                .addString("month_of_year", "not null")
                .addString("day_of_week", "not null")
                .addString("timezone", "not null")
                .build());

        handle.execute(
                createTable(type, "solar_schedules")
                .addLongId("id")
                .addString("solar_event", "not null")
                .addDouble("latitude", "not null")
                .addDouble("longitude", "not null")
                .build());

        handle.execute(
                createTable(type, "clocked_schedules")
                .addLongId("id")
                .addTimestamp("clocked_time", "not null")
                .build());

        // kwargs and headers are JSON objects. args is a JSON array.
        handle.execute(
                createTable(type, "periodic_tasks")
                .addLongId("id")
                .addString("name", "not null")
                .addString("task", "not null")
                .addLong("interval_id", "references interval_schedules (id)")
                .addLong("crontab_id", "references crontab_schedules (id)")
                .addLong("solar_id", "references solar_schedules (id)")
                .addLong("clocked_id", "references clocked_schedules (id)")
                .addMediumText("args", "")
                .addMediumText("kwargs", "")
                .addString("queue", "")
                .addString("exchange", "")
                .addString("routing_key", "")
                .addInt("priority", "")
                .addMediumText("headers", "")
                .addTimestamp("expires", "")
                .addLong("expire_seconds", "")
                .addBoolean("one_off", "not null")
                .addTimestamp("start_time", "")
                .addBoolean("enabled", "not null")
                .addTimestamp("last_run_at", "")
                .addLong("total_run_count", "not null")
                .addMediumText("description", "")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create unique index periodic_tasks_on_name on periodic_tasks (name)");
        handle.execute("create index periodic_tasks_on_updated_at on periodic_tasks (updated_at)");

        // single row bumped on every change the schedulers must pick up
        handle.execute(
                createTable(type, "periodic_tasks_changed")
                .addIntIdNoAutoIncrement("id")
                .addLong("revision", "not null")
                .addTimestamp("last_update", "not null")
                .build());
        handle.execute("insert into periodic_tasks_changed (id, revision, last_update) values (1, 0, now())");
    }
}
