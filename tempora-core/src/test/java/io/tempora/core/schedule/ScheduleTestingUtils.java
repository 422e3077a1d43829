package io.tempora.core.schedule;

import java.time.Instant;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigFactory;
import io.tempora.spi.config.ObjectMappers;
import io.tempora.spi.schedule.ScheduleVariant;

class ScheduleTestingUtils
{
    private ScheduleTestingUtils() { }

    static final Instant CREATED_AT = Instant.parse("2024-01-01T00:00:00Z");

    static Config newConfig()
    {
        return new ConfigFactory(ObjectMappers.objectMapper()).create();
    }

    static ImmutableStoredScheduleEntry.Builder storedEntryBuilder(long id, String name, ScheduleVariant schedule, Instant updatedAt)
    {
        return new ImmutableStoredScheduleEntry.Builder()
            .id(id)
            .name(name)
            .task("proj.tasks." + name)
            .kwargs(newConfig())
            .headers(newConfig())
            .schedule(schedule)
            .totalRunCount(0)
            .createdAt(CREATED_AT)
            .updatedAt(updatedAt);
    }

    static StoredScheduleEntry storedEntry(long id, String name, ScheduleVariant schedule, Instant updatedAt)
    {
        return storedEntryBuilder(id, name, schedule, updatedAt).build();
    }
}
