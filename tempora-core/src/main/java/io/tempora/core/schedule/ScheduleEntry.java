package io.tempora.core.schedule;

import java.time.Instant;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.base.Optional;
import io.tempora.spi.config.Config;
import io.tempora.spi.schedule.ScheduleKind;
import io.tempora.spi.schedule.ScheduleValidator;
import io.tempora.spi.schedule.ScheduleVariant;
import org.immutables.value.Value;

/**
 * Definition of a periodic task: what to send to the task-queue runtime
 * and when.
 */
@Value.Immutable
public abstract class ScheduleEntry
{
    public abstract String getName();

    public abstract String getTask();

    @Value.Default
    public ArrayNode getArgs()
    {
        return JsonNodeFactory.instance.arrayNode();
    }

    public abstract Config getKwargs();

    public abstract ScheduleVariant getSchedule();

    @Value.Default
    public boolean getEnabled()
    {
        return true;
    }

    @Value.Default
    public boolean getOneOff()
    {
        return false;
    }

    public abstract Optional<String> getQueue();

    public abstract Optional<String> getExchange();

    public abstract Optional<String> getRoutingKey();

    public abstract Optional<Integer> getPriority();

    public abstract Config getHeaders();

    /**
     * Absolute expiry. Once passed, the entry is disabled instead of run.
     */
    public abstract Optional<Instant> getExpires();

    /**
     * Expiry of each dispatched message, relative to its dispatch time.
     */
    public abstract Optional<Long> getExpireSeconds();

    public abstract Optional<Instant> getStartTime();

    public abstract Optional<String> getDescription();

    public static ImmutableScheduleEntry.Builder builder()
    {
        return ImmutableScheduleEntry.builder();
    }

    @Value.Check
    protected void check()
    {
        ScheduleValidator validator = ScheduleValidator.builder()
            .checkNotEmpty("name", getName())
            .checkMaxLength("name", getName(), 200)
            .checkNotEmpty("task", getTask())
            .checkMaxLength("task", getTask(), 200)
            .check("one_off", getOneOff(),
                    getSchedule().getKind() != ScheduleKind.CLOCKED || getOneOff(),
                    "clocked must be one off, one_off must set true")
            .check("expires", getExpires().orNull(),
                    !getExpires().isPresent() || !getExpireSeconds().isPresent(),
                    "only one can be set, in expires and expire_seconds");
        if (getExpireSeconds().isPresent()) {
            validator.check("expire_seconds", getExpireSeconds().get(), getExpireSeconds().get() >= 0, "must not be negative");
        }
        if (getPriority().isPresent()) {
            validator.checkRange("priority", getPriority().get(), 0, 255);
        }
        checkOptionLength(validator, "queue", getQueue());
        checkOptionLength(validator, "exchange", getExchange());
        checkOptionLength(validator, "routing_key", getRoutingKey());
        checkOptionLength(validator, "description", getDescription());
        validator.validate("schedule entry", this);
    }

    private static void checkOptionLength(ScheduleValidator validator, String fieldName, Optional<String> value)
    {
        if (value.isPresent()) {
            validator.checkMaxLength(fieldName, value.get(), 200);
        }
    }

    @Override
    public String toString()
    {
        return getName() + ": " + getSchedule();
    }
}
