package io.tempora.spi.dispatch;

import java.time.Instant;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.base.Optional;
import io.tempora.spi.config.Config;
import org.immutables.value.Value;

/**
 * A request to enqueue one run of a task on the task-queue runtime.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDispatchRequest.class)
@JsonDeserialize(as = ImmutableDispatchRequest.class)
public interface DispatchRequest
{
    /**
     * Name of the schedule entry that triggered this request.
     */
    String getEntryName();

    String getTask();

    ArrayNode getArgs();

    Config getKwargs();

    Optional<String> getQueue();

    Optional<String> getExchange();

    Optional<String> getRoutingKey();

    Optional<Integer> getPriority();

    /**
     * Message headers. Always includes {@code periodic_task_name}.
     */
    Config getHeaders();

    /**
     * The runtime should discard the message if it is not started by this time.
     */
    Optional<Instant> getExpires();

    /**
     * Time the scheduler decided to run the task.
     */
    Instant getScheduledAt();

    static ImmutableDispatchRequest.Builder builder()
    {
        return ImmutableDispatchRequest.builder();
    }
}
