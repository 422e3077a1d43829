package io.tempora.cli;

import java.time.Instant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.tempora.spi.config.ConfigFactory;
import io.tempora.spi.config.ObjectMappers;
import io.tempora.spi.dispatch.DispatchRequest;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class LoggingTaskDispatcherTest
{
    private final ObjectMapper mapper = ObjectMappers.objectMapper();
    private final ConfigFactory cf = new ConfigFactory(mapper);

    @Test
    public void writesRequestAsJson()
        throws Exception
    {
        DispatchRequest request = DispatchRequest.builder()
            .entryName("nightly")
            .task("proj.tasks.cleanup")
            .args(JsonNodeFactory.instance.arrayNode().add(1))
            .kwargs(cf.create().set("dry_run", true))
            .headers(cf.create().set("periodic_task_name", "nightly"))
            .queue("maintenance")
            .scheduledAt(Instant.parse("2024-06-01T00:00:00Z"))
            .build();

        LoggingTaskDispatcher dispatcher = new LoggingTaskDispatcher(mapper);
        JsonNode json = mapper.readTree(dispatcher.toJson(request));

        assertThat(json.get("task").asText(), is("proj.tasks.cleanup"));
        assertThat(json.get("queue").asText(), is("maintenance"));
        assertThat(json.get("args").get(0).asInt(), is(1));
        assertThat(json.get("kwargs").get("dry_run").asBoolean(), is(true));
        assertThat(json.get("headers").get("periodic_task_name").asText(), is("nightly"));

        // accepted without a runtime
        dispatcher.dispatch(request);
    }
}
