package io.tempora.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.tempora.spi.dispatch.DispatchRequest;
import io.tempora.spi.dispatch.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each dispatch request to the log as JSON instead of sending it
 * to a task-queue runtime.
 */
public class LoggingTaskDispatcher
        implements TaskDispatcher
{
    private static final Logger logger = LoggerFactory.getLogger(LoggingTaskDispatcher.class);

    private final ObjectMapper mapper;

    @Inject
    public LoggingTaskDispatcher(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    @Override
    public void dispatch(DispatchRequest request)
    {
        logger.info("Dispatch {}", toJson(request));
    }

    String toJson(DispatchRequest request)
    {
        try {
            return mapper.writeValueAsString(request);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize dispatch request of " + request.getEntryName(), ex);
        }
    }
}
