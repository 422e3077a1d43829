package io.tempora.spi.config;

import java.io.IOException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;

public class ConfigFactory
{
    private final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }

    public Config create()
    {
        return new Config(objectMapper, objectMapper.createObjectNode());
    }

    /**
     * Wraps a copy of the given object node.
     */
    public Config create(ObjectNode node)
    {
        return new Config(objectMapper, node.deepCopy());
    }

    public Config fromJsonString(String json)
    {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        }
        catch (IOException ex) {
            throw new ConfigException("Invalid JSON: " + ex.getMessage(), ex);
        }
        if (!node.isObject()) {
            throw new ConfigException("Expected object but got " + node);
        }
        return new Config(objectMapper, (ObjectNode) node);
    }
}
