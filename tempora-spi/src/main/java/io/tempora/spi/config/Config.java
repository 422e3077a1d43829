package io.tempora.spi.config;

import java.util.List;
import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import static java.util.Locale.ENGLISH;

/**
 * A JSON object with typed accessors.
 *
 * Holds both the system configuration (flat dotted keys loaded from
 * properties, so scalars often arrive as strings) and the payloads of
 * schedule entries (kwargs, headers). Values are converted on read with
 * the ObjectMapper of the {@link ConfigFactory} that made this object.
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper, ObjectNode object)
    {
        this.mapper = mapper;
        this.object = object;
    }

    @JsonCreator
    public static Config deserializeFromJackson(@JacksonInject ObjectMapper mapper, JsonNode node)
    {
        if (!node.isObject()) {
            throw new RuntimeJsonMappingException("Expected object but got " + node);
        }
        return new Config(mapper, (ObjectNode) node);
    }

    @JsonValue
    public ObjectNode getInternalObjectNode()
    {
        return object;
    }

    /**
     * Sets {@code key} to the JSON form of {@code value}. A null value
     * removes the key.
     */
    public Config set(String key, Object value)
    {
        if (value == null) {
            object.remove(key);
        }
        else {
            object.set(key, mapper.valueToTree(value));
        }
        return this;
    }

    public Config deepCopy()
    {
        return new Config(mapper, object.deepCopy());
    }

    public List<String> getKeys()
    {
        return ImmutableList.copyOf(object.fieldNames());
    }

    public boolean isEmpty()
    {
        return object.size() == 0;
    }

    public boolean has(String key)
    {
        return object.has(key);
    }

    public <E> E get(String key, Class<E> type)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            throw new ConfigException("Parameter '" + key + "' is required but not set");
        }
        return convert(key, value, type);
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return convert(key, value, type);
    }

    public <E> Optional<E> getOptional(String key, Class<E> type)
    {
        return Optional.fromNullable(get(key, type, null));
    }

    public Config getNested(String key)
    {
        JsonNode value = object.get(key);
        if (value == null || !value.isObject()) {
            throw new ConfigException("Parameter '" + key + "' must be an object");
        }
        return new Config(mapper, (ObjectNode) value);
    }

    private <E> E convert(String key, JsonNode value, Class<E> type)
    {
        try {
            return mapper.treeToValue(value, type);
        }
        catch (JsonProcessingException | IllegalArgumentException ex) {
            if (ex.getCause() instanceof ConfigException) {
                throw (ConfigException) ex.getCause();
            }
            String sample = value.toString();
            if (sample.length() > 100) {
                sample = sample.substring(0, 97) + "...";
            }
            throw new ConfigException(String.format(ENGLISH, "Expected %s for key '%s' but got %s",
                        type.getSimpleName(), key, sample), ex);
        }
    }

    @Override
    public String toString()
    {
        return object.toString();
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof Config && object.equals(((Config) other).object);
    }

    @Override
    public int hashCode()
    {
        return object.hashCode();
    }
}
