package io.tempora.core.database;

import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Inject;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigException;
import io.tempora.spi.config.ConfigFactory;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Converts JSON columns from and to {@link Config} objects and argument
 * arrays.
 */
public class ConfigMapper
{
    private final ObjectMapper jsonTreeMapper;
    private final ConfigFactory cf;

    @Inject
    public ConfigMapper(ConfigFactory cf)
    {
        this.jsonTreeMapper = new ObjectMapper();
        this.cf = cf;
    }

    public ConfigArgumentFactory getArgumentFactory()
    {
        return new ConfigArgumentFactory();
    }

    public Config fromResultSetOrEmpty(ResultSet rs, String column)
            throws SQLException
    {
        String text = rs.getString(column);
        if (rs.wasNull()) {
            return cf.create();
        }
        JsonNode node = readTree(text, column);
        if (!(node instanceof ObjectNode)) {
            throw new ConfigException("Stored " + column + " must be an object: " + text);
        }
        return cf.create((ObjectNode) node);
    }

    public ArrayNode arrayFromResultSetOrEmpty(ResultSet rs, String column)
            throws SQLException
    {
        String text = rs.getString(column);
        if (rs.wasNull()) {
            return jsonTreeMapper.createArrayNode();
        }
        JsonNode node = readTree(text, column);
        if (!(node instanceof ArrayNode)) {
            throw new ConfigException("Stored " + column + " must be an array: " + text);
        }
        return (ArrayNode) node;
    }

    private JsonNode readTree(String text, String column)
    {
        try {
            return jsonTreeMapper.readTree(text);
        }
        catch (IOException ex) {
            throw new ConfigException("Stored " + column + " is not valid JSON", ex);
        }
    }

    public String toText(Config config)
    {
        return toText(config.getInternalObjectNode());
    }

    public String toText(JsonNode node)
    {
        try {
            return jsonTreeMapper.writeValueAsString(node);
        }
        catch (IOException ex) {
            throw new ConfigException("Failed to serialize " + node, ex);
        }
    }

    public String toBinding(Config config)
    {
        if (config == null || config.isEmpty()) {
            return null;
        }
        return toText(config);
    }

    public class ConfigArgumentFactory
            extends AbstractArgumentFactory<Config>
    {
        public ConfigArgumentFactory()
        {
            super(Types.CLOB);
        }

        @Override
        protected Argument build(Config value, ConfigRegistry config)
        {
            return new ConfigArgument(value);
        }
    }

    public class ConfigArgument
            implements Argument
    {
        private final Config config;

        public ConfigArgument(Config config)
        {
            this.config = config;
        }

        @Override
        public void apply(int position, PreparedStatement statement, StatementContext ctx)
                throws SQLException
        {
            String text = toBinding(config);
            if (text == null) {
                statement.setNull(position, Types.CLOB);
            }
            else {
                statement.setString(position, text);
            }
        }

        @Override
        public String toString()
        {
            return String.valueOf(config);
        }
    }
}
