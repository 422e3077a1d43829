package io.tempora.core.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigException;
import org.immutables.value.Value;

import static java.util.Locale.ENGLISH;

/**
 * Connection settings read from {@code database.*} keys.
 *
 * H2 runs in memory unless {@code database.path} is set. PostgreSQL needs
 * host, user and database, and is pooled by HikariCP.
 */
@Value.Immutable
public abstract class DatabaseConfig
{
    public abstract DatabaseType getType();

    public abstract Optional<String> getPath();

    public abstract Optional<String> getHost();

    public abstract Optional<Integer> getPort();

    public abstract Optional<String> getUser();

    @Value.Default
    public String getPassword()
    {
        return "";
    }

    public abstract Optional<String> getDatabase();

    public abstract Optional<String> getSslmode();

    /**
     * Extra JDBC driver properties from {@code database.opts.*}.
     */
    public abstract Map<String, String> getOptions();

    @Value.Default
    public boolean getAutoMigrate()
    {
        return true;
    }

    // seconds
    @Value.Default
    public int getConnectionTimeout()
    {
        return 30;
    }

    // one scheduler thread plus admin callers
    @Value.Default
    public int getMaximumPoolSize()
    {
        return 4;
    }

    @Value.Default
    public int getMinimumPoolSize()
    {
        return 1;
    }

    public static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    @Value.Check
    protected void check()
    {
        if (getType() == DatabaseType.POSTGRESQL
                && !(getHost().isPresent() && getUser().isPresent() && getDatabase().isPresent())) {
            throw new ConfigException("database.host, database.user and database.database are required for postgresql");
        }
    }

    public static DatabaseConfig convertFrom(Config config)
    {
        String typeName = config.get("database.type", String.class, "memory");
        ImmutableDatabaseConfig.Builder builder = builder()
            .type(DatabaseType.fromConfigName(typeName))
            .host(config.getOptional("database.host", String.class))
            .port(config.getOptional("database.port", Integer.class))
            .user(config.getOptional("database.user", String.class))
            .password(config.get("database.password", String.class, ""))
            .database(config.getOptional("database.database", String.class))
            .sslmode(config.getOptional("database.sslmode", String.class))
            .autoMigrate(config.get("database.migrate", boolean.class, true))
            .connectionTimeout(config.get("database.connectionTimeout", int.class, 30))
            .maximumPoolSize(config.get("database.maximumPoolSize", int.class, 4))
            .minimumPoolSize(config.get("database.minimumPoolSize", int.class, 1));

        if (typeName.equals("h2")) {
            builder.path(config.get("database.path", String.class));
        }

        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        for (String key : config.getKeys()) {
            if (key.startsWith("database.opts.")) {
                options.put(key.substring("database.opts.".length()), config.get(key, String.class));
            }
        }
        return builder.options(options.build()).build();
    }

    /**
     * JDBC URL. Creates the directory of a file-based H2 database.
     */
    public String getJdbcUrl()
    {
        switch (getType()) {
        case H2:
            if (!getPath().isPresent()) {
                return "jdbc:h2:mem:tempora-" + UUID.randomUUID();
            }
            Path dir = Paths.get(getPath().get()).toAbsolutePath();
            try {
                Files.createDirectories(dir);
            }
            catch (IOException ex) {
                throw new ConfigException("Failed to create database directory " + dir, ex);
            }
            return "jdbc:h2:" + dir.resolve("tempora");
        case POSTGRESQL:
            if (getPort().isPresent()) {
                return String.format(ENGLISH, "jdbc:postgresql://%s:%d/%s", getHost().get(), getPort().get(), getDatabase().get());
            }
            return String.format(ENGLISH, "jdbc:postgresql://%s/%s", getHost().get(), getDatabase().get());
        default:
            throw new AssertionError("Unknown database type: " + getType());
        }
    }

    public Properties getJdbcProperties()
    {
        Properties props = new Properties();
        if (getType() == DatabaseType.POSTGRESQL) {
            props.setProperty("user", getUser().get());
            props.setProperty("password", getPassword());
            props.setProperty("tcpKeepAlive", "true");
            if (getSslmode().isPresent()) {
                props.setProperty("sslmode", getSslmode().get());
            }
        }
        props.putAll(getOptions());
        return props;
    }
}
