package io.tempora.core.database;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;
import java.util.Properties;
import com.google.common.collect.Lists;
import io.tempora.commons.ThrowablesUtil;
import io.tempora.core.repository.ResourceConflictException;
import io.tempora.core.repository.ResourceNotFoundException;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigFactory;
import io.tempora.spi.config.ObjectMappers;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import static org.junit.Assert.fail;

public class DatabaseTestingUtils
{
    private DatabaseTestingUtils() { }

    /**
     * In-memory H2 unless TEMPORA_TEST_POSTGRESQL holds connection
     * properties such as host, user and database.
     */
    public static DatabaseConfig getEnvironmentDatabaseConfig()
    {
        String pg = System.getenv("TEMPORA_TEST_POSTGRESQL");
        if (pg != null && !pg.isEmpty()) {
            Properties props = new Properties();
            try (StringReader reader = new StringReader(pg)) {
                props.load(reader);
            }
            catch (IOException ex) {
                throw ThrowablesUtil.propagate(ex);
            }

            Config config = createConfig();
            for (String key : props.stringPropertyNames()) {
                config.set("database." + key, props.getProperty(key));
            }
            config.set("database.type", "postgresql");

            return DatabaseConfig.convertFrom(config);
        }
        else {
            return DatabaseConfig.builder()
                .type(DatabaseType.H2)
                .build();
        }
    }

    public static DatabaseFactory setupDatabase()
    {
        DatabaseConfig config = getEnvironmentDatabaseConfig();
        DataSourceProvider dsp = new DataSourceProvider(config);

        Jdbi dbi = DatabaseModule.createJdbi(dsp.get(), createConfigMapper());
        new DatabaseMigrator(dbi, config).migrate();

        cleanDatabase(config.getType(), dbi);

        return new DatabaseFactory(new ThreadLocalTransactionManager(dbi), dbi, dsp, config);
    }

    public static final String[] ALL_TABLES = new String[] {
        "interval_schedules",
        "crontab_schedules",
        "solar_schedules",
        "clocked_schedules",
        "periodic_tasks",
    };

    public static void cleanDatabase(DatabaseType type, Jdbi dbi)
    {
        try (Handle handle = dbi.open()) {
            switch (type) {
            case H2:
                // h2 database can't truncate tables with references if REFERENTIAL_INTEGRITY is true (default)
                handle.execute("SET REFERENTIAL_INTEGRITY FALSE");
                for (String name : Lists.reverse(Arrays.asList(ALL_TABLES))) {
                    handle.execute("TRUNCATE TABLE " + name);
                }
                handle.execute("SET REFERENTIAL_INTEGRITY TRUE");
                break;
            default:
                // postgresql needs "CASCADE" option to TRUNCATE
                for (String name : Lists.reverse(Arrays.asList(ALL_TABLES))) {
                    handle.execute("TRUNCATE " + name + " CASCADE");
                }
                break;
            }
            handle.execute("update periodic_tasks_changed set revision = 0 where id = 1");
        }
    }

    public static ConfigFactory createConfigFactory()
    {
        return new ConfigFactory(ObjectMappers.objectMapper());
    }

    public static ConfigMapper createConfigMapper()
    {
        return new ConfigMapper(createConfigFactory());
    }

    public static Config createConfig()
    {
        return createConfigFactory().create();
    }

    public interface StoreAction
    {
        void run() throws ResourceNotFoundException, ResourceConflictException;
    }

    public static void assertNotFound(StoreAction r)
    {
        try {
            r.run();
            fail();
        }
        catch (ResourceNotFoundException ex) {
        }
        catch (ResourceConflictException ex) {
            throw new AssertionError("Expected not found but conflicted", ex);
        }
    }

    public static void assertConflict(StoreAction r)
    {
        try {
            r.run();
            fail();
        }
        catch (ResourceConflictException ex) {
        }
        catch (ResourceNotFoundException ex) {
            throw new AssertionError("Expected conflict but not found", ex);
        }
    }
}
