package io.tempora.core.database;

import javax.sql.DataSource;
import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.tempora.core.schedule.EntryStore;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(Jdbi.class).toProvider(JdbiProvider.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(ConfigMapper.class).in(Scopes.SINGLETON);
        binder.bind(DatabaseMigrator.class).in(Scopes.SINGLETON);
        binder.bind(EntryStore.class).to(DatabaseEntryStore.class).in(Scopes.SINGLETON);
    }

    /**
     * Applies pending migrations when constructed if database.migrate is
     * enabled. Stores depend on it so that the schema exists before use.
     */
    public static class AutoMigrator
    {
        @Inject
        public AutoMigrator(DatabaseMigrator migrator, DatabaseConfig config)
        {
            if (config.getAutoMigrate()) {
                migrator.migrate();
            }
        }
    }

    /**
     * Jdbi with the row mapper and JSON argument factory of the entry store.
     */
    public static class JdbiProvider
            implements Provider<Jdbi>
    {
        private final DataSource ds;
        private final ConfigMapper configMapper;

        @Inject
        public JdbiProvider(DataSource ds, ConfigMapper configMapper)
        {
            this.ds = ds;
            this.configMapper = configMapper;
        }

        @Override
        public Jdbi get()
        {
            return createJdbi(ds, configMapper);
        }
    }

    public static Jdbi createJdbi(DataSource ds, ConfigMapper configMapper)
    {
        Jdbi dbi = Jdbi.create(ds);
        dbi.registerRowMapper(new DatabaseEntryStore.StoredScheduleEntryMapper(configMapper));
        dbi.registerArgument(configMapper.getArgumentFactory());
        dbi.installPlugin(new SqlObjectPlugin());
        return dbi;
    }
}
