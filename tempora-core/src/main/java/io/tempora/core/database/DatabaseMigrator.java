package io.tempora.core.database;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.tempora.core.database.migrate.Migration;
import io.tempora.core.database.migrate.Migration_20240601000000_CreateScheduleTables;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.tempora.core.database.migrate.CreateTableBuilder.createTable;

/**
 * Applies the migrations missing from the schema_migrations table, oldest
 * first, each in its own transaction.
 */
public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private static final List<Migration> MIGRATIONS = ImmutableList.of(
            new Migration_20240601000000_CreateScheduleTables());

    private final Jdbi dbi;
    private final DatabaseType type;

    @Inject
    public DatabaseMigrator(Jdbi dbi, DatabaseConfig config)
    {
        this.dbi = dbi;
        this.type = config.getType();
    }

    /**
     * @return number of migrations applied by this call
     */
    public synchronized int migrate()
    {
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                handle.execute(createTable(type, "schema_migrations")
                        .addString("name", "not null")
                        .addTimestamp("created_at", "not null")
                        .build());
            }
        }

        int numApplied = 0;
        for (Migration m : getApplicableMigration()) {
            if (applyIfNotApplied(m)) {
                numApplied++;
            }
        }
        if (numApplied > 0) {
            logger.info("{} migrations applied.", numApplied);
        }
        return numApplied;
    }

    private boolean applyIfNotApplied(Migration m)
    {
        try (Handle handle = dbi.open()) {
            return handle.inTransaction(h -> {
                if (type == DatabaseType.POSTGRESQL) {
                    // other processes may migrate the same database
                    h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                    if (getAppliedVersions(h).contains(m.getVersion())) {
                        return false;
                    }
                }
                logger.debug("Applying database migration {}", m.getVersion());
                m.migrate(h, type);
                h.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
                return true;
            });
        }
    }

    /**
     * @return migrations not applied yet, oldest first
     */
    public List<Migration> getApplicableMigration()
    {
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                return MIGRATIONS;
            }
            Set<String> applied = getAppliedVersions(handle);
            return MIGRATIONS.stream()
                .filter(m -> !applied.contains(m.getVersion()))
                .collect(Collectors.toList());
        }
    }

    public boolean existsSchemaMigrationsTable()
    {
        try (Handle handle = dbi.open()) {
            return existsSchemaMigrationsTable(handle);
        }
    }

    private static Set<String> getAppliedVersions(Handle handle)
    {
        return handle.createQuery("select name from schema_migrations")
            .mapTo(String.class)
            .collect(Collectors.toSet());
    }

    private static boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                .mapTo(String.class)
                .list();
            return true;
        }
        catch (RuntimeException ex) {
            // the query fails when the table is missing
            return false;
        }
    }
}
