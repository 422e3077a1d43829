package io.tempora.cli;

import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import com.beust.jcommander.Parameter;
import io.tempora.core.database.DataSourceProvider;
import io.tempora.core.database.DatabaseConfig;
import io.tempora.core.database.DatabaseMigrator;
import io.tempora.core.database.migrate.Migration;
import io.tempora.spi.config.Config;
import org.jdbi.v3.core.Jdbi;

import static io.tempora.cli.ExitException.usageExit;

public class Migrate
    extends Command
{
    @Parameter(names = {"-o", "--database"})
    String database = null;

    private SubCommand subCommand = null;

    @Override
    public void main()
            throws Exception
    {
        checkArgs();
        DatabaseConfig dbConfig = DatabaseConfig.convertFrom(buildConfig());
        try (DataSourceProvider dsp = new DataSourceProvider(dbConfig)) {
            DatabaseMigrator migrator = new DatabaseMigrator(Jdbi.create(dsp.get()), dbConfig);
            switch (subCommand) {
            case RUN:
                runMigrate(migrator);
                break;
            case CHECK:
                checkMigrate(migrator);
                break;
            default:
                throw new AssertionError("Unknown sub command: " + subCommand);
            }
        }
    }

    private void runMigrate(DatabaseMigrator migrator)
    {
        int numApplied = migrator.migrate();
        if (numApplied == 0) {
            out.println("No update");
        }
        else {
            out.println("Migrations successfully finished");
        }
    }

    private void checkMigrate(DatabaseMigrator migrator)
    {
        if (!migrator.existsSchemaMigrationsTable()) {
            out.println("No table exist");
            return;
        }

        List<Migration> migrations = migrator.getApplicableMigration();
        for (Migration m : migrations) {
            out.println(m.getVersion());
        }
        if (migrations.isEmpty()) {
            out.println("No update");
        }
    }

    private void checkArgs()
        throws ExitException
    {
        if (args.size() != 1) {
            throw usage("Invalid parameters");
        }
        switch (args.get(0)) {
        case "run":
            subCommand = SubCommand.RUN;
            break;
        case "check":
            subCommand = SubCommand.CHECK;
            break;
        default:
            throw usage("Invalid command: " + args.get(0));
        }

        if (database == null && configPath == null) {
            throw usage("--database, or --config option is required");
        }
    }

    private Config buildConfig()
            throws Exception
    {
        Properties props = loadSystemProperties();
        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }
        return toSystemConfig(props);
    }

    @Override
    public ExitException usage(String error)
    {
        err.println("Usage: " + programName + " migrate (run|check)  run or check database migration");
        err.println("  Options:");
        err.println("    -o, --database DIR               path to H2 database");
        Main.showCommonOptions(env, err);
        return usageExit(error);
    }

    private enum SubCommand
    {
        RUN,
        CHECK;
    }
}
