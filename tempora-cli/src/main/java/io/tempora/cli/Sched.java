package io.tempora.cli;

import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import com.beust.jcommander.Parameter;
import com.google.inject.Scopes;
import io.tempora.core.TemporaEmbed;
import io.tempora.spi.dispatch.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.tempora.cli.ExitException.usageExit;

public class Sched
    extends Command
{
    private static final Logger logger = LoggerFactory.getLogger(Sched.class);

    @Parameter(names = {"-o", "--database"})
    String database = null;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }

        Properties props = loadSystemProperties();
        if (database != null) {
            props.setProperty("database.type", "h2");
            props.setProperty("database.path", Paths.get(database).toAbsolutePath().toString());
        }
        // use memory database by default
        if (!props.containsKey("database.type")) {
            props.setProperty("database.type", "memory");
        }

        TemporaEmbed embed = new TemporaEmbed.Bootstrap()
            .setSystemConfig(toSystemConfig(props))
            .addModules(binder -> binder.bind(TaskDispatcher.class).to(LoggingTaskDispatcher.class).in(Scopes.SINGLETON))
            .initialize();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down scheduler");
            try {
                embed.close();
            }
            catch (Exception ex) {
                logger.error("Failed to shut down scheduler", ex);
            }
            finally {
                stopped.countDown();
            }
        }, "shutdown"));

        logger.info("Scheduler is running. Press Ctrl-C to stop.");
        stopped.await();
    }

    @Override
    public ExitException usage(String error)
    {
        err.println("Usage: " + programName + " scheduler [options...]");
        err.println("  Options:");
        err.println("    -o, --database DIR               store entries to this H2 database (default: in memory)");
        Main.showCommonOptions(env, err);
        return usageExit(error);
    }
}
