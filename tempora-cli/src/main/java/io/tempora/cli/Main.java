package io.tempora.cli;

import java.io.PrintStream;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Map;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.MissingCommandException;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.common.base.MoreObjects;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.TypeLiteral;

import static io.tempora.cli.ConfigUtil.defaultConfigPath;
import static io.tempora.cli.ExitException.usageExit;

/**
 * Entry point of the tempora command. Commands are created by Guice so
 * that they receive the process environment and output streams.
 */
public class Main
{
    private static final String DEFAULT_PROGRAM_NAME = "tempora";

    private static final DateTimeFormatter BANNER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");

    private final Map<String, String> env;
    private final PrintStream out;
    private final PrintStream err;
    private final String programName;

    public Main(Map<String, String> env, PrintStream out, PrintStream err)
    {
        this.env = env;
        this.out = out;
        this.err = err;
        this.programName = System.getProperty("io.tempora.cli.programName", DEFAULT_PROGRAM_NAME);
    }

    static class GlobalOptions
    {
        @Parameter(names = {"-c", "--config"})
        String configPath = null;

        @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
        boolean help;
    }

    public static void main(String... args)
    {
        int code = new Main(System.getenv(), System.out, System.err).cli(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static String version()
    {
        return MoreObjects.firstNonNull(Main.class.getPackage().getImplementationVersion(), "unknown");
    }

    private Module cliModule()
    {
        return binder -> {
            binder.bind(new TypeLiteral<Map<String, String>>() {}).annotatedWith(Environment.class).toInstance(env);
            binder.bind(String.class).annotatedWith(ProgramName.class).toInstance(programName);
            binder.bind(PrintStream.class).annotatedWith(StdOut.class).toInstance(out);
            binder.bind(PrintStream.class).annotatedWith(StdErr.class).toInstance(err);
        };
    }

    private JCommander commander(GlobalOptions global)
    {
        Injector injector = Guice.createInjector(cliModule());
        JCommander jc = new JCommander(global);
        jc.setProgramName(programName);
        jc.addCommand("scheduler", injector.getInstance(Sched.class), "sched");
        jc.addCommand("migrate", injector.getInstance(Migrate.class));
        // arguments starting with @ are taken literally
        jc.setExpandAtSign(false);
        jc.getCommands().values().forEach(c -> c.setExpandAtSign(false));
        return jc;
    }

    public int cli(String... args)
    {
        if (Arrays.asList(args).contains("--version")) {
            out.println(version());
            return 0;
        }
        err.println(ZonedDateTime.now().format(BANNER_TIME) + ": Tempora v" + version());
        if (args.length == 0) {
            return usage(null).getCode();
        }

        GlobalOptions global = new GlobalOptions();
        JCommander jc = commander(global);
        Command command = null;
        try {
            command = parse(jc, global, args);
            command.applyCommonOptions(global.configPath);
            command.main();
            return 0;
        }
        catch (ParameterException ex) {
            err.println("error: " + ex.getMessage());
            return 1;
        }
        catch (ExitException ex) {
            if (ex.getError().isPresent()) {
                err.println("error: " + ex.getError().get());
            }
            return ex.getCode();
        }
        catch (Exception ex) {
            reportFailure(ex, command != null && command.isVerbose());
            return 1;
        }
    }

    private Command parse(JCommander jc, GlobalOptions global, String... args)
            throws ExitException
    {
        try {
            jc.parse(args);
        }
        catch (MissingCommandException ex) {
            throw usage("available commands are: " + jc.getCommands().keySet());
        }
        String name = jc.getParsedCommand();
        if (global.help || name == null) {
            throw usage(null);
        }
        return (Command) jc.getCommands().get(name).getObjects().get(0);
    }

    private void reportFailure(Exception ex, boolean verbose)
    {
        String message = MoreObjects.firstNonNull(ex.getMessage(), "").trim();
        if (message.isEmpty()) {
            // nothing to show without the trace
            ex.printStackTrace(err);
            return;
        }
        err.println("error: " + message);
        if (verbose) {
            ex.printStackTrace(err);
        }
    }

    private ExitException usage(String error)
    {
        err.println("Usage: " + programName + " <command> [options...]");
        err.println("  Commands:");
        err.println("    sched[uler]                        run the periodic task scheduler");
        err.println("    migrate (run|check)                migrate database");
        err.println("");
        err.println("  Options:");
        showCommonOptions(env, err);
        if (error == null) {
            err.println("Use `<command> --help` to see detailed usage of a command.");
        }
        return usageExit(error);
    }

    public static void showCommonOptions(Map<String, String> env, PrintStream err)
    {
        err.println("    -L, --log PATH                   output log messages to a file (default: -)");
        err.println("    -l, --log-level LEVEL            log level (error, warn, info, debug or trace)");
        err.println("    -X KEY=VALUE                     add a system config");
        err.println("    -c, --config PATH.properties     configuration file (default: " + defaultConfigPath(env) + ")");
        err.println("    --version                        show version");
        err.println("");
    }
}
