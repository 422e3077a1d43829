package io.tempora.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Inject;
import io.tempora.core.config.PropertyUtils;
import io.tempora.spi.config.Config;
import io.tempora.spi.config.ConfigFactory;
import io.tempora.spi.config.ObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class Command
{
    private static final Logger log = LoggerFactory.getLogger(Command.class);

    private static final Set<String> LOG_LEVELS = ImmutableSet.of("error", "warn", "info", "debug", "trace");

    @Inject @Environment protected Map<String, String> env;
    @Inject @ProgramName protected String programName;
    @Inject @StdOut protected PrintStream out;
    @Inject @StdErr protected PrintStream err;

    @Parameter()
    protected List<String> args = new ArrayList<>();

    @Parameter(names = {"-c", "--config"})
    protected String configPath = null;

    @Parameter(names = {"-L", "--log"})
    protected String logPath = "-";

    @Parameter(names = {"-l", "--log-level"})
    protected String logLevel = "info";

    @DynamicParameter(names = "-X")
    protected Map<String, String> systemProperties = new HashMap<>();

    @Parameter(names = {"-help", "--help"}, help = true, hidden = true)
    protected boolean help;

    public abstract void main() throws Exception;

    public abstract ExitException usage(String error);

    /**
     * Applies the options shared by all commands. The global --config
     * applies unless the command sets its own.
     */
    void applyCommonOptions(String globalConfigPath)
            throws ExitException
    {
        if (help) {
            throw usage(null);
        }
        if (!LOG_LEVELS.contains(logLevel)) {
            throw usage("Unknown log level '" + logLevel + "'");
        }
        if (configPath == null) {
            configPath = globalConfigPath;
        }
        CliLogging.configure(logLevel, logPath);
        systemProperties.forEach(System::setProperty);
    }

    /**
     * Stack traces of failures are shown at debug and trace levels.
     */
    boolean isVerbose()
    {
        return logLevel.equals("debug") || logLevel.equals("trace");
    }

    /**
     * Later sources win: default config file, TEMPORA_CONFIG, JVM system
     * properties (including -X), then the --config file.
     */
    protected Properties loadSystemProperties()
        throws IOException
    {
        Properties props = new Properties();

        if (configPath == null) {
            Path defaultConfigPath = ConfigUtil.defaultConfigPath(env);
            try {
                props.putAll(PropertyUtils.loadFile(defaultConfigPath));
            }
            catch (NoSuchFileException ex) {
                log.trace("configuration file not found: {}", defaultConfigPath, ex);
            }
        }

        props.load(new StringReader(env.getOrDefault("TEMPORA_CONFIG", "")));

        props.putAll(System.getProperties());

        if (configPath != null) {
            props.putAll(PropertyUtils.loadFile(Paths.get(configPath)));
        }

        return props;
    }

    protected static ConfigFactory configFactory()
    {
        return new ConfigFactory(ObjectMappers.objectMapper());
    }

    protected static Config toSystemConfig(Properties props)
    {
        return PropertyUtils.toConfig(props, configFactory());
    }
}
