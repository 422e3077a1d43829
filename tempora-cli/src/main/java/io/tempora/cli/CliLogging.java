package io.tempora.cli;

import java.util.Locale;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

/**
 * Replaces the logback configuration with one of the bundled files.
 * The files read the tempora.log.level and tempora.log.path system properties.
 */
class CliLogging
{
    private CliLogging()
    { }

    static void configure(String level, String logPath)
    {
        System.setProperty("tempora.log.level", Level.toLevel(level.toUpperCase(Locale.ENGLISH), Level.DEBUG).toString());

        String resource;
        if (!logPath.equals("-")) {
            System.setProperty("tempora.log.path", logPath);
            resource = "/tempora/cli/logback-file.xml";
        }
        else if (System.console() != null) {
            resource = "/tempora/cli/logback-color.xml";
        }
        else {
            resource = "/tempora/cli/logback-console.xml";
        }

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(CliLogging.class.getResource(resource));
        }
        catch (JoranException ex) {
            throw new IllegalStateException("Invalid logging configuration " + resource, ex);
        }
    }
}
