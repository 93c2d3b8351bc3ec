package de.mirkosertic.lawnotes.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configures logging from the command line flags.
 * <p>
 * With file logging, loads logback-file.xml which writes everything to
 * ~/.lawnotes/log and only warnings to the terminal.
 * <p>
 * Otherwise logback.xml is used, which logs to standard error so that the
 * candidate selection prompt on standard output stays readable.
 */
public final class LoggingConfigurator {

    private static final String LOG_DIR = System.getProperty("user.home") + "/.lawnotes/log";
    private static final String FILE_CONFIG = "logback-file.xml";
    private static final String BASE_PACKAGE = "de.mirkosertic.lawnotes";

    private LoggingConfigurator() {
    }

    /**
     * Configure logging. Must be called before the first logger is used.
     *
     * @param fileLogging true to log into ~/.lawnotes/log instead of the terminal
     * @param verbose     true to log this application at DEBUG level
     */
    public static void configure(final boolean fileLogging, final boolean verbose) {
        if (fileLogging) {
            ensureLogDirectoryExists();
            loadConfiguration(FILE_CONFIG);
        }
        // Default mode uses logback.xml which is loaded automatically
        if (verbose) {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.getLogger(BASE_PACKAGE).setLevel(Level.DEBUG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            final Path logDir = Paths.get(LOG_DIR);
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
        } catch (final Exception e) {
            System.err.println("Warning: Could not create log directory: " + LOG_DIR);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final Exception e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
