package de.mirkosertic.lawnotes.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version information from the Maven-filtered build-info.properties, also used as
 * the {@code --version} provider of the command line and in the HTTP user agent.
 * Falls back to "dev"/"unknown" when running from an IDE.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";
    private static final String VERSION_KEY = "build.version";
    private static final String TIMESTAMP_KEY = "build.timestamp";

    private static final String version;
    private static final String buildTimestamp;

    static {
        String tempVersion = "dev";
        String tempTimestamp = "unknown";

        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                final Properties props = new Properties();
                props.load(input);
                tempVersion = unfiltered(props.getProperty(VERSION_KEY), "dev");
                tempTimestamp = unfiltered(props.getProperty(TIMESTAMP_KEY), "unknown");
                logger.debug("Loaded build info: version={}, timestamp={}", tempVersion, tempTimestamp);
            } else {
                logger.debug("Build info file not found, using defaults (IDE/dev mode)");
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }

        version = tempVersion;
        buildTimestamp = tempTimestamp;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }

    public static String userAgent() {
        return "lawnotes/" + version;
    }

    private BuildInfo() {
    }

    /**
     * Feeds {@code --version} of the command line.
     */
    public static final class VersionProvider implements CommandLine.IVersionProvider {

        @Override
        public String[] getVersion() {
            return new String[] {"lawnotes " + version + " (built " + buildTimestamp + ")"};
        }
    }

    // An IDE copies the resource without Maven filtering
    private static String unfiltered(final String value, final String fallback) {
        if (value == null || value.isEmpty() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }
}
