package org.postfixer.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;

/**
 * Builds the application configuration from, in decreasing priority: system properties,
 * environment variables, a configuration file and the {@code reference.conf} defaults.
 */
public final class ConfigLoader {

    /** Looked up in the working directory when no file is given explicitly. */
    public static final String DEFAULT_FILE_NAME = "postfixer.conf";

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * @param explicitFile The file named on the command line, or null to look for {@value #DEFAULT_FILE_NAME}.
     * @return The resolved configuration.
     * @throws FileNotFoundException if {@code explicitFile} is given but does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or substitutions cannot be resolved.
     */
    public static Config load(File explicitFile) throws FileNotFoundException {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileLayer(explicitFile))
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    private static Config fileLayer(File explicitFile) throws FileNotFoundException {
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new FileNotFoundException(explicitFile.getAbsolutePath());
            }
            LOG.info("Using configuration file {}", explicitFile.getAbsolutePath());
            return ConfigFactory.parseFile(explicitFile);
        }
        File local = new File(DEFAULT_FILE_NAME);
        if (local.isFile()) {
            LOG.info("Using configuration file {} from the working directory", local.getAbsolutePath());
            return ConfigFactory.parseFile(local);
        }
        return ConfigFactory.empty();
    }
}
