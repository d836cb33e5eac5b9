package org.buildlens.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the buildlens configuration from its layered sources.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>System properties ({@code -Dbuildlens.client.format=LOG})</li>
 *   <li>Environment variables</li>
 *   <li>An explicitly given configuration file</li>
 *   <li>{@code buildlens.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "buildlens.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration.
     *
     * @param explicitFile A configuration file given on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if {@code explicitFile} does not exist.
     */
    public static Config load(File explicitFile) {
        Config fileConfig = ConfigFactory.empty();
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        }

        File cwdFile = new File(CONFIG_FILE_NAME);
        Config cwdConfig = ConfigFactory.empty();
        if (cwdFile.isFile()) {
            LOG.debug("Using configuration file found in current directory: {}", cwdFile.getAbsolutePath());
            cwdConfig = ConfigFactory.parseFile(cwdFile);
        }

        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(cwdConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
