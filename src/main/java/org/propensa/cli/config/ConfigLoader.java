package org.propensa.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Resolves the tool configuration (HOCON).
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dpropensa.generator.timestamp=false})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The user file is looked up in this order: the {@code --config} option, {@code -Dconfig.file},
 * {@code config/propensa.conf} in the working directory, {@code config/propensa.conf} next to the
 * installation's {@code lib} directory.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "propensa.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages about which configuration file was chosen.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration.
     *
     * @param explicitConfigFile File given on the command line, or {@code null}.
     * @param handler            Receives resolution messages.
     * @return The resolved configuration.
     * @throws IllegalArgumentException              If an explicitly requested file does not exist.
     * @throws com.typesafe.config.ConfigException   If a file cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            final File file = new File(property).getAbsoluteFile();
            requireExists(file, "Configuration file specified via -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + file.getAbsolutePath() + " (-Dconfig.file)");
            return loadFromFile(file);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installedFile = findInstalledConfigFile();
        if (installedFile != null) {
            handler.log(MessageLevel.INFO, "Using installed configuration file " + installedFile.getAbsolutePath());
            return loadFromFile(installedFile);
        }

        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using defaults");
        return loadDefaults();
    }

    /**
     * Loads a configuration file on top of the classpath defaults.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the classpath defaults, overridable by system properties and environment.
     */
    public static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExists(final File file, final String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code APP_HOME/config/propensa.conf}, where {@code APP_HOME} is the parent of the
     * directory holding the running jar.
     *
     * @return The file, or {@code null} if not running from a jar or the file does not exist.
     */
    private static File findInstalledConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final File jar;
        try {
            jar = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        final File candidate = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.exists() ? candidate : null;
    }
}
