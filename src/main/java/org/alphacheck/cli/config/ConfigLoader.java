package org.alphacheck.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

/**
 * Loads the HOCON configuration for the CLI.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dalphacheck.threads=4})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code config/alphacheck.conf} or the file given explicitly)</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The reference layer is loaded unresolved so that substitutions in {@code reference.conf}
 * (e.g. {@code ${alphacheck.base-dir}}) see the user's overrides.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "alphacheck.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a config resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the config file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Locates and loads the configuration. The user file is taken from the first match of:
     * <ol>
     *   <li>{@code explicitConfigFile} ({@code --config})</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@code config/alphacheck.conf} relative to the working directory</li>
     *   <li>{@code APP_HOME/config/alphacheck.conf}, where {@code APP_HOME} is the parent of the
     *       directory holding the application jar</li>
     * </ol>
     * If none exists only the classpath defaults are used.
     *
     * @param explicitConfigFile config file from the CLI, or {@code null}
     * @param handler            receives resolution messages
     * @return the resolved config
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        final String systemConfigPath = System.getProperty("config.file");
        final boolean systemConfigSet = systemConfigPath != null && !systemConfigPath.isBlank();

        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            if (systemConfigSet) {
                handler.log(MessageLevel.WARN, "Ignoring -Dconfig.file=" + systemConfigPath
                        + " because --config was given");
            }
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        if (systemConfigSet) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file " + installationConfigFile);
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found, using built-in defaults");
        return loadDefaults();
    }

    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * @return {@code APP_HOME/config/alphacheck.conf} if running from a jar and the file exists,
     *         otherwise {@code null}
     */
    private static File detectInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final File jar;
        try {
            final URL location = codeSource.getLocation();
            jar = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            // not a file: URL (e.g. nested jar); fall back to classpath defaults
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        final File configFile = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
