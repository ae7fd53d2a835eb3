package org.ionresults.config;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Finds the configuration file of the materialization stage and layers it over the defaults.
 * <p>
 * Layers, highest precedence first: JVM system properties, environment variables, the config
 * file, {@code reference.conf}. Substitutions are resolved once all layers are stacked, so an
 * override of {@code materialization.imageStoreKind} also reaches {@code imageStore.storeKind}.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_FILE_PROPERTY = "config.file";
    static final File WORKING_DIRECTORY_FILE = new File("config", "ion-results.conf");

    private ConfigLoader() {
    }

    /**
     * Where the config file layer came from.
     */
    public enum Source {
        /** File handed to {@link #load(File)}. */
        EXPLICIT_FILE,
        /** {@code -Dconfig.file}. */
        SYSTEM_PROPERTY,
        /** {@code config/ion-results.conf} below the working directory. */
        WORKING_DIRECTORY,
        /** No file, {@code reference.conf} only. */
        CLASSPATH_DEFAULTS
    }

    /**
     * @param config the resolved configuration
     * @param source where the file layer came from
     * @param file   the file layer, {@code null} for {@link Source#CLASSPATH_DEFAULTS}
     */
    public record LoadedConfig(Config config, Source source, File file) {
    }

    /**
     * Loads the configuration. The first existing candidate wins: {@code explicitConfigFile},
     * {@code -Dconfig.file}, {@code config/ion-results.conf}; without any, only the defaults apply.
     *
     * @param explicitConfigFile file chosen by the caller, {@code null} to search
     * @return the resolved configuration and its origin
     * @throws IllegalArgumentException            if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution not resolved
     */
    public static LoadedConfig load(File explicitConfigFile) {
        LoadedConfig loaded = load(explicitConfigFile, System.getProperty(CONFIG_FILE_PROPERTY), WORKING_DIRECTORY_FILE);
        if (loaded.file() == null) {
            log.warn("No configuration file found (looked for {}), using classpath defaults",
                WORKING_DIRECTORY_FILE.getPath());
        } else {
            log.info("Loaded configuration from {} ({})", loaded.file().getAbsolutePath(), loaded.source());
        }
        return loaded;
    }

    static LoadedConfig load(File explicitConfigFile, String systemPropertyPath, File workingDirectoryFile) {
        if (explicitConfigFile != null) {
            return fromFile(requireExisting(explicitConfigFile, "Configuration file"), Source.EXPLICIT_FILE);
        }
        if (systemPropertyPath != null && !systemPropertyPath.isBlank()) {
            File file = new File(systemPropertyPath).getAbsoluteFile();
            return fromFile(requireExisting(file, "Configuration file given by -D" + CONFIG_FILE_PROPERTY),
                Source.SYSTEM_PROPERTY);
        }
        if (workingDirectoryFile.isFile()) {
            return fromFile(workingDirectoryFile, Source.WORKING_DIRECTORY);
        }
        return new LoadedConfig(stack(ConfigFactory.empty()), Source.CLASSPATH_DEFAULTS, null);
    }

    private static LoadedConfig fromFile(File file, Source source) {
        return new LoadedConfig(stack(ConfigFactory.parseFile(file)), source, file);
    }

    private static Config stack(Config fileLayer) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileLayer)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static File requireExisting(File file, String description) {
        if (!file.isFile()) {
            throw new IllegalArgumentException(description + " not found: " + file.getAbsolutePath());
        }
        return file;
    }
}
