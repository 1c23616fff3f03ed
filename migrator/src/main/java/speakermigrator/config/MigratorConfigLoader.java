package speakermigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * Loads migrator configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code migrator.properties} on the classpath</li>
 *   <li>{@code migrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties with the same keys override file values
 * (e.g. {@code -Dmigrator.server.url=http://192.168.1.20:8000}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migrator.server.url} - base URL of the local service</li>
 *   <li>{@code migrator.server.https.port} - HTTPS port of the local service</li>
 *   <li>{@code migrator.data.dir} - device store root</li>
 *   <li>{@code migrator.certs.dir} - CA material directory</li>
 *   <li>{@code migrator.ssh.user}, {@code migrator.ssh.password}, {@code migrator.ssh.port}</li>
 *   <li>{@code migrator.ssh.timeout} - seconds</li>
 *   <li>{@code migrator.device.http.port}, {@code migrator.device.http.timeout}</li>
 *   <li>{@code migrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigratorConfig
 */
public final class MigratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigratorConfigLoader.class);

    private static final String PREFIX = "migrator.";

    private MigratorConfigLoader() {}

    /**
     * Load from classpath (migrator.properties or migrator.yml).
     *
     * @throws MigratorConfigException if no config file found
     */
    public static MigratorConfig load() {
        InputStream is = getResource("migrator.properties");
        if (is != null) {
            return loadProperties(is, "migrator.properties");
        }

        is = getResource("migrator.yml");
        if (is != null) {
            return loadYaml(is, "migrator.yml");
        }

        throw new MigratorConfigException(
                "Config file required: migrator.properties or migrator.yml");
    }

    /**
     * Load from classpath, falling back to defaults (plus system property overrides)
     * when no file is present.
     */
    public static MigratorConfig loadOrDefaults() {
        try {
            return load();
        } catch (MigratorConfigException e) {
            log.info("No config file on classpath, using defaults");
            return parse(new Properties());
        }
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static MigratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static MigratorConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigratorConfigException("Failed to load " + source, e);
        }
    }

    private static MigratorConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (IOException | YAMLException e) {
            throw new MigratorConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    static MigratorConfig parse(Properties props) {
        MigratorConfig.Builder b = MigratorConfig.builder();

        try {
            apply(props, "server.url", b::serverUrl);
            getInt(props, "server.https.port").ifPresent(b::httpsPort);
            getString(props, "data.dir").map(Path::of).ifPresent(b::dataDir);
            getString(props, "certs.dir").map(Path::of).ifPresent(b::certsDir);
            apply(props, "ssh.user", b::sshUser);
            getRaw(props, "ssh.password").ifPresent(b::sshPassword);
            getInt(props, "ssh.port").ifPresent(b::sshPort);
            getLong(props, "ssh.timeout").ifPresent(b::sshTimeoutSeconds);
            getInt(props, "device.http.port").ifPresent(b::deviceHttpPort);
            getLong(props, "device.http.timeout").ifPresent(b::deviceHttpTimeoutSeconds);
        } catch (IllegalArgumentException e) {
            throw new MigratorConfigException("Invalid configuration: " + e.getMessage(), e);
        }

        getString(props, "alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static void apply(Properties props, String key, Consumer<String> setter) {
        getString(props, key).ifPresent(setter);
    }

    private static Optional<String> getRaw(Properties props, String key) {
        String full = PREFIX + key;
        String v = System.getProperty(full);
        if (v == null) v = props.getProperty(full);
        return Optional.ofNullable(v);
    }

    private static Optional<String> getString(Properties props, String key) {
        return getRaw(props, key).map(String::trim).filter(s -> !s.isEmpty());
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid {}: {}", PREFIX + key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid {}: {}", PREFIX + key, v);
                return Optional.empty();
            }
        });
    }
}
