package speakermigrator.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Central configuration for the speaker migrator.
 *
 * <p>Holds the base URL of the local substitute service, where local state lives
 * (device store, certificate authority), how the remote shell logs in, and how
 * the live device endpoint is queried.
 *
 * <p>Instances are immutable. Load them from {@code migrator.properties} or
 * {@code migrator.yml} with {@link MigratorConfigLoader}, or build them directly.
 *
 * @see MigratorConfigLoader
 */
public final class MigratorConfig {

    public static final MigratorConfig DEFAULTS = builder().build();

    private final String serverUrl;
    private final int httpsPort;
    private final Path dataDir;
    private final Path certsDir;
    private final String sshUser;
    private final String sshPassword;
    private final int sshPort;
    private final Duration sshTimeout;
    private final int deviceHttpPort;
    private final Duration deviceHttpTimeout;
    private final AlertLevel alertLevel;

    private MigratorConfig(Builder b) {
        this.serverUrl = b.serverUrl;
        this.httpsPort = b.httpsPort;
        this.dataDir = b.dataDir;
        this.certsDir = b.certsDir != null ? b.certsDir : b.dataDir.resolve("certs");
        this.sshUser = b.sshUser;
        this.sshPassword = b.sshPassword;
        this.sshPort = b.sshPort;
        this.sshTimeout = b.sshTimeout;
        this.deviceHttpPort = b.deviceHttpPort;
        this.deviceHttpTimeout = b.deviceHttpTimeout;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Base URL of the local substitute service, used when a call supplies no target. */
    public String serverUrl() { return serverUrl; }

    /** HTTPS port of the local service, used for preview URLs and HTTPS probes. */
    public int httpsPort() { return httpsPort; }

    /** Root directory of the device store. */
    public Path dataDir() { return dataDir; }

    /** Directory holding {@code ca.crt} and {@code ca.key}. */
    public Path certsDir() { return certsDir; }

    public String sshUser() { return sshUser; }

    public String sshPassword() { return sshPassword; }

    public int sshPort() { return sshPort; }

    /** Connect timeout for each remote shell round-trip. */
    public Duration sshTimeout() { return sshTimeout; }

    /** Port of the speaker's local info endpoint. */
    public int deviceHttpPort() { return deviceHttpPort; }

    public Duration deviceHttpTimeout() { return deviceHttpTimeout; }

    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigratorConfig{" +
                "serverUrl=" + serverUrl +
                ", httpsPort=" + httpsPort +
                ", dataDir=" + dataDir +
                ", certsDir=" + certsDir +
                ", sshUser=" + sshUser +
                ", sshPort=" + sshPort +
                ", sshTimeout=" + sshTimeout.toSeconds() + "s" +
                ", deviceHttpPort=" + deviceHttpPort +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for {@link MigratorConfig}.
     */
    public static final class Builder {
        private String serverUrl = "http://localhost:8000";
        private int httpsPort = 8443;
        private Path dataDir = Path.of("data");
        private Path certsDir;
        private String sshUser = "root";
        private String sshPassword = "";
        private int sshPort = 22;
        private Duration sshTimeout = Duration.ofSeconds(10);
        private int deviceHttpPort = 8090;
        private Duration deviceHttpTimeout = Duration.ofSeconds(5);
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder serverUrl(String url) {
            if (url == null || url.isBlank()) throw new IllegalArgumentException("serverUrl must not be blank");
            this.serverUrl = stripTrailingSlash(url.trim());
            return this;
        }

        public Builder httpsPort(int port) {
            this.httpsPort = requirePort(port, "httpsPort");
            return this;
        }

        public Builder dataDir(Path dir) {
            if (dir == null) throw new IllegalArgumentException("dataDir must not be null");
            this.dataDir = dir;
            return this;
        }

        public Builder certsDir(Path dir) {
            this.certsDir = dir;
            return this;
        }

        public Builder sshUser(String user) {
            if (user == null || user.isBlank()) throw new IllegalArgumentException("sshUser must not be blank");
            this.sshUser = user;
            return this;
        }

        public Builder sshPassword(String password) {
            this.sshPassword = password != null ? password : "";
            return this;
        }

        public Builder sshPort(int port) {
            this.sshPort = requirePort(port, "sshPort");
            return this;
        }

        public Builder sshTimeout(Duration timeout) {
            this.sshTimeout = timeout;
            return this;
        }

        public Builder sshTimeoutSeconds(long seconds) {
            return sshTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder deviceHttpPort(int port) {
            this.deviceHttpPort = requirePort(port, "deviceHttpPort");
            return this;
        }

        public Builder deviceHttpTimeout(Duration timeout) {
            this.deviceHttpTimeout = timeout;
            return this;
        }

        public Builder deviceHttpTimeoutSeconds(long seconds) {
            return deviceHttpTimeout(seconds > 0 ? Duration.ofSeconds(seconds) : Duration.ZERO);
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigratorConfig build() {
            return new MigratorConfig(this);
        }

        private static int requirePort(int port, String name) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException(name + " out of range: " + port);
            }
            return port;
        }

        private static String stripTrailingSlash(String url) {
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }
}
