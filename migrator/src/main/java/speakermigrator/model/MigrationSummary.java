package speakermigrator.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Dry-run report for one speaker: what it runs now, what a migration would
 * write, and whether it looks migrated already.
 *
 * <p>Created fresh per call and never persisted. Build with {@link #builder()}.
 */
@JsonAutoDetect(
        fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class MigrationSummary {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final boolean sshSuccess;
    private final String currentConfig;
    private final String plannedConfig;
    private final String originalConfig;
    private final PrivateConfig parsedCurrentConfig;
    private final String plannedHosts;
    private final String currentHosts;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final boolean remoteServicesEnabled;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final boolean remoteServicesPersistent;
    private final List<String> remoteServicesFound;
    private final String deviceName;
    private final String deviceModel;
    private final String deviceSerial;
    private final String deviceId;
    private final String accountId;
    private final String firmwareVersion;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final boolean caCertTrusted;
    @JsonProperty("server_https_url")
    private final String serverHttpsUrl;
    private final String currentResolvConf;
    private final String plannedResolv;
    private final boolean dnsHookInstalled;
    private final String targetHost;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private final boolean isMigrated;

    private MigrationSummary(Builder b) {
        this.sshSuccess = b.sshSuccess;
        this.currentConfig = b.currentConfig;
        this.plannedConfig = b.plannedConfig;
        this.originalConfig = b.originalConfig;
        this.parsedCurrentConfig = b.parsedCurrentConfig;
        this.plannedHosts = b.plannedHosts;
        this.currentHosts = b.currentHosts;
        this.remoteServicesEnabled = b.remoteServicesEnabled;
        this.remoteServicesPersistent = b.remoteServicesPersistent;
        this.remoteServicesFound = List.copyOf(b.remoteServicesFound);
        this.deviceName = b.deviceName;
        this.deviceModel = b.deviceModel;
        this.deviceSerial = b.deviceSerial;
        this.deviceId = b.deviceId;
        this.accountId = b.accountId;
        this.firmwareVersion = b.firmwareVersion;
        this.caCertTrusted = b.caCertTrusted;
        this.serverHttpsUrl = b.serverHttpsUrl;
        this.currentResolvConf = b.currentResolvConf;
        this.plannedResolv = b.plannedResolv;
        this.dnsHookInstalled = b.dnsHookInstalled;
        this.targetHost = b.targetHost;
        this.isMigrated = b.migrated;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** True if the remote shell reached the device. */
    public boolean sshSuccess() { return sshSuccess; }

    /** Current config text, or a diagnostic when it could not be read. */
    public String currentConfig() { return currentConfig; }

    public String plannedConfig() { return plannedConfig; }

    /** Content of the on-device {@code .original} backup, or empty. */
    public String originalConfig() { return originalConfig; }

    /** Parsed current config, or null when unreadable. */
    public PrivateConfig parsedCurrentConfig() { return parsedCurrentConfig; }

    public String plannedHosts() { return plannedHosts; }

    public String currentHosts() { return currentHosts; }

    public boolean remoteServicesEnabled() { return remoteServicesEnabled; }

    /** True if a marker exists somewhere that survives a reboot. */
    public boolean remoteServicesPersistent() { return remoteServicesPersistent; }

    public List<String> remoteServicesFound() { return remoteServicesFound; }

    public String deviceName() { return deviceName; }

    public String deviceModel() { return deviceModel; }

    public String deviceSerial() { return deviceSerial; }

    public String deviceId() { return deviceId; }

    public String accountId() { return accountId; }

    public String firmwareVersion() { return firmwareVersion; }

    public boolean caCertTrusted() { return caCertTrusted; }

    public String serverHttpsUrl() { return serverHttpsUrl; }

    public String currentResolvConf() { return currentResolvConf; }

    public String plannedResolv() { return plannedResolv; }

    /** True if the priority nameserver file exists on the device. */
    public boolean dnsHookInstalled() { return dnsHookInstalled; }

    /** Host name of the target service the summary was computed against. */
    public String targetHost() { return targetHost; }

    public boolean isMigrated() { return isMigrated; }

    /** Returns a copy with the migrated flag replaced. */
    public MigrationSummary withMigrated(boolean migrated) {
        Builder b = toBuilder();
        b.migrated = migrated;
        return b.build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.sshSuccess = sshSuccess;
        b.currentConfig = currentConfig;
        b.plannedConfig = plannedConfig;
        b.originalConfig = originalConfig;
        b.parsedCurrentConfig = parsedCurrentConfig;
        b.plannedHosts = plannedHosts;
        b.currentHosts = currentHosts;
        b.remoteServicesEnabled = remoteServicesEnabled;
        b.remoteServicesPersistent = remoteServicesPersistent;
        b.remoteServicesFound = new ArrayList<>(remoteServicesFound);
        b.deviceName = deviceName;
        b.deviceModel = deviceModel;
        b.deviceSerial = deviceSerial;
        b.deviceId = deviceId;
        b.accountId = accountId;
        b.firmwareVersion = firmwareVersion;
        b.caCertTrusted = caCertTrusted;
        b.serverHttpsUrl = serverHttpsUrl;
        b.currentResolvConf = currentResolvConf;
        b.plannedResolv = plannedResolv;
        b.dnsHookInstalled = dnsHookInstalled;
        b.targetHost = targetHost;
        b.migrated = isMigrated;
        return b;
    }

    @Override
    public String toString() {
        return "MigrationSummary{sshSuccess=" + sshSuccess
                + ", device=" + deviceName
                + ", caCertTrusted=" + caCertTrusted
                + ", remoteServicesEnabled=" + remoteServicesEnabled
                + ", isMigrated=" + isMigrated + "}";
    }

    /**
     * Builder for {@link MigrationSummary}. String fields default to empty.
     */
    public static final class Builder {
        private boolean sshSuccess;
        private String currentConfig = "";
        private String plannedConfig = "";
        private String originalConfig = "";
        private PrivateConfig parsedCurrentConfig;
        private String plannedHosts = "";
        private String currentHosts = "";
        private boolean remoteServicesEnabled;
        private boolean remoteServicesPersistent;
        private List<String> remoteServicesFound = new ArrayList<>();
        private String deviceName = "";
        private String deviceModel = "";
        private String deviceSerial = "";
        private String deviceId = "";
        private String accountId = "";
        private String firmwareVersion = "";
        private boolean caCertTrusted;
        private String serverHttpsUrl = "";
        private String currentResolvConf = "";
        private String plannedResolv = "";
        private boolean dnsHookInstalled;
        private String targetHost = "";
        private boolean migrated;

        private Builder() {}

        public Builder sshSuccess(boolean v) { this.sshSuccess = v; return this; }

        public Builder currentConfig(String v) { this.currentConfig = orEmpty(v); return this; }

        public Builder plannedConfig(String v) { this.plannedConfig = orEmpty(v); return this; }

        public Builder originalConfig(String v) { this.originalConfig = orEmpty(v); return this; }

        public Builder parsedCurrentConfig(PrivateConfig v) { this.parsedCurrentConfig = v; return this; }

        public Builder plannedHosts(String v) { this.plannedHosts = orEmpty(v); return this; }

        public Builder currentHosts(String v) { this.currentHosts = orEmpty(v); return this; }

        /**
         * Records a remote-services marker that exists on the device. Markers
         * outside {@code /tmp} make the setting persistent.
         */
        public Builder remoteServicesFound(String location) {
            this.remoteServicesFound.add(location);
            this.remoteServicesEnabled = true;
            if (!location.startsWith("/tmp/")) {
                this.remoteServicesPersistent = true;
            }
            return this;
        }

        public Builder deviceName(String v) { this.deviceName = orEmpty(v); return this; }

        public Builder deviceModel(String v) { this.deviceModel = orEmpty(v); return this; }

        public Builder deviceSerial(String v) { this.deviceSerial = orEmpty(v); return this; }

        public Builder deviceId(String v) { this.deviceId = orEmpty(v); return this; }

        public Builder accountId(String v) { this.accountId = orEmpty(v); return this; }

        public Builder firmwareVersion(String v) { this.firmwareVersion = orEmpty(v); return this; }

        public Builder caCertTrusted(boolean v) { this.caCertTrusted = v; return this; }

        public Builder serverHttpsUrl(String v) { this.serverHttpsUrl = orEmpty(v); return this; }

        public Builder currentResolvConf(String v) { this.currentResolvConf = orEmpty(v); return this; }

        public Builder plannedResolv(String v) { this.plannedResolv = orEmpty(v); return this; }

        public Builder dnsHookInstalled(boolean v) { this.dnsHookInstalled = v; return this; }

        public Builder targetHost(String v) { this.targetHost = orEmpty(v); return this; }

        public Builder migrated(boolean v) { this.migrated = v; return this; }

        public MigrationSummary build() {
            return new MigrationSummary(this);
        }

        private static String orEmpty(String v) {
            return v != null ? v : "";
        }
    }
}
