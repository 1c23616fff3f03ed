package speakermigrator.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.alert.MigrationAlertLogger;
import speakermigrator.alert.OperationLog;
import speakermigrator.backup.OffDeviceBackup;
import speakermigrator.backup.OnDeviceBackup;
import speakermigrator.backup.RevertManager;
import speakermigrator.ca.CertificateAuthority;
import speakermigrator.ca.FileCertificateAuthority;
import speakermigrator.codec.PrivateConfigCodec;
import speakermigrator.config.MigratorConfig;
import speakermigrator.detect.MigrationStateDetector;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DeviceInfoClient;
import speakermigrator.device.DevicePaths;
import speakermigrator.device.HttpDeviceInfoClient;
import speakermigrator.device.VendorDomains;
import speakermigrator.exceptions.DeviceStoreException;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.DeviceInfo;
import speakermigrator.model.DnsSettings;
import speakermigrator.model.MigrationMethod;
import speakermigrator.model.MigrationSummary;
import speakermigrator.model.PrivateConfig;
import speakermigrator.patch.DnsHookPatcher;
import speakermigrator.patch.HostsFileEditor;
import speakermigrator.remote.RemoteServicesManager;
import speakermigrator.resolve.HostResolver;
import speakermigrator.resolve.TargetResolver;
import speakermigrator.resolve.TargetUrl;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.JschRemoteShell;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.RemoteShellFactory;
import speakermigrator.shell.ShellCommand;
import speakermigrator.smoke.ConnectivitySelfTest;
import speakermigrator.store.DeviceStore;
import speakermigrator.store.FileDeviceStore;
import speakermigrator.strategy.DeviceSession;
import speakermigrator.strategy.DnsPreflight;
import speakermigrator.strategy.DnsStatusProvider;
import speakermigrator.strategy.HostsFileStrategy;
import speakermigrator.strategy.MigrationRequest;
import speakermigrator.strategy.MigrationStrategy;
import speakermigrator.strategy.PlannedConfigs;
import speakermigrator.strategy.ResolvConfStrategy;
import speakermigrator.strategy.XmlConfigStrategy;
import speakermigrator.trust.TrustStoreEditor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Reconfigures speakers over a remote shell so their cloud traffic goes to the
 * local substitute service, and undoes that again.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #getMigrationSummary}: read-only dry run</li>
 *   <li>{@link #migrateSpeaker}: off-device backup, write-access preflight, then one
 *       of the {@link MigrationMethod} strategies</li>
 *   <li>{@link #revertMigration}: restore originals, whatever method was used</li>
 *   <li>self-tests, explicit backup, CA trust, remote-services markers and reboot</li>
 * </ul>
 *
 * <p>The manager holds only its collaborators and is safe to use from several
 * threads for different devices. Calls for the same device are not serialized.
 * No operation reboots the device except {@link #reboot}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationManager manager = MigrationManager.create(MigratorConfigLoader.load());
 * MigrationSummary summary = manager.getMigrationSummary("192.168.1.20", null, null, null);
 * String log = manager.migrateSpeaker("192.168.1.20", null, null, null, "hosts");
 * </pre>
 */
public final class MigrationManager {

    private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

    private final MigratorConfig config;
    private final RemoteShellFactory shellFactory;
    private final DeviceStore store;
    private final CertificateAuthority ca;
    private final DeviceInfoClient infoClient;
    private final TargetResolver resolver;
    private final DnsStatusProvider dnsStatusProvider;

    private MigrationManager(Builder b) {
        this.config = b.config;
        this.shellFactory = Objects.requireNonNull(b.shellFactory, "shellFactory");
        this.store = b.store;
        this.ca = b.ca;
        this.infoClient = b.infoClient != null ? b.infoClient : new HttpDeviceInfoClient(b.config);
        this.resolver = new TargetResolver(b.hostResolver != null ? b.hostResolver : HostResolver.SYSTEM);
        this.dnsStatusProvider = b.dnsStatusProvider;
        MigrationAlertLogger.setAlertLevel(config.alertLevel());
    }

    public static Builder builder(MigratorConfig config) {
        return new Builder(config);
    }

    /**
     * Wires the file-based store and CA under the configured directories and the
     * JSch transport.
     */
    public static MigrationManager create(MigratorConfig config) {
        return builder(config)
                .shellFactory(JschRemoteShell.factory(config))
                .deviceStore(new FileDeviceStore(config.dataDir()))
                .certificateAuthority(new FileCertificateAuthority(config.certsDir()))
                .build();
    }

    public MigratorConfig config() {
        return config;
    }

    // ---------------------------------------------------------------- summary

    /**
     * Builds a dry-run report for a speaker. Nothing on the device changes.
     *
     * <p>An unreachable device is not an error: the summary reports
     * {@code sshSuccess=false} and the reason in {@code currentConfig}.
     *
     * @param deviceAddress the speaker
     * @param targetUrl target service URL, or null/empty for the configured server URL
     * @param proxyUrl proxy URL for upstream routing, may be null
     * @param options subsystem routing options, may be null
     * @throws MigrateException if the planned configuration cannot be serialized
     */
    public MigrationSummary getMigrationSummary(String deviceAddress, String targetUrl, String proxyUrl,
                                                Map<String, String> options) throws MigrateException {
        String target = targetOrDefault(targetUrl);
        TargetUrl parsedTarget = TargetUrl.parse(target);
        DeviceSession session = openSession(deviceAddress);
        RemoteShell shell = session.shell();

        MigrationSummary.Builder summary = MigrationSummary.builder()
                .targetHost(parsedTarget.host());
        populateIdentity(summary, deviceAddress);

        PrivateConfig current = readCurrentConfig(shell, summary);
        PrivateConfig planned = PlannedConfigs.plan(target, proxyUrl, options, current);
        try {
            summary.plannedConfig(PrivateConfigCodec.encode(planned));
        } catch (MigrateException e) {
            throw e.withContext(deviceAddress, null);
        }

        if (parsedTarget.hasUsableHost()) {
            String ip = resolver.resolve(parsedTarget.host(), shell);
            summary.plannedResolv(DnsHookPatcher.priorityResolvConf(ip));
            summary.plannedHosts(HostsFileEditor.plannedEntries(ip, VendorDomains.ALL));
        }

        MigrationSummary probe = summary.build();
        if (probe.sshSuccess()) {
            session.remoteServices().findMarkers().forEach(summary::remoteServicesFound);
            summary.caCertTrusted(session.trustStore().isTrusted());
            summary.currentResolvConf(outputIfSucceeded(shell, DeviceCommands.cat(DevicePaths.RESOLV_CONF)));
            summary.currentHosts(outputIfSucceeded(shell, DeviceCommands.cat(DevicePaths.HOSTS)));
            summary.dnsHookInstalled(shell.run(DeviceCommands.isFile(DevicePaths.PRIORITY_RESOLV)).succeeded());
        }

        if (!parsedTarget.host().isEmpty()) {
            summary.serverHttpsUrl("https://" + parsedTarget.host() + ":" + config.httpsPort() + "/health");
        }

        MigrationSummary result = summary.build();
        return result.withMigrated(MigrationStateDetector.isMigrated(result, parsedTarget.host()));
    }

    private void populateIdentity(MigrationSummary.Builder summary, String deviceAddress) {
        if (store != null) {
            try {
                store.findByAddress(deviceAddress).ifPresent(d -> summary
                        .deviceName(d.name())
                        .deviceModel(d.productCode())
                        .deviceSerial(d.deviceSerialNumber())
                        .deviceId(d.deviceId())
                        .accountId(d.accountId())
                        .firmwareVersion(d.firmwareVersion()));
            } catch (DeviceStoreException e) {
                log.warn("{}: device store lookup failed: {}", deviceAddress, e.getMessage());
            }
        }

        DeviceInfo info;
        try {
            info = infoClient.fetch(deviceAddress);
        } catch (IOException e) {
            log.debug("{}: live device info unavailable: {}", deviceAddress, e.getMessage());
            return;
        }
        if (!info.name().isEmpty()) summary.deviceName(info.name());
        if (!info.type().isEmpty()) summary.deviceModel(info.type());
        if (!info.serialNumber().isEmpty()) summary.deviceSerial(info.serialNumber());
        if (!info.firmwareVersion().isEmpty()) summary.firmwareVersion(info.firmwareVersion());
        if (!info.deviceId().isEmpty()) summary.deviceId(info.deviceId());
        if (!info.margeAccountUuid().isEmpty()) summary.accountId(info.margeAccountUuid());
    }

    /**
     * Reads the original and current configuration into the summary and decides
     * reachability.
     *
     * @return the parsed current configuration, or null
     */
    private static PrivateConfig readCurrentConfig(RemoteShell shell, MigrationSummary.Builder summary) {
        String path = DevicePaths.PRIVATE_CONFIG;
        if (shell.run(DeviceCommands.isFile(DevicePaths.original(path))).succeeded()) {
            summary.originalConfig(outputIfSucceeded(shell, DeviceCommands.cat(DevicePaths.original(path))));
        }

        CommandResult read = shell.run(DeviceCommands.cat(path));
        if (read.hasOutput()) {
            summary.sshSuccess(true).currentConfig(read.output());
            PrivateConfig parsed = PrivateConfigCodec.decode(read.output()).orElse(null);
            summary.parsedCurrentConfig(parsed);
            return parsed;
        }

        String readError = "Error reading config: " + (read.succeeded() ? "empty output" : read.failureReason());
        if (read.output().isEmpty()
                && shell.run(ShellCommand.of("ls", "-l", path)).hasOutput()
                && shell.run(ShellCommand.of("base64", path)).hasOutput()) {
            summary.sshSuccess(true).currentConfig(readError);
            return null;
        }

        CommandResult ls = shell.run(ShellCommand.of("ls", "/"));
        if (ls.succeeded()) {
            summary.sshSuccess(true).currentConfig(read.succeeded() ? read.output() : readError);
        } else {
            summary.sshSuccess(false).currentConfig("SSH connection failed: " + ls.failureReason());
        }
        return null;
    }

    // ---------------------------------------------------------------- migrate / revert

    /**
     * Migrates a speaker.
     *
     * @param method {@code xml}, {@code hosts} or {@code resolv}; null or empty selects {@code xml}
     * @return the operation log
     * @throws MigrateException on a hard failure, with the log so far attached
     * @see #migrateSpeaker(String, String, String, Map, MigrationMethod)
     */
    public String migrateSpeaker(String deviceAddress, String targetUrl, String proxyUrl,
                                 Map<String, String> options, String method) throws MigrateException {
        MigrationMethod parsed;
        try {
            parsed = MigrationMethod.parse(method);
        } catch (IllegalArgumentException e) {
            MigrationAlertLogger.migrationFailed(deviceAddress, null, "validate", e);
            throw new MigrateException(e.getMessage(), deviceAddress, "validate", null, e);
        }
        return migrateSpeaker(deviceAddress, targetUrl, proxyUrl, options, parsed);
    }

    /**
     * Migrates a speaker.
     *
     * <p>Steps: best-effort off-device backup, write-access preflight (hard),
     * DNS preflight for {@link MigrationMethod#RESOLV} (hard), on-device original
     * of the private configuration, then the strategy.
     * The device is not rebooted.
     *
     * @return the operation log
     * @throws MigrateException on a hard failure, with the log so far attached
     */
    public String migrateSpeaker(String deviceAddress, String targetUrl, String proxyUrl,
                                 Map<String, String> options, MigrationMethod method) throws MigrateException {
        long start = System.nanoTime();
        MigrationRequest request = new MigrationRequest(deviceAddress, targetOrDefault(targetUrl),
                proxyUrl, options, method);
        DeviceSession session = openSession(deviceAddress);
        OperationLog oplog = new OperationLog(deviceAddress);
        MigrationAlertLogger.migrationStarted(deviceAddress, method);

        try {
            backupOffDevice(session, oplog);
            checkWriteAccess(session.shell(), oplog);
            if (method == MigrationMethod.RESOLV) {
                new DnsPreflight(store, dnsStatusProvider).check(oplog);
            }
            session.backups().backupOnce(DevicePaths.PRIVATE_CONFIG, oplog);
            strategyFor(method).migrate(session, request, oplog);
        } catch (MigrateException e) {
            MigrationAlertLogger.migrationFailed(deviceAddress, method, e.getStage(), e);
            throw e;
        }

        MigrationAlertLogger.migrationCompleted(deviceAddress, method, (System.nanoTime() - start) / 1_000_000);
        return oplog.toString();
    }

    private void backupOffDevice(DeviceSession session, OperationLog oplog) {
        try {
            offDeviceBackup().backup(session.shell());
            oplog.add("Successfully created off-device backup of current configuration.");
        } catch (MigrateException | DeviceStoreException e) {
            MigrationAlertLogger.backupWarning(session.deviceAddress(), e.getMessage());
            oplog.warn("Failed to create off-device backup: " + e.getMessage());
        }
    }

    private static void checkWriteAccess(RemoteShell shell, OperationLog oplog) throws MigrateException {
        ShellCommand rw = DeviceCommands.writeAccess();
        CommandResult result = shell.run(rw);
        if (!result.succeeded()) {
            MigrationAlertLogger.preflightFailed(shell.host(), result.failureReason());
            throw oplog.failure("pre-flight check failed: cannot gain write access (cmd: " + rw.render()
                    + ", output: " + result.output().trim() + "): " + result.failureReason(), "preflight", null);
        }
        oplog.add("Pre-flight: Write access verified.");
    }

    static MigrationStrategy strategyFor(MigrationMethod method) {
        return switch (method) {
            case XML -> new XmlConfigStrategy();
            case HOSTS -> new HostsFileStrategy();
            case RESOLV -> new ResolvConfStrategy();
        };
    }

    /**
     * Puts a speaker back on the vendor cloud.
     *
     * @return the operation log
     * @throws MigrateException if the private configuration has no backup or cannot be restored
     */
    public String revertMigration(String deviceAddress) throws MigrateException {
        DeviceSession session = openSession(deviceAddress);
        OperationLog oplog = new OperationLog(deviceAddress);
        MigrationAlertLogger.revertStarted(deviceAddress);
        try {
            new RevertManager(session.shell(), session.backups(), session.trustStore()).revert(oplog);
        } catch (MigrateException e) {
            MigrationAlertLogger.revertFailed(deviceAddress, e);
            throw e;
        }
        MigrationAlertLogger.revertCompleted(deviceAddress, oplog.warnings());
        return oplog.toString();
    }

    // ---------------------------------------------------------------- backups

    /**
     * Creates the on-device original of the private configuration.
     *
     * @throws MigrateException if the original already exists or cannot be written
     */
    public String backupConfig(String deviceAddress) throws MigrateException {
        OperationLog oplog = new OperationLog(deviceAddress);
        openSession(deviceAddress).backups().createOriginal(DevicePaths.PRIVATE_CONFIG, oplog);
        return oplog.toString();
    }

    /**
     * Copies the private configuration and hosts file into the device store.
     *
     * @return the directory holding the copies
     */
    public Path backupConfigOffDevice(String deviceAddress) throws MigrateException {
        return offDeviceBackup().backup(shellFactory.forHost(deviceAddress));
    }

    private OffDeviceBackup offDeviceBackup() {
        return new OffDeviceBackup(store, infoClient);
    }

    /**
     * Fetches the speaker's identity document.
     */
    public DeviceInfo getLiveDeviceInfo(String deviceAddress) throws IOException {
        return infoClient.fetch(deviceAddress);
    }

    // ---------------------------------------------------------------- trust / markers / reboot

    /** Injects the local CA into the speaker's trust bundle. */
    public String trustCaCert(String deviceAddress) throws MigrateException {
        OperationLog oplog = new OperationLog(deviceAddress);
        openSession(deviceAddress).trustStore().inject(oplog);
        return oplog.toString();
    }

    public boolean isCaTrusted(String deviceAddress) {
        return openSession(deviceAddress).trustStore().isTrusted();
    }

    public String ensureRemoteServices(String deviceAddress) throws MigrateException {
        OperationLog oplog = new OperationLog(deviceAddress);
        openSession(deviceAddress).remoteServices().ensure(oplog);
        return oplog.toString();
    }

    public String removeRemoteServices(String deviceAddress) throws MigrateException {
        OperationLog oplog = new OperationLog(deviceAddress);
        openSession(deviceAddress).remoteServices().remove(oplog);
        return oplog.toString();
    }

    /**
     * Reboots the speaker.
     *
     * @return the command output
     */
    public String reboot(String deviceAddress) throws MigrateException {
        RemoteShell shell = shellFactory.forHost(deviceAddress);
        log.info("Rebooting speaker at {}", deviceAddress);
        CommandResult result = shell.run(DeviceCommands.withWriteAccess(ShellCommand.of("reboot")));
        if (!result.succeeded()) {
            throw new MigrateException("failed to reboot speaker: " + result.failureReason(),
                    deviceAddress, "reboot", result.output(), null);
        }
        return result.output();
    }

    /** Resolves a host name on this machine, returning it unchanged if that fails. */
    public String resolvedIp(String host) {
        return resolver.resolveLocally(host);
    }

    // ---------------------------------------------------------------- self-tests

    public String testHostsRedirection(String deviceAddress, String targetUrl) throws MigrateException {
        return selfTest(deviceAddress).testHostsRedirection(targetOrDefault(targetUrl));
    }

    public String testConnection(String deviceAddress, String url, boolean useExplicitCa) throws MigrateException {
        return selfTest(deviceAddress).testConnection(url, useExplicitCa);
    }

    public String testDnsRedirection(String deviceAddress, String targetUrl) throws MigrateException {
        DnsSettings settings = DnsSettings.DEFAULTS;
        if (store != null) {
            try {
                settings = store.getDnsSettings();
            } catch (DeviceStoreException e) {
                log.warn("Cannot read DNS settings, assuming port {}: {}", DnsSettings.STANDARD_PORT, e.getMessage());
            }
        }
        return selfTest(deviceAddress).testDnsRedirection(targetOrDefault(targetUrl), settings);
    }

    private ConnectivitySelfTest selfTest(String deviceAddress) {
        return new ConnectivitySelfTest(openSession(deviceAddress), ca, config.httpsPort());
    }

    // ---------------------------------------------------------------- helpers

    private DeviceSession openSession(String deviceAddress) {
        RemoteShell shell = shellFactory.forHost(deviceAddress);
        return new DeviceSession(
                shell,
                new OnDeviceBackup(shell),
                new TrustStoreEditor(shell, ca),
                new RemoteServicesManager(shell),
                resolver);
    }

    private String targetOrDefault(String targetUrl) {
        return targetUrl == null || targetUrl.isBlank() ? config.serverUrl() : targetUrl;
    }

    private static String outputIfSucceeded(RemoteShell shell, ShellCommand command) {
        CommandResult result = shell.run(command);
        return result.succeeded() ? result.output() : "";
    }

    /**
     * Builder for {@link MigrationManager}. Only the configuration and the shell
     * factory are required.
     */
    public static final class Builder {
        private final MigratorConfig config;
        private RemoteShellFactory shellFactory;
        private DeviceStore store;
        private CertificateAuthority ca;
        private DeviceInfoClient infoClient;
        private HostResolver hostResolver;
        private DnsStatusProvider dnsStatusProvider;

        private Builder(MigratorConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder shellFactory(RemoteShellFactory shellFactory) {
            this.shellFactory = shellFactory;
            return this;
        }

        public Builder deviceStore(DeviceStore store) {
            this.store = store;
            return this;
        }

        public Builder certificateAuthority(CertificateAuthority ca) {
            this.ca = ca;
            return this;
        }

        /** Defaults to {@link HttpDeviceInfoClient}. */
        public Builder deviceInfoClient(DeviceInfoClient infoClient) {
            this.infoClient = infoClient;
            return this;
        }

        /** Defaults to {@link HostResolver#SYSTEM}. */
        public Builder hostResolver(HostResolver hostResolver) {
            this.hostResolver = hostResolver;
            return this;
        }

        /** Live DNS service status for the resolv preflight; optional. */
        public Builder dnsStatusProvider(DnsStatusProvider dnsStatusProvider) {
            this.dnsStatusProvider = dnsStatusProvider;
            return this;
        }

        public MigrationManager build() {
            return new MigrationManager(this);
        }
    }
}
