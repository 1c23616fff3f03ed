package speakermigrator.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import speakermigrator.backup.OffDeviceBackup;
import speakermigrator.config.MigratorConfig;
import speakermigrator.device.DeviceInfoClient;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.DeviceInfo;
import speakermigrator.model.DnsSettings;
import speakermigrator.model.MigrationMethod;
import speakermigrator.model.MigrationSummary;
import speakermigrator.store.DeviceStore;
import speakermigrator.store.FileDeviceStore;
import speakermigrator.strategy.ResolvConfStrategy;
import speakermigrator.support.FakeDevice;
import speakermigrator.support.SpeakerFiles;
import speakermigrator.support.StaticCertificateAuthority;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

@DisplayName("MigrationManager")
class MigrationManagerTest {

    private static final String SPEAKER = "10.0.0.5";
    private static final String TARGET = "http://svc:8000";
    private static final String TARGET_IP = "10.0.0.9";

    @Mock
    private DeviceStore store;

    @Mock
    private DeviceInfoClient infoClient;

    private FakeDevice device;
    private MigrationManager manager;

    @BeforeEach
    void setUp() throws IOException {
        MockitoAnnotations.openMocks(this);
        when(infoClient.fetch(anyString())).thenThrow(new IOException("connection refused"));
        when(store.listDevices()).thenReturn(List.of());
        when(store.getDnsSettings()).thenReturn(new DnsSettings(true, ":53"));
        device = SpeakerFiles.pristine(SPEAKER);
        manager = managerFor(device, store);
    }

    private static DeviceInfo kitchenSpeaker() {
        return new DeviceInfo("689E19B8BB8A", "Kitchen", "SoundTouch 10", "3230304",
                List.of(new DeviceInfo.Component("SCM", "27.0.6", "I6332527")));
    }

    private MigrationManager managerFor(FakeDevice speaker, DeviceStore deviceStore) {
        return MigrationManager.builder(MigratorConfig.DEFAULTS)
                .shellFactory(host -> speaker)
                .deviceStore(deviceStore)
                .certificateAuthority(new StaticCertificateAuthority())
                .deviceInfoClient(infoClient)
                .hostResolver(host -> new InetAddress[] {
                        InetAddress.getByAddress(host, new byte[] {10, 0, 0, 9})})
                .build();
    }

    @Nested
    @DisplayName("migrateSpeaker")
    class MigrateSpeaker {

        @Test
        @DisplayName("hosts: should redirect vendor domains and trust the CA without rebooting")
        void hostsMigration() throws MigrateException {
            String log = manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts");

            assertThat(device.uploadsTo(DevicePaths.HOSTS)).singleElement()
                    .satisfies(hosts -> assertThat(hosts)
                            .startsWith("127.0.0.1 localhost\n")
                            .contains(TARGET_IP + "\tstreaming.bose.com")
                            .contains(TARGET_IP + "\tmusic.api.bose.com"));
            assertThat(device.runs())
                    .contains("(rw || mount -o remount,rw /) && cp /etc/hosts /etc/hosts.original")
                    .contains("cp /etc/pki/tls/certs/ca-bundle.crt /etc/pki/tls/certs/ca-bundle.crt.original")
                    .noneMatch(cmd -> cmd.contains("reboot"));
            assertThat(device.content(DevicePaths.original(DevicePaths.HOSTS))).isEqualTo(SpeakerFiles.HOSTS);
            assertThat(device.content(DevicePaths.original(DevicePaths.PRIVATE_CONFIG)))
                    .isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(device.content(DevicePaths.CA_BUNDLE)).contains(StaticCertificateAuthority.PEM);
            assertThat(log)
                    .contains("Pre-flight: Write access verified.")
                    .contains("Failed to create off-device backup");
        }

        @Test
        @DisplayName("xml: should write the planned config after backing up the original")
        void xmlMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, null, null, "");

            assertThat(device.content(DevicePaths.original(DevicePaths.PRIVATE_CONFIG)))
                    .isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(device.content(DevicePaths.PRIVATE_CONFIG))
                    .startsWith("<?xml version=\"1.0\" encoding=\"utf-8\"?>")
                    .contains("<margeServerUrl>http://svc:8000/marge</margeServerUrl>");
            assertThat(device.has("/etc/remote_services")).isTrue();
        }

        @Test
        @DisplayName("xml: should route upstream subsystems through the proxy")
        void xmlMigrationWithOptions() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "http://proxy:9000", Map.of("stats", "upstream"),
                    MigrationMethod.XML);

            assertThat(device.content(DevicePaths.PRIVATE_CONFIG))
                    .contains("<statsServerUrl>http://proxy:9000/proxy/https://events.api.bosecm.com</statsServerUrl>")
                    .contains("<margeServerUrl>http://svc:8000/marge</margeServerUrl>");
        }

        @Test
        @DisplayName("should keep the first original across repeated migrations")
        void repeatedMigrationsKeepOriginal() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "xml");
            manager.migrateSpeaker(SPEAKER, "http://other:8000", "", null, "xml");
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts");
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts");

            assertThat(device.content(DevicePaths.original(DevicePaths.PRIVATE_CONFIG)))
                    .isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(device.content(DevicePaths.original(DevicePaths.HOSTS))).isEqualTo(SpeakerFiles.HOSTS);
            assertThat(device.content(DevicePaths.original(DevicePaths.CA_BUNDLE))).isEqualTo(SpeakerFiles.CA_BUNDLE);
        }

        @Test
        @DisplayName("resolv: should install the DNS hook")
        void resolvMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");

            assertThat(device.content(DevicePaths.PRIORITY_RESOLV)).endsWith("nameserver " + TARGET_IP + "\n");
            assertThat(device.content(DevicePaths.BOOT_SCRIPT))
                    .startsWith("#!/bin/sh\n")
                    .contains(DevicePaths.PRIORITY_RESOLV);
            assertThat(device.content(DevicePaths.DHCP_DEFAULT_SCRIPT)).contains("cat " + DevicePaths.PRIORITY_RESOLV);
            assertThat(device.content(DevicePaths.original(DevicePaths.DHCP_DEFAULT_SCRIPT)))
                    .isEqualTo(SpeakerFiles.DHCP_DEFAULT);
            assertThat(device.runs()).contains("chmod +x " + DevicePaths.BOOT_SCRIPT);
        }

        @Test
        @DisplayName("resolv: should produce the same scripts when repeated")
        void resolvMigrationIsRepeatable() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");
            String boot = device.content(DevicePaths.BOOT_SCRIPT);
            String dhcp = device.content(DevicePaths.DHCP_DEFAULT_SCRIPT);

            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");

            assertThat(device.content(DevicePaths.BOOT_SCRIPT)).isEqualTo(boot);
            assertThat(device.content(DevicePaths.DHCP_DEFAULT_SCRIPT)).isEqualTo(dhcp);
        }

        @Test
        @DisplayName("resolv: should leave the DHCP script originals untouched when repeated")
        void resolvMigrationKeepsDhcpOriginals() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");
            manager.migrateSpeaker(SPEAKER, "http://other:8000", "", null, "resolv");

            assertThat(device.content(DevicePaths.original(DevicePaths.DHCP_DEFAULT_SCRIPT)))
                    .isEqualTo(SpeakerFiles.DHCP_DEFAULT);
            assertThat(device.content(DevicePaths.original(DevicePaths.PRIVATE_CONFIG)))
                    .isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(device.content(DevicePaths.original(DevicePaths.CA_BUNDLE)))
                    .isEqualTo(SpeakerFiles.CA_BUNDLE);
        }

        @Test
        @DisplayName("resolv: should stop when the DNS service is disabled")
        void resolvPreflightFailure() {
            when(store.getDnsSettings()).thenReturn(DnsSettings.DEFAULTS);

            assertThatThrownBy(() -> manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv"))
                    .isInstanceOfSatisfying(MigrateException.class, e -> {
                        assertThat(e.getStage()).isEqualTo("dns-preflight");
                        assertThat(e.getLog()).contains("Pre-flight: Write access verified.");
                    });
            assertThat(device.uploads()).isEmpty();
        }

        @Test
        @DisplayName("should abort when write access cannot be gained")
        void writeAccessFailure() {
            device.writeAccessFails();

            assertThatThrownBy(() -> manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts"))
                    .isInstanceOfSatisfying(MigrateException.class, e -> {
                        assertThat(e.getStage()).isEqualTo("preflight");
                        assertThat(e.getMessage()).contains("pre-flight check failed: cannot gain write access");
                    });
            assertThat(device.uploads()).isEmpty();
        }

        @Test
        @DisplayName("should reject an unknown method")
        void unknownMethod() {
            assertThatThrownBy(() -> manager.migrateSpeaker(SPEAKER, TARGET, "", null, "carrier-pigeon"))
                    .isInstanceOf(MigrateException.class)
                    .hasMessageContaining("unsupported migration method: carrier-pigeon");
            assertThat(device.runs()).isEmpty();
        }

        @Test
        @DisplayName("every method should have a strategy")
        void everyMethodHasStrategy() {
            assertThat(MigrationMethod.values())
                    .allSatisfy(method -> assertThat(MigrationManager.strategyFor(method)).isNotNull());
            assertThat(MigrationManager.strategyFor(MigrationMethod.RESOLV))
                    .isInstanceOf(ResolvConfStrategy.class);
        }

        @Test
        @DisplayName("hosts: should reject a localhost target")
        void localhostTarget() {
            assertThatThrownBy(() -> manager.migrateSpeaker(SPEAKER, "http://localhost:8000", "", null, "hosts"))
                    .hasMessageContaining("target URL must contain a valid IP or hostname");
            assertThat(device.uploadsTo(DevicePaths.HOSTS)).isEmpty();
        }
    }

    @Nested
    @DisplayName("revertMigration")
    class RevertMigration {

        @Test
        @DisplayName("should restore the original config bytes")
        void shouldRestoreConfig() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "xml");
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts");

            manager.revertMigration(SPEAKER);

            assertThat(device.content(DevicePaths.PRIVATE_CONFIG)).isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(device.content(DevicePaths.HOSTS)).isEqualTo(SpeakerFiles.HOSTS);
            assertThat(device.content(DevicePaths.CA_BUNDLE)).isEqualTo(SpeakerFiles.CA_BUNDLE);
        }

        @Test
        @DisplayName("should undo the DNS hook")
        void shouldUndoDnsHook() throws MigrateException {
            device.file(DevicePaths.BOOT_SCRIPT, "#!/bin/sh\nntpd -q\n");
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "xml");
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");

            manager.revertMigration(SPEAKER);

            assertThat(device.has(DevicePaths.PRIORITY_RESOLV)).isFalse();
            assertThat(device.content(DevicePaths.BOOT_SCRIPT)).isEqualTo("#!/bin/sh\nntpd -q\n");
            assertThat(device.content(DevicePaths.DHCP_DEFAULT_SCRIPT)).isEqualTo(SpeakerFiles.DHCP_DEFAULT);
        }

        @Test
        @DisplayName("should undo a hosts-only migration")
        void shouldUndoHostsOnlyMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts");

            manager.revertMigration(SPEAKER);

            assertThat(device.content(DevicePaths.HOSTS)).isEqualTo(SpeakerFiles.HOSTS);
            assertThat(device.content(DevicePaths.CA_BUNDLE))
                    .isEqualTo(SpeakerFiles.CA_BUNDLE)
                    .doesNotContain(StaticCertificateAuthority.PEM);
            assertThat(device.content(DevicePaths.PRIVATE_CONFIG)).isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
        }

        @Test
        @DisplayName("should undo a resolv-only migration")
        void shouldUndoResolvOnlyMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");

            manager.revertMigration(SPEAKER);

            assertThat(device.has(DevicePaths.PRIORITY_RESOLV)).isFalse();
            assertThat(device.content(DevicePaths.DHCP_DEFAULT_SCRIPT)).isEqualTo(SpeakerFiles.DHCP_DEFAULT);
            assertThat(device.content(DevicePaths.CA_BUNDLE)).isEqualTo(SpeakerFiles.CA_BUNDLE);
            assertThat(device.content(DevicePaths.PRIVATE_CONFIG)).isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
        }

        @Test
        @DisplayName("should fail without a config backup and upload nothing")
        void shouldFailWithoutBackup() {
            assertThatThrownBy(() -> manager.revertMigration(SPEAKER))
                    .isInstanceOf(MigrateException.class)
                    .hasMessageContaining("backup");
            assertThat(device.uploads()).isEmpty();
        }
    }

    @Nested
    @DisplayName("getMigrationSummary")
    class Summary {

        @Test
        @DisplayName("should report a pristine speaker as not migrated")
        void pristineSpeaker() throws MigrateException {
            MigrationSummary summary = manager.getMigrationSummary(SPEAKER, TARGET, "", null);

            assertThat(summary.sshSuccess()).isTrue();
            assertThat(summary.isMigrated()).isFalse();
            assertThat(summary.currentConfig()).isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(summary.parsedCurrentConfig().margeServerUrl()).isEqualTo("https://streaming.bose.com");
            assertThat(summary.plannedConfig()).contains("http://svc:8000/marge");
            assertThat(summary.plannedHosts()).contains(TARGET_IP + "\tstreaming.bose.com");
            assertThat(summary.plannedResolv()).contains("nameserver " + TARGET_IP);
            assertThat(summary.serverHttpsUrl()).isEqualTo("https://svc:8443/health");
            assertThat(summary.caCertTrusted()).isFalse();
            assertThat(summary.remoteServicesFound()).isEmpty();
            assertThat(summary.targetHost()).isEqualTo("svc");
            assertThat(device.uploads()).isEmpty();
        }

        @Test
        @DisplayName("should report migrated after a hosts migration")
        void afterHostsMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "hosts");

            MigrationSummary summary = manager.getMigrationSummary(SPEAKER, TARGET, "", null);

            assertThat(summary.caCertTrusted()).isTrue();
            assertThat(summary.isMigrated()).isTrue();
        }

        @Test
        @DisplayName("should report migrated after a resolv migration")
        void afterResolvMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "resolv");

            MigrationSummary summary = manager.getMigrationSummary(SPEAKER, TARGET, "", null);

            assertThat(summary.dnsHookInstalled()).isTrue();
            assertThat(summary.isMigrated()).isTrue();
        }

        @Test
        @DisplayName("should show the original config and remote-services markers after an xml migration")
        void afterXmlMigration() throws MigrateException {
            manager.migrateSpeaker(SPEAKER, TARGET, "", null, "xml");

            MigrationSummary summary = manager.getMigrationSummary(SPEAKER, TARGET, "", null);

            assertThat(summary.originalConfig()).isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(summary.remoteServicesFound()).containsExactly("/etc/remote_services");
            assertThat(summary.remoteServicesPersistent()).isTrue();
            assertThat(summary.isMigrated()).isTrue();
        }

        @Test
        @DisplayName("should describe an unreachable speaker without failing")
        void unreachableSpeaker() throws MigrateException {
            FakeDevice offline = new FakeDevice(SPEAKER).unreachable();

            MigrationSummary summary = managerFor(offline, store).getMigrationSummary(SPEAKER, TARGET, "", null);

            assertThat(summary.sshSuccess()).isFalse();
            assertThat(summary.currentConfig()).startsWith("SSH connection failed:");
            assertThat(summary.isMigrated()).isFalse();
            assertThat(summary.plannedConfig()).contains("http://svc:8000/marge");
        }

        @Test
        @DisplayName("should take identity from the live device")
        void liveIdentity() throws Exception {
            doReturn(kitchenSpeaker()).when(infoClient).fetch(SPEAKER);

            MigrationSummary summary = manager.getMigrationSummary(SPEAKER, TARGET, "", null);

            assertThat(summary.deviceName()).isEqualTo("Kitchen");
            assertThat(summary.deviceModel()).isEqualTo("SoundTouch 10");
            assertThat(summary.deviceSerial()).isEqualTo("I6332527");
            assertThat(summary.firmwareVersion()).isEqualTo("27.0.6");
            assertThat(summary.accountId()).isEqualTo("3230304");
        }
    }

    @Nested
    @DisplayName("backups")
    class Backups {

        @TempDir
        Path dataDir;

        @Test
        @DisplayName("should copy config and hosts into the device store")
        void offDeviceBackup() throws Exception {
            doReturn(kitchenSpeaker()).when(infoClient).fetch(SPEAKER);
            MigrationManager withFiles = managerFor(device, new FileDeviceStore(dataDir));

            Path dir = withFiles.backupConfigOffDevice(SPEAKER);

            assertThat(dir).isEqualTo(dataDir.resolve("3230304/devices/I6332527"));
            assertThat(Files.readString(dir.resolve(OffDeviceBackup.CONFIG_BACKUP_FILE)))
                    .isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThat(Files.readString(dir.resolve(OffDeviceBackup.HOSTS_BACKUP_FILE))).isEqualTo(SpeakerFiles.HOSTS);
        }

        @Test
        @DisplayName("backupConfig should refuse a second backup")
        void backupConfigOnce() throws MigrateException {
            manager.backupConfig(SPEAKER);

            assertThat(device.content(DevicePaths.original(DevicePaths.PRIVATE_CONFIG)))
                    .isEqualTo(SpeakerFiles.PRIVATE_CONFIG);
            assertThatThrownBy(() -> manager.backupConfig(SPEAKER))
                    .hasMessageContaining("backup already exists");
        }
    }

    @Test
    @DisplayName("reboot should be the only operation that reboots")
    void reboot() throws MigrateException {
        manager.reboot(SPEAKER);

        assertThat(device.runs()).containsExactly("(rw || mount -o remount,rw /) && reboot");
    }

    @Test
    @DisplayName("trustCaCert and isCaTrusted should agree")
    void trustCaCert() throws MigrateException {
        assertThat(manager.isCaTrusted(SPEAKER)).isFalse();

        manager.trustCaCert(SPEAKER);

        assertThat(manager.isCaTrusted(SPEAKER)).isTrue();
    }
}
