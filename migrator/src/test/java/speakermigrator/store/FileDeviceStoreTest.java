package speakermigrator.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import speakermigrator.exceptions.DeviceStoreException;
import speakermigrator.model.DeviceRecord;
import speakermigrator.model.DnsSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileDeviceStore")
class FileDeviceStoreTest {

    @TempDir
    Path dataDir;

    private void installFixture(Path target) throws IOException {
        Files.createDirectories(target.getParent());
        try (InputStream in = getClass().getResourceAsStream("/fixtures/DeviceInfo.xml")) {
            Files.copy(in, target);
        }
    }

    @Nested
    @DisplayName("listDevices")
    class ListDevices {

        @Test
        @DisplayName("should return nothing for a missing data directory")
        void shouldReturnNothingForMissingDir() {
            assertThat(new FileDeviceStore(dataDir.resolve("absent")).listDevices()).isEmpty();
        }

        @Test
        @DisplayName("should read device documents below each account")
        void shouldReadDeviceDocuments() throws IOException {
            installFixture(dataDir.resolve("3230304/devices/689E19B8BB8A/DeviceInfo.xml"));

            List<DeviceRecord> devices = new FileDeviceStore(dataDir).listDevices();

            assertThat(devices).singleElement().satisfies(d -> {
                assertThat(d.deviceId()).isEqualTo("689E19B8BB8A");
                assertThat(d.name()).isEqualTo("Kitchen");
                assertThat(d.productCode()).isEqualTo("SoundTouch 10 sm2");
                assertThat(d.deviceSerialNumber()).isEqualTo("I6332527703739342000020");
                assertThat(d.productSerialNumber()).isEqualTo("069231P63364828AE");
                assertThat(d.ipAddress()).isEqualTo("192.168.1.31");
                assertThat(d.accountId()).isEqualTo("3230304");
                assertThat(d.firmwareVersion()).startsWith("27.0.6");
            });
        }

        @Test
        @DisplayName("should de-duplicate the legacy flat layout")
        void shouldDeduplicateLegacyLayout() throws IOException {
            installFixture(dataDir.resolve("3230304/devices/689E19B8BB8A/DeviceInfo.xml"));
            installFixture(dataDir.resolve("3230304/devices/DeviceInfo.xml"));

            assertThat(new FileDeviceStore(dataDir).listDevices()).hasSize(1);
        }

        @Test
        @DisplayName("should skip unreadable documents")
        void shouldSkipUnreadable() throws IOException {
            Path broken = dataDir.resolve("acct/devices/X/DeviceInfo.xml");
            Files.createDirectories(broken.getParent());
            Files.writeString(broken, "<info");

            assertThat(new FileDeviceStore(dataDir).listDevices()).isEmpty();
        }

        @Test
        @DisplayName("should find a device by address")
        void shouldFindByAddress() throws IOException {
            installFixture(dataDir.resolve("3230304/devices/689E19B8BB8A/DeviceInfo.xml"));
            FileDeviceStore store = new FileDeviceStore(dataDir);

            assertThat(store.findByAddress("192.168.1.31")).isPresent();
            assertThat(store.findByAddress("192.168.1.99")).isEmpty();
        }
    }

    @Nested
    @DisplayName("DNS settings")
    class Settings {

        @Test
        @DisplayName("should default when no settings file exists")
        void shouldDefault() {
            assertThat(new FileDeviceStore(dataDir).getDnsSettings()).isEqualTo(DnsSettings.DEFAULTS);
        }

        @Test
        @DisplayName("should save and reload while keeping unrelated keys")
        void shouldSaveAndKeepOtherKeys() throws IOException {
            Files.writeString(dataDir.resolve(FileDeviceStore.SETTINGS_FILE), "theme: dark\n");
            FileDeviceStore store = new FileDeviceStore(dataDir);

            store.saveDnsSettings(new DnsSettings(true, "0.0.0.0:53"));

            assertThat(store.getDnsSettings()).isEqualTo(new DnsSettings(true, "0.0.0.0:53"));
            assertThat(Files.readString(dataDir.resolve(FileDeviceStore.SETTINGS_FILE)))
                    .contains("theme: dark")
                    .contains("bindAddr").contains("0.0.0.0:53");
        }

        @Test
        @DisplayName("should fail on a malformed settings file")
        void shouldFailOnMalformedFile() throws IOException {
            Files.writeString(dataDir.resolve(FileDeviceStore.SETTINGS_FILE), "- just\n- a list\n");

            assertThatThrownBy(() -> new FileDeviceStore(dataDir).getDnsSettings())
                    .isInstanceOf(DeviceStoreException.class)
                    .hasMessageContaining("not a mapping");
        }
    }

    @Test
    @DisplayName("accountDeviceDir should nest the device under its account")
    void accountDeviceDir() {
        assertThat(new FileDeviceStore(dataDir).accountDeviceDir("acct", "SN1"))
                .isEqualTo(dataDir.resolve("acct").resolve("devices").resolve("SN1"));
    }
}
