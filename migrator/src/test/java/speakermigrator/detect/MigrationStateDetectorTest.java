package speakermigrator.detect;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import speakermigrator.model.MigrationSummary;
import speakermigrator.model.PrivateConfig;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrationStateDetector")
class MigrationStateDetectorTest {

    private static final String TARGET = "10.0.0.9";

    private static MigrationSummary.Builder reachable() {
        return MigrationSummary.builder().sshSuccess(true);
    }

    @Test
    @DisplayName("should never report an unreachable speaker as migrated")
    void unreachableIsNotMigrated() {
        MigrationSummary summary = MigrationSummary.builder()
                .sshSuccess(false)
                .parsedCurrentConfig(PrivateConfig.pointingAt("http://" + TARGET))
                .build();

        assertThat(MigrationStateDetector.isMigrated(summary, TARGET)).isFalse();
    }

    @Test
    @DisplayName("should detect a config pointing at the target")
    void configPointingAtTarget() {
        MigrationSummary summary = reachable()
                .parsedCurrentConfig(PrivateConfig.pointingAt("http://" + TARGET + ":8000"))
                .build();

        assertThat(MigrationStateDetector.isMigrated(summary, TARGET)).isTrue();
    }

    @Test
    @DisplayName("should require CA trust for hosts redirection")
    void hostsRequireTrust() {
        MigrationSummary.Builder b = reachable().currentHosts("10.0.0.9\tstreaming.bose.com\n");

        assertThat(MigrationStateDetector.isMigrated(b.build(), TARGET)).isFalse();
        assertThat(MigrationStateDetector.isMigrated(b.caCertTrusted(true).build(), TARGET)).isTrue();
    }

    @Test
    @DisplayName("should detect an installed DNS hook when the CA is trusted")
    void dnsHook() {
        MigrationSummary summary = reachable().caCertTrusted(true).dnsHookInstalled(true).build();

        assertThat(MigrationStateDetector.isMigrated(summary, TARGET)).isTrue();
    }

    @Test
    @DisplayName("should detect the target in resolv.conf when the CA is trusted")
    void resolvConf() {
        MigrationSummary summary = reachable().caCertTrusted(true)
                .currentResolvConf("nameserver 10.0.0.9\n").build();

        assertThat(MigrationStateDetector.isMigrated(summary, TARGET)).isTrue();
    }

    @Test
    @DisplayName("should report a pristine speaker as not migrated")
    void pristine() {
        MigrationSummary summary = reachable()
                .parsedCurrentConfig(PrivateConfig.pointingAt("https://streaming.bose.com"))
                .currentHosts("127.0.0.1 localhost\n")
                .currentResolvConf("nameserver 192.168.1.1\n")
                .build();

        assertThat(MigrationStateDetector.isMigrated(summary, TARGET)).isFalse();
    }
}
