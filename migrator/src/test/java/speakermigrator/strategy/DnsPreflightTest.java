package speakermigrator.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import speakermigrator.alert.OperationLog;
import speakermigrator.exceptions.DeviceStoreException;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.DnsSettings;
import speakermigrator.store.DeviceStore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@DisplayName("DnsPreflight")
class DnsPreflightTest {

    @Mock
    private DeviceStore store;

    private OperationLog oplog;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        oplog = new OperationLog("10.0.0.5");
    }

    @Test
    @DisplayName("should fail without a store")
    void shouldFailWithoutStore() {
        assertThatThrownBy(() -> new DnsPreflight(null, null).check(oplog))
                .isInstanceOf(MigrateException.class)
                .hasMessageContaining("failed to retrieve settings");
    }

    @Test
    @DisplayName("should fail when settings cannot be read")
    void shouldFailWhenSettingsUnreadable() {
        when(store.getDnsSettings()).thenThrow(new DeviceStoreException("disk gone"));

        assertThatThrownBy(() -> new DnsPreflight(store, null).check(oplog))
                .hasMessageContaining("failed to retrieve settings: disk gone");
    }

    @Test
    @DisplayName("should fail when the DNS service is disabled")
    void shouldFailWhenDisabled() {
        when(store.getDnsSettings()).thenReturn(new DnsSettings(false, ":53"));

        assertThatThrownBy(() -> new DnsPreflight(store, null).check(oplog))
                .isInstanceOf(MigrateException.class)
                .hasMessageContaining("not enabled");
    }

    @Test
    @DisplayName("should fail when bound to a non-standard port")
    void shouldFailOnNonStandardPort() {
        when(store.getDnsSettings()).thenReturn(new DnsSettings(true, ":5353"));

        assertThatThrownBy(() -> new DnsPreflight(store, null).check(oplog))
                .hasMessageContaining("bound to :5353")
                .hasMessageContaining("port 53 is required");
    }

    @Test
    @DisplayName("should fail when the service is configured but not running")
    void shouldFailWhenNotRunning() {
        when(store.getDnsSettings()).thenReturn(new DnsSettings(true, ":53"));
        DnsStatusProvider status = () -> new DnsStatusProvider.DnsStatus(false, ":53");

        assertThatThrownBy(() -> new DnsPreflight(store, status).check(oplog))
                .hasMessageContaining("not actually running");
    }

    @Test
    @DisplayName("should fail when running on another port than configured")
    void shouldFailWhenRunningElsewhere() {
        when(store.getDnsSettings()).thenReturn(new DnsSettings(true, ":53"));
        DnsStatusProvider status = () -> new DnsStatusProvider.DnsStatus(true, "0.0.0.0:5300");

        assertThatThrownBy(() -> new DnsPreflight(store, status).check(oplog))
                .hasMessageContaining("running on 0.0.0.0:5300");
    }

    @Test
    @DisplayName("should pass when enabled and running on port 53")
    void shouldPass() {
        when(store.getDnsSettings()).thenReturn(new DnsSettings(true, "0.0.0.0:53"));
        DnsStatusProvider status = () -> new DnsStatusProvider.DnsStatus(true, "0.0.0.0:53");

        assertThatCode(() -> new DnsPreflight(store, status).check(oplog)).doesNotThrowAnyException();
        assertThat(oplog.toString()).contains("DNS pre-flight");
    }

    @Test
    @DisplayName("should pass on settings alone without a status provider")
    void shouldPassWithoutStatusProvider() {
        when(store.getDnsSettings()).thenReturn(new DnsSettings(true, ":53"));

        assertThatCode(() -> new DnsPreflight(store, null).check(oplog)).doesNotThrowAnyException();
    }
}
