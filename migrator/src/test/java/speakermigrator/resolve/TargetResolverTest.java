package speakermigrator.resolve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import speakermigrator.alert.OperationLog;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.support.FakeDevice;

import java.net.InetAddress;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TargetResolver")
class TargetResolverTest {

    private static final HostResolver FAILING = host -> {
        throw new UnknownHostException(host);
    };

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("should return IP literals unchanged without asking the device")
        void shouldReturnLiterals() {
            FakeDevice device = new FakeDevice("10.0.0.5");

            assertThat(new TargetResolver(FAILING).resolve("10.0.0.9", device)).isEqualTo("10.0.0.9");
            assertThat(device.runs()).isEmpty();
        }

        @Test
        @DisplayName("should prefer the address the device resolves")
        void shouldPreferDeviceResolution() {
            FakeDevice device = new FakeDevice("10.0.0.5")
                    .pingReplies("PING svc (10.0.0.7): 56 data bytes\n64 bytes from 10.0.0.7: seq=0 ttl=64\n");
            TargetResolver resolver = new TargetResolver(host -> new InetAddress[] {
                    InetAddress.getByAddress(host, new byte[] {10, 9, 9, 9})});

            assertThat(resolver.resolve("svc", device)).isEqualTo("10.0.0.7");
            assertThat(device.runs()).containsExactly("ping -c 1 svc");
        }

        @Test
        @DisplayName("should fall back to local lookup, preferring IPv4")
        void shouldFallBackToLocalLookup() throws Exception {
            FakeDevice device = new FakeDevice("10.0.0.5");
            InetAddress v6 = InetAddress.getByName("fe80::1");
            InetAddress v4 = InetAddress.getByAddress("svc", new byte[] {10, 0, 0, 8});
            TargetResolver resolver = new TargetResolver(host -> new InetAddress[] {v6, v4});

            assertThat(resolver.resolve("svc", device)).isEqualTo("10.0.0.8");
        }

        @Test
        @DisplayName("should return the host name when nothing resolves")
        void shouldReturnHostWhenUnresolvable() {
            assertThat(new TargetResolver(FAILING).resolve("svc", null)).isEqualTo("svc");
        }
    }

    @Test
    @DisplayName("requireTarget should reject localhost")
    void requireTargetShouldRejectLocalhost() {
        OperationLog oplog = new OperationLog("10.0.0.5");

        assertThatThrownBy(() -> TargetResolver.requireTarget("http://localhost:8000", oplog))
                .isInstanceOf(MigrateException.class)
                .hasMessageContaining("target URL must contain a valid IP or hostname (got localhost)");
        assertThat(oplog.toString()).contains("Error: target URL");
    }

    @Test
    @DisplayName("addressInParentheses should ignore non-addresses")
    void addressInParentheses() {
        assertThat(TargetResolver.addressInParentheses("PING svc (10.1.2.3): 56 data bytes")).isEqualTo("10.1.2.3");
        assertThat(TargetResolver.addressInParentheses("ping: bad address 'svc'")).isNull();
        assertThat(TargetResolver.addressInParentheses("(not-an-ip)")).isNull();
    }
}
