package speakermigrator.device;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HttpDeviceInfoClient")
class HttpDeviceInfoClientTest {

    private final HttpDeviceInfoClient client = new HttpDeviceInfoClient(8090, Duration.ofSeconds(1));

    @Test
    @DisplayName("should add the device port when the address has none")
    void addsPort() {
        assertThat(client.infoUri("192.168.1.31")).hasToString("http://192.168.1.31:8090/info");
        assertThat(client.infoUri("speaker.local")).hasToString("http://speaker.local:8090/info");
    }

    @Test
    @DisplayName("should keep an explicit port")
    void keepsPort() {
        assertThat(client.infoUri("192.168.1.31:18090")).hasToString("http://192.168.1.31:18090/info");
        assertThat(client.infoUri("[fe80::1]:8090")).hasToString("http://[fe80::1]:8090/info");
    }
}
