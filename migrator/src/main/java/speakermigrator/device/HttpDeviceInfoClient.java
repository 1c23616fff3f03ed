package speakermigrator.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.codec.DeviceInfoCodec;
import speakermigrator.config.MigratorConfig;
import speakermigrator.model.DeviceInfo;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches {@code http://<device>:<port>/info} with the JDK HTTP client.
 *
 * <p>An address that already carries a port is used as is, which lets tests
 * point the client at a local server.
 */
public final class HttpDeviceInfoClient implements DeviceInfoClient {

    private static final Logger log = LoggerFactory.getLogger(HttpDeviceInfoClient.class);

    private final HttpClient httpClient;
    private final int port;
    private final Duration timeout;

    public HttpDeviceInfoClient(MigratorConfig config) {
        this(config.deviceHttpPort(), config.deviceHttpTimeout());
    }

    public HttpDeviceInfoClient(int port, Duration timeout) {
        this.port = port;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public DeviceInfo fetch(String deviceAddress) throws IOException {
        URI uri = infoUri(deviceAddress);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + uri, e);
        }
        try (InputStream body = response.body()) {
            if (response.statusCode() != 200) {
                throw new IOException("GET " + uri + " returned HTTP " + response.statusCode());
            }
            DeviceInfo info = DeviceInfoCodec.decode(body);
            log.debug("Fetched {} from {}", info, uri);
            return info;
        }
    }

    URI infoUri(String deviceAddress) {
        if (hasPort(deviceAddress)) {
            return URI.create("http://" + deviceAddress + "/info");
        }
        return URI.create("http://" + deviceAddress + ":" + port + "/info");
    }

    private static boolean hasPort(String address) {
        if (address.startsWith("[")) {
            return address.contains("]:");
        }
        int colon = address.indexOf(':');
        return colon > 0 && colon == address.lastIndexOf(':');
    }
}
