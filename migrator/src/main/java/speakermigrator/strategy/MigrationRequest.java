package speakermigrator.strategy;

import speakermigrator.model.MigrationMethod;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Parameters of one migration.
 *
 * @param deviceAddress the speaker
 * @param targetUrl base URL of the substitute service
 * @param proxyUrl proxy base URL for upstream routing, empty if none was given
 * @param options subsystem key to routing value, or null if none were given
 * @param method the redirection technique
 */
public record MigrationRequest(
        String deviceAddress,
        String targetUrl,
        String proxyUrl,
        Map<String, String> options,
        MigrationMethod method
) {
    public MigrationRequest {
        proxyUrl = proxyUrl != null ? proxyUrl : "";
        options = options != null ? Collections.unmodifiableMap(new HashMap<>(options)) : null;
    }
}
