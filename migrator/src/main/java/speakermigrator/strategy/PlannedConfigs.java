package speakermigrator.strategy;

import speakermigrator.model.PrivateConfig;
import speakermigrator.model.Subsystem;

import java.util.Map;

/**
 * Builds the private configuration a migration writes.
 */
public final class PlannedConfigs {

    static final String PROXY_PATH = "/proxy/";

    private PlannedConfigs() {}

    /**
     * Plans the configuration for a target.
     *
     * <p>Without a readable current configuration every subsystem points at the
     * target. With one, subsystems marked {@code upstream} in {@code options} are
     * proxied to their current URL; when no options were given at all but a proxy
     * URL was, every subsystem is proxied.
     *
     * @param targetUrl base URL of the substitute service
     * @param proxyUrl proxy base URL, empty if none was given
     * @param options routing options, or null if none were given
     * @param current the speaker's current configuration, or null
     */
    public static PrivateConfig plan(String targetUrl, String proxyUrl, Map<String, String> options,
                                     PrivateConfig current) {
        PrivateConfig planned = PrivateConfig.pointingAt(targetUrl);
        if (current == null) {
            return planned;
        }
        boolean explicitProxy = proxyUrl != null && !proxyUrl.isEmpty();
        if (options != null) {
            return withUpstreamRouting(planned, current, explicitProxy ? proxyUrl : targetUrl, options);
        }
        if (explicitProxy) {
            return withAllProxied(planned, current, proxyUrl);
        }
        return planned;
    }

    /**
     * Routes the subsystems marked {@code upstream} through the proxy to their
     * current URL. Subsystems with an empty current URL keep the planned value.
     */
    static PrivateConfig withUpstreamRouting(PrivateConfig planned, PrivateConfig current,
                                                    String proxyUrl, Map<String, String> options) {
        if (proxyUrl == null || proxyUrl.isEmpty() || current == null) {
            return planned;
        }
        PrivateConfig result = planned;
        for (Subsystem s : Subsystem.values()) {
            String currentUrl = current.url(s);
            if (s.isUpstream(options) && !currentUrl.isEmpty()) {
                result = result.withUrl(s, proxied(proxyUrl, currentUrl));
            }
        }
        return result;
    }

    /** Routes all four subsystems through the proxy to their current URL. */
    static PrivateConfig withAllProxied(PrivateConfig planned, PrivateConfig current, String proxyUrl) {
        PrivateConfig result = planned;
        for (Subsystem s : Subsystem.values()) {
            result = result.withUrl(s, proxied(proxyUrl, current.url(s)));
        }
        return result;
    }

    static String proxied(String proxyUrl, String upstreamUrl) {
        return proxyUrl + PROXY_PATH + upstreamUrl;
    }
}
