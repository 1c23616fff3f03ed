package speakermigrator.model;

import java.util.Map;

/**
 * Cloud subsystems addressed by the speaker's private configuration.
 *
 * <p>Each subsystem can be routed directly to the target service or, with the
 * option value {@code "upstream"}, through the local proxy to its current URL.
 */
public enum Subsystem {
    MARGE("marge"),
    STATS("stats"),
    SW_UPDATE("sw_update"),
    BMX("bmx");

    /** Option value requesting proxied passthrough to the current URL. */
    public static final String UPSTREAM = "upstream";

    private final String key;

    Subsystem(String key) {
        this.key = key;
    }

    /** Option key naming this subsystem. */
    public String key() {
        return key;
    }

    /**
     * Returns true if the routing options ask for this subsystem to be proxied upstream.
     *
     * @param options subsystem key to routing value, may be null
     */
    public boolean isUpstream(Map<String, String> options) {
        return options != null && UPSTREAM.equals(options.get(key));
    }
}
