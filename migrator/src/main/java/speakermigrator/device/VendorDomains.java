package speakermigrator.device;

import java.util.List;

/**
 * Vendor cloud domains that are redirected to the local service.
 */
public final class VendorDomains {

    public static final List<String> ALL = List.of(
            "streaming.bose.com",
            "updates.bose.com",
            "stats.bose.com",
            "bmx.bose.com",
            "content.api.bose.io",
            "events.api.bosecm.com",
            "bose-prod.apigee.net",
            "worldwide.bose.com",
            "music.api.bose.com");

    private VendorDomains() {}

    /** Returns true if {@code text} mentions any vendor domain. */
    public static boolean mentionedIn(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (String domain : ALL) {
            if (text.contains(domain)) {
                return true;
            }
        }
        return false;
    }
}
