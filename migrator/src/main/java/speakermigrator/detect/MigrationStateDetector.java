package speakermigrator.detect;

import speakermigrator.device.VendorDomains;
import speakermigrator.model.MigrationSummary;
import speakermigrator.model.PrivateConfig;

/**
 * Guesses from a summary whether a speaker is already redirected.
 *
 * <p>This is a heuristic over file contents and trust state, not a record of
 * what was done. A speaker is considered migrated if any of these hold:
 * <ul>
 *   <li>its private config mentions the target host in any URL</li>
 *   <li>its hosts file mentions a vendor domain and the local CA is trusted</li>
 *   <li>the DNS hook is installed, or resolv.conf mentions the target host,
 *       and the local CA is trusted</li>
 * </ul>
 * An unreachable speaker is never considered migrated.
 */
public final class MigrationStateDetector {

    private MigrationStateDetector() {}

    /**
     * @param summary facts gathered from the speaker
     * @param targetHost host name of the target service
     */
    public static boolean isMigrated(MigrationSummary summary, String targetHost) {
        if (!summary.sshSuccess()) {
            return false;
        }
        boolean hasTarget = targetHost != null && !targetHost.isEmpty();

        PrivateConfig current = summary.parsedCurrentConfig();
        if (current != null && hasTarget && current.anyUrlContains(targetHost)) {
            return true;
        }
        if (!summary.caCertTrusted()) {
            return false;
        }
        if (VendorDomains.mentionedIn(summary.currentHosts())) {
            return true;
        }
        return summary.dnsHookInstalled()
                || (hasTarget && summary.currentResolvConf().contains(targetHost));
    }
}
