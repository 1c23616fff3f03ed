package speakermigrator.strategy;

import speakermigrator.alert.OperationLog;
import speakermigrator.exceptions.DeviceStoreException;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.DnsSettings;
import speakermigrator.store.DeviceStore;

/**
 * Preconditions for DNS-based migration: the local DNS service must be enabled,
 * bound to port 53 and, when a status provider is available, actually running there.
 */
public final class DnsPreflight {

    private final DeviceStore store;
    private final DnsStatusProvider statusProvider;

    /**
     * @param store settings source
     * @param statusProvider live status, or null if unavailable
     */
    public DnsPreflight(DeviceStore store, DnsStatusProvider statusProvider) {
        this.store = store;
        this.statusProvider = statusProvider;
    }

    /**
     * @throws MigrateException if a precondition does not hold
     */
    public void check(OperationLog oplog) throws MigrateException {
        if (store == null) {
            throw oplog.failure("failed to retrieve settings: datastore not configured", "dns-preflight", null);
        }
        DnsSettings settings;
        try {
            settings = store.getDnsSettings();
        } catch (DeviceStoreException e) {
            throw oplog.failure("failed to retrieve settings: " + e.getMessage(), "dns-preflight", e);
        }
        if (!settings.enabled()) {
            throw oplog.failure("DNS discovery server is not enabled. Please enable it in Settings "
                    + "before using /etc/resolv.conf migration", "dns-preflight", null);
        }
        if (!settings.bindsStandardPort()) {
            throw oplog.failure("DNS discovery server is bound to " + settings.bindAddr()
                    + ", but port 53 is required for /etc/resolv.conf migration", "dns-preflight", null);
        }
        if (statusProvider == null) {
            return;
        }
        DnsStatusProvider.DnsStatus status = statusProvider.status();
        if (!status.running()) {
            throw oplog.failure("DNS discovery server is configured but not actually running on "
                    + status.bindAddr() + ". Please check logs for binding errors", "dns-preflight", null);
        }
        if (!DnsSettings.bindsStandardPort(status.bindAddr())) {
            throw oplog.failure("DNS discovery server is running on " + status.bindAddr()
                    + ", but port 53 is required", "dns-preflight", null);
        }
        oplog.add("DNS pre-flight: service running on " + status.bindAddr());
    }
}
