package speakermigrator.store;

import speakermigrator.model.DeviceRecord;
import speakermigrator.model.DnsSettings;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Local record of known devices, per-account settings and backup directories.
 */
public interface DeviceStore {

    /** Lists every known device across all accounts, de-duplicated. */
    List<DeviceRecord> listDevices();

    /**
     * Finds the device last seen at the given address.
     *
     * @param address the device address
     * @return the first matching record, or empty
     */
    default Optional<DeviceRecord> findByAddress(String address) {
        return listDevices().stream()
                .filter(d -> address.equals(d.ipAddress()))
                .findFirst();
    }

    /** Directory holding local state for one device of one account. */
    Path accountDeviceDir(String account, String device);

    /** Settings of the local DNS redirection service. */
    DnsSettings getDnsSettings();

    void saveDnsSettings(DnsSettings settings);
}
