package speakermigrator.model;

/**
 * A device known to the local device store.
 *
 * @param deviceId device identifier (may be empty)
 * @param name user-visible name
 * @param productCode product type and module type
 * @param firmwareVersion SCM software version
 * @param deviceSerialNumber SCM serial number
 * @param productSerialNumber packaged product serial number
 * @param ipAddress last known address of the device
 * @param accountId account directory the device was found under
 */
public record DeviceRecord(
        String deviceId,
        String name,
        String productCode,
        String firmwareVersion,
        String deviceSerialNumber,
        String productSerialNumber,
        String ipAddress,
        String accountId
) {
    /**
     * Builds a record from a stored identity document.
     *
     * @param info the parsed {@code DeviceInfo.xml}
     * @param accountId the owning account
     */
    public static DeviceRecord from(DeviceInfo info, String accountId) {
        return new DeviceRecord(
                info.deviceId(),
                info.name(),
                (info.type() + " " + info.moduleType()).trim(),
                info.firmwareVersion(),
                info.componentSerial(DeviceInfo.SCM),
                info.componentSerial(DeviceInfo.PACKAGED_PRODUCT),
                info.scmIpAddress(),
                accountId);
    }

    /** Key used to de-duplicate records: the device id, else the address. */
    public String identityKey() {
        return deviceId != null && !deviceId.isEmpty() ? deviceId : ipAddress;
    }
}
