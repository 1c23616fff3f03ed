package speakermigrator.strategy;

import speakermigrator.backup.OnDeviceBackup;
import speakermigrator.remote.RemoteServicesManager;
import speakermigrator.resolve.TargetResolver;
import speakermigrator.shell.RemoteShell;
import speakermigrator.trust.TrustStoreEditor;

/**
 * Collaborators bound to one device for the duration of one operation.
 *
 * @param shell shell on the device
 * @param backups on-device originals
 * @param trustStore trust bundle editor
 * @param remoteServices remote-services markers
 * @param resolver target host resolution
 */
public record DeviceSession(
        RemoteShell shell,
        OnDeviceBackup backups,
        TrustStoreEditor trustStore,
        RemoteServicesManager remoteServices,
        TargetResolver resolver
) {
    public String deviceAddress() {
        return shell.host();
    }
}
