package speakermigrator.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DeviceInfoClient;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.DeviceInfo;
import speakermigrator.model.DeviceRecord;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.store.DeviceStore;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Copies the speaker's configuration and hosts file into the local device store.
 *
 * <p>Files land in {@code <account>/devices/<device>/} and are refreshed on every call.
 * The account is the speaker's live account id, else the account a stored record
 * with the same serial or device id belongs to, else {@code default}.
 */
public final class OffDeviceBackup {

    private static final Logger log = LoggerFactory.getLogger(OffDeviceBackup.class);

    public static final String CONFIG_BACKUP_FILE = "SoundTouchSdkPrivateCfg.xml.bak";
    public static final String HOSTS_BACKUP_FILE = "hosts.bak";
    public static final String DEFAULT_ACCOUNT = "default";

    private final DeviceStore store;
    private final DeviceInfoClient infoClient;

    public OffDeviceBackup(DeviceStore store, DeviceInfoClient infoClient) {
        this.store = store;
        this.infoClient = infoClient;
    }

    /**
     * Writes the backups.
     *
     * @param shell shell on the speaker
     * @return the directory the backups were written to
     * @throws MigrateException if no store is configured, the speaker's identity
     *         cannot be fetched or a backup file cannot be written
     */
    public Path backup(RemoteShell shell) throws MigrateException {
        String address = shell.host();
        if (store == null) {
            throw new MigrateException("datastore not configured", address, "off-device-backup", null, null);
        }
        DeviceInfo info;
        try {
            info = infoClient.fetch(address);
        } catch (IOException e) {
            throw new MigrateException("failed to get device info: " + e.getMessage(),
                    address, "off-device-backup", null, e);
        }

        Path dir = store.accountDeviceDir(accountFor(info), deviceIdFor(info, address));
        try {
            Files.createDirectories(dir);
            copy(shell, DevicePaths.PRIVATE_CONFIG, dir.resolve(CONFIG_BACKUP_FILE));
            copy(shell, DevicePaths.HOSTS, dir.resolve(HOSTS_BACKUP_FILE));
        } catch (IOException e) {
            throw new MigrateException("failed to write backup to " + dir + ": " + e.getMessage(),
                    address, "off-device-backup", null, e);
        }
        log.info("{}: off-device backup written to {}", address, dir);
        return dir;
    }

    private static void copy(RemoteShell shell, String remotePath, Path target) throws IOException {
        CommandResult content = shell.run(DeviceCommands.cat(remotePath));
        if (content.succeeded() && !content.output().isEmpty()) {
            Files.write(target, content.output().getBytes(StandardCharsets.UTF_8));
        }
    }

    String accountFor(DeviceInfo info) {
        if (!info.margeAccountUuid().isEmpty()) {
            return info.margeAccountUuid();
        }
        String serial = info.serialNumber();
        for (DeviceRecord d : store.listDevices()) {
            boolean sameSerial = !serial.isEmpty() && serial.equals(d.deviceSerialNumber());
            boolean sameId = !info.deviceId().isEmpty() && info.deviceId().equals(d.deviceId());
            if ((sameSerial || sameId) && d.accountId() != null && !d.accountId().isEmpty()) {
                return d.accountId();
            }
        }
        return DEFAULT_ACCOUNT;
    }

    static String deviceIdFor(DeviceInfo info, String address) {
        if (!info.serialNumber().isEmpty()) {
            return info.serialNumber();
        }
        if (!info.deviceId().isEmpty()) {
            return info.deviceId();
        }
        return address;
    }
}
