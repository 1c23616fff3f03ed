package speakermigrator.backup;

import speakermigrator.alert.OperationLog;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.exceptions.RemoteShellException;
import speakermigrator.patch.DnsHookPatcher;
import speakermigrator.patch.PatchResult;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;
import speakermigrator.trust.TrustStoreEditor;

import java.nio.charset.StandardCharsets;

/**
 * Puts a speaker back on the vendor cloud, whichever method migrated it.
 *
 * <p>Only the private configuration is mandatory: without its original the
 * revert fails before touching anything. Every other step reverts what it finds
 * and records problems as warnings. The device is not rebooted and
 * remote-services markers are left in place.
 */
public final class RevertManager {

    private final RemoteShell shell;
    private final OnDeviceBackup backups;
    private final TrustStoreEditor trustStore;

    public RevertManager(RemoteShell shell, OnDeviceBackup backups, TrustStoreEditor trustStore) {
        this.shell = shell;
        this.backups = backups;
        this.trustStore = trustStore;
    }

    /**
     * Runs the revert.
     *
     * @throws MigrateException if the private configuration has no backup or cannot be restored
     */
    public void revert(OperationLog oplog) throws MigrateException {
        revertPrivateConfig(oplog);

        backups.restore(DevicePaths.HOSTS, oplog);
        revertResolvConf(oplog);
        removeDnsHook(oplog);
        trustStore.remove(oplog);
    }

    private void revertPrivateConfig(OperationLog oplog) throws MigrateException {
        String path = DevicePaths.PRIVATE_CONFIG;
        if (!backups.hasOriginal(path)) {
            throw oplog.failure("backup " + DevicePaths.original(path) + " not found, cannot revert",
                    "revert-config", null);
        }
        if (!backups.restore(path, oplog)) {
            throw oplog.failure("failed to revert " + path, "revert-config", null);
        }
    }

    private void revertResolvConf(OperationLog oplog) {
        String path = DevicePaths.RESOLV_CONF;
        if (!backups.hasOriginal(path)) {
            return;
        }
        shell.run(ShellCommand.of("chattr", "-i", path));
        backups.restore(path, oplog);
    }

    private void removeDnsHook(OperationLog oplog) {
        if (shell.run(DeviceCommands.isFile(DevicePaths.PRIORITY_RESOLV)).succeeded()) {
            oplog.add("Removing " + DevicePaths.PRIORITY_RESOLV);
            run(DeviceCommands.remove(DevicePaths.PRIORITY_RESOLV), oplog);
        }

        revertBootScript(oplog);

        backups.restore(DevicePaths.DHCP_DEFAULT_SCRIPT, oplog);
        backups.restore(DevicePaths.UDHCPC_SCRIPT, oplog);
    }

    private void revertBootScript(OperationLog oplog) {
        String path = DevicePaths.BOOT_SCRIPT;
        CommandResult current = shell.run(DeviceCommands.cat(path));
        if (!current.succeeded()) {
            return;
        }
        if (DnsHookPatcher.isStoredError(current.output())) {
            oplog.add("Removing corrupted " + path);
            run(DeviceCommands.remove(path), oplog);
            return;
        }
        PatchResult stripped = DnsHookPatcher.stripBootScriptHook(current.output());
        if (!stripped.changed()) {
            return;
        }
        oplog.add("Removing DNS hook logic from " + path);
        try {
            shell.upload(stripped.text().getBytes(StandardCharsets.UTF_8), path);
        } catch (RemoteShellException e) {
            oplog.warn("failed to update " + path + ": " + e.getMessage());
        }
    }

    private void run(ShellCommand command, OperationLog oplog) {
        CommandResult result = shell.run(command);
        oplog.command(command, result);
        if (!result.succeeded()) {
            oplog.warn(command.render() + " failed: " + result.failureReason());
        }
    }
}
