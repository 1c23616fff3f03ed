package speakermigrator.backup;

import speakermigrator.alert.OperationLog;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.exceptions.RemoteShellException;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.nio.charset.StandardCharsets;

/**
 * Pristine {@code <path>.original} copies of device files.
 *
 * <p>An original is written at most once per path and never overwritten, so it
 * always holds the content from before the first edit.
 */
public final class OnDeviceBackup {

    private final RemoteShell shell;

    public OnDeviceBackup(RemoteShell shell) {
        this.shell = shell;
    }

    public boolean hasOriginal(String path) {
        return shell.run(DeviceCommands.isFile(DevicePaths.original(path))).succeeded();
    }

    /**
     * Creates the original of {@code path} unless it exists. Failures are
     * recorded as warnings.
     *
     * @return true if an original exists afterwards
     */
    public boolean backupOnce(String path, OperationLog oplog) {
        if (hasOriginal(path)) {
            oplog.add("Backup " + DevicePaths.original(path) + " already exists");
            return true;
        }
        oplog.add("Backing up " + path + " to " + DevicePaths.original(path));
        try {
            copyWithFallback(path, oplog);
            return true;
        } catch (MigrateException e) {
            oplog.warn("failed to back up " + path + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Creates the original of {@code path}.
     *
     * @throws MigrateException if an original already exists or the copy fails
     */
    public void createOriginal(String path, OperationLog oplog) throws MigrateException {
        if (hasOriginal(path)) {
            throw oplog.failure("backup already exists at " + DevicePaths.original(path), "backup", null);
        }
        copyWithFallback(path, oplog);
    }

    /**
     * Restores {@code path} from its original if there is one.
     *
     * @return true if an original existed and the copy succeeded
     */
    public boolean restore(String path, OperationLog oplog) {
        if (!hasOriginal(path)) {
            return false;
        }
        oplog.add("Reverting " + path + " from backup");
        ShellCommand cp = DeviceCommands.withWriteAccess(DeviceCommands.copy(DevicePaths.original(path), path));
        CommandResult result = shell.run(cp);
        oplog.command(cp, result);
        if (!result.succeeded()) {
            oplog.warn("failed to revert " + path + ": " + result.failureReason());
        }
        return result.succeeded();
    }

    /**
     * Makes {@code path} match its pristine content: backs it up on first use,
     * restores it from the original afterwards.
     */
    public void resetToOriginal(String path, OperationLog oplog) {
        if (!hasOriginal(path)) {
            ShellCommand cp = DeviceCommands.copy(path, DevicePaths.original(path));
            oplog.command(cp, shell.run(cp));
        } else {
            shell.run(DeviceCommands.copy(DevicePaths.original(path), path));
        }
    }

    private void copyWithFallback(String path, OperationLog oplog) throws MigrateException {
        String original = DevicePaths.original(path);
        ShellCommand cp = DeviceCommands.withWriteAccess(DeviceCommands.copy(path, original));
        CommandResult copied = shell.run(cp);
        oplog.command(cp, copied);
        if (copied.succeeded()) {
            oplog.add("Copied backup to " + original);
            return;
        }

        CommandResult content = shell.run(DeviceCommands.cat(path));
        if (!content.succeeded() || content.output().isEmpty()) {
            throw oplog.failure("failed to read " + path + ": "
                    + (content.succeeded() ? "empty file" : content.failureReason()), "backup", null);
        }
        ShellCommand rw = DeviceCommands.writeAccess();
        oplog.command(rw, shell.run(rw));
        try {
            shell.upload(content.output().getBytes(StandardCharsets.UTF_8), original);
        } catch (RemoteShellException e) {
            throw oplog.failure("failed to upload backup " + original + ": " + e.getMessage(), "backup", e);
        }
        oplog.add("Uploaded backup to " + original + " via fallback");
    }
}
