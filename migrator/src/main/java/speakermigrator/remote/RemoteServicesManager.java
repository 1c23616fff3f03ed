package speakermigrator.remote;

import speakermigrator.alert.OperationLog;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates, removes and finds the remote-services marker files that enable the
 * speaker's configurable-endpoint feature.
 *
 * <p>Locations are tried in {@link DevicePaths#REMOTE_SERVICES_MARKERS} order,
 * each first with write access to the root file system and then without.
 */
public final class RemoteServicesManager {

    private final RemoteShell shell;

    public RemoteServicesManager(RemoteShell shell) {
        this.shell = shell;
    }

    /**
     * Creates a marker in the first location that accepts it.
     *
     * @throws MigrateException if no location accepts the marker
     */
    public void ensure(OperationLog oplog) throws MigrateException {
        for (String location : DevicePaths.REMOTE_SERVICES_MARKERS) {
            ShellCommand touch = ShellCommand.of("touch", location);
            if (attempt(DeviceCommands.withWriteAccess(touch), oplog) || attempt(touch, oplog)) {
                return;
            }
        }
        throw oplog.failure("failed to enable remote services in any of the locations: "
                + DevicePaths.REMOTE_SERVICES_MARKERS, "remote-services", null);
    }

    /**
     * Deletes the marker from every location.
     *
     * @throws MigrateException if removal failed in every location
     */
    public void remove(OperationLog oplog) throws MigrateException {
        List<String> failed = new ArrayList<>();
        for (String location : DevicePaths.REMOTE_SERVICES_MARKERS) {
            ShellCommand rm = ShellCommand.of("rm", "-v", location);
            if (!attempt(DeviceCommands.withWriteAccess(rm), oplog) && !attempt(rm, oplog)) {
                failed.add(location);
            }
        }
        if (failed.size() == DevicePaths.REMOTE_SERVICES_MARKERS.size()) {
            throw oplog.failure("failed to remove remote services from any location: " + failed,
                    "remote-services", null);
        }
    }

    /** Returns every marker location that currently exists. */
    public List<String> findMarkers() {
        List<String> found = new ArrayList<>();
        for (String location : DevicePaths.REMOTE_SERVICES_MARKERS) {
            if (shell.run(DeviceCommands.exists(location)).succeeded()) {
                found.add(location);
            }
        }
        return found;
    }

    private boolean attempt(ShellCommand command, OperationLog oplog) {
        CommandResult result = shell.run(command);
        oplog.command(command, result);
        return result.succeeded();
    }
}
