package speakermigrator.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.alert.OperationLog;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.device.VendorDomains;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.exceptions.RemoteShellException;
import speakermigrator.model.MigrationMethod;
import speakermigrator.patch.HostsFileEditor;
import speakermigrator.resolve.TargetResolver;
import speakermigrator.resolve.TargetUrl;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.nio.charset.StandardCharsets;

/**
 * Points the vendor domains at the target in {@code /etc/hosts} and trusts the local CA.
 */
public final class HostsFileStrategy implements MigrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(HostsFileStrategy.class);

    @Override
    public MigrationMethod method() {
        return MigrationMethod.HOSTS;
    }

    @Override
    public void migrate(DeviceSession session, MigrationRequest request, OperationLog oplog) throws MigrateException {
        RemoteShell shell = session.shell();

        TargetUrl target = TargetResolver.requireTarget(request.targetUrl(), oplog);
        String ip = session.resolver().resolve(target.host(), shell);
        oplog.add("Resolved " + target.host() + " to " + ip);

        CommandResult hosts = shell.run(DeviceCommands.cat(DevicePaths.HOSTS));
        oplog.command(DeviceCommands.cat(DevicePaths.HOSTS), hosts);
        if (!hosts.succeeded()) {
            throw oplog.failure("failed to read " + DevicePaths.HOSTS + ": " + hosts.failureReason(), "hosts", null);
        }
        String updated = HostsFileEditor.redirect(hosts.output(), ip, VendorDomains.ALL);

        ShellCommand rw = DeviceCommands.writeAccess();
        oplog.command(rw, shell.run(rw));
        session.backups().backupOnce(DevicePaths.HOSTS, oplog);

        try {
            shell.upload(updated.getBytes(StandardCharsets.UTF_8), DevicePaths.HOSTS);
        } catch (RemoteShellException e) {
            throw oplog.failure("failed to update " + DevicePaths.HOSTS + ": " + e.getMessage(), "upload", e);
        }
        oplog.add("Uploaded updated " + DevicePaths.HOSTS);
        log.debug("{}: new hosts file:\n{}", session.deviceAddress(), updated);

        session.trustStore().ensureTrusted(oplog);
    }
}
