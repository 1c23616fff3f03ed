package speakermigrator.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.alert.OperationLog;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.exceptions.RemoteShellException;
import speakermigrator.model.MigrationMethod;
import speakermigrator.patch.DnsHookPatcher;
import speakermigrator.patch.PatchResult;
import speakermigrator.resolve.TargetResolver;
import speakermigrator.resolve.TargetUrl;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Makes the speaker prefer the local DNS service.
 *
 * <p>Writes a priority nameserver file, hooks it into the DHCP client scripts so
 * it is prepended to every generated {@code resolv.conf}, and adds a boot-script
 * block that re-applies the hook after firmware updates. Finally trusts the local CA.
 * DNS service preconditions are checked by the caller.
 */
public final class ResolvConfStrategy implements MigrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ResolvConfStrategy.class);

    @Override
    public MigrationMethod method() {
        return MigrationMethod.RESOLV;
    }

    @Override
    public void migrate(DeviceSession session, MigrationRequest request, OperationLog oplog) throws MigrateException {
        RemoteShell shell = session.shell();

        TargetUrl target = TargetResolver.requireTarget(request.targetUrl(), oplog);
        String ip = session.resolver().resolve(target.host(), shell);
        oplog.add("Resolved " + target.host() + " to " + ip);

        shell.run(ShellCommand.of("mkdir", "-p", DevicePaths.NV_DIR));
        upload(shell, DnsHookPatcher.priorityResolvConf(ip), DevicePaths.PRIORITY_RESOLV, oplog);
        oplog.add("Uploaded " + DevicePaths.PRIORITY_RESOLV);

        installBootHook(shell, oplog);

        ShellCommand rw = DeviceCommands.writeAccess();
        oplog.command(rw, shell.run(rw));
        patchNow(session, DevicePaths.DHCP_DEFAULT_SCRIPT, DnsHookPatcher::patchDhcpDefault, oplog);
        if (shell.run(DeviceCommands.isFile(DevicePaths.UDHCPC_SCRIPT)).succeeded()) {
            patchNow(session, DevicePaths.UDHCPC_SCRIPT, DnsHookPatcher::patchUdhcpScript, oplog);
        }

        session.trustStore().ensureTrusted(oplog);
        log.info("{}: DNS hook installed, nameserver {}", session.deviceAddress(), ip);
    }

    private static void installBootHook(RemoteShell shell, OperationLog oplog) throws MigrateException {
        String path = DevicePaths.BOOT_SCRIPT;
        CommandResult current = shell.run(DeviceCommands.cat(path));
        PatchResult patched = DnsHookPatcher.patchBootScript(current.succeeded() ? current.output() : "");
        if (!patched.changed()) {
            oplog.add(path + " already contains the DNS hook");
            return;
        }
        upload(shell, patched.text(), path, oplog);
        oplog.add("Updated " + path + " with DNS hook logic");
        shell.run(ShellCommand.of("chmod", "+x", path));
    }

    /**
     * Applies the hook to a live DHCP script, starting from its pristine content
     * so repeated migrations produce the same file.
     */
    private static void patchNow(DeviceSession session, String path, Function<String, PatchResult> patcher,
                                 OperationLog oplog) {
        RemoteShell shell = session.shell();
        session.backups().resetToOriginal(path, oplog);

        CommandResult current = shell.run(DeviceCommands.cat(path));
        if (!current.succeeded()) {
            oplog.add("Failed to apply patch immediately to " + path + ": " + current.failureReason());
            return;
        }
        PatchResult patched = patcher.apply(current.output());
        if (!patched.changed()) {
            oplog.add(path + " has no anchor for the DNS hook or is already patched");
            return;
        }
        try {
            shell.upload(patched.text().getBytes(StandardCharsets.UTF_8), path);
            oplog.add("Applied patch to " + path);
        } catch (RemoteShellException e) {
            oplog.add("Failed to apply patch immediately to " + path + ": " + e.getMessage());
        }
    }

    private static void upload(RemoteShell shell, String content, String path, OperationLog oplog)
            throws MigrateException {
        try {
            shell.upload(content.getBytes(StandardCharsets.UTF_8), path);
        } catch (RemoteShellException e) {
            throw oplog.failure("failed to update " + path + ": " + e.getMessage(), "upload", e);
        }
    }
}
