package speakermigrator.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.alert.OperationLog;
import speakermigrator.codec.PrivateConfigCodec;
import speakermigrator.device.DeviceCommands;
import speakermigrator.device.DevicePaths;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.exceptions.RemoteShellException;
import speakermigrator.model.MigrationMethod;
import speakermigrator.model.PrivateConfig;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.nio.charset.StandardCharsets;

/**
 * Rewrites the speaker's private configuration to point at the target service.
 */
public final class XmlConfigStrategy implements MigrationStrategy {

    private static final Logger log = LoggerFactory.getLogger(XmlConfigStrategy.class);

    @Override
    public MigrationMethod method() {
        return MigrationMethod.XML;
    }

    @Override
    public void migrate(DeviceSession session, MigrationRequest request, OperationLog oplog) throws MigrateException {
        RemoteShell shell = session.shell();

        OperationLog markerLog = new OperationLog(session.deviceAddress());
        try {
            session.remoteServices().ensure(markerLog);
            oplog.section("Ensuring remote services", markerLog.toString());
        } catch (MigrateException e) {
            oplog.section("Ensuring remote services", markerLog.toString());
            oplog.warn("failed to ensure remote services: " + e.getMessage());
        }

        PrivateConfig config = plan(shell, request, oplog);
        String document = PrivateConfigCodec.encode(config);

        ShellCommand rw = DeviceCommands.writeAccess();
        oplog.command(rw, shell.run(rw));
        try {
            shell.upload(document.getBytes(StandardCharsets.UTF_8), DevicePaths.PRIVATE_CONFIG);
        } catch (RemoteShellException e) {
            throw oplog.failure("failed to upload config: " + e.getMessage(), "upload", e);
        }
        oplog.add("Uploaded new configuration to " + DevicePaths.PRIVATE_CONFIG);
        log.info("{}: private config now points at {}", session.deviceAddress(), request.targetUrl());
    }

    private PrivateConfig plan(RemoteShell shell, MigrationRequest request, OperationLog oplog) {
        PrivateConfig current = null;
        CommandResult read = shell.run(DeviceCommands.cat(DevicePaths.PRIVATE_CONFIG));
        if (read.hasOutput()) {
            oplog.add("Read current configuration");
            current = PrivateConfigCodec.decode(read.output()).orElse(null);
        }
        return PlannedConfigs.plan(request.targetUrl(), request.proxyUrl(), request.options(), current);
    }
}
