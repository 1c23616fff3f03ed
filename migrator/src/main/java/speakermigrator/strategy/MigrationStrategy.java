package speakermigrator.strategy;

import speakermigrator.alert.OperationLog;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.model.MigrationMethod;

/**
 * One way of redirecting a speaker's cloud traffic.
 *
 * <p>Strategies run after the manager has verified write access. They append
 * progress to the operation log and throw on hard failures; whatever ran before
 * the failure stays on the device.
 */
public interface MigrationStrategy {

    MigrationMethod method();

    void migrate(DeviceSession session, MigrationRequest request, OperationLog oplog) throws MigrateException;
}
