package speakermigrator.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.config.AlertLevel;
import speakermigrator.model.MigrationMethod;

/**
 * Structured logging for speaker migration events.
 *
 * <p>Entries use markers like MIGRATION_STARTED, MIGRATION_FAILED, REVERT_COMPLETED
 * with key=value pairs so they can be grepped out of the service log and alerted on.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - MIGRATION_STARTED device=192.168.1.20 method=hosts
 * 12:00:00.300 WARN  migration - BACKUP_WARNING device=192.168.1.20 reason="hosts: exit status 1"
 * 12:00:02.100 INFO  migration - MIGRATION_COMPLETED device=192.168.1.20 method=hosts duration_ms=2100
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void migrationStarted(String device, MigrationMethod method) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_STARTED device={} method={}", device, method.value());
        }
    }

    public static void migrationCompleted(String device, MigrationMethod method, long durationMs) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_COMPLETED device={} method={} duration_ms={}", device, method.value(), durationMs);
        }
    }

    /**
     * Log when a migration fails. Always logged.
     *
     * @param device the device address
     * @param method the requested method (may be null if it could not be parsed)
     * @param stage the failing stage (may be null)
     * @param error the failure
     */
    public static void migrationFailed(String device, MigrationMethod method, String stage, Throwable error) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("MIGRATION_FAILED device={} method={} stage={} error=\"{}\"",
                device,
                method != null ? method.value() : "UNKNOWN",
                stage != null ? stage : "UNKNOWN",
                errorMsg);
    }

    /**
     * Log when the write-access preflight fails. Always logged.
     */
    public static void preflightFailed(String device, String reason) {
        log.error("PREFLIGHT_FAILED device={} reason=\"{}\"", device, reason);
    }

    /**
     * Log a best-effort backup that did not succeed.
     *
     * @param device the device address
     * @param reason what could not be backed up and why
     */
    public static void backupWarning(String device, String reason) {
        if (shouldLogWarn()) {
            log.warn("BACKUP_WARNING device={} reason=\"{}\"", device, reason);
        }
    }

    public static void revertStarted(String device) {
        if (shouldLogInfo()) {
            log.info("REVERT_STARTED device={}", device);
        }
    }

    /**
     * Log when a revert finishes.
     *
     * @param device the device address
     * @param skippedSteps number of best-effort steps that did not succeed
     */
    public static void revertCompleted(String device, int skippedSteps) {
        if (skippedSteps > 0) {
            if (shouldLogWarn()) {
                log.warn("REVERT_COMPLETED device={} status=PARTIAL skipped_steps={}", device, skippedSteps);
            }
        } else if (shouldLogInfo()) {
            log.info("REVERT_COMPLETED device={} status=SUCCESS", device);
        }
    }

    public static void revertFailed(String device, Throwable error) {
        // Always log errors
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("REVERT_FAILED device={} error=\"{}\"", device, errorMsg);
    }
}
