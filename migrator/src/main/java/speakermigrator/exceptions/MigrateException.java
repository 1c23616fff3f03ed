package speakermigrator.exceptions;

/**
 * Exception thrown when a speaker operation fails hard.
 *
 * <p>Besides the message and cause, the exception carries diagnostic context:
 * <ul>
 *   <li>The device address the operation was running against</li>
 *   <li>The stage where the failure occurred (e.g. {@code preflight}, {@code upload})</li>
 *   <li>The operation log accumulated up to the failure</li>
 * </ul>
 *
 * <p>Operations are not transactional. Steps that completed before the failure
 * stay in place on the device, and the attached log is the only record of them.
 *
 * @see speakermigrator.engine.MigrationManager
 */
public class MigrateException extends Exception {

    private final String deviceAddress;
    private final String stage;
    private final String log;

    /**
     * Creates a new exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null, null);
    }

    /**
     * Creates a new exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    /**
     * Creates a new exception with full diagnostic context.
     *
     * @param message the error message
     * @param deviceAddress the device the operation targeted (may be null)
     * @param stage the stage where the failure occurred (may be null)
     * @param log the operation log up to the failure (may be null)
     * @param cause the underlying cause (may be null)
     */
    public MigrateException(String message, String deviceAddress, String stage, String log, Throwable cause) {
        super(message, cause);
        this.deviceAddress = deviceAddress;
        this.stage = stage;
        this.log = log;
    }

    /**
     * Returns a copy of this exception with the given log and device attached.
     * Context already present on this exception is kept.
     */
    public MigrateException withContext(String deviceAddress, String log) {
        MigrateException copy = new MigrateException(
                super.getMessage(),
                this.deviceAddress != null ? this.deviceAddress : deviceAddress,
                stage,
                this.log != null ? this.log : log,
                getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /** Returns the device address, or null if not set. */
    public String getDeviceAddress() {
        return deviceAddress;
    }

    /** Returns the failing stage, or null if not set. */
    public String getStage() {
        return stage;
    }

    /**
     * Returns the operation log accumulated before the failure.
     *
     * @return the log, never null
     */
    public String getLog() {
        return log != null ? log : "";
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        StringBuilder sb = new StringBuilder(base != null ? base : "");

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (deviceAddress != null) sb.append(" [device=").append(deviceAddress).append("]");

        return sb.toString();
    }
}
