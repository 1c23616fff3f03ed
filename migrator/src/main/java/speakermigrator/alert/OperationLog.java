package speakermigrator.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.ShellCommand;

/**
 * Human-readable transcript of one operation against a device.
 *
 * <p>The transcript is returned to the caller on success and attached to the
 * {@link MigrateException} on failure, so partial progress is always visible.
 * Warnings are also written to the SLF4J log.
 */
public final class OperationLog {

    private static final Logger log = LoggerFactory.getLogger(OperationLog.class);

    private final String device;
    private final StringBuilder text = new StringBuilder();
    private int warnings;

    public OperationLog(String device) {
        this.device = device;
    }

    /** Appends one line. */
    public OperationLog add(String line) {
        text.append(line).append('\n');
        return this;
    }

    /** Appends a command and its output. */
    public OperationLog command(ShellCommand command, CommandResult result) {
        text.append(command.render()).append(": ").append(result.output().trim());
        if (!result.succeeded()) {
            text.append(" (").append(result.failureReason()).append(')');
        }
        text.append('\n');
        return this;
    }

    /** Appends a titled block of text, such as a nested operation's transcript. */
    public OperationLog section(String title, String body) {
        text.append(title).append(":\n").append(body);
        if (body.length() > 0 && body.charAt(body.length() - 1) != '\n') {
            text.append('\n');
        }
        return this;
    }

    /** Appends a warning line and logs it. */
    public OperationLog warn(String message) {
        warnings++;
        log.warn("{}: {}", device, message);
        text.append("Warning: ").append(message).append('\n');
        return this;
    }

    /** Number of warnings recorded so far. */
    public int warnings() {
        return warnings;
    }

    public String device() {
        return device;
    }

    /**
     * Creates a hard failure carrying this transcript.
     *
     * @param message what failed
     * @param stage where it failed
     * @param cause underlying cause, may be null
     */
    public MigrateException failure(String message, String stage, Throwable cause) {
        text.append("Error: ").append(message).append('\n');
        return new MigrateException(message, device, stage, text.toString(), cause);
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
