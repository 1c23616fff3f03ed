package speakermigrator.shell;

/**
 * Outcome of one remote command.
 *
 * <p>Mirrors the {@code (output, error)} pair of a shell round-trip: the combined
 * stdout/stderr is always available, and {@link #succeeded()} tells whether the
 * command ran and exited zero.
 *
 * @param output combined stdout and stderr, never null
 * @param exitStatus the exit status, or -1 if the command never ran
 * @param error transport error description, or null if the command ran
 */
public record CommandResult(String output, int exitStatus, String error) {

    public CommandResult {
        output = output != null ? output : "";
    }

    public static CommandResult ok(String output) {
        return new CommandResult(output, 0, null);
    }

    public static CommandResult exited(String output, int exitStatus) {
        return new CommandResult(output, exitStatus, null);
    }

    public static CommandResult transportFailure(String error) {
        return new CommandResult("", -1, error);
    }

    /** Returns true if the command ran and exited with status zero. */
    public boolean succeeded() {
        return error == null && exitStatus == 0;
    }

    /** Returns true if the command ran and produced non-empty output. */
    public boolean hasOutput() {
        return succeeded() && !output.isEmpty();
    }

    /** Human-readable failure reason, or null on success. */
    public String failureReason() {
        if (succeeded()) return null;
        if (error != null) return error;
        return "exit status " + exitStatus;
    }
}
