package speakermigrator.shell;

import speakermigrator.exceptions.RemoteShellException;

/**
 * Command execution and file upload on one remote device.
 *
 * <p>Each call is an independent round-trip. Implementations may reuse a session
 * internally, but must not change what a single call observes.
 */
public interface RemoteShell {

    /** Returns the device address this shell talks to. */
    String host();

    /**
     * Runs a command and returns its combined output and exit status.
     * Never throws for a command that fails; see {@link CommandResult#succeeded()}.
     */
    CommandResult run(ShellCommand command);

    /**
     * Writes {@code content} to {@code remotePath}, replacing the file.
     *
     * @throws RemoteShellException if the transport or the remote write fails
     */
    void upload(byte[] content, String remotePath) throws RemoteShellException;
}
