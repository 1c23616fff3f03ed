package speakermigrator.exceptions;

/**
 * Exception thrown when the remote shell transport fails.
 *
 * <p>A command that runs and exits non-zero is not a transport failure; it is
 * reported through {@link speakermigrator.shell.CommandResult}. This exception covers
 * connection, session and upload failures.
 */
public class RemoteShellException extends Exception {

    private final String host;

    public RemoteShellException(String host, String message) {
        super(message);
        this.host = host;
    }

    public RemoteShellException(String host, String message, Throwable cause) {
        super(message, cause);
        this.host = host;
    }

    /** Returns the host the transport was talking to. */
    public String getHost() {
        return host;
    }
}
