package speakermigrator.shell;

/**
 * Creates a {@link RemoteShell} for a device address.
 */
@FunctionalInterface
public interface RemoteShellFactory {

    RemoteShell forHost(String host);
}
