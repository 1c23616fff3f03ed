package speakermigrator.config;

/**
 * Exception thrown when migrator configuration cannot be loaded or is invalid.
 *
 * <p>Thrown when no configuration file is found, when a file cannot be parsed,
 * or when a value is out of range.
 *
 * @see MigratorConfigLoader
 */
public class MigratorConfigException extends RuntimeException {

    public MigratorConfigException(String message) {
        super(message);
    }

    public MigratorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
