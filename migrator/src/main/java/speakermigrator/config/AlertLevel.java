package speakermigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events emitted by
 * {@link speakermigrator.alert.MigrationAlertLogger}. Configured via the
 * {@code migrator.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - all events: started, completed, warnings, errors</li>
 *   <li>{@link #WARNING} - backup warnings and errors only</li>
 *   <li>{@link #ERROR} - failed migrations, reverts and preflight checks only</li>
 * </ul>
 *
 * @see MigratorConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and errors. This is the default. */
    WARNING,

    /** Log errors only. */
    ERROR
}
