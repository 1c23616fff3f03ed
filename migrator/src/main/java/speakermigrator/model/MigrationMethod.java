package speakermigrator.model;

import java.util.Locale;

/**
 * The redirection technique applied to a speaker.
 */
public enum MigrationMethod {

    /** Rewrite the speaker's private configuration document. */
    XML("xml"),

    /** Redirect vendor domains in the hosts file and trust the local CA. */
    HOSTS("hosts"),

    /** Install a priority nameserver through a DHCP hook and trust the local CA. */
    RESOLV("resolv");

    private final String value;

    MigrationMethod(String value) {
        this.value = value;
    }

    /** Wire name of the method, as accepted by {@link #parse(String)}. */
    public String value() {
        return value;
    }

    /**
     * Parses a method name. A null or blank name selects {@link #XML}.
     *
     * @param name the method name
     * @return the method
     * @throws IllegalArgumentException if the name is not a known method
     */
    public static MigrationMethod parse(String name) {
        if (name == null || name.isBlank()) {
            return XML;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (MigrationMethod m : values()) {
            if (m.value.equals(normalized)) {
                return m;
            }
        }
        throw new IllegalArgumentException("unsupported migration method: " + name);
    }
}
