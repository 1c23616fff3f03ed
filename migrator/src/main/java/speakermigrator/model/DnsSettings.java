package speakermigrator.model;

/**
 * Settings of the local DNS redirection service.
 *
 * @param enabled whether the service is enabled
 * @param bindAddr bind address such as {@code :53} or {@code 0.0.0.0:5353}
 */
public record DnsSettings(boolean enabled, String bindAddr) {

    public static final String DEFAULT_BIND_ADDR = ":53";
    public static final int STANDARD_PORT = 53;

    public static final DnsSettings DEFAULTS = new DnsSettings(false, DEFAULT_BIND_ADDR);

    public DnsSettings {
        bindAddr = bindAddr != null ? bindAddr : DEFAULT_BIND_ADDR;
    }

    /** Returns true if the address binds the standard DNS port. */
    public boolean bindsStandardPort() {
        return bindsStandardPort(bindAddr);
    }

    /** Returns true if {@code addr} ends with {@code :53} or is exactly {@code 53}. */
    public static boolean bindsStandardPort(String addr) {
        return addr != null && (addr.endsWith(":" + STANDARD_PORT) || addr.equals(String.valueOf(STANDARD_PORT)));
    }

    /**
     * Port parsed from the text after the last colon, or 53 if there is none or
     * it is not a number.
     */
    public int port() {
        int colon = bindAddr.lastIndexOf(':');
        if (colon < 0) {
            return STANDARD_PORT;
        }
        try {
            return Integer.parseInt(bindAddr.substring(colon + 1));
        } catch (NumberFormatException e) {
            return STANDARD_PORT;
        }
    }
}
