package speakermigrator.device;

import java.util.List;

/**
 * Well-known file locations on the speaker.
 */
public final class DevicePaths {

    /** Cloud endpoint document. */
    public static final String PRIVATE_CONFIG = "/opt/Bose/etc/SoundTouchSdkPrivateCfg.xml";

    public static final String HOSTS = "/etc/hosts";

    public static final String RESOLV_CONF = "/etc/resolv.conf";

    /** Shared trust bundle used for TLS validation. */
    public static final String CA_BUNDLE = "/etc/pki/tls/certs/ca-bundle.crt";

    /** Priority nameserver file read by the DHCP hook. Its presence marks the hook as installed. */
    public static final String PRIORITY_RESOLV = "/mnt/nv/aftertouch.resolv.conf";

    /** Directory of {@link #PRIORITY_RESOLV} and {@link #BOOT_SCRIPT}; survives firmware resets of the root fs. */
    public static final String NV_DIR = "/mnt/nv";

    /** Script run on every boot. */
    public static final String BOOT_SCRIPT = "/mnt/nv/rc.local";

    public static final String DHCP_DEFAULT_SCRIPT = "/etc/udhcpc.d/50default";

    public static final String UDHCPC_SCRIPT = "/opt/Bose/udhcpc.script";

    /** Remote-services marker locations in priority order. */
    public static final List<String> REMOTE_SERVICES_MARKERS = List.of(
            "/etc/remote_services",
            "/mnt/nv/remote_services",
            "/tmp/remote_services");

    /** Where self-tests place the CA certificate for {@code curl --cacert}. */
    public static final String TEMP_TEST_CA = "/tmp/soundtouch-test-ca.crt";

    public static final String ORIGINAL_SUFFIX = ".original";

    private DevicePaths() {}

    /** Path of the pristine backup of {@code path}. */
    public static String original(String path) {
        return path + ORIGINAL_SUFFIX;
    }
}
