package speakermigrator.strategy;

/**
 * Reports the live state of the local DNS redirection service.
 */
@FunctionalInterface
public interface DnsStatusProvider {

    DnsStatus status();

    /**
     * @param running whether the service is serving
     * @param bindAddr the address it is bound to
     */
    record DnsStatus(boolean running, String bindAddr) {}
}
