package speakermigrator.resolve;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Local name resolution.
 */
@FunctionalInterface
public interface HostResolver {

    /** Resolver backed by the JVM's name service. */
    HostResolver SYSTEM = InetAddress::getAllByName;

    InetAddress[] lookup(String host) throws UnknownHostException;
}
