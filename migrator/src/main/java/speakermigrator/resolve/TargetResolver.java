package speakermigrator.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import speakermigrator.alert.OperationLog;
import speakermigrator.exceptions.MigrateException;
import speakermigrator.shell.CommandResult;
import speakermigrator.shell.RemoteShell;
import speakermigrator.shell.ShellCommand;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Resolves the target service's host name to the address a speaker should use.
 *
 * <p>Resolution from the speaker itself is preferred, since NAT or container
 * networking can make the service's own view of its address wrong for the
 * speaker. Resolution is best effort and never throws: if nothing works the host
 * name is returned unchanged.
 */
public final class TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

    private static final Pattern IPV4 = Pattern.compile(
            "((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)");

    private final HostResolver localResolver;

    public TargetResolver(HostResolver localResolver) {
        this.localResolver = localResolver;
    }

    /**
     * Extracts and validates the host of a target URL.
     *
     * @throws MigrateException if the URL has no host or points at localhost
     */
    public static TargetUrl requireTarget(String targetUrl, OperationLog oplog) throws MigrateException {
        TargetUrl target = TargetUrl.parse(targetUrl);
        if (!target.hasUsableHost()) {
            throw oplog.failure("target URL must contain a valid IP or hostname (got " + target.host() + ")",
                    "resolve", null);
        }
        return target;
    }

    /**
     * Resolves a host name, asking the speaker first.
     *
     * @param host host name or IP literal
     * @param shell shell on the speaker, or null to resolve locally only
     * @return an IP address, or {@code host} itself if resolution failed
     */
    public String resolve(String host, RemoteShell shell) {
        if (isIpLiteral(host)) {
            return host;
        }
        if (shell != null) {
            CommandResult ping = shell.run(ShellCommand.of("ping", "-c", "1", host));
            if (ping.succeeded()) {
                String ip = addressInParentheses(ping.output());
                if (ip != null) {
                    log.debug("Resolved {} to {} from device {}", host, ip, shell.host());
                    return ip;
                }
            }
        }
        return resolveLocally(host);
    }

    /** Resolves on this host only, preferring an IPv4 address. */
    public String resolveLocally(String host) {
        if (isIpLiteral(host)) {
            return host;
        }
        InetAddress[] addresses;
        try {
            addresses = localResolver.lookup(host);
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve {} locally: {}", host, e.getMessage());
            return host;
        }
        if (addresses == null || addresses.length == 0) {
            return host;
        }
        for (InetAddress a : addresses) {
            if (a instanceof Inet4Address) {
                return a.getHostAddress();
            }
        }
        return addresses[0].getHostAddress();
    }

    /** Returns true for IPv4 dotted quads and IPv6 literals. */
    public static boolean isIpLiteral(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }
        if (IPV4.matcher(host).matches()) {
            return true;
        }
        if (host.indexOf(':') >= 0) {
            try {
                // a string containing ':' is only ever parsed as a literal, never looked up
                InetAddress.getByName(host);
                return true;
            } catch (UnknownHostException e) {
                return false;
            }
        }
        return false;
    }

    /**
     * Pulls the address out of BusyBox ping output such as
     * {@code PING svc (10.0.0.7): 56 data bytes}.
     */
    static String addressInParentheses(String output) {
        int start = output.indexOf('(');
        int end = output.indexOf(')');
        if (start < 0 || end <= start) {
            return null;
        }
        String candidate = output.substring(start + 1, end).trim();
        return isIpLiteral(candidate) ? candidate : null;
    }
}
