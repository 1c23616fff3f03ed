package speakermigrator.resolve;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Host and port extraction from a target service URL.
 *
 * <p>Parsing never throws: an unparseable URL yields an empty host.
 */
public final class TargetUrl {

    private final String url;
    private final String host;
    private final int port;

    private TargetUrl(String url, String host, int port) {
        this.url = url;
        this.host = host;
        this.port = port;
    }

    public static TargetUrl parse(String url) {
        if (url == null || url.isBlank()) {
            return new TargetUrl("", "", -1);
        }
        try {
            URI uri = new URI(url.trim());
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null && uri.getRawAuthority() != null) {
                // hosts with characters URI rejects (underscores) only parse as a registry authority
                String authority = uri.getRawAuthority();
                int at = authority.lastIndexOf('@');
                if (at >= 0) {
                    authority = authority.substring(at + 1);
                }
                int colon = authority.lastIndexOf(':');
                if (colon > 0 && !authority.endsWith("]")) {
                    port = parsePort(authority.substring(colon + 1));
                    authority = authority.substring(0, colon);
                }
                host = authority;
            }
            return new TargetUrl(url, stripBrackets(host != null ? host : ""), port);
        } catch (URISyntaxException e) {
            return new TargetUrl(url, "", -1);
        }
    }

    public String url() {
        return url;
    }

    /** Host name without brackets, or empty. */
    public String host() {
        return host;
    }

    /** Explicit port, or -1 if the URL has none. */
    public int port() {
        return port;
    }

    /** Returns true if the host is usable as a redirection target. */
    public boolean hasUsableHost() {
        return !host.isEmpty() && !"localhost".equalsIgnoreCase(host);
    }

    private static int parsePort(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    @Override
    public String toString() {
        return url;
    }
}
