package speakermigrator.patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure edits of hosts-file text.
 */
public final class HostsFileEditor {

    private HostsFileEditor() {}

    /**
     * Points every domain in {@code domains} at {@code ip}.
     *
     * <p>Existing entries whose first host name is one of the domains are rewritten
     * in place. Blank lines, comments and other entries are kept untouched.
     * Domains without an entry are appended in list order.
     *
     * @param current current hosts file text
     * @param ip address to redirect to
     * @param domains domains to redirect
     * @return the new hosts text, always newline-terminated
     */
    public static String redirect(String current, String ip, List<String> domains) {
        List<String> out = new ArrayList<>();
        Set<String> found = new HashSet<>();
        for (String line : lines(current)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                out.add(line);
                continue;
            }
            String[] fields = trimmed.split("\\s+");
            if (fields.length >= 2 && domains.contains(fields[1])) {
                out.add(entry(ip, fields[1]));
                found.add(fields[1]);
                continue;
            }
            out.add(line);
        }
        for (String domain : domains) {
            if (!found.contains(domain)) {
                out.add(entry(ip, domain));
            }
        }
        return String.join("\n", out) + "\n";
    }

    /**
     * Planned hosts entries for the given domains, one per line, not newline-terminated.
     */
    public static String plannedEntries(String ip, List<String> domains) {
        List<String> out = new ArrayList<>(domains.size());
        for (String domain : domains) {
            out.add(entry(ip, domain));
        }
        return String.join("\n", out);
    }

    /**
     * Replaces any line mentioning {@code domain} with a single entry for it.
     * Blank lines are dropped.
     */
    public static String withEntry(String current, String ip, String domain) {
        String base = without(current, domain);
        return base + entry(ip, domain) + "\n";
    }

    /**
     * Removes every line mentioning {@code domain}. Blank lines are dropped.
     *
     * @return the remaining text, newline-terminated unless empty
     */
    public static String without(String current, String domain) {
        List<String> kept = new ArrayList<>();
        for (String line : lines(current)) {
            if (!line.isEmpty() && !line.contains(domain)) {
                kept.add(line);
            }
        }
        return kept.isEmpty() ? "" : String.join("\n", kept) + "\n";
    }

    /** One hosts entry, tab-separated. */
    public static String entry(String ip, String domain) {
        return ip + "\t" + domain;
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
