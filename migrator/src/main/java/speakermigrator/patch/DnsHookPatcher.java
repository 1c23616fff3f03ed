package speakermigrator.patch;

import speakermigrator.device.DevicePaths;

import java.util.ArrayList;
import java.util.List;

/**
 * Marker-guarded edits that install or remove the priority-nameserver hook in the
 * speaker's boot and DHCP client scripts.
 *
 * <p>All methods are pure: they take the current file text and return the new
 * text. A script that already mentions {@link DevicePaths#PRIORITY_RESOLV} is
 * considered patched and is returned unchanged.
 */
public final class DnsHookPatcher {

    /** First line of the block appended to the boot script. */
    public static final String BOOT_BLOCK_MARKER = "# Aftertouch DNS hook";

    /** Text a failed {@code cat} leaves behind when its output was saved as the script. */
    public static final String STORED_ERROR_TEXT = "cat: can't open";

    static final String SHEBANG = "#!/bin/sh";

    /** Anchor in {@code 50default} after which the hook line goes. */
    static final String DHCP_DEFAULT_ANCHOR = "echo \"search $domain\"";

    /** Anchor in {@code udhcpc.script} after which the hook line goes. */
    static final String UDHCPC_ANCHOR = "echo \"search $search_list # $interface\" >> $RESOLV_CONF";

    private static final String HOOK = DevicePaths.PRIORITY_RESOLV;

    static final String DHCP_DEFAULT_HOOK_LINE =
            "        [ -f " + HOOK + " ] && cat " + HOOK + " && dns=\"\"";

    static final String UDHCPC_HOOK_LINE =
            "                [ -f " + HOOK + " ] && cat " + HOOK + " >> \"$RESOLV_CONF\" && dns=\"\"";

    private DnsHookPatcher() {}

    /**
     * Shell block appended to the boot script. On every boot it re-applies the
     * DHCP hook to scripts a firmware update may have replaced.
     */
    public static String bootScriptBlock() {
        String dhcp = DevicePaths.DHCP_DEFAULT_SCRIPT;
        List<String> lines = List.of(
                "",
                BOOT_BLOCK_MARKER + ": prioritizes our custom nameserver if it exists",
                "if [ -f \"" + HOOK + "\" ]; then",
                "    if [ -f \"" + dhcp + "\" ] && ! grep -q \"" + HOOK + "\" \"" + dhcp + "\"; then",
                "        logger -t \"aftertouch\" \"Patching " + dhcp + " with Aftertouch DNS hook\"",
                "        sed -i '/echo \"search \\$domain\"/a \\" + DHCP_DEFAULT_HOOK_LINE + "' \"" + dhcp + "\"",
                "    fi",
                "    targetScript=\"" + DevicePaths.UDHCPC_SCRIPT + "\"",
                "    if [ -f \"$targetScript\" ] && ! grep -q \"" + HOOK + "\" \"$targetScript\"; then",
                "        logger -t \"aftertouch\" \"Patching $targetScript with Aftertouch DNS hook\"",
                "        sed -i '/echo \"search \\$search_list # \\$interface\" >> \\$RESOLV_CONF/a \\"
                        + UDHCPC_HOOK_LINE + "' \"$targetScript\"",
                "    fi",
                "fi",
                "");
        return String.join("\n", lines);
    }

    /**
     * Appends the hook block to the boot script unless it is already present.
     * A stored error message is discarded first, and the script always starts
     * with a shebang line.
     *
     * @param current current script text, empty or null if the file is missing
     */
    public static PatchResult patchBootScript(String current) {
        String text = current != null ? current : "";
        if (text.contains(HOOK)) {
            return PatchResult.unchanged(text);
        }
        if (isStoredError(text)) {
            text = "";
        }
        if (!text.startsWith(SHEBANG)) {
            text = SHEBANG + "\n" + text;
        }
        if (!text.endsWith("\n")) {
            text += "\n";
        }
        return PatchResult.changed(text + bootScriptBlock());
    }

    /**
     * Removes the hook block from the boot script: the marker line through the
     * {@code fi} that closes it, plus the blank line that precedes the marker.
     */
    public static PatchResult stripBootScriptHook(String current) {
        if (current == null || !(current.contains(BOOT_BLOCK_MARKER) || current.contains(HOOK))) {
            return PatchResult.unchanged(current != null ? current : "");
        }
        String[] lines = current.split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        boolean skipping = false;
        int depth = 0;
        for (String line : lines) {
            String trimmed = line.trim();
            if (!skipping && line.contains(BOOT_BLOCK_MARKER)) {
                skipping = true;
                depth = 0;
                if (!kept.isEmpty() && kept.get(kept.size() - 1).isEmpty()) {
                    kept.remove(kept.size() - 1);
                }
                continue;
            }
            if (skipping) {
                if (trimmed.startsWith("if ")) {
                    depth++;
                } else if (trimmed.equals("fi")) {
                    depth--;
                    if (depth <= 0) {
                        skipping = false;
                    }
                }
                continue;
            }
            kept.add(line);
        }
        String result = String.join("\n", kept);
        return result.equals(current) ? PatchResult.unchanged(current) : PatchResult.changed(result);
    }

    /** Returns true if the script text is a stored {@code cat} error rather than a script. */
    public static boolean isStoredError(String text) {
        return text != null && text.contains(STORED_ERROR_TEXT);
    }

    /** Inserts the hook line after the search-domain echo in {@code 50default}. */
    public static PatchResult patchDhcpDefault(String current) {
        return insertAfterAnchor(current, DHCP_DEFAULT_ANCHOR, DHCP_DEFAULT_HOOK_LINE);
    }

    /** Inserts the hook line after the search-list echo in {@code udhcpc.script}. */
    public static PatchResult patchUdhcpScript(String current) {
        return insertAfterAnchor(current, UDHCPC_ANCHOR, UDHCPC_HOOK_LINE);
    }

    private static PatchResult insertAfterAnchor(String current, String anchor, String hookLine) {
        String text = current != null ? current : "";
        if (text.contains(HOOK)) {
            return PatchResult.unchanged(text);
        }
        String[] lines = text.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length + 1);
        boolean inserted = false;
        for (String line : lines) {
            out.add(line);
            if (line.contains(anchor)) {
                out.add(hookLine);
                inserted = true;
            }
        }
        if (!inserted) {
            return PatchResult.unchanged(text);
        }
        return PatchResult.changed(String.join("\n", out));
    }

    /**
     * Content of the priority nameserver file.
     *
     * @param nameserverIp address of the local DNS service
     */
    public static String priorityResolvConf(String nameserverIp) {
        return "# Created by Aftertouch/SoundTouch-Service\n"
                + "# Priority nameserver for Bose service redirection\n"
                + "nameserver " + nameserverIp + "\n";
    }
}
