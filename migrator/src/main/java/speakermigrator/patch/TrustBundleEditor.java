package speakermigrator.patch;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure edits of a PEM trust bundle holding at most one labelled CA block.
 *
 * <p>The block is the CA certificate between two {@link #LABEL} lines:
 * <pre>
 * # AfterTouch
 * -----BEGIN CERTIFICATE-----
 * ...
 * -----END CERTIFICATE-----
 * # AfterTouch
 * </pre>
 */
public final class TrustBundleEditor {

    public static final String LABEL = "# AfterTouch";

    private TrustBundleEditor() {}

    /**
     * Removes every labelled block. Lines are dropped while an odd number of
     * label lines has been seen.
     */
    public static PatchResult strip(String bundle) {
        String text = bundle != null ? bundle : "";
        if (!text.contains(LABEL)) {
            return PatchResult.unchanged(text);
        }
        List<String> kept = new ArrayList<>();
        boolean inBlock = false;
        for (String line : text.split("\n", -1)) {
            if (line.contains(LABEL)) {
                if (!inBlock && !kept.isEmpty() && kept.get(kept.size() - 1).isEmpty()) {
                    kept.remove(kept.size() - 1);
                }
                inBlock = !inBlock;
                continue;
            }
            if (!inBlock) {
                kept.add(line);
            }
        }
        String result = String.join("\n", kept);
        if (!result.isEmpty() && !result.endsWith("\n")) {
            result += "\n";
        }
        return PatchResult.changed(result);
    }

    /**
     * Strips any existing block and appends a fresh one for {@code caPem}.
     *
     * @param bundle current bundle text
     * @param caPem PEM text of the CA certificate
     * @return bundle with exactly one up-to-date block
     */
    public static String inject(String bundle, String caPem) {
        String text = strip(bundle).text();
        if (!text.isEmpty() && !text.endsWith("\n")) {
            text += "\n";
        }
        String pem = caPem.endsWith("\n") ? caPem : caPem + "\n";
        return text + "\n" + LABEL + "\n" + pem + LABEL + "\n";
    }

    /** Counts labelled blocks in the bundle. */
    public static int countBlocks(String bundle) {
        if (bundle == null) {
            return 0;
        }
        int labels = 0;
        for (String line : bundle.split("\n")) {
            if (line.contains(LABEL)) {
                labels++;
            }
        }
        return labels / 2;
    }

    /**
     * First base64 body line of a PEM certificate, used as a weak fingerprint
     * when the bundle carries the certificate without a label.
     *
     * @return the line, or empty if the PEM has no body
     */
    public static String firstBodyLine(String caPem) {
        for (String line : caPem.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.contains("BEGIN CERTIFICATE") && !trimmed.contains("END CERTIFICATE")) {
                return trimmed;
            }
        }
        return "";
    }
}
