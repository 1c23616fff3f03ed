package speakermigrator.patch;

/**
 * Output of a text patch.
 *
 * @param text the patched text, or the input if nothing changed
 * @param changed whether the patch altered the text
 */
public record PatchResult(String text, boolean changed) {

    public static PatchResult unchanged(String text) {
        return new PatchResult(text, false);
    }

    public static PatchResult changed(String text) {
        return new PatchResult(text, true);
    }
}
