package com.williamcallahan.html2text.support;

/**
 * Substitution pass applied to raw HTML source before it reaches the parser.
 *
 * <p>Line endings are unified to {@code \n}, and both the {@code &nbsp;} entity and the
 * U+00A0 character become an ordinary space so that the whitespace rules downstream
 * treat them like any other blank.</p>
 */
public final class HtmlSourceNormalizer {

    private static final String NBSP_ENTITY = "&nbsp;";
    private static final char NBSP_CHARACTER = '\u00a0';

    private HtmlSourceNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes line endings and non-breaking spaces.
     *
     * @param htmlSource raw source (may be null)
     * @return normalized source, or empty string if null
     */
    public static String normalize(String htmlSource) {
        if (htmlSource == null) {
            return "";
        }
        return fixNewlines(replaceNonBreakingSpaces(htmlSource));
    }

    static String replaceNonBreakingSpaces(String text) {
        return text.replace(NBSP_ENTITY, " ").replace(NBSP_CHARACTER, ' ');
    }

    static String fixNewlines(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
