package com.williamcallahan.html2text.service.text;

import java.util.regex.Pattern;

/**
 * Cleans the raw walk output into the final text.
 *
 * <p>Steps, in order: strip blanks around line breaks, fold spaces around a tab into the tab,
 * cap blank lines at one, and trim the whole result.</p>
 */
public final class WhitespaceNormalizer {

    private static final Pattern LINE_EDGE_BLANKS = Pattern.compile("[ \\t]*\\n[ \\t]*");
    private static final Pattern SPACES_AROUND_TAB = Pattern.compile(" *\\t *");
    private static final Pattern NEWLINE_RUN = Pattern.compile("\\n{2,}");

    private WhitespaceNormalizer() {
        // Utility class - no instantiation
    }

    /**
     * Normalizes raw converter output.
     *
     * @param rawText concatenated walk output
     * @return text with no blank-edged lines, at most one blank line in a row, and no outer whitespace
     */
    public static String normalize(String rawText) {
        String text = LINE_EDGE_BLANKS.matcher(rawText).replaceAll("\n");
        text = SPACES_AROUND_TAB.matcher(text).replaceAll("\t");
        text = NEWLINE_RUN.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
