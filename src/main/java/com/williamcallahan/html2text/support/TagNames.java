package com.williamcallahan.html2text.support;

import java.util.Set;
import org.jsoup.nodes.Element;

/**
 * Tag name lookups shared by the conversion rule tables.
 *
 * <p>Names come from the parser's normalized form, so a tree built with case-preserving
 * parse settings dispatches the same way as one built by the default HTML parser.</p>
 */
public final class TagNames {

    private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6");

    private TagNames() {
        // Utility class - no instantiation
    }

    /**
     * Returns the parser-normalized (lower-case) tag name of an element.
     *
     * @param element element to name
     * @return lower-case tag name
     */
    public static String of(Element element) {
        return element.normalName();
    }

    /**
     * Tests whether a normalized tag name is one of {@code h1} through {@code h6}.
     *
     * @param tagName lower-case tag name
     * @return true for heading tags
     */
    public static boolean isHeading(String tagName) {
        return HEADINGS.contains(tagName);
    }
}
