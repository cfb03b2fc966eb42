package com.williamcallahan.html2text.service.text;

import com.williamcallahan.html2text.support.TagNames;
import java.util.Optional;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;

/**
 * Finds the next element sibling of a node, skipping text, comments and other non-element nodes.
 */
public final class SiblingScanner {

    private SiblingScanner() {
        // Utility class - no instantiation
    }

    /**
     * Scans forward through the sibling chain for the first element.
     *
     * @param node node whose following siblings are scanned
     * @return lower-case tag name of the first following element, or empty when the chain runs out
     */
    public static Optional<String> nextElementName(Node node) {
        Node sibling = node.nextSibling();
        while (sibling != null && !(sibling instanceof Element)) {
            sibling = sibling.nextSibling();
        }
        if (sibling == null) {
            return Optional.empty();
        }
        return Optional.of(TagNames.of((Element) sibling));
    }
}
