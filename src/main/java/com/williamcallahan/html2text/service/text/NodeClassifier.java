package com.williamcallahan.html2text.service.text;

import com.williamcallahan.html2text.support.TagNames;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Maps a node to the text emitted around it during conversion.
 *
 * <p>The prefix rule runs when a node is entered and decides whether its children are
 * walked. The suffix rule runs once every child has been processed and may look at the
 * next element sibling. Tags not listed in either table emit nothing and are descended into.</p>
 *
 * <p>Instances hold only immutable marker strings and are safe to share between threads.</p>
 */
public final class NodeClassifier {

    private static final String NEWLINE = "\n";
    private static final String TAB = "\t";
    private static final String LIST_ITEM_MARKER = "- ";
    private static final String NO_TEXT = "";
    private static final String DIV = "div";

    private static final Set<String> SKIPPED_TAGS = Set.of("style", "head", "title", "meta", "script");

    // Same class as \s in the rule tables: tab, newline, form feed, carriage return, space
    private static final Pattern TEXT_WHITESPACE_RUN = Pattern.compile("[\\t\\n\\f\\r ]+");

    private final String imagePlaceholder;
    private final String horizontalRuleLine;

    /**
     * Creates a classifier with the given markers.
     *
     * @param imagePlaceholder text emitted for {@code img} elements
     * @param horizontalRule rule emitted for {@code hr} elements, without a line break
     */
    public NodeClassifier(String imagePlaceholder, String horizontalRule) {
        this.imagePlaceholder = imagePlaceholder;
        this.horizontalRuleLine = horizontalRule + NEWLINE;
    }

    /**
     * Resolves the prefix text and descend decision for a node being entered.
     *
     * @param node node being entered
     * @return prefix emission
     */
    public NodeEmission prefix(Node node) {
        if (node instanceof TextNode) {
            return NodeEmission.leaf(collapseWhitespace(((TextNode) node).getWholeText()));
        }
        if (!(node instanceof Element)) {
            return NodeEmission.branch(NO_TEXT);
        }
        String tagName = TagNames.of((Element) node);
        if ("img".equals(tagName)) {
            return NodeEmission.leaf(imagePlaceholder);
        }
        if (SKIPPED_TAGS.contains(tagName)) {
            return NodeEmission.SKIPPED_SUBTREE;
        }
        String prefixText = switch (tagName) {
            case "hr" -> horizontalRuleLine;
            case "h1", "h2", "h3", "h4", "h5", "h6", "ol", "ul" -> NEWLINE;
            case "tr", "p", DIV -> NEWLINE;
            case "td", "th" -> TAB;
            case "li" -> LIST_ITEM_MARKER;
            default -> NO_TEXT;
        };
        return NodeEmission.branch(prefixText);
    }

    /**
     * Resolves the text emitted when leaving a node, after all of its children.
     *
     * @param node node being exited
     * @return suffix text, possibly empty
     */
    public String suffix(Node node) {
        if (!(node instanceof Element)) {
            return NO_TEXT;
        }
        String tagName = TagNames.of((Element) node);
        String suffixText;
        if (TagNames.isHeading(tagName) || "li".equals(tagName)) {
            suffixText = NEWLINE;
        } else if ("p".equals(tagName) || "br".equals(tagName)) {
            suffixText = isFollowedByDiv(node) ? NO_TEXT : NEWLINE;
        } else if (DIV.equals(tagName)) {
            // no line break before another div, or at the end of the parent
            Optional<String> nextName = SiblingScanner.nextElementName(node);
            suffixText = nextName.isPresent() && !DIV.equals(nextName.get()) ? NEWLINE : NO_TEXT;
        } else {
            suffixText = NO_TEXT;
        }
        if ("a".equals(tagName) && isFollowedByHeading(node)) {
            return suffixText + NEWLINE;
        }
        return suffixText;
    }

    static String collapseWhitespace(String text) {
        return TEXT_WHITESPACE_RUN.matcher(text).replaceAll(" ");
    }

    private static boolean isFollowedByDiv(Node node) {
        return SiblingScanner.nextElementName(node).filter(DIV::equals).isPresent();
    }

    private static boolean isFollowedByHeading(Node node) {
        return SiblingScanner.nextElementName(node).filter(TagNames::isHeading).isPresent();
    }
}
