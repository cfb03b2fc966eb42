package com.williamcallahan.html2text.service.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.junit.jupiter.api.Test;

/**
 * Tests prefix and suffix rules for individual nodes.
 */
class NodeClassifierTest {

    private static final String RULE = "-----";

    private final NodeClassifier classifier = new NodeClassifier("[image]", RULE);

    @Test
    void prefix_textNode_collapsesWhitespaceAndIsLeaf() {
        NodeEmission emission = classifier.prefix(new TextNode("  one\t\ttwo\r\n\fthree "));

        assertEquals(" one two three ", emission.text());
        assertFalse(emission.descend());
    }

    @Test
    void prefix_image_isPlaceholderLeaf() {
        NodeEmission emission = classifier.prefix(new Element("img"));

        assertEquals("[image]", emission.text());
        assertFalse(emission.descend());
    }

    @Test
    void prefix_skippedTags_emitNothingAndSkipChildren() {
        for (String tagName : new String[] {"style", "head", "title", "meta", "script"}) {
            NodeEmission emission = classifier.prefix(new Element(tagName));

            assertEquals("", emission.text(), tagName);
            assertFalse(emission.descend(), tagName);
        }
    }

    @Test
    void prefix_blockTags_startNewLine() {
        for (String tagName : new String[] {"h1", "h2", "h3", "h4", "h5", "h6", "ol", "ul", "tr", "p", "div"}) {
            NodeEmission emission = classifier.prefix(new Element(tagName));

            assertEquals("\n", emission.text(), tagName);
            assertTrue(emission.descend(), tagName);
        }
    }

    @Test
    void prefix_cellsListItemsAndRules() {
        assertEquals("\t", classifier.prefix(new Element("td")).text());
        assertEquals("\t", classifier.prefix(new Element("th")).text());
        assertEquals("- ", classifier.prefix(new Element("li")).text());
        assertEquals(RULE + "\n", classifier.prefix(new Element("hr")).text());
        assertTrue(classifier.prefix(new Element("hr")).descend());
    }

    @Test
    void prefix_unknownTagAndDocument_emitNothingAndDescend() {
        NodeEmission custom = classifier.prefix(new Element("custom-widget"));
        NodeEmission document = classifier.prefix(Jsoup.parse("<p>x</p>"));

        assertEquals("", custom.text());
        assertTrue(custom.descend());
        assertEquals("", document.text());
        assertTrue(document.descend());
    }

    @Test
    void prefix_tagNameIsCaseInsensitive() {
        assertEquals("[image]", classifier.prefix(new Element("IMG")).text());
        assertEquals("\n", classifier.prefix(new Element("Div")).text());
        assertFalse(classifier.prefix(new Element("SCRIPT")).descend());
    }

    @Test
    void suffix_headingsAndListItems_alwaysEndLine() {
        Document document = Jsoup.parseBodyFragment("<h2>H</h2><div>D</div><ul><li>L</li></ul>");

        assertEquals("\n", classifier.suffix(document.selectFirst("h2")));
        assertEquals("\n", classifier.suffix(document.selectFirst("li")));
    }

    @Test
    void suffix_paragraph_endsLineUnlessDivFollows() {
        Document beforeDiv = Jsoup.parseBodyFragment("<p>A</p> <!-- c --> <div>B</div>");
        Document beforeParagraph = Jsoup.parseBodyFragment("<p>A</p><p>B</p>");
        Document last = Jsoup.parseBodyFragment("<p>A</p> trailing text");

        assertEquals("", classifier.suffix(beforeDiv.selectFirst("p")));
        assertEquals("\n", classifier.suffix(beforeParagraph.selectFirst("p")));
        assertEquals("\n", classifier.suffix(last.selectFirst("p")));
    }

    @Test
    void suffix_lineBreak_followsParagraphRule() {
        Document beforeDiv = Jsoup.parseBodyFragment("a<br><div>b</div>");
        Document last = Jsoup.parseBodyFragment("a<br>b");

        assertEquals("", classifier.suffix(beforeDiv.selectFirst("br")));
        assertEquals("\n", classifier.suffix(last.selectFirst("br")));
    }

    @Test
    void suffix_div_endsLineOnlyBeforeNonDivElement() {
        Document beforeDiv = Jsoup.parseBodyFragment("<div>A</div><div>B</div>");
        Document beforeParagraph = Jsoup.parseBodyFragment("<div>A</div><p>B</p>");
        Document last = Jsoup.parseBodyFragment("<div>A</div> trailing text");

        assertEquals("", classifier.suffix(beforeDiv.selectFirst("div")));
        assertEquals("\n", classifier.suffix(beforeParagraph.selectFirst("div")));
        assertEquals("", classifier.suffix(last.selectFirst("div")));
    }

    @Test
    void suffix_linkBeforeHeading_addsNewline() {
        Document beforeHeading = Jsoup.parseBodyFragment("<a href=\"#\">x</a> <h3>y</h3>");
        Document beforeParagraph = Jsoup.parseBodyFragment("<a href=\"#\">x</a><p>y</p>");

        assertEquals("\n", classifier.suffix(beforeHeading.selectFirst("a")));
        assertEquals("", classifier.suffix(beforeParagraph.selectFirst("a")));
    }

    @Test
    void suffix_otherNodes_emitNothing() {
        Document document = Jsoup.parseBodyFragment("<span>s</span><td>t</td><h1>h</h1>");

        assertEquals("", classifier.suffix(document.selectFirst("span")));
        assertEquals("", classifier.suffix(new TextNode("plain")));
        assertEquals("", classifier.suffix(document));
    }
}
