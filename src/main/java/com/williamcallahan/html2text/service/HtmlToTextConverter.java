package com.williamcallahan.html2text.service;

import com.williamcallahan.html2text.config.ConversionProperties;
import com.williamcallahan.html2text.service.text.NodeClassifier;
import com.williamcallahan.html2text.service.text.TreeWalker;
import com.williamcallahan.html2text.service.text.WhitespaceNormalizer;
import com.williamcallahan.html2text.support.HtmlSourceNormalizer;
import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Converts HTML into readable plain text.
 *
 * <p>Structure survives as whitespace and punctuation: headings, paragraphs and rows start on
 * new lines, list items get a {@code "- "} marker, table cells are tab separated, images become
 * a placeholder, and {@code script}, {@code style} and document head content are dropped.</p>
 *
 * <p>Each call owns its own work stack and output buffer, so one instance can serve
 * concurrent callers as long as no caller mutates a tree while it is being converted.</p>
 */
@Service
public class HtmlToTextConverter {

    private static final Logger log = LoggerFactory.getLogger(HtmlToTextConverter.class);

    private final TreeWalker treeWalker;

    /**
     * Creates a converter with the default markers.
     */
    public HtmlToTextConverter() {
        this(new ConversionProperties());
    }

    /**
     * Creates a converter with the configured markers.
     *
     * @param properties conversion settings
     * @throws IllegalArgumentException if a marker is missing
     * @throws IllegalStateException if the horizontal rule spans more than one line
     */
    @Autowired
    public HtmlToTextConverter(ConversionProperties properties) {
        properties.validateConfiguration();
        this.treeWalker = new TreeWalker(
                new NodeClassifier(properties.getImagePlaceholder(), properties.getHorizontalRule()));
        log.debug("HTML to text converter ready (imagePlaceholder={}, horizontalRuleLength={})",
                properties.getImagePlaceholder(), properties.getHorizontalRule().length());
    }

    /**
     * Parses HTML source and converts it to plain text.
     *
     * @param htmlSource HTML markup; null is treated as empty
     * @return plain text, empty for empty input
     */
    public String convert(String htmlSource) {
        String normalizedSource = HtmlSourceNormalizer.normalize(htmlSource);
        if (normalizedSource.isEmpty()) {
            return "";
        }
        Document document = Jsoup.parse(normalizedSource);
        return render(document, normalizedSource.length());
    }

    /**
     * Converts an already parsed tree to plain text. The tree is only read.
     *
     * @param root root of the tree, typically a jsoup {@link Document}
     * @return plain text
     */
    public String convertTree(Node root) {
        Objects.requireNonNull(root, "root node must not be null");
        return render(root, -1);
    }

    private String render(Node root, int sourceLength) {
        TreeWalker.Walk walk = treeWalker.walk(root);
        String text = WhitespaceNormalizer.normalize(walk.rawText());
        if (log.isDebugEnabled()) {
            log.debug("Converted HTML (sourceLength={}, enteredNodes={}, peakPending={}, rawLength={}, textLength={})",
                    sourceLength, walk.enteredNodes(), walk.peakPending(), walk.rawText().length(), text.length());
        }
        return text;
    }
}
