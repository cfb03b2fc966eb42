package com.williamcallahan.html2text.config;

import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Text emitted for the structural markers that are not plain whitespace.
 */
@ConfigurationProperties(prefix = "html2text")
public class ConversionProperties {

    /** Placeholder emitted in place of every {@code img} element. */
    public static final String IMAGE_PLACEHOLDER_DEF = "[image]";

    /** Rule emitted for every {@code hr} element, before its trailing newline. */
    public static final String HORIZONTAL_RULE_DEF = "-".repeat(63);

    private static final String IMAGE_PLACEHOLDER_KEY = "html2text.image-placeholder";
    private static final String HORIZONTAL_RULE_KEY = "html2text.horizontal-rule";
    private static final String NULL_TEXT_FMT = "%s must not be null.";
    private static final String SINGLE_LINE_FMT = "%s must not contain line breaks.";

    private String imagePlaceholder = IMAGE_PLACEHOLDER_DEF;
    private String horizontalRule = HORIZONTAL_RULE_DEF;

    /**
     * Creates conversion properties with default markers.
     */
    public ConversionProperties() {
    }

    /**
     * Validates conversion settings.
     *
     * @throws IllegalArgumentException if a marker is missing
     * @throws IllegalStateException if the horizontal rule spans more than one line
     */
    public void validateConfiguration() {
        requireNonNullText(IMAGE_PLACEHOLDER_KEY, imagePlaceholder);
        requireNonNullText(HORIZONTAL_RULE_KEY, horizontalRule);
        if (horizontalRule.indexOf('\n') >= 0 || horizontalRule.indexOf('\r') >= 0) {
            throw new IllegalStateException(String.format(Locale.ROOT, SINGLE_LINE_FMT, HORIZONTAL_RULE_KEY));
        }
    }

    private static void requireNonNullText(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NULL_TEXT_FMT, key));
        }
    }

    public String getImagePlaceholder() {
        return imagePlaceholder;
    }

    public void setImagePlaceholder(String imagePlaceholder) {
        this.imagePlaceholder = imagePlaceholder;
    }

    public String getHorizontalRule() {
        return horizontalRule;
    }

    public void setHorizontalRule(String horizontalRule) {
        this.horizontalRule = horizontalRule;
    }
}
