package com.williamcallahan.html2text.service.text;

/**
 * Prefix text produced on entering a node, and whether its children are walked.
 *
 * @param text text appended to the output before any child is visited
 * @param descend true when the node's children should be visited
 */
public record NodeEmission(String text, boolean descend) {

    static final NodeEmission SKIPPED_SUBTREE = new NodeEmission("", false);

    public NodeEmission {
        text = text == null ? "" : text;
    }

    /**
     * Emission for a node whose children, if any, are never visited.
     */
    static NodeEmission leaf(String text) {
        return new NodeEmission(text, false);
    }

    /**
     * Emission for a node whose children are visited after the prefix.
     */
    static NodeEmission branch(String text) {
        return new NodeEmission(text, true);
    }
}
