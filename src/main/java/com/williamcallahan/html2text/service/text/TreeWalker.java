package com.williamcallahan.html2text.service.text;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.jsoup.nodes.Node;

/**
 * Walks a node tree in document order and concatenates the classifier's prefix and suffix text.
 *
 * <p>The walk keeps its own stack of {@link WorkItem}s instead of recursing, so the depth of the
 * input tree never meets the thread's call stack limit. Pending items are bounded by tree depth
 * plus the widest run of not-yet-visited siblings.</p>
 */
public final class TreeWalker {

    private final NodeClassifier classifier;

    /**
     * Creates a walker that emits text according to the given classifier.
     *
     * @param classifier prefix and suffix rules
     */
    public TreeWalker(NodeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * Produces the raw, un-normalized text for a tree.
     *
     * @param root root of the tree; only read
     * @return raw text and walk statistics
     */
    public Walk walk(Node root) {
        Objects.requireNonNull(root, "root node must not be null");
        StringBuilder output = new StringBuilder();
        Deque<WorkItem> pending = new ArrayDeque<>();
        pending.push(WorkItem.enter(root));
        int enteredNodes = 0;
        int peakPending = 1;

        while (!pending.isEmpty()) {
            WorkItem item = pending.pop();
            Node node = item.node();
            if (item.phase() == WorkItem.Phase.EXIT) {
                output.append(classifier.suffix(node));
                continue;
            }
            enteredNodes++;
            NodeEmission emission = classifier.prefix(node);
            output.append(emission.text());
            pending.push(WorkItem.exit(node));
            if (emission.descend()) {
                // reversed so that popping yields document order
                for (int index = node.childNodeSize() - 1; index >= 0; index--) {
                    pending.push(WorkItem.enter(node.childNode(index)));
                }
            }
            peakPending = Math.max(peakPending, pending.size());
        }
        return new Walk(output.toString(), enteredNodes, peakPending);
    }

    /**
     * Result of a single walk.
     *
     * @param rawText concatenated prefix, text and suffix emissions
     * @param enteredNodes number of nodes entered; children of leaf and skipped nodes are not counted
     * @param peakPending largest number of work items held at once
     */
    public record Walk(String rawText, int enteredNodes, int peakPending) {}
}
