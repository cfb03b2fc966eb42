package com.williamcallahan.html2text.service.text;

import org.jsoup.nodes.Node;

/**
 * Pending step of a document-order walk: either entering a node or leaving it.
 *
 * @param phase whether the node is being entered or exited
 * @param node node the step applies to
 */
record WorkItem(Phase phase, Node node) {

    enum Phase {
        /** Emit the prefix, schedule the exit, then schedule the children. */
        ENTER,
        /** Emit the suffix; every child has already been entered and exited. */
        EXIT
    }

    static WorkItem enter(Node node) {
        return new WorkItem(Phase.ENTER, node);
    }

    static WorkItem exit(Node node) {
        return new WorkItem(Phase.EXIT, node);
    }
}
