package mobileqa.navigator;

import java.util.Map;

/**
 * A screen that can take part in navigation.
 */
public interface PageNode {

    /** Unique name of the page within a graph. */
    String getName();

    /** Whether this page is on screen now. */
    boolean isCurrentPage();

    /**
     * Outgoing edges keyed by target page name. Iteration order is the
     * tie-break order for equally short paths.
     */
    Map<String, Transition> getEdges();
}
