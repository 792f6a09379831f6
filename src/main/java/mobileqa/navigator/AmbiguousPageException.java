package mobileqa.navigator;

import java.util.List;

/**
 * Thrown when more than one page claims to be on screen. Identity predicates
 * of a well-formed page set are mutually exclusive.
 */
public class AmbiguousPageException extends NavigationException {

    private final List<String> pageNames;

    public AmbiguousPageException(List<String> pageNames) {
        super("Several pages match the current screen: " + pageNames);
        this.pageNames = List.copyOf(pageNames);
    }

    public List<String> getPageNames() { return pageNames; }
}
