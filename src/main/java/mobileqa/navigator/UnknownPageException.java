package mobileqa.navigator;

/** Thrown for a page name, or an edge target, that is not registered in the graph. */
public class UnknownPageException extends NavigationException {

    private final String pageName;

    public UnknownPageException(String pageName, String context) {
        super("Unknown page '" + pageName + "'" + (context == null ? "" : " (" + context + ")"));
        this.pageName = pageName;
    }

    public String getPageName() { return pageName; }
}
