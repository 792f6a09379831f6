package mobileqa.navigator;

public class DuplicatePageException extends NavigationException {

    private final String pageName;

    public DuplicatePageException(String pageName) {
        super("Page '" + pageName + "' is already registered");
        this.pageName = pageName;
    }

    public String getPageName() { return pageName; }
}
