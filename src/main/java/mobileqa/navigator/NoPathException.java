package mobileqa.navigator;

public class NoPathException extends NavigationException {

    private final String from;
    private final String to;

    public NoPathException(String from, String to) {
        super("No path from '" + from + "' to '" + to + "'");
        this.from = from;
        this.to = to;
    }

    public String getFrom() { return from; }
    public String getTo()   { return to; }
}
