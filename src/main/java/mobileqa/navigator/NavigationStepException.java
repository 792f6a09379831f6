package mobileqa.navigator;

/**
 * Thrown when a hop does not land on its expected page. Hops already taken
 * are not rolled back; {@link #getHopIndex()} says where navigation stopped.
 */
public class NavigationStepException extends NavigationException {

    private final int hopIndex;
    private final String from;
    private final String expected;
    private final String detected;

    /**
     * @param hopIndex zero-based index of the failing hop
     * @param detected the page on screen afterwards, or {@code null} if none (or several) matched
     * @param cause    the transition's own failure, or the wait timeout
     */
    public NavigationStepException(int hopIndex, String from, String expected, String detected, Throwable cause) {
        super(String.format("Hop %d (%s -> %s) failed: expected '%s' but detected %s",
                hopIndex, from, expected, expected, detected == null ? "no page" : "'" + detected + "'"), cause);
        this.hopIndex = hopIndex;
        this.from = from;
        this.expected = expected;
        this.detected = detected;
    }

    public int    getHopIndex() { return hopIndex; }
    public String getFrom()     { return from; }
    public String getExpected() { return expected; }

    /** The page detected after the failed hop, or {@code null}. */
    public String getDetected() { return detected; }
}
