package mobileqa.navigator;

/**
 * The in-app action behind one edge, e.g. tapping a menu row or pressing
 * back. The graph checks the target page's identity afterwards, so the
 * action itself only has to trigger the change.
 */
@FunctionalInterface
public interface Transition {

    void perform();
}
