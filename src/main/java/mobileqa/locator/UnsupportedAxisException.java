package mobileqa.locator;

/**
 * Thrown when a hierarchical relation (an XPath axis) cannot be expressed in
 * the target locator shape. The converter never approximates an axis.
 */
public class UnsupportedAxisException extends LocatorException {

    private final String axis;

    public UnsupportedAxisException(String axis) {
        super("Axis '" + axis + "' has no equivalent in the selector grammar");
        this.axis = axis;
    }

    public String getAxis() { return axis; }
}
