package mobileqa.element;

import java.util.Locale;

/** Direction of a swipe or scroll gesture, named as the device server expects it. */
public enum SwipeDirection {
    UP, DOWN, LEFT, RIGHT;

    String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
