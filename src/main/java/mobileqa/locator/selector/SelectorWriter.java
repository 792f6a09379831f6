package mobileqa.locator.selector;

/**
 * Serializes a {@link Selector} to its canonical string form:
 * {@code new UiSelector().text("Wi-Fi").className("android.widget.TextView");}
 *
 * <p>The output re-parses to a structurally equal tree; string arguments are
 * re-escaped so that quotes and backslashes survive the round trip.
 */
public final class SelectorWriter {

    private SelectorWriter() {}

    public static String write(Selector selector) {
        return writeChain(selector) + ";";
    }

    private static String writeChain(Selector selector) {
        StringBuilder sb = new StringBuilder("new UiSelector()");
        for (SelectorNode node : selector.nodes()) {
            sb.append('.').append(node.method().getMethodName()).append('(');
            for (int i = 0; i < node.arguments().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(formatArgument(node.arguments().get(i)));
            }
            sb.append(')');
        }
        return sb.toString();
    }

    private static String formatArgument(Object arg) {
        if (arg instanceof Selector nested) {
            return writeChain(nested);
        }
        if (arg instanceof Boolean || arg instanceof Integer) {
            return String.valueOf(arg);
        }
        return '"' + escape(String.valueOf(arg)) + '"';
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
