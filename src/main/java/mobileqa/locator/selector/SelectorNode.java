package mobileqa.locator.selector;

import java.util.List;
import java.util.Objects;

/**
 * One call in a selector chain, e.g. {@code text("Wi-Fi")}.
 *
 * <p>Arguments keep the order they were written in. Every argument must be a
 * {@code String}, {@code Integer}, {@code Boolean} or nested {@link Selector};
 * the node does not check arity, which is the parser's job.
 *
 * @param method    the recognized method
 * @param arguments ordered, immutable arguments
 */
public record SelectorNode(UiMethod method, List<Object> arguments) {

    public SelectorNode {
        Objects.requireNonNull(method, "method must not be null");
        arguments = List.copyOf(arguments);
    }

    /** Builds a single-argument call after checking the argument type. */
    public static SelectorNode of(UiMethod method, Object argument) {
        Objects.requireNonNull(argument, "argument must not be null");
        if (!method.getArgumentType().accepts(argument)) {
            throw new IllegalArgumentException(method.getMethodName() + " expects "
                    + method.getArgumentType() + " but got " + argument.getClass().getSimpleName());
        }
        return new SelectorNode(method, List.of(argument));
    }

    /** The sole argument of a unary call. */
    public Object argument() {
        if (arguments.size() != 1) {
            throw new IllegalStateException(method.getMethodName() + " has " + arguments.size() + " arguments");
        }
        return arguments.get(0);
    }

    /** The nested selector of {@code childSelector}/{@code fromParent}. */
    public Selector nested() {
        return (Selector) argument();
    }

    @Override
    public String toString() {
        return method.getMethodName() + arguments;
    }
}
