package mobileqa.locator.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the selector AST: an ordered chain of calls, all of which must hold
 * for a node to match. Immutable; converters build new trees instead of
 * editing existing ones.
 */
public record Selector(List<SelectorNode> nodes) {

    public Selector {
        nodes = List.copyOf(nodes);
    }

    public static Selector of(SelectorNode... nodes) {
        return new Selector(List.of(nodes));
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    /** Returns a new selector with {@code node} appended. */
    public Selector append(SelectorNode node) {
        List<SelectorNode> copy = new ArrayList<>(nodes);
        copy.add(node);
        return new Selector(copy);
    }

    /** Canonical string form, see {@link SelectorWriter}. */
    @Override
    public String toString() {
        return SelectorWriter.write(this);
    }
}
