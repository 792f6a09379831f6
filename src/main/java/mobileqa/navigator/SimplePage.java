package mobileqa.navigator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * A page assembled from a name, an identity check and edges, for screens
 * that do not need their own page class.
 *
 * <pre>{@code
 * PageNode main = SimplePage.builder("Main")
 *         .identity(() -> session.getElement(Map.of("text", "Home")).isPresent(Duration.ofSeconds(1)))
 *         .edge("Settings", () -> session.getElement(Map.of("content-desc", "Settings")).tap())
 *         .build();
 * }</pre>
 */
public final class SimplePage implements PageNode {

    private final String name;
    private final BooleanSupplier identity;
    private final Map<String, Transition> edges;

    private SimplePage(Builder b) {
        this.name = b.name;
        this.identity = b.identity;
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(b.edges));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override public String getName()                   { return name; }
    @Override public boolean isCurrentPage()            { return identity.getAsBoolean(); }
    @Override public Map<String, Transition> getEdges() { return edges; }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private BooleanSupplier identity = () -> false;
        private final Map<String, Transition> edges = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder identity(BooleanSupplier identity) {
            this.identity = Objects.requireNonNull(identity, "identity");
            return this;
        }

        public Builder edge(String target, Transition transition) {
            edges.put(target, Objects.requireNonNull(transition, "transition"));
            return this;
        }

        public SimplePage build() {
            return new SimplePage(this);
        }
    }
}
