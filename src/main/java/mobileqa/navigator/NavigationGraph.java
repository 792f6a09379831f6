package mobileqa.navigator;

import mobileqa.session.DriverSession;
import mobileqa.session.SessionConfig;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.support.ui.FluentWait;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of pages and the directed edges between them.
 *
 * <p>{@link #navigate(String, String)} takes a shortest path by hop count.
 * Equally short paths are broken by edge order, so the same graph always
 * yields the same route. After every hop the graph waits for the next page's
 * identity check; a hop that does not land stops navigation with a
 * {@link NavigationStepException}.
 *
 * <pre>{@code
 * NavigationGraph graph = NavigationGraph.from(config, session);
 * graph.register(new MainPage(session));
 * graph.register(new SettingsPage(session));
 * graph.register(new WifiPage(session));
 * graph.navigate("MainPage", "WifiPage");   // Main -> Settings -> Wifi
 * }</pre>
 */
public class NavigationGraph {

    private static final Logger log = LoggerFactory.getLogger(NavigationGraph.class);

    private static final Duration DEFAULT_POLL = Duration.ofMillis(500);

    private final Map<String, PageNode> pages = new LinkedHashMap<>();
    private final Duration hopTimeout;
    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    public NavigationGraph(Duration hopTimeout) {
        this(hopTimeout, DEFAULT_POLL, Clock.systemUTC(), Sleeper.SYSTEM_SLEEPER);
    }

    public NavigationGraph(Duration hopTimeout, Duration pollInterval, Clock clock, Sleeper sleeper) {
        this.hopTimeout = hopTimeout;
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /** A graph waiting on the session's clock with the configured hop timeout. */
    public static NavigationGraph from(SessionConfig config, DriverSession session) {
        return new NavigationGraph(config.getHopTimeout(), config.getPollInterval(),
                session.getClock(), session.getSleeper());
    }

    // ── Registration ──────────────────────────────────────────────────────

    /** @throws DuplicatePageException if a page with the same name is registered */
    public NavigationGraph register(PageNode page) {
        String name = page.getName();
        if (pages.containsKey(name)) {
            throw new DuplicatePageException(name);
        }
        pages.put(name, page);
        log.debug("Registered page '{}' with edges {}", name, page.getEdges().keySet());
        return this;
    }

    public NavigationGraph registerAll(Collection<? extends PageNode> toRegister) {
        toRegister.forEach(this::register);
        return this;
    }

    /** @throws UnknownPageException if no page has that name */
    public PageNode getPage(String name) {
        PageNode page = pages.get(name);
        if (page == null) {
            throw new UnknownPageException(name, "registered: " + pages.keySet());
        }
        return page;
    }

    public Collection<PageNode> getPages() {
        return Collections.unmodifiableCollection(pages.values());
    }

    // ── Current page ──────────────────────────────────────────────────────

    /**
     * The page whose identity check holds, or empty if none does.
     *
     * @throws AmbiguousPageException if more than one does
     */
    public Optional<PageNode> currentPage() {
        List<PageNode> matching = matchingPages();
        if (matching.size() > 1) {
            throw new AmbiguousPageException(names(matching));
        }
        return matching.stream().findFirst();
    }

    private List<PageNode> matchingPages() {
        List<PageNode> matching = new ArrayList<>();
        for (PageNode page : pages.values()) {
            if (page.isCurrentPage()) matching.add(page);
        }
        return matching;
    }

    // ── Path finding ──────────────────────────────────────────────────────

    /**
     * Shortest path by hop count, both ends included. {@code from == to}
     * gives a one-element path (zero hops).
     *
     * @throws UnknownPageException if either end, or an edge met during the search, names an unregistered page
     * @throws NoPathException      if {@code to} cannot be reached
     */
    public List<String> findPath(String from, String to) {
        getPage(from);
        getPage(to);
        if (from.equals(to)) {
            return List.of(from);
        }
        Map<String, String> previous = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        previous.put(from, null);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : pages.get(current).getEdges().keySet()) {
                if (next.equals(current) || previous.containsKey(next)) continue;
                if (!pages.containsKey(next)) {
                    throw new UnknownPageException(next, "edge from '" + current + "'");
                }
                previous.put(next, current);
                if (next.equals(to)) {
                    return unwind(previous, to);
                }
                queue.add(next);
            }
        }
        throw new NoPathException(from, to);
    }

    private static List<String> unwind(Map<String, String> previous, String to) {
        List<String> path = new ArrayList<>();
        for (String at = to; at != null; at = previous.get(at)) {
            path.add(at);
        }
        Collections.reverse(path);
        return path;
    }

    // ── Navigation ────────────────────────────────────────────────────────

    /**
     * Navigates from the page currently on screen.
     *
     * @throws NavigationException if no page is recognized on screen
     */
    public PageNode navigate(String to) {
        PageNode current = currentPage().orElseThrow(() ->
                new NavigationException("Cannot navigate to '" + to + "': no registered page matches the screen"));
        return navigate(current.getName(), to);
    }

    /**
     * Walks the shortest path hop by hop, checking after each hop that its
     * target page is on screen.
     *
     * @return the page reached
     * @throws NavigationStepException at the first hop that does not land
     */
    public PageNode navigate(String from, String to) {
        List<String> path = findPath(from, to);
        log.info("Navigating {} -> {} via {} ({} hop(s))", from, to, path, path.size() - 1);
        for (int hop = 0; hop < path.size() - 1; hop++) {
            String source = path.get(hop);
            PageNode target = pages.get(path.get(hop + 1));
            log.info("Hop {}: {} -> {}", hop, source, target.getName());
            try {
                pages.get(source).getEdges().get(target.getName()).perform();
            } catch (RuntimeException e) {
                throw stepFailure(hop, source, target.getName(), e);
            }
            try {
                awaitPage(target);
            } catch (TimeoutException e) {
                throw stepFailure(hop, source, target.getName(), e);
            }
        }
        return pages.get(to);
    }

    private void awaitPage(PageNode page) {
        new FluentWait<>(page, clock, sleeper)
                .withTimeout(hopTimeout)
                .pollingEvery(pollInterval)
                .withMessage(() -> "page '" + page.getName() + "' did not appear within " + hopTimeout.toMillis() + " ms")
                .until(PageNode::isCurrentPage);
    }

    /**
     * A step failure naming the page found on screen. An identity check that
     * throws while looking is attached as suppressed and the page is left unknown.
     */
    private NavigationStepException stepFailure(int hop, String source, String expected, RuntimeException cause) {
        String detected = null;
        RuntimeException detectionFailure = null;
        try {
            detected = detectedPage();
        } catch (RuntimeException e) {
            log.warn("Could not detect the page on screen after failed hop {}: {}", hop, e.getMessage());
            detectionFailure = e;
        }
        NavigationStepException failure = new NavigationStepException(hop, source, expected, detected, cause);
        if (detectionFailure != null) {
            failure.addSuppressed(detectionFailure);
        }
        return failure;
    }

    /** The single page on screen, or {@code null} when none or several match. */
    private String detectedPage() {
        List<PageNode> matching = matchingPages();
        if (matching.size() != 1) {
            log.warn("Detected {} pages on screen after failed hop: {}", matching.size(), names(matching));
            return null;
        }
        return matching.get(0).getName();
    }

    private static List<String> names(List<PageNode> nodes) {
        List<String> out = new ArrayList<>(nodes.size());
        for (PageNode n : nodes) out.add(n.getName());
        return out;
    }
}
