package mobileqa.element;

import mobileqa.MobileQAException;
import mobileqa.locator.Locator;
import mobileqa.session.DriverSession;
import mobileqa.session.SessionLostException;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs one element operation under a {@link RetryPolicy}.
 *
 * <p>Each failure is classified by {@link FailureKind}:
 * <ul>
 *   <li>TRANSIENT: sleep with backoff and try again, until the attempt budget
 *       is spent or the next sleep would pass the deadline; then
 *       {@link ElementNotFoundException}.</li>
 *   <li>SESSION_LOST: {@link DriverSession#reconnect()} once and repeat the
 *       same operation right away. A second loss in the same operation is a
 *       {@link SessionLostException}.</li>
 *   <li>FATAL: rethrown as is.</li>
 * </ul>
 *
 * <p>Not thread-safe; create one per operation.
 */
public final class RetryingExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);

    private final DriverSession session;
    private final RetryPolicy policy;
    private final Clock clock;
    private final Sleeper sleeper;

    public RetryingExecutor(DriverSession session, RetryPolicy policy, Clock clock, Sleeper sleeper) {
        this.session = session;
        this.policy = policy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> T execute(Locator locator, Supplier<T> operation) {
        return execute(locator, operation, () -> {});
    }

    /**
     * @param locator   reported in {@link ElementNotFoundException}
     * @param operation the remote work; must be safe to repeat
     * @param onFailure called after every retryable failure, before the next attempt
     */
    public <T> T execute(Locator locator, Supplier<T> operation, Runnable onFailure) {
        long start = clock.millis();
        int attempts = 0;
        boolean reconnected = false;
        RuntimeException lastFailure = null;

        while (true) {
            attempts++;
            try {
                return operation.get();
            } catch (RuntimeException e) {
                FailureKind kind = FailureKind.classify(e);
                if (kind == FailureKind.FATAL) {
                    throw e;
                }
                onFailure.run();
                if (kind == FailureKind.SESSION_LOST) {
                    if (reconnected) {
                        throw new SessionLostException("Session lost again after reconnecting, while resolving "
                                + locator.describe(), e);
                    }
                    log.info("Session lost while resolving {}: {}; reconnecting", locator.describe(), firstLine(e));
                    session.reconnect();
                    reconnected = true;
                    continue;
                }
                lastFailure = e;
            }

            long elapsed = clock.millis() - start;
            Duration delay = policy.delayAfter(attempts);
            if (attempts >= policy.maxAttempts() || elapsed + delay.toMillis() > policy.timeout().toMillis()) {
                log.debug("Giving up on {} after {} attempt(s) in {} ms", locator.describe(), attempts, elapsed);
                throw new ElementNotFoundException(locator, elapsed, attempts, lastFailure);
            }
            log.debug("Attempt {}/{} for {} failed ({}); retrying in {} ms",
                    attempts, policy.maxAttempts(), locator.describe(), firstLine(lastFailure), delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new MobileQAException("Interrupted while waiting for " + locator.describe(), ie);
            }
        }
    }

    /** Selenium messages carry multi-line build info; the first line is the useful part. */
    private static String firstLine(Throwable t) {
        if (t == null || t.getMessage() == null) return String.valueOf(t);
        int nl = t.getMessage().indexOf('\n');
        return nl < 0 ? t.getMessage() : t.getMessage().substring(0, nl);
    }
}
