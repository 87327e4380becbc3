package com.lending.dialog.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

import com.lending.dialog.domain.entity.Session;

/**
 * Inactivity handling for sessions.
 * <p>
 * The check is lazy: it runs at the start of every event against the
 * previous {@code lastActivityAt}, so there is no background sweeper and an
 * idle user costs nothing.
 * </p>
 */
public class SessionLifecycleManager {

    private static final Logger log = Logger.getLogger(SessionLifecycleManager.class.getName());

    private final Duration threshold;

    public SessionLifecycleManager(Duration threshold) {
        if (threshold == null || threshold.isNegative() || threshold.isZero()) {
            throw new IllegalArgumentException("threshold must be positive, got: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @return true if more than {@code threshold} elapsed since the last activity (strictly greater)
     */
    public static boolean isStale(Session session, Instant now, Duration threshold) {
        return Duration.between(session.getLastActivityAt(), now).compareTo(threshold) > 0;
    }

    public boolean isStale(Session session, Instant now) {
        return isStale(session, now, threshold);
    }

    /**
     * Applies the staleness rule and stamps the event time.
     *
     * @return the session to continue with: reset if stale, always touched with {@code now}
     */
    public Check check(Session session, Instant now) {
        if (!isStale(session, now)) {
            return new Check(session.touch(now), false, false);
        }
        boolean wasInJourney = session.isInJourney();
        log.info(String.format("action=session_stale identity=%s journey=%s step=%s idle=%ds",
                session.getIdentity(), session.getJourney(), session.getCurrentStep(),
                Duration.between(session.getLastActivityAt(), now).toSeconds()));
        return new Check(session.reset().touch(now), true, wasInJourney);
    }

    public Duration getThreshold() {
        return threshold;
    }

    /**
     * Outcome of a lifecycle check.
     *
     * @param session      session to continue with
     * @param reset        true if the session was reset
     * @param wasInJourney true if the reset abandoned an active journey
     */
    public record Check(Session session, boolean reset, boolean wasInJourney) {
    }
}
