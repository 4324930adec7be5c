package org.tanzu.viewsync;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.viewsync.config.ViewSyncProperties;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-wide registry of PDF viewer sessions.
 * Sessions are created on first use by a publish or a client registration and are only
 * removed by the idle sweep once they have no connected clients.
 */
@Component
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, ViewerSession> activeSessions = new ConcurrentHashMap<>();

    private final ViewSyncProperties properties;

    private Disposable sweepTask;

    public SessionRegistry(ViewSyncProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ViewSyncProperties.SweepConfig sweep = properties.getSweep();
        if (!sweep.isEnabled()) {
            logger.info("Idle session sweep disabled");
            return;
        }
        sweepTask = Flux.interval(sweep.getInterval())
                .subscribe(
                        tick -> cleanupIdleSessions(sweep.getIdleTimeout()),
                        error -> logger.error("Idle session sweep stopped", error)
                );
        logger.info("Idle session sweep every {} for sessions idle longer than {}",
                sweep.getInterval(), sweep.getIdleTimeout());
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.dispose();
        }
    }

    /**
     * Returns the session with the given ID, creating an empty one owned by {@code userId} if absent.
     *
     * @param sessionId The session ID
     * @param userId The user creating or accessing the session
     * @return The live session
     */
    public ViewerSession getOrCreate(String sessionId, String userId) {
        return activeSessions.computeIfAbsent(sessionId, id -> {
            logger.info("Created new PDF session: {} for user: {}", id, userId);
            return new ViewerSession(id, userId, properties.getCommandQueueCapacity());
        });
    }

    /**
     * Runs {@code action} while holding the session lock, creating the session if needed.
     * Verifies that {@code userId} may access the session and records activity.
     * If the sweep retires the session concurrently, the lookup is retried against a fresh session.
     *
     * @throws SessionAccessDeniedException if the session belongs to a different user
     */
    public <T> T withSession(String sessionId, String userId, Function<ViewerSession, T> action) {
        while (true) {
            ViewerSession session = getOrCreate(sessionId, userId);
            synchronized (session) {
                if (session.isRetired()) {
                    continue;
                }
                if (!session.isAccessibleBy(userId)) {
                    logger.warn("Rejected access to session {} by user {} (owner: {})",
                            sessionId, userId, session.getUserId());
                    throw new SessionAccessDeniedException(sessionId, session.getUserId(), userId);
                }
                session.touch();
                return action.apply(session);
            }
        }
    }

    /**
     * Checks that {@code userId} may use the session without creating it. Unknown sessions pass.
     *
     * @throws SessionAccessDeniedException if the session exists and belongs to a different user
     */
    public void checkAccess(String sessionId, String userId) {
        ViewerSession session = activeSessions.get(sessionId);
        if (session != null && !session.isAccessibleBy(userId)) {
            throw new SessionAccessDeniedException(sessionId, session.getUserId(), userId);
        }
    }

    /**
     * Gets the session for a given ID without creating it.
     */
    public Optional<ViewerSession> find(String sessionId) {
        return Optional.ofNullable(activeSessions.get(sessionId));
    }

    /**
     * Diagnostic copy of every session. Each session is copied under its own lock;
     * no registry-wide lock is taken.
     */
    public List<SessionView> snapshot() {
        List<SessionView> views = new ArrayList<>();
        for (ViewerSession session : activeSessions.values()) {
            views.add(session.toView());
        }
        return views;
    }

    /**
     * Diagnostic copies of the sessions created by a user.
     */
    public List<SessionView> snapshotForUser(String userId) {
        List<SessionView> views = new ArrayList<>();
        for (ViewerSession session : activeSessions.values()) {
            if (session.getUserId().equals(userId)) {
                views.add(session.toView());
            }
        }
        return views;
    }

    public int getSessionCount() {
        return activeSessions.size();
    }

    /**
     * Removes sessions that have no connected clients and no activity within {@code idleTimeout}.
     *
     * @param idleTimeout How long a client-less session may stay idle
     * @return Number of sessions removed
     */
    public int cleanupIdleSessions(Duration idleTimeout) {
        Instant cutoff = Instant.now().minus(idleTimeout);
        int cleanedUp = 0;
        for (ViewerSession session : activeSessions.values()) {
            synchronized (session) {
                if (!session.isIdleSince(cutoff)) {
                    continue;
                }
                session.retire();
                activeSessions.remove(session.getId(), session);
            }
            logger.info("Cleaning up inactive session: {}", session.getId());
            cleanedUp++;
        }
        if (cleanedUp > 0) {
            logger.info("Cleaned up {} idle sessions, {} remaining", cleanedUp, activeSessions.size());
        }
        return cleanedUp;
    }
}
