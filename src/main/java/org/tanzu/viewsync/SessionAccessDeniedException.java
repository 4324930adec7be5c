package org.tanzu.viewsync;

/**
 * Thrown when a named user addresses a session created by a different named user.
 */
public class SessionAccessDeniedException extends RuntimeException {

    public SessionAccessDeniedException(String sessionId, String sessionUserId, String requestUserId) {
        super(String.format("Session %s belongs to different user (session: %s, request: %s)",
                sessionId, sessionUserId, requestUserId));
    }
}
