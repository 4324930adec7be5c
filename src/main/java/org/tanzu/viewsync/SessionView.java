package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a session for diagnostics. Not used by application logic.
 */
public class SessionView {

    private final String sessionId;
    private final String userId;
    private final int connectedClients;
    private final int queuedCommands;
    private final String lastActivity;
    private final List<JsonNode> commands;

    public SessionView(String sessionId, String userId, int connectedClients, int queuedCommands,
                       Instant lastActivity, List<JsonNode> commands) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.connectedClients = connectedClients;
        this.queuedCommands = queuedCommands;
        this.lastActivity = lastActivity.toString();
        this.commands = List.copyOf(commands);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public int getConnectedClients() {
        return connectedClients;
    }

    public int getQueuedCommands() {
        return queuedCommands;
    }

    public String getLastActivity() {
        return lastActivity;
    }

    public List<JsonNode> getCommands() {
        return commands;
    }
}
