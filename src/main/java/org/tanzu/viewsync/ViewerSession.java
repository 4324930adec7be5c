package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A group of PDF viewers kept in sync.
 *
 * The session's monitor is its lock: every method that touches clients or the command queue is
 * synchronized, and {@link SessionRegistry#withSession} runs callers under the same monitor so
 * a multi-step update such as append-and-fan-out is one critical section.
 */
public class ViewerSession {

    private static final String ANONYMOUS = "anonymous";
    private static final String AUTHENTICATED = "authenticated";

    private final String id;
    private final String userId;
    private final Instant createdAt;
    private final int queueCapacity;
    private final Map<String, ClientConnection> clients = new LinkedHashMap<>();
    private final Deque<ObjectNode> commandQueue = new ArrayDeque<>();
    private volatile Instant lastActivity;
    private boolean retired;

    public ViewerSession(String id, String userId, int queueCapacity) {
        this.id = id;
        this.userId = userId;
        this.queueCapacity = queueCapacity;
        this.createdAt = Instant.now();
        this.lastActivity = createdAt;
    }

    public synchronized void addClient(ClientConnection connection) {
        clients.put(connection.getId(), connection);
    }

    public synchronized boolean removeClient(String clientId) {
        return clients.remove(clientId) != null;
    }

    /**
     * Copy of the current client set, safe to iterate while clients come and go.
     */
    public synchronized List<ClientConnection> clientSnapshot() {
        return new ArrayList<>(clients.values());
    }

    public synchronized int getClientCount() {
        return clients.size();
    }

    /**
     * Appends a rendered command, evicting the oldest once the queue is at capacity.
     */
    public synchronized void enqueue(ObjectNode scopedCommand) {
        commandQueue.addLast(scopedCommand);
        while (commandQueue.size() > queueCapacity) {
            commandQueue.removeFirst();
        }
    }

    public synchronized int getQueuedCommandCount() {
        return commandQueue.size();
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    /**
     * Development-mode ownership rule: the same user, or either side anonymous or authenticated.
     */
    public boolean isAccessibleBy(String requestUserId) {
        return userId.equals(requestUserId)
                || ANONYMOUS.equals(userId) || ANONYMOUS.equals(requestUserId)
                || AUTHENTICATED.equals(userId) || AUTHENTICATED.equals(requestUserId);
    }

    synchronized boolean isIdleSince(Instant cutoff) {
        return clients.isEmpty() && lastActivity.isBefore(cutoff);
    }

    synchronized void retire() {
        this.retired = true;
    }

    synchronized boolean isRetired() {
        return retired;
    }

    public synchronized SessionView toView() {
        List<JsonNode> commands = new ArrayList<>(commandQueue);
        return new SessionView(id, userId, clients.size(), commandQueue.size(), lastActivity, commands);
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }
}
