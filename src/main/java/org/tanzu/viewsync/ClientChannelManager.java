package org.tanzu.viewsync;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.tanzu.viewsync.config.ViewSyncProperties;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the lifecycle of viewer push channels: registration into a session, periodic keep-alive
 * frames, and deregistration on every exit path.
 */
@Component
public class ClientChannelManager {

    private static final Logger logger = LoggerFactory.getLogger(ClientChannelManager.class);

    private final SessionRegistry sessionRegistry;
    private final ViewSyncProperties properties;
    private final Scheduler heartbeatScheduler;

    // Open channels by client ID
    private final Map<String, ClientHandle> openHandles = new ConcurrentHashMap<>();

    @Autowired
    public ClientChannelManager(SessionRegistry sessionRegistry, ViewSyncProperties properties) {
        this(sessionRegistry, properties, Schedulers.parallel());
    }

    ClientChannelManager(SessionRegistry sessionRegistry, ViewSyncProperties properties, Scheduler heartbeatScheduler) {
        this.sessionRegistry = sessionRegistry;
        this.properties = properties;
        this.heartbeatScheduler = heartbeatScheduler;
    }

    /**
     * Registers a new viewer channel in a session and starts its heartbeat.
     * The connection frame is queued before the handle is returned.
     *
     * @param sessionId The resolved session ID
     * @param userId The resolved user ID
     * @return Handle whose event stream should be handed to the transport
     * @throws SessionAccessDeniedException if the session belongs to a different user
     */
    public ClientHandle register(String sessionId, String userId) {
        ClientConnection connection = new ClientConnection(sessionId, userId, properties.getClientBufferSize());

        ClientHandle handle = sessionRegistry.withSession(sessionId, userId, session -> {
            session.addClient(connection);
            connection.send(SseFrameFormatter.connectionFrame(sessionId, userId));
            logger.info("Registered client {} for session: {}, user: {}. Total clients in session: {}",
                    connection.getId(), sessionId, userId, session.getClientCount());
            ClientHandle created = new ClientHandle(session, connection, this::deregister);
            openHandles.put(created.getClientId(), created);
            return created;
        });

        Duration interval = properties.getHeartbeatInterval();
        Disposable heartbeat = Flux.interval(interval, interval, heartbeatScheduler)
                .subscribe(
                        tick -> sendHeartbeat(handle),
                        error -> {
                            logger.error("Heartbeat failed for client {} in session {}",
                                    handle.getClientId(), sessionId, error);
                            deregister(handle);
                        }
                );
        connection.attachHeartbeat(heartbeat);

        return handle;
    }

    /**
     * Verifies ahead of {@link #register} that the user may open a channel on the session.
     *
     * @throws SessionAccessDeniedException if the session belongs to a different user
     */
    public void checkAccess(String sessionId, String userId) {
        sessionRegistry.checkAccess(sessionId, userId);
    }

    /**
     * Removes a viewer from its session, stops its heartbeat and completes its stream.
     * Safe to call more than once and from any exit path.
     *
     * @param handle The handle returned by {@link #register}
     */
    public void deregister(ClientHandle handle) {
        openHandles.remove(handle.getClientId(), handle);
        boolean closed = handle.getConnection().close();
        ViewerSession session = handle.getSession();
        boolean removed = session.removeClient(handle.getClientId());
        if (removed) {
            session.touch();
        }
        if (closed || removed) {
            logger.info("Client {} removed from session {}. Remaining clients: {}",
                    handle.getClientId(), handle.getSessionId(), session.getClientCount());
        }
    }

    /**
     * Deregisters an open channel by client ID. Unknown IDs are ignored.
     */
    public void deregister(String clientId) {
        ClientHandle handle = openHandles.get(clientId);
        if (handle != null) {
            deregister(handle);
        }
    }

    public Optional<ClientHandle> findHandle(String clientId) {
        return Optional.ofNullable(openHandles.get(clientId));
    }

    public int getOpenChannelCount() {
        return openHandles.size();
    }

    @PreDestroy
    public void closeAll() {
        logger.info("Shutting down ClientChannelManager, closing {} channels", openHandles.size());
        for (ClientHandle handle : new ArrayList<>(openHandles.values())) {
            deregister(handle);
        }
    }

    private void sendHeartbeat(ClientHandle handle) {
        if (!handle.getConnection().send(SseFrameFormatter.heartbeatFrame())) {
            logger.warn("Heartbeat write failed for client {} in session {}, treating as disconnect",
                    handle.getClientId(), handle.getSessionId());
            deregister(handle);
        } else {
            logger.debug("Sent heartbeat to client {} in session {}", handle.getClientId(), handle.getSessionId());
        }
    }
}
