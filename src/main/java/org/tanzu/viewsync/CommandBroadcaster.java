package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.tanzu.viewsync.command.ViewerCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans a validated command out to every viewer currently connected to a session.
 *
 * Queue append and fan-out happen under the session lock, so commands published one after another
 * reach every viewer in publish order. Writes never block and a failing viewer is dropped without
 * affecting delivery to the others. Viewers that connect later do not receive earlier commands.
 */
@Component
public class CommandBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(CommandBroadcaster.class);

    private final SessionRegistry sessionRegistry;
    private final ClientChannelManager channelManager;

    public CommandBroadcaster(SessionRegistry sessionRegistry, ClientChannelManager channelManager) {
        this.sessionRegistry = sessionRegistry;
        this.channelManager = channelManager;
    }

    /**
     * Publishes a command to a session, creating the session if it does not exist yet.
     *
     * @param sessionId The resolved session ID
     * @param userId The resolved user ID
     * @param command The validated command
     * @return Number of viewers the command was written to
     * @throws SessionAccessDeniedException if the session belongs to a different user
     */
    public int publish(String sessionId, String userId, ViewerCommand command) {
        ObjectNode scopedCommand = SseFrameFormatter.toJson(command, sessionId, userId);
        ServerSentEvent<String> frame = SseFrameFormatter.commandFrame(scopedCommand);
        List<ClientConnection> failed = new ArrayList<>();

        int delivered = sessionRegistry.withSession(sessionId, userId, session -> {
            session.enqueue(scopedCommand);
            List<ClientConnection> clients = session.clientSnapshot();
            logger.debug("Broadcasting {} to {} clients in session {}", command.getType(), clients.size(), sessionId);

            int count = 0;
            for (ClientConnection client : clients) {
                try {
                    if (client.send(frame)) {
                        count++;
                    } else {
                        failed.add(client);
                    }
                } catch (RuntimeException e) {
                    logger.warn("Error sending command to client {} in session {}", client.getId(), sessionId, e);
                    failed.add(client);
                }
            }
            return count;
        });

        for (ClientConnection client : failed) {
            logger.warn("Removing failed client {} from session {}", client.getId(), sessionId);
            channelManager.deregister(client.getId());
        }

        logger.info("Broadcast {} to session {} by user {}: delivered to {} clients, {} failed",
                command.getType(), sessionId, userId, delivered, failed.size());
        return delivered;
    }
}
