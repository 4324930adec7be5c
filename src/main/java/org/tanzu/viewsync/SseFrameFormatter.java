package org.tanzu.viewsync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.tanzu.viewsync.command.ViewerCommand;

/**
 * Utility class for building the Server-Sent Event frames written to PDF viewer channels.
 * Command and connection frames carry a single JSON {@code data} line, heartbeats are SSE comments.
 */
public final class SseFrameFormatter {

    private static final Logger logger = LoggerFactory.getLogger(SseFrameFormatter.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String HEARTBEAT_COMMENT = "heartbeat";

    private SseFrameFormatter() {
    }

    /**
     * Renders a command scoped to a session and user as a JSON object.
     *
     * @param command The validated command
     * @param sessionId The session the command was published to
     * @param userId The publishing user
     * @return JSON object with type, payload fields, timestamp, sessionId and userId
     */
    public static ObjectNode toJson(ViewerCommand command, String sessionId, String userId) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", command.getType());
        command.writePayload(node);
        node.put("timestamp", command.getTimestamp().toString());
        node.put("sessionId", sessionId);
        node.put("userId", userId);
        return node;
    }

    /**
     * Wraps an already rendered command as a data frame.
     */
    public static ServerSentEvent<String> commandFrame(ObjectNode scopedCommand) {
        String data = writeJson(scopedCommand);
        logger.debug("Formatted command frame: {}", data);
        return ServerSentEvent.<String>builder()
                .data(data)
                .build();
    }

    /**
     * Creates the frame sent once when a viewer channel opens.
     */
    public static ServerSentEvent<String> connectionFrame(String sessionId, String userId) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", "connected");
        node.put("sessionId", sessionId);
        node.put("userId", userId);
        return ServerSentEvent.<String>builder()
                .data(writeJson(node))
                .build();
    }

    /**
     * Creates a keep-alive frame. Browsers ignore SSE comments, so it is a no-op for the viewer.
     */
    public static ServerSentEvent<String> heartbeatFrame() {
        return ServerSentEvent.<String>builder()
                .comment(HEARTBEAT_COMMENT)
                .build();
    }

    public static boolean isHeartbeat(ServerSentEvent<?> event) {
        return HEARTBEAT_COMMENT.equals(event.comment()) && event.data() == null;
    }

    private static String writeJson(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize frame", e);
        }
    }
}
