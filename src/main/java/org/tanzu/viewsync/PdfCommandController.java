package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import org.tanzu.viewsync.command.ChangePageCommand;
import org.tanzu.viewsync.command.CommandValidationException;
import org.tanzu.viewsync.command.ZoomToXCommand;
import org.tanzu.viewsync.command.ZoomToYCommand;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP boundary for PDF viewer synchronization.
 *
 * POST endpoints validate input, resolve identity, build a command and broadcast it to the session.
 * GET /pdf/events opens the push channel a viewer listens on.
 */
@RestController
@RequestMapping("/pdf")
public class PdfCommandController {

    private static final Logger logger = LoggerFactory.getLogger(PdfCommandController.class);

    @Autowired
    private CommandBroadcaster broadcaster;

    @Autowired
    private ClientChannelManager channelManager;

    @Autowired
    private IdentityResolver identityResolver;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Moves every viewer in the session to a page.
     *
     * @param page The 1-based page number from the path
     * @param body Optional JSON body with sessionId and userId
     * @param sessionHeader The x-session-id header
     * @param userHeader The x-user-id header
     * @return Acknowledgement, or 400 for an invalid page number
     */
    @PostMapping({"/page/{page}", "/change-page/{page}"})
    public ResponseEntity<Map<String, Object>> changePage(
            @PathVariable("page") String page,
            @RequestBody(required = false) String body,
            @RequestHeader(value = IdentityResolver.SESSION_HEADER, required = false) String sessionHeader,
            @RequestHeader(value = IdentityResolver.USER_HEADER, required = false) String userHeader) {

        try {
            ChangePageCommand command = ChangePageCommand.parse(page);

            // identity fields are optional here, so an unreadable body is treated as empty
            JsonNode json = parseLenient(body);
            String sessionId = identityResolver.resolveSessionId(IdentityResolver.textField(json, "sessionId"), sessionHeader);
            String userId = identityResolver.resolveUserId(IdentityResolver.textField(json, "userId"), userHeader);

            broadcaster.publish(sessionId, userId, command);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("message", "Changed to page " + command.getPage());
            response.put("page", command.getPage());
            response.put("sessionId", sessionId);
            response.put("userId", userId);
            return ResponseEntity.ok(response);

        } catch (CommandValidationException e) {
            logger.warn("Rejected page change to '{}': {}", page, e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (SessionAccessDeniedException e) {
            return errorResponse(HttpStatus.FORBIDDEN, e.getMessage());
        } catch (Exception e) {
            logger.error("Error changing PDF page", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to change page");
        }
    }

    @PostMapping("/zoom/x")
    public ResponseEntity<Map<String, Object>> zoomX(
            @RequestBody(required = false) String body,
            @RequestHeader(value = IdentityResolver.SESSION_HEADER, required = false) String sessionHeader,
            @RequestHeader(value = IdentityResolver.USER_HEADER, required = false) String userHeader) {

        try {
            JsonNode json = parseObject(body);
            ZoomToXCommand command = ZoomToXCommand.fromJson(json);

            String sessionId = identityResolver.resolveSessionId(IdentityResolver.textField(json, "sessionId"), sessionHeader);
            String userId = identityResolver.resolveUserId(IdentityResolver.textField(json, "userId"), userHeader);
            logger.debug("Zoom X requested: left={}, right={}, session={}, user={}",
                    command.getLeft(), command.getRight(), sessionId, userId);

            broadcaster.publish(sessionId, userId, command);

            Map<String, Object> bounds = new LinkedHashMap<>();
            bounds.put("left", command.getLeft());
            bounds.put("right", command.getRight());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("message", "Zoomed to X bounds: left=" + command.getLeft().toPlainString()
                    + ", right=" + command.getRight().toPlainString());
            response.put("bounds", bounds);
            response.put("sessionId", sessionId);
            response.put("userId", userId);
            return ResponseEntity.ok(response);

        } catch (CommandValidationException e) {
            logger.warn("Rejected zoom X request: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (SessionAccessDeniedException e) {
            return errorResponse(HttpStatus.FORBIDDEN, e.getMessage());
        } catch (Exception e) {
            logger.error("Error zooming PDF (X)", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to zoom PDF");
        }
    }

    @PostMapping("/zoom/y")
    public ResponseEntity<Map<String, Object>> zoomY(
            @RequestBody(required = false) String body,
            @RequestHeader(value = IdentityResolver.SESSION_HEADER, required = false) String sessionHeader,
            @RequestHeader(value = IdentityResolver.USER_HEADER, required = false) String userHeader) {

        try {
            JsonNode json = parseObject(body);
            ZoomToYCommand command = ZoomToYCommand.fromJson(json);

            String sessionId = identityResolver.resolveSessionId(IdentityResolver.textField(json, "sessionId"), sessionHeader);
            String userId = identityResolver.resolveUserId(IdentityResolver.textField(json, "userId"), userHeader);
            logger.debug("Zoom Y requested: top={}, bottom={}, session={}, user={}",
                    command.getTop(), command.getBottom(), sessionId, userId);

            broadcaster.publish(sessionId, userId, command);

            Map<String, Object> bounds = new LinkedHashMap<>();
            bounds.put("top", command.getTop());
            bounds.put("bottom", command.getBottom());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("message", "Zoomed to Y bounds: top=" + command.getTop().toPlainString()
                    + ", bottom=" + command.getBottom().toPlainString());
            response.put("bounds", bounds);
            response.put("sessionId", sessionId);
            response.put("userId", userId);
            return ResponseEntity.ok(response);

        } catch (CommandValidationException e) {
            logger.warn("Rejected zoom Y request: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (SessionAccessDeniedException e) {
            return errorResponse(HttpStatus.FORBIDDEN, e.getMessage());
        } catch (Exception e) {
            logger.error("Error zooming PDF (Y)", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to zoom PDF");
        }
    }

    /**
     * Opens the push channel for a viewer. Emits a connection frame, then one frame per broadcast
     * command and a keep-alive comment on the heartbeat interval.
     *
     * The client is registered when the transport subscribes to the stream, so a request torn down
     * before that leaves nothing behind in the session.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<?> events(
            @RequestParam(value = "sessionId", required = false) String sessionParam,
            @RequestParam(value = "userId", required = false) String userParam,
            @RequestHeader(value = IdentityResolver.SESSION_HEADER, required = false) String sessionHeader,
            @RequestHeader(value = IdentityResolver.USER_HEADER, required = false) String userHeader) {

        String sessionId = identityResolver.resolveSessionId(sessionParam, sessionHeader);
        String userId = identityResolver.resolveUserId(userParam, userHeader);
        logger.info("PDF events stream requested for session: {}, user: {}", sessionId, userId);

        try {
            channelManager.checkAccess(sessionId, userId);
        } catch (SessionAccessDeniedException e) {
            logger.warn("Refused events stream: {}", e.getMessage());
            return errorResponse(HttpStatus.FORBIDDEN, e.getMessage());
        }

        Flux<ServerSentEvent<String>> stream = Flux.defer(() -> {
            ClientHandle handle = channelManager.register(sessionId, userId);
            return handle.getEvents()
                    .doOnCancel(() -> logger.info("PDF events stream cancelled - client {} disconnected from session: {}",
                            handle.getClientId(), sessionId))
                    .doOnError(error -> logger.error("PDF events stream error for client {} in session {}",
                            handle.getClientId(), sessionId, error));
        });

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header("Cache-Control", "no-cache")
                .header("Connection", "keep-alive")
                .header("X-Accel-Buffering", "no") // Disable proxy buffering
                .body(stream);
    }

    private JsonNode parseObject(String body) {
        if (body == null || body.isBlank()) {
            throw new CommandValidationException("Invalid JSON body");
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new CommandValidationException("Invalid JSON body");
        }
        if (json == null || !json.isObject()) {
            throw new CommandValidationException("Invalid JSON body");
        }
        return json;
    }

    private JsonNode parseLenient(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            logger.debug("Ignoring unreadable page change body: {}", body);
            return null;
        }
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(error);
    }
}
