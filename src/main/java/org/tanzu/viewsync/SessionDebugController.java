package org.tanzu.viewsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views of the session registry for debugging and operations.
 */
@RestController
@RequestMapping("/pdf/debug")
public class SessionDebugController {

    private static final Logger logger = LoggerFactory.getLogger(SessionDebugController.class);

    @Autowired
    private SessionRegistry sessionRegistry;

    @GetMapping
    public Mono<Map<String, Object>> debug() {
        List<SessionView> sessions = sessionRegistry.snapshot();

        int totalClients = 0;
        int totalQueuedCommands = 0;
        for (SessionView session : sessions) {
            totalClients += session.getConnectedClients();
            totalQueuedCommands += session.getQueuedCommands();
        }

        Map<String, Object> debugInfo = new LinkedHashMap<>();
        debugInfo.put("totalSessions", sessions.size());
        debugInfo.put("totalConnectedClients", totalClients);
        debugInfo.put("totalQueuedCommands", totalQueuedCommands);
        debugInfo.put("sessions", sessions);
        debugInfo.put("timestamp", Instant.now().toString());

        logger.debug("Debug snapshot: {} sessions, {} clients", sessions.size(), totalClients);
        return Mono.just(debugInfo);
    }

    @GetMapping("/sessions/{sessionId}")
    public Mono<ResponseEntity<SessionView>> session(@PathVariable("sessionId") String sessionId) {
        return Mono.just(sessionRegistry.find(sessionId)
                .map(session -> ResponseEntity.ok(session.toView()))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @GetMapping("/users/{userId}/sessions")
    public Mono<List<SessionView>> userSessions(@PathVariable("userId") String userId) {
        return Mono.just(sessionRegistry.snapshotForUser(userId));
    }
}
