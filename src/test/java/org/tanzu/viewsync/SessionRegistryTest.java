package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.viewsync.config.ViewSyncProperties;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class SessionRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        ViewSyncProperties properties = new ViewSyncProperties();
        properties.setCommandQueueCapacity(3);
        properties.getSweep().setEnabled(false);
        registry = new SessionRegistry(properties);
    }

    @Test
    void testGetOrCreateReturnsSameSession() {
        ViewerSession first = registry.getOrCreate("s1", "alice");
        ViewerSession second = registry.getOrCreate("s1", "alice");

        assertThat(second).isSameAs(first);
        assertThat(first.getUserId()).isEqualTo("alice");
        assertThat(registry.getSessionCount()).isEqualTo(1);
    }

    @Test
    void testFindDoesNotCreate() {
        assertThat(registry.find("missing")).isEmpty();
        assertThat(registry.getSessionCount()).isZero();
    }

    @Test
    void testConcurrentGetOrCreateYieldsOneSession() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<ViewerSession> seen = ConcurrentHashMap.newKeySet();

        try {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    start.await();
                    seen.add(registry.getOrCreate("shared", "anonymous"));
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(seen).hasSize(1);
        assertThat(registry.getSessionCount()).isEqualTo(1);
    }

    @Test
    void testWithSessionRejectsDifferentNamedUser() {
        registry.getOrCreate("s1", "alice");

        assertThatThrownBy(() -> registry.withSession("s1", "bob", session -> 1))
                .isInstanceOf(SessionAccessDeniedException.class)
                .hasMessageContaining("belongs to different user");
    }

    @Test
    void testWithSessionAllowsAnonymousAndAuthenticatedMixing() {
        registry.getOrCreate("s1", "alice");
        registry.getOrCreate("s2", "anonymous");

        assertThat(registry.withSession("s1", "anonymous", ViewerSession::getId)).isEqualTo("s1");
        assertThat(registry.withSession("s1", "authenticated", ViewerSession::getId)).isEqualTo("s1");
        assertThat(registry.withSession("s2", "carol", ViewerSession::getId)).isEqualTo("s2");
    }

    @Test
    void testQueueKeepsMostRecentCommands() {
        ViewerSession session = registry.getOrCreate("s1", "anonymous");
        for (int i = 1; i <= 5; i++) {
            session.enqueue(objectMapper.createObjectNode().put("page", i));
        }

        SessionView view = registry.snapshot().get(0);
        assertThat(view.getQueuedCommands()).isEqualTo(3);
        assertThat(view.getCommands()).extracting(node -> node.get("page").asInt())
                .containsExactly(3, 4, 5);
    }

    @Test
    void testSnapshotExposesSessionState() {
        ViewerSession session = registry.getOrCreate("s1", "alice");
        session.addClient(new ClientConnection("s1", "alice", 8));
        registry.getOrCreate("s2", "bob");

        List<SessionView> views = registry.snapshot();

        assertThat(views).hasSize(2);
        SessionView s1 = views.stream().filter(v -> v.getSessionId().equals("s1")).findFirst().orElseThrow();
        assertThat(s1.getUserId()).isEqualTo("alice");
        assertThat(s1.getConnectedClients()).isEqualTo(1);
        assertThat(s1.getQueuedCommands()).isZero();
        assertThat(s1.getLastActivity()).isNotBlank();

        assertThat(registry.snapshotForUser("bob")).extracting(SessionView::getSessionId).containsExactly("s2");
    }

    @Test
    void testCleanupRemovesOnlyIdleSessionsWithoutClients() throws Exception {
        registry.getOrCreate("idle", "anonymous");
        ViewerSession busy = registry.getOrCreate("busy", "anonymous");
        busy.addClient(new ClientConnection("busy", "anonymous", 8));
        Thread.sleep(20);

        int removed = registry.cleanupIdleSessions(Duration.ofMillis(5));

        assertThat(removed).isEqualTo(1);
        assertThat(registry.find("idle")).isEmpty();
        assertThat(registry.find("busy")).isPresent();
    }

    @Test
    void testCleanupKeepsRecentlyActiveSessions() {
        registry.getOrCreate("fresh", "anonymous");

        assertThat(registry.cleanupIdleSessions(Duration.ofHours(1))).isZero();
        assertThat(registry.find("fresh")).isPresent();
    }

    @Test
    void testRetiredSessionIsReplacedOnNextAccess() throws Exception {
        ViewerSession original = registry.getOrCreate("s1", "anonymous");
        Thread.sleep(20);
        registry.cleanupIdleSessions(Duration.ofMillis(5));

        ViewerSession replacement = registry.withSession("s1", "anonymous", session -> session);

        assertThat(replacement).isNotSameAs(original);
        assertThat(registry.find("s1")).containsSame(replacement);
    }
}
