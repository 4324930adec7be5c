package org.tanzu.viewsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import org.tanzu.viewsync.command.ChangePageCommand;
import org.tanzu.viewsync.command.ZoomToXCommand;
import org.tanzu.viewsync.config.ViewSyncProperties;
import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CommandBroadcasterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Disposable> subscriptions = new ArrayList<>();

    private ViewSyncProperties properties;
    private SessionRegistry registry;
    private ClientChannelManager channelManager;
    private CommandBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        properties = new ViewSyncProperties();
        properties.setCommandQueueCapacity(100);
        properties.setClientBufferSize(256);
        properties.getSweep().setEnabled(false);
        registry = new SessionRegistry(properties);
        channelManager = new ClientChannelManager(registry, properties, VirtualTimeScheduler.create());
        broadcaster = new CommandBroadcaster(registry, channelManager);
    }

    @AfterEach
    void tearDown() {
        subscriptions.forEach(Disposable::dispose);
        channelManager.closeAll();
    }

    @Test
    void testEveryClientReceivesCommandsInPublishOrder() throws Exception {
        List<ServerSentEvent<String>> first = connect("s1");
        List<ServerSentEvent<String>> second = connect("s1");

        for (int page = 1; page <= 20; page++) {
            assertThat(broadcaster.publish("s1", "anonymous", ChangePageCommand.of(page))).isEqualTo(2);
        }

        assertThat(pages(first)).containsExactlyElementsOf(range(1, 20));
        assertThat(pages(second)).containsExactlyElementsOf(range(1, 20));
    }

    @Test
    void testConcurrentPublishersProduceIdenticalOrderForAllClients() throws Exception {
        List<ServerSentEvent<String>> first = connect("s1");
        List<ServerSentEvent<String>> second = connect("s1");
        List<ServerSentEvent<String>> third = connect("s1");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 4; t++) {
                int offset = t * 25;
                executor.submit(() -> {
                    start.await();
                    for (int i = 1; i <= 25; i++) {
                        broadcaster.publish("s1", "anonymous", ChangePageCommand.of(offset + i));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        List<Integer> reference = pages(first);
        assertThat(reference).hasSize(100).doesNotHaveDuplicates();
        assertThat(pages(second)).containsExactlyElementsOf(reference);
        assertThat(pages(third)).containsExactlyElementsOf(reference);
    }

    @Test
    void testCommandsStayWithinTheirSession() throws Exception {
        List<ServerSentEvent<String>> inA = connect("A");
        List<ServerSentEvent<String>> inB = connect("B");

        broadcaster.publish("A", "anonymous", ChangePageCommand.of(7));

        assertThat(pages(inA)).containsExactly(7);
        assertThat(pages(inB)).isEmpty();
    }

    @Test
    void testFrameCarriesSessionAndUser() throws Exception {
        List<ServerSentEvent<String>> received = connect("s1");

        broadcaster.publish("s1", "alice", ZoomToXCommand.of(new BigDecimal("1.5"), new BigDecimal("3")));

        JsonNode frame = objectMapper.readTree(received.get(1).data());
        assertThat(frame.get("type").asText()).isEqualTo("zoomToX");
        assertThat(frame.get("bounds").get("left").asDouble()).isEqualTo(1.5);
        assertThat(frame.get("bounds").get("right").asDouble()).isEqualTo(3.0);
        assertThat(frame.get("sessionId").asText()).isEqualTo("s1");
        assertThat(frame.get("userId").asText()).isEqualTo("alice");
    }

    @Test
    void testPublishCreatesSessionAndQueuesWithoutClients() {
        int delivered = broadcaster.publish("empty", "alice", ChangePageCommand.of(2));

        assertThat(delivered).isZero();
        ViewerSession session = registry.find("empty").orElseThrow();
        assertThat(session.getUserId()).isEqualTo("alice");
        assertThat(session.getQueuedCommandCount()).isEqualTo(1);
    }

    @Test
    void testLateClientDoesNotReceiveEarlierCommands() throws Exception {
        broadcaster.publish("s1", "anonymous", ChangePageCommand.of(1));
        List<ServerSentEvent<String>> late = connect("s1");
        broadcaster.publish("s1", "anonymous", ChangePageCommand.of(2));

        assertThat(pages(late)).containsExactly(2);
        assertThat(registry.find("s1").get().getQueuedCommandCount()).isEqualTo(2);
    }

    @Test
    void testQueueIsBoundedToCapacity() {
        properties.setCommandQueueCapacity(10);
        for (int page = 1; page <= 15; page++) {
            broadcaster.publish("bounded", "anonymous", ChangePageCommand.of(page));
        }

        SessionView view = registry.find("bounded").get().toView();
        assertThat(view.getQueuedCommands()).isEqualTo(10);
        assertThat(view.getCommands().get(0).get("page").asInt()).isEqualTo(6);
    }

    @Test
    void testFailingClientIsDroppedWithoutAffectingOthers() throws Exception {
        List<ServerSentEvent<String>> healthy = connect("s1");
        properties.setClientBufferSize(1);
        // never subscribed: its single buffer slot already holds the connection frame
        ClientHandle stalled = channelManager.register("s1", "anonymous");

        int delivered = broadcaster.publish("s1", "anonymous", ChangePageCommand.of(4));
        broadcaster.publish("s1", "anonymous", ChangePageCommand.of(5));

        assertThat(delivered).isEqualTo(1);
        assertThat(pages(healthy)).containsExactly(4, 5);
        assertThat(stalled.getState()).isEqualTo(ConnectionState.CLOSED);
        assertThat(registry.find("s1").get().getClientCount()).isEqualTo(1);
    }

    @Test
    void testDeregisteredClientReceivesNothingFurther() throws Exception {
        List<ServerSentEvent<String>> received = new CopyOnWriteArrayList<>();
        ClientHandle handle = channelManager.register("s1", "anonymous");
        subscriptions.add(handle.getEvents().subscribe(received::add));

        broadcaster.publish("s1", "anonymous", ChangePageCommand.of(1));
        channelManager.deregister(handle);
        broadcaster.publish("s1", "anonymous", ChangePageCommand.of(2));

        assertThat(pages(received)).containsExactly(1);
    }

    @Test
    void testPublishToForeignSessionIsRejectedAndNotQueued() {
        broadcaster.publish("private", "alice", ChangePageCommand.of(1));

        assertThatThrownBy(() -> broadcaster.publish("private", "bob", ChangePageCommand.of(2)))
                .isInstanceOf(SessionAccessDeniedException.class);
        assertThat(registry.find("private").get().getQueuedCommandCount()).isEqualTo(1);
    }

    private List<ServerSentEvent<String>> connect(String sessionId) {
        List<ServerSentEvent<String>> received = new CopyOnWriteArrayList<>();
        ClientHandle handle = channelManager.register(sessionId, "anonymous");
        subscriptions.add(handle.getEvents().subscribe(received::add));
        return received;
    }

    private List<Integer> pages(List<ServerSentEvent<String>> frames) throws Exception {
        List<Integer> pages = new ArrayList<>();
        for (ServerSentEvent<String> frame : frames) {
            if (frame.data() == null) {
                continue;
            }
            JsonNode data = objectMapper.readTree(frame.data());
            if ("changePage".equals(data.get("type").asText())) {
                pages.add(data.get("page").asInt());
            }
        }
        return pages;
    }

    private static List<Integer> range(int from, int to) {
        List<Integer> values = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            values.add(i);
        }
        return values;
    }
}
