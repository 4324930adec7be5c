package org.tanzu.viewsync;

import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

import java.util.function.Consumer;

/**
 * Returned by {@link ClientChannelManager#register(String, String)}. Exposes the frame stream to
 * hand to the transport; the stream deregisters the client on cancel, error or completion.
 */
public class ClientHandle {

    private final ViewerSession session;
    private final ClientConnection connection;
    private final Flux<ServerSentEvent<String>> events;

    ClientHandle(ViewerSession session, ClientConnection connection, Consumer<ClientHandle> onTerminate) {
        this.session = session;
        this.connection = connection;
        this.events = connection.frames()
                .doOnSubscribe(subscription -> connection.markOpen())
                .doFinally(signal -> onTerminate.accept(this));
    }

    public Flux<ServerSentEvent<String>> getEvents() {
        return events;
    }

    public String getClientId() {
        return connection.getId();
    }

    public String getSessionId() {
        return session.getId();
    }

    public String getUserId() {
        return connection.getUserId();
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    ViewerSession getSession() {
        return session;
    }

    ClientConnection getConnection() {
        return connection;
    }
}
