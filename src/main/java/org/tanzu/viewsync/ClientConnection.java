package org.tanzu.viewsync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One open push channel to a single viewer.
 *
 * Frames are emitted into a bounded unicast sink, so a stalled viewer never blocks the writer;
 * once its buffer is full, further writes fail and the connection is expected to be closed.
 * Emissions are serialized on this object because publishes and heartbeats arrive from different threads.
 */
public class ClientConnection {

    private static final Logger logger = LoggerFactory.getLogger(ClientConnection.class);

    private final String id;
    private final String sessionId;
    private final String userId;
    private final Instant connectedAt;
    private final Sinks.Many<ServerSentEvent<String>> sink;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private Disposable heartbeat;

    public ClientConnection(String sessionId, String userId, int bufferSize) {
        this.id = UUID.randomUUID().toString();
        this.sessionId = sessionId;
        this.userId = userId;
        this.connectedAt = Instant.now();
        this.sink = Sinks.many().unicast()
                .onBackpressureBuffer(Queues.<ServerSentEvent<String>>get(bufferSize).get());
    }

    /**
     * Writes a frame to this viewer.
     *
     * @param frame The frame to emit
     * @return true if the frame was accepted, false if the channel is closed or the write was rejected
     */
    public synchronized boolean send(ServerSentEvent<String> frame) {
        if (state.get() == ConnectionState.CLOSED) {
            return false;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            logger.warn("Failed to write frame to client {} in session {}: {}", id, sessionId, result);
            return false;
        }
        return true;
    }

    /**
     * Frames for this viewer. The sink is unicast, so only the transport subscribes.
     */
    public Flux<ServerSentEvent<String>> frames() {
        return sink.asFlux();
    }

    public boolean markOpen() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN);
    }

    /**
     * Binds the keep-alive timer to this connection. If the connection is already closed the
     * timer is disposed right away.
     */
    public synchronized void attachHeartbeat(Disposable heartbeat) {
        if (state.get() == ConnectionState.CLOSED) {
            heartbeat.dispose();
            return;
        }
        this.heartbeat = heartbeat;
    }

    /**
     * Moves the connection to {@link ConnectionState#CLOSED}, stops the heartbeat and completes the stream.
     *
     * Completion is emitted outside the monitor because it runs the transport's termination
     * callbacks, which take the session lock.
     *
     * @return true on the first call only
     */
    public boolean close() {
        Disposable timer;
        synchronized (this) {
            if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
                return false;
            }
            timer = heartbeat;
            heartbeat = null;
        }
        if (timer != null) {
            timer.dispose();
        }
        sink.tryEmitComplete();
        return true;
    }

    public synchronized boolean hasActiveHeartbeat() {
        return heartbeat != null && !heartbeat.isDisposed();
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public ConnectionState getState() {
        return state.get();
    }
}
