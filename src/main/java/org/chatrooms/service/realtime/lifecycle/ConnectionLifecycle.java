package org.chatrooms.service.realtime.lifecycle;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.chatrooms.config.RealtimeSettings;
import org.chatrooms.dto.Identity;
import org.chatrooms.exception.ChatException;
import org.chatrooms.exception.ErrorCode;
import org.chatrooms.exception.RoomUnknownException;
import org.chatrooms.exception.UnauthorizedException;
import org.chatrooms.service.TokenVerifier;
import org.chatrooms.service.realtime.ingest.IngestPipeline;
import org.chatrooms.service.realtime.registry.ConnectionRegistry;
import org.chatrooms.service.realtime.util.Payloads;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Per-connection flow: authenticate, admit, run, tear down.
 *
 * The inbound side is the servlet container's callbacks for the socket (one at a time per
 * session). The outbound side is a pump task per connection that drains the bounded queue to
 * the socket; it is the only writer of frames. Teardown runs exactly once per connection,
 * whichever of peer close, transport error, eviction or shutdown gets there first.
 */
@Slf4j
@Service
public class ConnectionLifecycle {

    private final TokenVerifier tokenVerifier;
    private final ConnectionRegistry registry;
    private final IngestPipeline ingestPipeline;
    private final Payloads payloads;
    private final RealtimeSettings settings;
    private final ExecutorService pumps = Executors.newCachedThreadPool(new CustomizableThreadFactory("ws-pump-"));

    public ConnectionLifecycle(TokenVerifier tokenVerifier, ConnectionRegistry registry, IngestPipeline ingestPipeline,
                               Payloads payloads, RealtimeSettings settings) {
        this.tokenVerifier = tokenVerifier;
        this.registry = registry;
        this.ingestPipeline = ingestPipeline;
        this.payloads = payloads;
        this.settings = settings;
    }

    /**
     * Runs the handshake side of the state machine. On refusal the socket is closed with an
     * explicit reason before any data is exchanged and nothing is registered.
     *
     * @return the active connection, or empty when it was refused
     */
    public Optional<ChatConnection> open(WebSocketSession session, @Nullable String token, @Nullable String chatroomId) {
        log.debug("[{}] session={} room={}", ConnectionState.CONNECTING, session.getId(), chatroomId);

        log.debug("[{}] session={}", ConnectionState.AUTHENTICATING, session.getId());
        Identity identity;
        try {
            identity = tokenVerifier.verify(token);
        } catch (UnauthorizedException e) {
            log.warn("[REFUSED] session={} room={} reason={}", session.getId(), chatroomId, e.getMessage());
            closeTransport(session, CloseReason.UNAUTHORIZED);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("[REFUSED] session={} token verification failed", session.getId(), e);
            closeTransport(session, CloseReason.INTERNAL_ERROR);
            return Optional.empty();
        }

        if (chatroomId == null || chatroomId.isBlank()) {
            closeTransport(session, CloseReason.ROOM_NOT_FOUND);
            return Optional.empty();
        }

        ChatConnection connection = new ChatConnection(identity, chatroomId, session,
                settings.getOutboundCapacity(), this::scheduleRelease);
        try {
            registry.admit(chatroomId, connection);
        } catch (RoomUnknownException e) {
            log.warn("[REFUSED] session={} user={} room={} unknown", session.getId(), identity.userId(), chatroomId);
            closeTransport(session, CloseReason.ROOM_NOT_FOUND);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("[REFUSED] session={} room={} admission failed", session.getId(), chatroomId, e);
            closeTransport(session, CloseReason.INTERNAL_ERROR);
            return Optional.empty();
        }

        connection.activate();
        try {
            pumps.execute(() -> pump(connection));
        } catch (RejectedExecutionException e) {
            close(connection, CloseReason.GOING_AWAY);
            return Optional.empty();
        }
        log.info("[{}] conn={} user={} room={}", ConnectionState.ACTIVE, connection.getId(), identity.userId(), chatroomId);
        return Optional.of(connection);
    }

    /**
     * Inbound frame. Errors are answered on this connection only and it stays open.
     */
    public void onText(ChatConnection connection, String payload) {
        if (!connection.isOpen()) return;
        try {
            ingestPipeline.ingest(connection, payload);
        } catch (ChatException e) {
            log.debug("[REJECT] conn={} code={} detail={}", connection.getId(), e.getCode(), e.getMessage());
            connection.reply(payloads.errorFrame(e.getCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[REJECT] conn={} unexpected ingest failure", connection.getId(), e);
            connection.reply(payloads.errorFrame(ErrorCode.INTERNAL_ERROR, "Message could not be processed"));
        }
    }

    public void onBinary(ChatConnection connection) {
        if (!connection.isOpen()) return;
        connection.reply(payloads.errorFrame(ErrorCode.INVALID_PAYLOAD, "Binary frames are not supported"));
    }

    public void onTransportError(ChatConnection connection, Throwable error) {
        log.warn("[TRANSPORT] conn={} error={}", connection.getId(), error.getMessage());
        close(connection, CloseReason.TRANSPORT_ERROR);
    }

    public void onPeerClosed(ChatConnection connection, CloseStatus status) {
        log.debug("[PEER-CLOSE] conn={} status={}", connection.getId(), status);
        close(connection, CloseReason.NORMAL);
    }

    /**
     * Requests the close (no-op if one is already under way) and tears down on this thread.
     */
    public void close(ChatConnection connection, CloseReason reason) {
        connection.requestClose(reason);
        release(connection);
    }

    // close handler of every connection: eviction may be requested under a room lock,
    // so the socket is closed elsewhere
    private void scheduleRelease(ChatConnection connection) {
        try {
            pumps.execute(() -> release(connection));
        } catch (RejectedExecutionException e) {
            release(connection);
        }
    }

    void release(ChatConnection connection) {
        if (!connection.markReleased()) return;
        CloseReason reason = connection.getCloseReason() != null ? connection.getCloseReason() : CloseReason.NORMAL;
        registry.remove(connection.getChatroomId(), connection.getId());
        WebSocketSession session = connection.session();
        if (session.isOpen()) {
            closeTransport(session, reason);
        }
        connection.markClosed();
        log.info("[{}] conn={} user={} room={} reason={}", ConnectionState.CLOSED, connection.getId(),
                connection.getIdentity().userId(), connection.getChatroomId(), reason);
    }

    private void pump(ChatConnection connection) {
        WebSocketSession session = connection.session();
        try {
            while (connection.isOpen()) {
                TextMessage frame = connection.next(settings.getPumpPollMillis());
                if (frame == null) continue;
                try {
                    session.sendMessage(frame);
                } catch (IOException | IllegalStateException e) {
                    log.warn("[SEND] conn={} failed: {}", connection.getId(), e.getMessage());
                    connection.requestClose(CloseReason.TRANSPORT_ERROR);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.requestClose(CloseReason.GOING_AWAY);
        } finally {
            release(connection);
        }
    }

    private void closeTransport(WebSocketSession session, CloseReason reason) {
        try {
            session.close(reason.toCloseStatus());
        } catch (IOException | IllegalStateException e) {
            log.debug("[CLOSE] session={} already gone: {}", session.getId(), e.getMessage());
        }
    }

    /**
     * Closes every live connection, used on shutdown.
     */
    public int closeAll(CloseReason reason) {
        int closed = 0;
        for (ChatConnection c : registry.connections()) {
            close(c, reason);
            closed++;
        }
        return closed;
    }

    @PreDestroy
    public void shutdown() {
        int closed = closeAll(CloseReason.GOING_AWAY);
        log.info("Shutting down real-time core, {} connection(s) closed", closed);
        pumps.shutdown();
        try {
            if (!pumps.awaitTermination(settings.getPumpPollMillis() * 2, TimeUnit.MILLISECONDS)) {
                pumps.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pumps.shutdownNow();
        }
    }
}
