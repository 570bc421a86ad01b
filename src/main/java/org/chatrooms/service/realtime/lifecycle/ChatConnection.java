package org.chatrooms.service.realtime.lifecycle;

import lombok.Getter;
import org.chatrooms.dto.Identity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One live socket bound to one chatroom.
 *
 * Frames reach the socket only through the bounded outbound queue, drained by a single pump
 * owned by {@link ConnectionLifecycle}. Producers never block: {@link #offer} (broadcasts)
 * and {@link #reply} (error acks) either queue the frame or report a drop.
 */
public class ChatConnection {

    public enum Delivery { QUEUED, DROPPED, CLOSED }

    // wakes the pump up when a close is requested
    private static final TextMessage WAKE_UP = new TextMessage("");

    @Getter
    private final String id = UUID.randomUUID().toString();
    @Getter
    private final Identity identity;
    @Getter
    private final String chatroomId;
    private final WebSocketSession session;
    private final BlockingQueue<TextMessage> outbound;
    private final Consumer<ChatConnection> onCloseRequested;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.ADMITTED);
    private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();
    private final AtomicInteger consecutiveDrops = new AtomicInteger();
    private final AtomicBoolean released = new AtomicBoolean();

    public ChatConnection(Identity identity, String chatroomId, WebSocketSession session,
                          int outboundCapacity, Consumer<ChatConnection> onCloseRequested) {
        this.identity = identity;
        this.chatroomId = chatroomId;
        this.session = session;
        this.outbound = new ArrayBlockingQueue<>(outboundCapacity);
        this.onCloseRequested = onCloseRequested;
    }

    public Delivery offer(TextMessage frame) {
        if (!isOpen()) {
            return Delivery.CLOSED;
        }
        if (outbound.offer(frame)) {
            consecutiveDrops.set(0);
            return Delivery.QUEUED;
        }
        consecutiveDrops.incrementAndGet();
        return Delivery.DROPPED;
    }

    /**
     * Answer to this connection's own frame (error acks). Does not touch the consecutive-drop
     * count, which only tracks broadcast frames.
     */
    public Delivery reply(TextMessage frame) {
        if (!isOpen()) {
            return Delivery.CLOSED;
        }
        return outbound.offer(frame) ? Delivery.QUEUED : Delivery.DROPPED;
    }

    /**
     * First caller wins: records the reason, discards whatever is still queued and hands the
     * connection to the close handler. Later calls return false and change nothing.
     */
    public boolean requestClose(CloseReason reason) {
        if (!closeReason.compareAndSet(null, reason)) {
            return false;
        }
        state.set(ConnectionState.CLOSING);
        outbound.clear();
        outbound.offer(WAKE_UP);
        onCloseRequested.accept(this);
        return true;
    }

    /**
     * Next frame to write, or null when the poll timed out or a close was requested.
     */
    TextMessage next(long timeoutMillis) throws InterruptedException {
        TextMessage frame = outbound.poll(timeoutMillis, TimeUnit.MILLISECONDS);
        return (frame == WAKE_UP) ? null : frame;
    }

    boolean activate() {
        return state.compareAndSet(ConnectionState.ADMITTED, ConnectionState.ACTIVE);
    }

    // guards the teardown so that it runs once whoever notices the close first
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    void markClosed() {
        state.set(ConnectionState.CLOSED);
    }

    WebSocketSession session() {
        return session;
    }

    public boolean isOpen() {
        return closeReason.get() == null;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public CloseReason getCloseReason() {
        return closeReason.get();
    }

    public int getConsecutiveDrops() {
        return consecutiveDrops.get();
    }

    public int getQueuedFrames() {
        return outbound.size();
    }

    @Override
    public String toString() {
        return "ChatConnection{id=" + id + ", user=" + identity.userId() + ", room=" + chatroomId + ", state=" + state.get() + "}";
    }
}
