package org.chatrooms.service.realtime.lifecycle;

import org.springframework.web.socket.CloseStatus;

/**
 * Stable close codes, so clients can tell why the server hung up.
 */
public enum CloseReason {
    NORMAL(1000, "Normal closure"),
    GOING_AWAY(1001, "Server shutting down"),
    INTERNAL_ERROR(1011, "Internal error"),
    UNAUTHORIZED(4401, "Unauthorized"),
    ROOM_NOT_FOUND(4404, "Chatroom not found"),
    SLOW_CONSUMER(4408, "Evicted: slow consumer"),
    TRANSPORT_ERROR(4500, "Transport error");

    private final int code;
    private final String reason;

    CloseReason(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public CloseStatus toCloseStatus() {
        return new CloseStatus(code, reason);
    }
}
