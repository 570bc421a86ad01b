package org.chatrooms.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine readable error codes, sent in error frames and REST error bodies.
 */
public enum ErrorCode {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    ROOM_UNKNOWN(HttpStatus.NOT_FOUND),
    INVALID_PAYLOAD(HttpStatus.BAD_REQUEST),
    NOT_MEMBER(HttpStatus.FORBIDDEN),
    NOT_PARTICIPANT(HttpStatus.FORBIDDEN),
    NOT_SENDER(HttpStatus.FORBIDDEN),
    MESSAGE_UNKNOWN(HttpStatus.NOT_FOUND),
    PERSISTENCE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
