package org.chatrooms.exception;

/**
 * Base of the errors raised by the real-time core. Each one is scoped to the connection or
 * request that caused it.
 */
public abstract class ChatException extends RuntimeException {

    private final ErrorCode code;

    protected ChatException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ChatException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
