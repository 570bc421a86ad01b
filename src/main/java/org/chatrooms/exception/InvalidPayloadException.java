package org.chatrooms.exception;

public class InvalidPayloadException extends ChatException {
    public InvalidPayloadException(String message) {
        super(ErrorCode.INVALID_PAYLOAD, message);
    }
}
