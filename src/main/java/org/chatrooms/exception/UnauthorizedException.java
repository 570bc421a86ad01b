package org.chatrooms.exception;

public class UnauthorizedException extends ChatException {
    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
