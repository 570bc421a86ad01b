package org.chatrooms.exception;

public class NotSenderException extends ChatException {
    public NotSenderException(long messageId) {
        super(ErrorCode.NOT_SENDER, "Only the sender can change message " + messageId);
    }
}
