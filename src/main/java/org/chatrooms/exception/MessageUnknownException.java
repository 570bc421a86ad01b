package org.chatrooms.exception;

public class MessageUnknownException extends ChatException {
    public MessageUnknownException(long messageId) {
        super(ErrorCode.MESSAGE_UNKNOWN, "Message " + messageId + " does not exist");
    }
}
