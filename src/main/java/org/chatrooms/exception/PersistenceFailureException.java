package org.chatrooms.exception;

public class PersistenceFailureException extends ChatException {
    public PersistenceFailureException(String chatroomId, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, "Message could not be stored in chatroom " + chatroomId, cause);
    }
}
