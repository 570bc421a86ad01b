package org.chatrooms.exception;

public class NotParticipantException extends ChatException {
    public NotParticipantException(String chatroomId) {
        super(ErrorCode.NOT_PARTICIPANT, "Join chatroom " + chatroomId + " to read or send its messages");
    }
}
