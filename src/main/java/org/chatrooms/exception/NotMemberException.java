package org.chatrooms.exception;

public class NotMemberException extends ChatException {
    public NotMemberException(String chatroomId, String connectionId) {
        super(ErrorCode.NOT_MEMBER, "Connection " + connectionId + " is no longer a member of chatroom " + chatroomId);
    }
}
