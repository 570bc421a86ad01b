package org.chatrooms.exception;

public class RoomUnknownException extends ChatException {

    private final String chatroomId;

    public RoomUnknownException(String chatroomId) {
        super(ErrorCode.ROOM_UNKNOWN, "Chatroom " + chatroomId + " does not exist");
        this.chatroomId = chatroomId;
    }

    public String getChatroomId() {
        return chatroomId;
    }
}
