package org.chatrooms.service;

/**
 * Lookups against the chatroom store. {@link #exists} is consulted on admission,
 * {@link #isParticipant} by the REST message routes.
 */
public interface RoomDirectory {
    boolean exists(String chatroomId);

    boolean isParticipant(String chatroomId, String userId);
}
