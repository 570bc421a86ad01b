package org.chatrooms.service;

import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.MessageStoreException;

import java.util.List;
import java.util.Optional;

/**
 * Durable message history of the chatrooms.
 */
public interface MessageStore {

    /**
     * Appends a message to a room's history and returns it with its id and timestamp.
     *
     * @throws MessageStoreException when the write is rejected or the store is unavailable
     */
    StoredMessage append(String chatroomId, String senderId, String content);

    /**
     * Oldest first.
     */
    List<StoredMessage> history(String chatroomId, int skip, int limit);

    Optional<StoredMessage> find(long messageId);

    /**
     * Replaces the content and flags the message as edited.
     *
     * @return the updated message, or empty when there is no such message
     * @throws MessageStoreException when the write is rejected
     */
    Optional<StoredMessage> edit(long messageId, String content);

    /**
     * @return false when there was no such message
     */
    boolean delete(long messageId);
}
