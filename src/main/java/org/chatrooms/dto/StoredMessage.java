package org.chatrooms.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A message as returned by the store: id and timestamp assigned, immutable from here on.
 * This is the unit of broadcast.
 */
@Value
@Builder(toBuilder = true)
public class StoredMessage {
    Long id;
    String chatroomId;
    String senderId;
    String content;
    Instant createdAt;
    boolean edited;
}
