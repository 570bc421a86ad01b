package org.chatrooms.service.realtime.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.chatrooms.config.RealtimeSettings;
import org.chatrooms.dto.Identity;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.InvalidPayloadException;
import org.chatrooms.exception.NotMemberException;
import org.chatrooms.exception.PersistenceFailureException;
import org.chatrooms.exception.RoomUnknownException;
import org.chatrooms.service.MessageStore;
import org.chatrooms.service.RoomDirectory;
import org.chatrooms.service.realtime.broadcast.Broadcaster;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;
import org.chatrooms.service.realtime.registry.ConnectionRegistry;
import org.chatrooms.service.realtime.util.Payloads;
import org.springframework.stereotype.Service;

/**
 * validate -> check membership -> store -> broadcast.
 *
 * Nothing is broadcast unless the store accepted it first, and each message is fanned out as
 * soon as its store call returns. The sender is not excluded from the fan-out: it sees its
 * own message in the same order as everybody else.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestPipeline {

    private final ConnectionRegistry registry;
    private final MessageStore messageStore;
    private final Broadcaster broadcaster;
    private final RoomDirectory roomDirectory;
    private final Payloads payloads;
    private final RealtimeSettings settings;

    /**
     * @throws InvalidPayloadException     malformed frame, nothing stored
     * @throws NotMemberException          the connection was removed from its room, nothing stored
     * @throws PersistenceFailureException the store refused the write, nothing broadcast
     */
    public StoredMessage ingest(ChatConnection connection, String rawPayload) {
        String content = normalize(payloads.readContent(rawPayload));
        registry.requireMember(connection);
        return persistAndBroadcast(connection.getChatroomId(), connection.getIdentity(), content);
    }

    /**
     * Same path for messages posted over REST, which have no originating connection.
     */
    public StoredMessage publish(String chatroomId, Identity sender, String content) {
        String normalized = normalize(content);
        if (!roomDirectory.exists(chatroomId)) {
            throw new RoomUnknownException(chatroomId);
        }
        return persistAndBroadcast(chatroomId, sender, normalized);
    }

    // no room lock is held here: a slow store call only holds up its own message
    private StoredMessage persistAndBroadcast(String chatroomId, Identity sender, String content) {
        StoredMessage stored;
        try {
            stored = messageStore.append(chatroomId, sender.userId(), content);
        } catch (RuntimeException e) {
            log.warn("[STORE] room={} user={} append failed: {}", chatroomId, sender.userId(), e.getMessage());
            throw new PersistenceFailureException(chatroomId, e);
        }
        if (stored == null) {
            throw new PersistenceFailureException(chatroomId, null);
        }

        registry.publish(chatroomId, stored, m -> broadcaster.broadcast(chatroomId, m, null));
        log.debug("[INGEST] room={} user={} message={}", chatroomId, sender.userId(), stored.getId());
        return stored;
    }

    /**
     * Trimmed content, also applied to message edits.
     *
     * @throws InvalidPayloadException when null, blank or longer than {@code chat.ws.max-content-length}
     */
    public String normalize(String content) {
        if (content == null) {
            throw new InvalidPayloadException("\"content\" is required");
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidPayloadException("\"content\" must not be empty");
        }
        if (trimmed.length() > settings.getMaxContentLength()) {
            throw new InvalidPayloadException("\"content\" exceeds " + settings.getMaxContentLength() + " characters");
        }
        return trimmed;
    }
}
