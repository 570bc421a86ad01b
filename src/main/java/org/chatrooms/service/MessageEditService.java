package org.chatrooms.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.chatrooms.dto.Identity;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.MessageUnknownException;
import org.chatrooms.exception.NotSenderException;
import org.chatrooms.exception.PersistenceFailureException;
import org.chatrooms.service.realtime.ingest.IngestPipeline;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Sender-only edits and deletions of stored messages. Changes are not pushed to live members;
 * they show up in the history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageEditService {

    private final MessageStore messageStore;
    private final IngestPipeline ingestPipeline;

    public StoredMessage edit(long messageId, Identity editor, String content) {
        String normalized = ingestPipeline.normalize(content);
        StoredMessage current = requireOwned(messageId, editor);
        Optional<StoredMessage> edited;
        try {
            edited = messageStore.edit(messageId, normalized);
        } catch (RuntimeException e) {
            throw new PersistenceFailureException(current.getChatroomId(), e);
        }
        // deleted between the ownership check and the write
        StoredMessage result = edited.orElseThrow(() -> new MessageUnknownException(messageId));
        log.info("[EDIT] room={} message={} user={}", current.getChatroomId(), messageId, editor.userId());
        return result;
    }

    public void delete(long messageId, Identity requester) {
        StoredMessage current = requireOwned(messageId, requester);
        boolean deleted;
        try {
            deleted = messageStore.delete(messageId);
        } catch (RuntimeException e) {
            throw new PersistenceFailureException(current.getChatroomId(), e);
        }
        if (!deleted) {
            throw new MessageUnknownException(messageId);
        }
        log.info("[DELETE] room={} message={} user={}", current.getChatroomId(), messageId, requester.userId());
    }

    private StoredMessage requireOwned(long messageId, Identity requester) {
        StoredMessage current = messageStore.find(messageId)
                .orElseThrow(() -> new MessageUnknownException(messageId));
        if (requester == null || !current.getSenderId().equals(requester.userId())) {
            throw new NotSenderException(messageId);
        }
        return current;
    }
}
