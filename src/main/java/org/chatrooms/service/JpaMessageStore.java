package org.chatrooms.service;

import lombok.RequiredArgsConstructor;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.MessageStoreException;
import org.chatrooms.model.Message;
import org.chatrooms.repo.MessageRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaMessageStore implements MessageStore {

    private final MessageRepository repo;

    @Override
    @Transactional
    public StoredMessage append(String chatroomId, String senderId, String content) {
        Long roomId = parseId(chatroomId);
        if (roomId == null) {
            throw new MessageStoreException("Not a chatroom id: " + chatroomId);
        }

        Message m = new Message();
        m.setChatroomId(roomId);
        m.setSenderId(senderId);
        m.setContent(content);
        // micros: what most databases keep, so the broadcast matches a later history read
        m.setCreatedAt(Instant.now().truncatedTo(ChronoUnit.MICROS));
        try {
            return toStored(repo.saveAndFlush(m));
        } catch (DataAccessException e) {
            throw new MessageStoreException("Could not append message to chatroom " + chatroomId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredMessage> history(String chatroomId, int skip, int limit) {
        Long roomId = parseId(chatroomId);
        if (roomId == null) {
            return List.of();
        }
        return repo.findPage(roomId, skip, limit).stream()
                .map(JpaMessageStore::toStored)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredMessage> find(long messageId) {
        return repo.findById(messageId).map(JpaMessageStore::toStored);
    }

    @Override
    @Transactional
    public Optional<StoredMessage> edit(long messageId, String content) {
        Optional<Message> found = repo.findById(messageId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Message m = found.get();
        m.setContent(content);
        m.setEdited(true);
        try {
            return Optional.of(toStored(repo.saveAndFlush(m)));
        } catch (DataAccessException e) {
            throw new MessageStoreException("Could not edit message " + messageId, e);
        }
    }

    @Override
    @Transactional
    public boolean delete(long messageId) {
        if (!repo.existsById(messageId)) {
            return false;
        }
        try {
            repo.deleteById(messageId);
            return true;
        } catch (DataAccessException e) {
            throw new MessageStoreException("Could not delete message " + messageId, e);
        }
    }

    static StoredMessage toStored(Message m) {
        return StoredMessage.builder()
                .id(m.getId())
                .chatroomId(String.valueOf(m.getChatroomId()))
                .senderId(m.getSenderId())
                .content(m.getContent())
                .createdAt(m.getCreatedAt())
                .edited(m.isEdited())
                .build();
    }

    // chatroom ids are numeric in the database, opaque strings everywhere else
    static Long parseId(String chatroomId) {
        if (chatroomId == null || chatroomId.isBlank()) return null;
        try {
            return Long.valueOf(chatroomId.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
