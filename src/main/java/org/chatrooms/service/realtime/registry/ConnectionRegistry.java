package org.chatrooms.service.realtime.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.NotMemberException;
import org.chatrooms.exception.RoomUnknownException;
import org.chatrooms.service.RoomDirectory;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/**
 * Which live connections belong to which chatroom.
 *
 * Partitioned by room: each room has its own {@link RoomSession} with its own lock, and the
 * maps here are concurrent, so no lock ever spans two rooms.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final RoomDirectory roomDirectory;
    private final ConcurrentMap<String, RoomSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ChatConnection> connections = new ConcurrentHashMap<>();

    /**
     * Makes the connection visible to every later broadcast of the room.
     *
     * @throws RoomUnknownException when the room does not exist in the chatroom store
     */
    public void admit(String chatroomId, ChatConnection connection) {
        if (!chatroomId.equals(connection.getChatroomId())) {
            throw new IllegalArgumentException("Connection " + connection.getId() + " is bound to chatroom " + connection.getChatroomId());
        }
        if (!roomDirectory.exists(chatroomId)) {
            throw new RoomUnknownException(chatroomId);
        }

        connections.put(connection.getId(), connection);
        while (true) {
            RoomSession session = sessions.computeIfAbsent(chatroomId, RoomSession::new);
            if (session.admit(connection)) {
                log.info("[JOIN] room={} user={} conn={} total={}", chatroomId,
                        connection.getIdentity().userId(), connection.getId(), session.size());
                return;
            }
            // lost the race against retirement, replace the session
            sessions.remove(chatroomId, session);
        }
    }

    /**
     * Idempotent: removing an unknown or already removed connection does nothing.
     */
    public void remove(String chatroomId, String connectionId) {
        connections.remove(connectionId);
        RoomSession session = sessions.get(chatroomId);
        if (session == null) return;
        if (session.remove(connectionId)) {
            log.info("[LEAVE] room={} conn={} remaining={}", chatroomId, connectionId, session.size());
        }
        retireIfIdle(session);
    }

    /**
     * Administrative removal of every connection of a user from a room. The sockets stay open;
     * their next message is answered with NOT_MEMBER.
     */
    public List<ChatConnection> revoke(String chatroomId, String userId) {
        RoomSession session = sessions.get(chatroomId);
        if (session == null) return List.of();
        // still live connections: they stay listed until the lifecycle releases them
        List<ChatConnection> removed = session.removeUser(userId);
        if (!removed.isEmpty()) {
            log.info("[REVOKE] room={} user={} connections={}", chatroomId, userId, removed.size());
        }
        retireIfIdle(session);
        return removed;
    }

    /**
     * Point-in-time copy of the room's members.
     */
    public List<ChatConnection> membersOf(String chatroomId) {
        RoomSession session = sessions.get(chatroomId);
        return (session == null) ? List.of() : session.snapshot();
    }

    public boolean isMember(String chatroomId, String connectionId) {
        RoomSession session = sessions.get(chatroomId);
        return session != null && session.contains(connectionId);
    }

    /**
     * @throws NotMemberException when the connection has been removed from its room
     */
    public void requireMember(ChatConnection origin) {
        RoomSession session = sessions.get(origin.getChatroomId());
        if (session == null) {
            throw new NotMemberException(origin.getChatroomId(), origin.getId());
        }
        session.requireMember(origin);
    }

    /**
     * Fans a stored message out to the room's live members under the room lock. A room
     * nobody is connected to has nothing to deliver.
     */
    public void publish(String chatroomId, StoredMessage message, Consumer<StoredMessage> fanOut) {
        while (true) {
            RoomSession session = sessions.get(chatroomId);
            if (session == null) return;
            if (session.publish(message, fanOut)) return;
            // retired in the meantime, look again
            sessions.remove(chatroomId, session);
        }
    }

    private void retireIfIdle(RoomSession session) {
        if (session.retireIfIdle()) {
            sessions.remove(session.getChatroomId(), session);
        }
    }

    public List<ChatConnection> connections() {
        return List.copyOf(connections.values());
    }

    public int roomCount() {
        return sessions.size();
    }
}
