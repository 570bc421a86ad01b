package org.chatrooms.service.realtime.registry;

import lombok.extern.slf4j.Slf4j;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.NotMemberException;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Live state of one chatroom: its members, and the lock that orders its broadcasts.
 *
 * Every mutation goes through the room's own lock, so admissions, removals and fan-outs of a
 * room are linearized while other rooms proceed independently. The message store is never
 * called with this lock held: a sender checks membership, stores without the lock, then
 * publishes, and the room's broadcast order is the order in which the store calls returned.
 */
@Slf4j
public class RoomSession {

    private final String chatroomId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ChatConnection> members = new LinkedHashMap<>();
    private boolean retired;

    public RoomSession(String chatroomId) {
        this.chatroomId = chatroomId;
    }

    public String getChatroomId() {
        return chatroomId;
    }

    /**
     * @return false when the session was retired and must be replaced by a fresh one
     */
    boolean admit(ChatConnection connection) {
        lock.lock();
        try {
            if (retired) return false;
            members.put(connection.getId(), connection);
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean remove(String connectionId) {
        lock.lock();
        try {
            return members.remove(connectionId) != null;
        } finally {
            lock.unlock();
        }
    }

    List<ChatConnection> removeUser(String userId) {
        lock.lock();
        try {
            List<ChatConnection> removed = new ArrayList<>();
            Iterator<ChatConnection> it = members.values().iterator();
            while (it.hasNext()) {
                ChatConnection c = it.next();
                if (c.getIdentity().userId().equals(userId)) {
                    removed.add(c);
                    it.remove();
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<ChatConnection> snapshot() {
        lock.lock();
        try {
            return List.copyOf(members.values());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String connectionId) {
        lock.lock();
        try {
            return members.containsKey(connectionId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws NotMemberException when the connection is no longer registered here
     */
    void requireMember(ChatConnection origin) {
        lock.lock();
        try {
            if (retired || !members.containsKey(origin.getId())) {
                throw new NotMemberException(chatroomId, origin.getId());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the fan-out of a stored message under the room lock, so two fan-outs of the room
     * never interleave and every member gets them in the order the store handed them back.
     *
     * @return false when the session was retired; the caller retries on the current one
     */
    boolean publish(StoredMessage message, Consumer<StoredMessage> fanOut) {
        lock.lock();
        try {
            if (retired) return false;
            try {
                fanOut.accept(message);
            } catch (RuntimeException e) {
                log.error("[FANOUT] room={} message={} failed", chatroomId, message.getId(), e);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retires the session if nobody is connected. A retired session refuses admissions and
     * fan-outs; the registry drops it and creates a new one on demand.
     */
    boolean retireIfIdle() {
        lock.lock();
        try {
            if (!retired && members.isEmpty()) {
                retired = true;
            }
            return retired;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return members.size();
        } finally {
            lock.unlock();
        }
    }
}
