package org.chatrooms.service.realtime.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.chatrooms.config.RealtimeSettings;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;
import org.chatrooms.service.realtime.lifecycle.CloseReason;
import org.chatrooms.service.realtime.registry.ConnectionRegistry;
import org.chatrooms.service.realtime.util.Payloads;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;

/**
 * Fan-out of stored messages to the live members of a room.
 *
 * Never waits on a receiver: a member whose queue is full misses the frame, and once it has
 * missed {@code chat.ws.slow-consumer-threshold} frames in a row it is evicted. Eviction only
 * flags the connection; the socket is closed by the connection lifecycle, off this thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Broadcaster {

    private final ConnectionRegistry registry;
    private final Payloads payloads;
    private final RealtimeSettings settings;

    public DeliveryReport broadcast(String chatroomId, StoredMessage message, @Nullable String excludeConnectionId) {
        TextMessage frame = payloads.messageFrame(message);
        int delivered = 0;
        int skipped = 0;
        int evicted = 0;

        for (ChatConnection member : registry.membersOf(chatroomId)) {
            if (member.getId().equals(excludeConnectionId)) continue;

            switch (member.offer(frame)) {
                case QUEUED -> delivered++;
                case CLOSED -> skipped++;
                case DROPPED -> {
                    skipped++;
                    int drops = member.getConsecutiveDrops();
                    if (drops >= settings.getSlowConsumerThreshold() && member.requestClose(CloseReason.SLOW_CONSUMER)) {
                        evicted++;
                        log.warn("[EVICT] room={} conn={} user={} drops={}", chatroomId, member.getId(),
                                member.getIdentity().userId(), drops);
                    } else {
                        log.debug("[DROP] room={} conn={} drops={}", chatroomId, member.getId(), drops);
                    }
                }
            }
        }

        DeliveryReport report = new DeliveryReport(chatroomId, message.getId(), delivered, skipped, evicted);
        log.debug("[BROADCAST] {}", report);
        return report;
    }
}
