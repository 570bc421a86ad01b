// src/main/java/org/chatrooms/controller/MessageController.java
package org.chatrooms.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.chatrooms.dto.Identity;
import org.chatrooms.dto.SendMessageRequest;
import org.chatrooms.dto.StoredMessage;
import org.chatrooms.exception.NotParticipantException;
import org.chatrooms.exception.RoomUnknownException;
import org.chatrooms.service.MessageStore;
import org.chatrooms.service.RoomDirectory;
import org.chatrooms.service.realtime.ingest.IngestPipeline;
import org.chatrooms.service.realtime.lifecycle.ChatConnection;
import org.chatrooms.service.realtime.registry.ConnectionRegistry;
import org.chatrooms.service.realtime.util.Payloads;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/chatrooms/{chatroomId}")
@RequiredArgsConstructor
public class MessageController {

    private static final int MAX_PAGE = 100;

    private final IngestPipeline ingestPipeline;
    private final MessageStore messageStore;
    private final RoomDirectory roomDirectory;
    private final ConnectionRegistry registry;
    private final Payloads payloads;

    // ---------- history ----------

    @GetMapping("/messages")
    public List<Map<String, Object>> history(@PathVariable String chatroomId,
                                             @RequestParam(defaultValue = "0") int skip,
                                             @RequestParam(defaultValue = "50") int limit,
                                             @AuthenticationPrincipal Identity reader) {
        requireRoom(chatroomId);
        requireParticipant(chatroomId, reader);
        int page = Math.max(1, Math.min(MAX_PAGE, limit));
        return messageStore.history(chatroomId, Math.max(0, skip), page).stream()
                .map(payloads::messageResource)
                .toList();
    }

    // ---------- send: stored, then pushed to the live members ----------

    @PostMapping("/messages")
    public ResponseEntity<Map<String, Object>> send(@PathVariable String chatroomId,
                                                    @Valid @RequestBody SendMessageRequest body,
                                                    @AuthenticationPrincipal Identity sender) {
        requireRoom(chatroomId);
        requireParticipant(chatroomId, sender);
        StoredMessage saved = ingestPipeline.publish(chatroomId, sender, body.getContent());
        return ResponseEntity.created(URI.create("/api/v1/messages/" + saved.getId()))
                .body(payloads.messageResource(saved));
    }

    // ---------- who is connected right now ----------

    @GetMapping("/presence")
    public List<Map<String, Object>> presence(@PathVariable String chatroomId) {
        requireRoom(chatroomId);
        Map<String, Map<String, Object>> byUser = new LinkedHashMap<>();
        for (ChatConnection c : registry.membersOf(chatroomId)) {
            Identity id = c.getIdentity();
            Map<String, Object> entry = byUser.computeIfAbsent(id.userId(), k -> {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("user_id", id.userId());
                m.put("username", id.username());
                m.put("connections", 0);
                return m;
            });
            entry.put("connections", (Integer) entry.get("connections") + 1);
        }
        return List.copyOf(byUser.values());
    }

    @DeleteMapping("/members/{userId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, Object>> revoke(@PathVariable String chatroomId, @PathVariable String userId) {
        requireRoom(chatroomId);
        int revoked = registry.revoke(chatroomId, userId).size();
        return ResponseEntity.ok(Map.of("revoked", revoked));
    }

    private void requireRoom(String chatroomId) {
        if (!roomDirectory.exists(chatroomId)) {
            throw new RoomUnknownException(chatroomId);
        }
    }

    private void requireParticipant(String chatroomId, Identity user) {
        if (user == null || !roomDirectory.isParticipant(chatroomId, user.userId())) {
            throw new NotParticipantException(chatroomId);
        }
    }
}
