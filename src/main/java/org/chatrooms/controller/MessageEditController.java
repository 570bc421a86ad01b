package org.chatrooms.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.chatrooms.dto.Identity;
import org.chatrooms.dto.SendMessageRequest;
import org.chatrooms.service.MessageEditService;
import org.chatrooms.service.realtime.util.Payloads;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Changes to a single stored message, allowed to its sender only.
 */
@RestController
@RequestMapping("/api/v1/messages/{messageId}")
@RequiredArgsConstructor
public class MessageEditController {

    private final MessageEditService messageEditService;
    private final Payloads payloads;

    @PatchMapping
    public Map<String, Object> edit(@PathVariable long messageId,
                                    @Valid @RequestBody SendMessageRequest body,
                                    @AuthenticationPrincipal Identity editor) {
        return payloads.messageResource(messageEditService.edit(messageId, editor, body.getContent()));
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@PathVariable long messageId,
                                       @AuthenticationPrincipal Identity requester) {
        messageEditService.delete(messageId, requester);
        return ResponseEntity.noContent().build();
    }
}
