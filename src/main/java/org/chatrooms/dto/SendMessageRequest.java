package org.chatrooms.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {
    // blank/length rules are enforced by the ingest pipeline, same as on the socket
    @NotNull
    private String content;
}
