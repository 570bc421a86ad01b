package org.chatrooms.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Chatroom row. Rooms are created and managed by the REST back office; the real-time core only
 * asks whether an id exists.
 */
@Entity
@Table(name = "chatrooms")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRoom {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    private boolean isPrivate = false;

    private String ownerId;

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();
}
