package org.chatrooms.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A user who joined a chatroom. Written by the chatroom back office; read here to authorize
 * the REST message routes.
 */
@Entity
@Table(name = "chatroom_participants",
        uniqueConstraints = @UniqueConstraint(columnNames = {"chatroomId", "userId"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatRoomParticipant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long chatroomId;

    @Column(nullable = false)
    private String userId;

    @Builder.Default
    private LocalDateTime joinedAt = LocalDateTime.now();
}
