package org.chatrooms.repo;

import org.chatrooms.model.ChatRoomParticipant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatRoomParticipantRepository extends JpaRepository<ChatRoomParticipant, Long> {
    boolean existsByChatroomIdAndUserId(Long chatroomId, String userId);
}
