package org.chatrooms.service;

import lombok.RequiredArgsConstructor;
import org.chatrooms.repo.ChatRoomParticipantRepository;
import org.chatrooms.repo.ChatRoomRepository;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JpaRoomDirectory implements RoomDirectory {

    private final ChatRoomRepository repo;
    private final ChatRoomParticipantRepository participants;

    @Override
    public boolean exists(String chatroomId) {
        Long id = JpaMessageStore.parseId(chatroomId);
        return id != null && repo.existsById(id);
    }

    @Override
    public boolean isParticipant(String chatroomId, String userId) {
        Long id = JpaMessageStore.parseId(chatroomId);
        return id != null && userId != null && participants.existsByChatroomIdAndUserId(id, userId);
    }
}
