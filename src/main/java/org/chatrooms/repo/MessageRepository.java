package org.chatrooms.repo;

import org.chatrooms.model.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MessageRepository extends JpaRepository<Message, Long> {

    // history of a room, oldest first, skip/limit as exposed by the REST API
    @Query(value = "SELECT * FROM messages WHERE chatroom_id = :chatroomId ORDER BY created_at ASC, id ASC OFFSET :skip ROWS FETCH FIRST :limit ROWS ONLY",
            nativeQuery = true)
    List<Message> findPage(@Param("chatroomId") Long chatroomId,
                           @Param("skip") int skip,
                           @Param("limit") int limit);
}
