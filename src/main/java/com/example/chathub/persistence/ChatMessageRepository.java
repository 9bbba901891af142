package com.example.chathub.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChatMessageRepository extends Repository<ChatMessageEntity, Long> {

    ChatMessageEntity save(ChatMessageEntity e);

    @Query("select m from ChatMessageEntity m order by m.createdAtEpochMs desc, m.id desc")
    List<ChatMessageEntity> findLatest(Pageable pageable);

    @Query("select m from ChatMessageEntity m where m.groupId = :gid order by m.createdAtEpochMs desc, m.id desc")
    List<ChatMessageEntity> findLatestByGroupId(@Param("gid") long groupId, Pageable pageable);
}
