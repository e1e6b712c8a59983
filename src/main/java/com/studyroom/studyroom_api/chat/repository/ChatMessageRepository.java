package com.studyroom.studyroom_api.chat.repository;

import com.studyroom.studyroom_api.chat.entity.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    @Query("""
            select m from ChatMessage m
             where m.meetingId = :meetingId
               and m.sequence > :afterSequence
               and m.sentAt >= :since
             order by m.sequence asc
            """)
    List<ChatMessage> findSince(
            @Param("meetingId") String meetingId,
            @Param("afterSequence") long afterSequence,
            @Param("since") Instant since,
            Pageable pageable
    );

    List<ChatMessage> findByMeetingIdOrderBySequenceDesc(String meetingId, Pageable pageable);
}
