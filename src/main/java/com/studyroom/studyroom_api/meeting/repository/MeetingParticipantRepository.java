package com.studyroom.studyroom_api.meeting.repository;

import com.studyroom.studyroom_api.meeting.entity.MeetingParticipant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface MeetingParticipantRepository extends JpaRepository<MeetingParticipant, Long> {

    @Query("""
            select p from MeetingParticipant p
             where p.meeting.id = :meetingPk
               and p.activeKey = :userId
            """)
    Optional<MeetingParticipant> findActive(@Param("meetingPk") Long meetingPk, @Param("userId") String userId);

    @Query("""
            select p from MeetingParticipant p
             where p.meeting.id = :meetingPk
               and p.leftAt is null
             order by p.joinedAt asc, p.id asc
            """)
    List<MeetingParticipant> findActiveByMeeting(@Param("meetingPk") Long meetingPk);

    @Query("select p from MeetingParticipant p where p.meeting.id = :meetingPk order by p.id asc")
    List<MeetingParticipant> findAllByMeeting(@Param("meetingPk") Long meetingPk);

    @Query("select count(p) from MeetingParticipant p where p.meeting.id = :meetingPk and p.leftAt is null")
    long countActive(@Param("meetingPk") Long meetingPk);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingParticipant p
               set p.leftAt = :now,
                   p.activeKey = null
             where p.id = :participantId
               and p.activeKey is not null
            """)
    int markLeftIfActive(@Param("participantId") Long participantId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MeetingParticipant p
               set p.leftAt = :now,
                   p.activeKey = null
             where p.meeting.id = :meetingPk
               and p.activeKey is not null
            """)
    int markAllLeft(@Param("meetingPk") Long meetingPk, @Param("now") Instant now);
}
