package com.studyroom.studyroom_api.meeting.repository;

import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MeetingRepository extends JpaRepository<Meeting, Long> {

    Optional<Meeting> findByMeetingId(String meetingId);

    boolean existsByMeetingId(String meetingId);

    List<Meeting> findByStatusOrderByActualStartTimeDesc(MeetingStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Meeting m where m.id = :id")
    Optional<Meeting> findByIdForUpdate(@Param("id") Long id);

    @Query("select m.activeParticipantCount from Meeting m where m.id = :id")
    int findActiveParticipantCount(@Param("id") Long id);

    @Query("select m.lastMessageSequence from Meeting m where m.id = :id")
    long findLastMessageSequence(@Param("id") Long id);

    @Query(
            value = """
                    select m from Meeting m
                     where (m.createdBy = :userId
                            or exists (select 1 from MeetingParticipant p where p.meeting = m and p.userId = :userId))
                       and (:status is null or m.status = :status)
                     order by m.createdAt desc, m.id desc
                    """,
            countQuery = """
                    select count(m) from Meeting m
                     where (m.createdBy = :userId
                            or exists (select 1 from MeetingParticipant p where p.meeting = m and p.userId = :userId))
                       and (:status is null or m.status = :status)
                    """
    )
    Page<Meeting> findUserMeetings(
            @Param("userId") String userId,
            @Param("status") MeetingStatus status,
            Pageable pageable
    );

    @Query("""
            select m.meetingId from Meeting m
             where m.status = :active
               and m.activeParticipantCount = 0
               and m.emptySince <= :threshold
            """)
    List<String> findIdleMeetingIds(
            @Param("active") MeetingStatus active,
            @Param("threshold") Instant threshold
    );

    // 정원 확인과 좌석 확보를 한 번의 조건부 UPDATE 로 처리한다. 0 이면 거절.
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.activeParticipantCount = m.activeParticipantCount + 1,
                   m.emptySince = null,
                   m.updatedAt = :now
             where m.id = :id
               and m.status in :joinable
               and m.activeParticipantCount < m.settings.maxParticipants
            """)
    int reserveSeat(
            @Param("id") Long id,
            @Param("joinable") Collection<MeetingStatus> joinable,
            @Param("now") Instant now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.activeParticipantCount = m.activeParticipantCount - 1,
                   m.updatedAt = :now
             where m.id = :id
               and m.activeParticipantCount > 0
            """)
    int releaseSeat(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.emptySince = :now
             where m.id = :id
               and m.activeParticipantCount = 0
               and m.status in :joinable
            """)
    int markEmptySince(
            @Param("id") Long id,
            @Param("joinable") Collection<MeetingStatus> joinable,
            @Param("now") Instant now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.status = :to,
                   m.actualStartTime = :now,
                   m.updatedAt = :now
             where m.meetingId = :meetingId
               and m.status = :from
            """)
    int activateIfMatch(
            @Param("meetingId") String meetingId,
            @Param("from") MeetingStatus from,
            @Param("to") MeetingStatus to,
            @Param("now") Instant now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.status = :ended,
                   m.endedAt = :now,
                   m.activeParticipantCount = 0,
                   m.emptySince = null,
                   m.updatedAt = :now
             where m.id = :id
               and m.status in :from
            """)
    int finishIfMatch(
            @Param("id") Long id,
            @Param("from") Collection<MeetingStatus> from,
            @Param("ended") MeetingStatus ended,
            @Param("now") Instant now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.status = :ended,
                   m.endedAt = :now,
                   m.emptySince = null,
                   m.updatedAt = :now
             where m.id = :id
               and m.status = :active
               and m.activeParticipantCount = 0
               and m.emptySince <= :threshold
            """)
    int finishIfIdle(
            @Param("id") Long id,
            @Param("active") MeetingStatus active,
            @Param("ended") MeetingStatus ended,
            @Param("threshold") Instant threshold,
            @Param("now") Instant now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.settings.maxParticipants = :maxParticipants,
                   m.settings.isPublic = :isPublic,
                   m.settings.requireApproval = :requireApproval,
                   m.settings.allowChat = :allowChat,
                   m.settings.allowScreenShare = :allowScreenShare,
                   m.settings.allowRecording = :allowRecording,
                   m.settings.muteOnEntry = :muteOnEntry,
                   m.updatedAt = :now
             where m.id = :id
               and m.status in :joinable
               and m.activeParticipantCount <= :maxParticipants
            """)
    int updateSettingsIfFits(
            @Param("id") Long id,
            @Param("maxParticipants") int maxParticipants,
            @Param("isPublic") boolean isPublic,
            @Param("requireApproval") boolean requireApproval,
            @Param("allowChat") boolean allowChat,
            @Param("allowScreenShare") boolean allowScreenShare,
            @Param("allowRecording") boolean allowRecording,
            @Param("muteOnEntry") boolean muteOnEntry,
            @Param("joinable") Collection<MeetingStatus> joinable,
            @Param("now") Instant now
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Meeting m
               set m.lastMessageSequence = m.lastMessageSequence + 1
             where m.id = :id
               and m.status in :joinable
            """)
    int incrementMessageSequence(
            @Param("id") Long id,
            @Param("joinable") Collection<MeetingStatus> joinable
    );
}
