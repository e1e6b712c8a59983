package com.studyroom.studyroom_api.meeting.store;

import com.studyroom.studyroom_api.meeting.entity.MeetingParticipant;

import java.time.Instant;

/**
 * 트랜잭션 밖으로 넘기는 입장 기록 사본. attendanceId 는 입장 1회마다 새로 발급된다.
 */
public record ParticipantSnapshot(
        Long attendanceId,
        String userId,
        String displayName,
        String email,
        Instant joinedAt,
        Instant leftAt
) {

    public static ParticipantSnapshot from(MeetingParticipant participant) {
        return new ParticipantSnapshot(
                participant.getId(),
                participant.getUserId(),
                participant.getDisplayName(),
                participant.getEmail(),
                participant.getJoinedAt(),
                participant.getLeftAt()
        );
    }

    public ParticipantSnapshot withLeftAt(Instant leftAt) {
        return new ParticipantSnapshot(attendanceId, userId, displayName, email, joinedAt, leftAt);
    }
}
