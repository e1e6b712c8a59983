package com.studyroom.studyroom_api.meeting.dto;

import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;

import java.time.Instant;

public record MeetingSummary(
        String meetingId,
        String title,
        MeetingStatus status,
        String hostUserId,
        int participantCount,
        int maxParticipants,
        boolean requiresPassword,
        Instant scheduledStartTime,
        Instant actualStartTime,
        Instant endedAt,
        Instant createdAt
) {

    public static MeetingSummary from(Meeting meeting) {
        return new MeetingSummary(
                meeting.getMeetingId(),
                meeting.getTitle(),
                meeting.getStatus(),
                meeting.getHostUserId(),
                meeting.getActiveParticipantCount(),
                meeting.getSettings().getMaxParticipants(),
                meeting.requiresPassword(),
                meeting.getScheduledStartTime(),
                meeting.getActualStartTime(),
                meeting.getEndedAt(),
                meeting.getCreatedAt()
        );
    }
}
