package com.studyroom.studyroom_api.meeting.dto;

import com.studyroom.studyroom_api.meeting.entity.Meeting;
import com.studyroom.studyroom_api.meeting.entity.MeetingStatus;

import java.time.Instant;

public record EndMeetingResponse(
        String meetingId,
        MeetingStatus status,
        Instant endedAt,
        Long durationMinutes,
        boolean alreadyEnded
) {

    public static EndMeetingResponse of(Meeting meeting, boolean alreadyEnded) {
        return new EndMeetingResponse(
                meeting.getMeetingId(),
                meeting.getStatus(),
                meeting.getEndedAt(),
                meeting.getDurationMinutes(),
                alreadyEnded
        );
    }
}
