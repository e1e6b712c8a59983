package com.studyroom.studyroom_api.meeting.event;

import java.time.Instant;

public record MeetingEndedEvent(String meetingId, String roomId, Instant endedAt) {
}
