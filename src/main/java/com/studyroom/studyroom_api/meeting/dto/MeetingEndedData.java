package com.studyroom.studyroom_api.meeting.dto;

import java.time.Instant;

/**
 * meeting-ended 이벤트 본문. reason 은 host, empty, idle 중 하나.
 */
public record MeetingEndedData(String meetingId, String reason, Instant endedAt) {
}
