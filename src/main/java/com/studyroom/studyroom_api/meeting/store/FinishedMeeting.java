package com.studyroom.studyroom_api.meeting.store;

import java.time.Instant;

public record FinishedMeeting(String meetingId, String roomId, int forcedDepartures, Instant endedAt) {
}
