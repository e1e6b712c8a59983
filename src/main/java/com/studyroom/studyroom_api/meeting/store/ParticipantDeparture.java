package com.studyroom.studyroom_api.meeting.store;

public record ParticipantDeparture(String roomId, ParticipantSnapshot participant, int remainingCount) {
}
