package com.studyroom.studyroom_api.meeting.store;

public record ParticipantCandidate(String userId, String displayName, String email) {
}
