package com.studyroom.studyroom_api.meeting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.studyroom.studyroom_api.meeting.entity.MeetingParticipant;

import java.time.Instant;

public record ParticipantResponse(
        String userId,
        String displayName,
        String email,
        @JsonProperty("isHost") boolean isHost,
        Instant joinedAt
) {

    public static ParticipantResponse of(MeetingParticipant participant, String hostUserId) {
        return new ParticipantResponse(
                participant.getUserId(),
                participant.getDisplayName(),
                participant.getEmail(),
                participant.getUserId().equals(hostUserId),
                participant.getJoinedAt()
        );
    }
}
