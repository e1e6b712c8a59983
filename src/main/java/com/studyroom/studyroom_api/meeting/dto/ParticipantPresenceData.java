package com.studyroom.studyroom_api.meeting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.studyroom.studyroom_api.meeting.store.ParticipantSnapshot;

import java.time.Instant;

/**
 * participant-joined / participant-left 이벤트 본문.
 */
public record ParticipantPresenceData(
        String userId,
        String displayName,
        @JsonProperty("isHost") boolean isHost,
        Instant at
) {

    public static ParticipantPresenceData joined(ParticipantSnapshot participant, boolean isHost) {
        return new ParticipantPresenceData(participant.userId(), participant.displayName(), isHost, participant.joinedAt());
    }

    public static ParticipantPresenceData left(ParticipantSnapshot participant, boolean isHost) {
        return new ParticipantPresenceData(participant.userId(), participant.displayName(), isHost, participant.leftAt());
    }
}
