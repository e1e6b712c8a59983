package com.studyroom.studyroom_api.meeting.dto;

import com.studyroom.studyroom_api.meeting.store.ParticipantCandidate;

/**
 * REST 와 WebSocket 입장 요청을 같은 형태로 맞춘 값.
 */
public record JoinMeetingCommand(
        String meetingId,
        String userId,
        String displayName,
        String email,
        String roomPassword
) {

    public static JoinMeetingCommand of(String meetingId, JoinMeetingRequest request) {
        return new JoinMeetingCommand(
                meetingId,
                request.userId(),
                request.displayName(),
                request.email(),
                request.roomPassword()
        );
    }

    public ParticipantCandidate toCandidate() {
        return new ParticipantCandidate(userId, displayName.trim(), email);
    }
}
