package com.studyroom.studyroom_api.presence;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 참여자 한 명의 미디어 상태. 실제 미디어는 클라이언트끼리 주고받고, 서버는 마지막 신호만 보관해 중계한다.
 */
public record ParticipantMediaState(
        String userId,
        String displayName,
        @JsonProperty("isAudioMuted") boolean isAudioMuted,
        @JsonProperty("isVideoMuted") boolean isVideoMuted,
        @JsonProperty("isHandRaised") boolean isHandRaised,
        @JsonProperty("isScreenSharing") boolean isScreenSharing
) {

    public static ParticipantMediaState onEntry(String userId, String displayName, boolean muteOnEntry) {
        return new ParticipantMediaState(userId, displayName, muteOnEntry, false, false, false);
    }

    public ParticipantMediaState withAudioMuted(boolean muted) {
        return new ParticipantMediaState(userId, displayName, muted, isVideoMuted, isHandRaised, isScreenSharing);
    }

    public ParticipantMediaState withVideoMuted(boolean muted) {
        return new ParticipantMediaState(userId, displayName, isAudioMuted, muted, isHandRaised, isScreenSharing);
    }

    public ParticipantMediaState withHandRaised(boolean raised) {
        return new ParticipantMediaState(userId, displayName, isAudioMuted, isVideoMuted, raised, isScreenSharing);
    }

    public ParticipantMediaState withScreenSharing(boolean sharing) {
        return new ParticipantMediaState(userId, displayName, isAudioMuted, isVideoMuted, isHandRaised, sharing);
    }
}
