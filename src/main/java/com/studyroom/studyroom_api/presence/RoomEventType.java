package com.studyroom.studyroom_api.presence;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomEventType {
    // 방 전체 브로드캐스트
    PARTICIPANT_JOINED("participant-joined"),
    PARTICIPANT_LEFT("participant-left"),
    CHAT_MESSAGE("chat-message"),
    MEETING_ENDED("meeting-ended"),

    // 보낸 연결을 뺀 방 전체로 중계하는 미디어 상태
    PARTICIPANT_AUDIO_CHANGED("participant-audio-changed"),
    PARTICIPANT_VIDEO_CHANGED("participant-video-changed"),
    PARTICIPANT_HAND_RAISED("participant-hand-raised"),
    PARTICIPANT_SCREEN_SHARE_STARTED("participant-screen-share-started"),
    PARTICIPANT_SCREEN_SHARE_STOPPED("participant-screen-share-stopped"),

    // 요청한 연결에만 보내는 응답
    JOINED("joined"),
    PONG("pong"),
    ERROR("error");

    private final String wireName;

    RoomEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
