package com.studyroom.studyroom_api.presence;

import java.util.Arrays;

/**
 * 클라이언트 미디어 신호와 방에 중계되는 이벤트의 대응.
 */
public enum MediaSignal {
    MUTE_AUDIO("mute-audio", RoomEventType.PARTICIPANT_AUDIO_CHANGED),
    MUTE_VIDEO("mute-video", RoomEventType.PARTICIPANT_VIDEO_CHANGED),
    HAND_RAISE("hand-raise", RoomEventType.PARTICIPANT_HAND_RAISED),
    START_SCREEN_SHARE("start-screen-share", RoomEventType.PARTICIPANT_SCREEN_SHARE_STARTED),
    STOP_SCREEN_SHARE("stop-screen-share", RoomEventType.PARTICIPANT_SCREEN_SHARE_STOPPED);

    private final String frameType;
    private final RoomEventType eventType;

    MediaSignal(String frameType, RoomEventType eventType) {
        this.frameType = frameType;
        this.eventType = eventType;
    }

    public String frameType() {
        return frameType;
    }

    public RoomEventType eventType() {
        return eventType;
    }

    /**
     * @param flag mute-audio/mute-video 는 음소거 여부, hand-raise 는 손들기 여부. 화면 공유 신호는 무시한다.
     */
    public ParticipantMediaState apply(ParticipantMediaState state, boolean flag) {
        return switch (this) {
            case MUTE_AUDIO -> state.withAudioMuted(flag);
            case MUTE_VIDEO -> state.withVideoMuted(flag);
            case HAND_RAISE -> state.withHandRaised(flag);
            case START_SCREEN_SHARE -> state.withScreenSharing(true);
            case STOP_SCREEN_SHARE -> state.withScreenSharing(false);
        };
    }

    public static MediaSignal fromFrameType(String frameType) {
        return Arrays.stream(values())
                .filter(signal -> signal.frameType.equals(frameType))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown media frame: " + frameType));
    }
}
