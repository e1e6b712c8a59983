package com.studyroom.studyroom_api.presence.websocket;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 클라이언트가 보내는 프레임. type 에 따라 쓰는 필드가 다르다.
 * <ul>
 *     <li>join: meetingId, userId, displayName, email, roomPassword</li>
 *     <li>chat: body</li>
 *     <li>mute-audio, mute-video: isMuted</li>
 *     <li>hand-raise: isRaised</li>
 *     <li>start-screen-share, stop-screen-share, ping, leave: 없음</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientFrame(
        String type,
        String meetingId,
        String userId,
        String displayName,
        String email,
        String roomPassword,
        String body,
        @JsonProperty("isMuted") Boolean isMuted,
        @JsonProperty("isRaised") Boolean isRaised
) {

    public static final String JOIN = "join";
    public static final String CHAT = "chat";
    public static final String PING = "ping";
    public static final String LEAVE = "leave";
    public static final String MUTE_AUDIO = "mute-audio";
    public static final String MUTE_VIDEO = "mute-video";
    public static final String HAND_RAISE = "hand-raise";
    public static final String START_SCREEN_SHARE = "start-screen-share";
    public static final String STOP_SCREEN_SHARE = "stop-screen-share";
}
