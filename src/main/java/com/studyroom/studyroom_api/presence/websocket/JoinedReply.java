package com.studyroom.studyroom_api.presence.websocket;

import com.studyroom.studyroom_api.chat.dto.ChatMessageResponse;
import com.studyroom.studyroom_api.meeting.dto.JoinMeetingResponse;
import com.studyroom.studyroom_api.presence.ParticipantMediaState;

import java.util.List;

/**
 * WebSocket 입장 성공 시 요청한 연결에만 보내는 본문.
 *
 * @param mediaState       입장한 사용자 자신의 미디어 상태(muteOnEntry 반영)
 * @param participantMedia 실시간 연결이 있는 참여자 전원의 미디어 상태
 */
public record JoinedReply(
        JoinMeetingResponse join,
        List<ChatMessageResponse> recentMessages,
        ParticipantMediaState mediaState,
        List<ParticipantMediaState> participantMedia
) {
}
