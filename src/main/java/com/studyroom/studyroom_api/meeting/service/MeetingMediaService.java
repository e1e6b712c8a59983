package com.studyroom.studyroom_api.meeting.service;

import com.studyroom.studyroom_api.presence.LiveConnection;
import com.studyroom.studyroom_api.presence.MediaSignal;
import com.studyroom.studyroom_api.presence.ParticipantMediaState;

import java.util.List;

public interface MeetingMediaService {

    /**
     * 보낸 연결의 미디어 상태를 바꾸고 같은 방의 다른 연결에 알린다.
     *
     * @param sender 사용자의 현재 WebSocket 연결
     */
    ParticipantMediaState changeMedia(String meetingId, LiveConnection sender, MediaSignal signal, boolean flag);

    /**
     * 실시간 연결이 있는 참여자들의 미디어 상태. 입장 순서.
     */
    List<ParticipantMediaState> roomMedia(String meetingId);
}
